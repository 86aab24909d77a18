package com.example.incidentengine.ingress;

import com.example.incidentengine.exception.UnauthorizedException;
import com.example.incidentengine.exception.UnauthorizedException.Reason;
import org.springframework.stereotype.Component;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;

/**
 * Verifies {@code X-Signature: sha256=<hex>} where the hex is
 * HMAC-SHA256(secret, timestamp + "." + rawBody), and rejects timestamps
 * further than the tenant's allowed skew from the gate clock.
 */
@Component
public class WebhookSignatureVerifier {

    static final String PREFIX = "sha256=";
    private static final String ALGORITHM = "HmacSHA256";

    public void verify(String secret, String timestampHeader, String signatureHeader,
                       byte[] rawBody, Instant now, long maxSkewSeconds) {
        if (secret == null || isBlank(timestampHeader) || isBlank(signatureHeader)) {
            throw new UnauthorizedException(Reason.MISSING_SIGNATURE);
        }

        long timestamp;
        try {
            timestamp = Long.parseLong(timestampHeader.trim());
        } catch (NumberFormatException e) {
            throw new UnauthorizedException(Reason.MALFORMED_TIMESTAMP);
        }
        if (!withinSkew(timestamp, now, maxSkewSeconds)) {
            throw new UnauthorizedException(Reason.STALE_TIMESTAMP);
        }

        String expected = sign(secret, timestampHeader.trim(), rawBody);
        String provided = signatureHeader.trim().toLowerCase(Locale.ROOT);
        if (!MessageDigest.isEqual(expected.getBytes(StandardCharsets.UTF_8),
                provided.getBytes(StandardCharsets.UTF_8))) {
            throw new UnauthorizedException(Reason.BAD_SIGNATURE);
        }
    }

    /** Signature header value a sender must present for the given timestamp and body. */
    public String sign(String secret, String timestamp, byte[] rawBody) {
        try {
            Mac mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), ALGORITHM));
            mac.update(timestamp.getBytes(StandardCharsets.UTF_8));
            mac.update((byte) '.');
            mac.update(rawBody == null ? new byte[0] : rawBody);
            return PREFIX + HexFormat.of().formatHex(mac.doFinal());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HmacSHA256 unavailable", e);
        }
    }

    private static boolean withinSkew(long timestamp, Instant now, long maxSkewSeconds) {
        if (timestamp < Instant.MIN.getEpochSecond() || timestamp > Instant.MAX.getEpochSecond()) {
            return false;
        }
        long skew = Duration.between(Instant.ofEpochSecond(timestamp), now).getSeconds();
        return Math.abs(skew) <= maxSkewSeconds;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
