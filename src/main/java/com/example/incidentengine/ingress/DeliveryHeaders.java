package com.example.incidentengine.ingress;

/**
 * Optional delivery headers: {@code X-Signature}, {@code X-Timestamp}, {@code X-Delivery-ID}.
 */
public record DeliveryHeaders(String signature, String timestamp, String deliveryId) {

    public static DeliveryHeaders none() {
        return new DeliveryHeaders(null, null, null);
    }
}
