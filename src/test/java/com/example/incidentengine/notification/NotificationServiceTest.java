package com.example.incidentengine.notification;

import com.example.incidentengine.config.EngineProperties;
import com.example.incidentengine.domain.NotificationOutbox;
import com.example.incidentengine.support.EngineIntegrationTest;
import okhttp3.Call;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Protocol;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.mail.MailSendException;
import org.springframework.mail.SimpleMailMessage;
import org.springframework.mail.javamail.JavaMailSender;

import java.io.IOException;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class NotificationServiceTest extends EngineIntegrationTest {

    private static final String SLACK_TARGET = "slack:https://hooks.slack.test/services/T000/B000/XXX";

    @MockBean
    private OkHttpClient httpClient;

    @MockBean
    private JavaMailSender mailSender;

    @Autowired
    private NotificationService notificationService;

    @Autowired
    private EngineProperties properties;

    private final Call call = mock(Call.class);

    @BeforeEach
    void enableSlack() {
        properties.getNotifications().getSlack().setEnabled(true);
        when(httpClient.newCall(any())).thenReturn(call);
    }

    @AfterEach
    void disableChannels() {
        properties.getNotifications().getSlack().setEnabled(false);
        properties.getNotifications().getEmail().setEnabled(false);
    }

    private NotificationOutbox enqueue(String target) {
        return notificationService.enqueue(ACME, "inc-1", "ESCALATION", target, "ESCALATION (Level 1)", "body");
    }

    private static Response response(Request request, int code) {
        return new Response.Builder()
                .request(request)
                .protocol(Protocol.HTTP_1_1)
                .code(code)
                .message(code == 200 ? "OK" : "Error")
                .body(ResponseBody.create("", MediaType.get("text/plain")))
                .build();
    }

    @Test
    void failedSlackDeliveryStaysInOutboxUntilRetrySucceeds() throws IOException {
        when(call.execute()).thenThrow(new IOException("connection refused"));
        NotificationOutbox entry = enqueue(SLACK_TARGET);

        notificationService.deliverAll(List.of(entry.getId()));

        NotificationOutbox failed = outboxRepository.findById(entry.getId()).orElseThrow();
        assertNull(failed.getDeliveredAt());
        assertEquals(1, failed.getAttempts());
        assertEquals("connection refused", failed.getLastError());

        Request request = new Request.Builder().url("https://hooks.slack.test/services/T000/B000/XXX").build();
        doReturn(response(request, 200)).when(call).execute();

        assertEquals(1, notificationService.retryPending());

        NotificationOutbox delivered = outboxRepository.findById(entry.getId()).orElseThrow();
        assertNotNull(delivered.getDeliveredAt());
        assertEquals(2, delivered.getAttempts());
        assertNull(delivered.getLastError());
    }

    @Test
    void nonSuccessStatusCountsAsFailure() throws IOException {
        Request request = new Request.Builder().url("https://hooks.slack.test/services/T000/B000/XXX").build();
        when(call.execute()).thenReturn(response(request, 500));
        NotificationOutbox entry = enqueue(SLACK_TARGET);

        notificationService.deliverAll(List.of(entry.getId()));

        NotificationOutbox failed = outboxRepository.findById(entry.getId()).orElseThrow();
        assertNull(failed.getDeliveredAt());
        assertEquals("Slack webhook returned 500", failed.getLastError());
    }

    @Test
    void retryGivesUpAfterMaxAttempts() throws IOException {
        when(call.execute()).thenThrow(new IOException("timeout"));
        NotificationOutbox entry = enqueue(SLACK_TARGET);
        entry.setAttempts(NotificationService.MAX_ATTEMPTS);
        outboxRepository.save(entry);

        assertEquals(0, notificationService.retryPending());

        assertEquals(NotificationService.MAX_ATTEMPTS,
                outboxRepository.findById(entry.getId()).orElseThrow().getAttempts());
        verify(httpClient, never()).newCall(any());
    }

    @Test
    void roleTargetsAreDeliveredInApp() {
        NotificationOutbox entry = enqueue("company_admin");

        notificationService.deliverAll(List.of(entry.getId()));

        assertNotNull(outboxRepository.findById(entry.getId()).orElseThrow().getDeliveredAt());
        verify(httpClient, never()).newCall(any());
    }

    @Test
    void blankTargetFallsBackToMspAdmin() {
        assertEquals("msp_admin", enqueue(" ").getTarget());
    }

    @Test
    void deliveredEntriesAreNotSentTwice() {
        NotificationOutbox entry = enqueue("email:oncall@acme.test");
        notificationService.deliverAll(List.of(entry.getId()));
        notificationService.deliverAll(List.of(entry.getId()));

        assertEquals(1, outboxRepository.findById(entry.getId()).orElseThrow().getAttempts());
        assertEquals(1, notificationService.forIncident("inc-1").size());
    }

    @Test
    void emailTargetIsSentThroughMailServer() {
        properties.getNotifications().getEmail().setEnabled(true);
        NotificationOutbox entry = enqueue("email:oncall@acme.test");

        notificationService.deliverAll(List.of(entry.getId()));

        ArgumentCaptor<SimpleMailMessage> sent = ArgumentCaptor.forClass(SimpleMailMessage.class);
        verify(mailSender).send(sent.capture());
        assertArrayEquals(new String[] {"oncall@acme.test"}, sent.getValue().getTo());
        assertEquals("ESCALATION (Level 1)", sent.getValue().getSubject());
        assertEquals(properties.getNotifications().getEmail().getFrom(), sent.getValue().getFrom());
        assertNotNull(outboxRepository.findById(entry.getId()).orElseThrow().getDeliveredAt());
    }

    @Test
    void failedEmailStaysPending() {
        properties.getNotifications().getEmail().setEnabled(true);
        doThrow(new MailSendException("smtp unreachable")).when(mailSender).send(any(SimpleMailMessage.class));
        NotificationOutbox entry = enqueue("email:oncall@acme.test");

        notificationService.deliverAll(List.of(entry.getId()));

        NotificationOutbox failed = outboxRepository.findById(entry.getId()).orElseThrow();
        assertNull(failed.getDeliveredAt());
        assertEquals(1, failed.getAttempts());
        assertEquals("smtp unreachable", failed.getLastError());
    }

    @Test
    void emailWithoutMailChannelIsDeliveredInApp() {
        NotificationOutbox entry = enqueue("email:oncall@acme.test");

        notificationService.deliverAll(List.of(entry.getId()));

        assertNotNull(outboxRepository.findById(entry.getId()).orElseThrow().getDeliveredAt());
        verify(mailSender, never()).send(any(SimpleMailMessage.class));
    }
}
