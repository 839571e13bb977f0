package com.vouch.auth.infrastructure.notify;

import com.vouch.auth.config.NotifierProperties;
import com.vouch.auth.domain.exception.NotifyException;
import com.vouch.auth.domain.model.RequestSecurityContext;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.clients.producer.RecordMetadata;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class KafkaNotifierTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final String TOPIC = "auth.notifications";

    private KafkaTemplate<String, Object> kafkaTemplate;
    private NotifierProperties properties;
    private KafkaNotifier notifier;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        kafkaTemplate = mock(KafkaTemplate.class);
        properties = new NotifierProperties();
        notifier = new KafkaNotifier(kafkaTemplate, properties, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @SuppressWarnings("unchecked")
    void reset_code_event_carries_code_and_request_origin() {
        when(kafkaTemplate.send(eq(TOPIC), eq("frank@example.com"), any())).thenReturn(acked());

        notifier.sendPasswordResetCode("frank@example.com", "048213",
                new RequestSecurityContext("203.0.113.7", "Mozilla/5.0", NOW));

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("frank@example.com"), payload.capture());
        Map<String, Object> event = (Map<String, Object>) payload.getValue();
        assertThat(event)
                .containsEntry("eventType", "PASSWORD_RESET_CODE_REQUESTED")
                .containsEntry("email", "frank@example.com")
                .containsEntry("code", "048213")
                .containsEntry("requestIp", "203.0.113.7")
                .containsEntry("userAgent", "Mozilla/5.0")
                .containsEntry("timestamp", NOW.toEpochMilli());
    }

    @Test
    @SuppressWarnings("unchecked")
    void verification_event_carries_the_link() {
        when(kafkaTemplate.send(eq(TOPIC), anyString(), any())).thenReturn(acked());

        notifier.sendEmailVerification("frank@example.com", "https://app.vouch.dev/verify?token=abc");

        ArgumentCaptor<Object> payload = ArgumentCaptor.forClass(Object.class);
        verify(kafkaTemplate).send(eq(TOPIC), eq("frank@example.com"), payload.capture());
        assertThat((Map<String, Object>) payload.getValue())
                .containsEntry("eventType", "EMAIL_VERIFICATION_REQUESTED")
                .containsEntry("verificationUrl", "https://app.vouch.dev/verify?token=abc");
    }

    @Test
    void broker_failure_becomes_notify_error() {
        when(kafkaTemplate.send(eq(TOPIC), anyString(), any()))
                .thenReturn(CompletableFuture.failedFuture(new KafkaException("broker unavailable")));

        NotifyException ex = assertThrows(NotifyException.class,
                () -> notifier.sendEmailVerification("frank@example.com", "https://app.vouch.dev/verify?token=abc"));

        assertThat(ex.getCause()).isInstanceOf(KafkaException.class);
        assertThat(ex.isRetryable()).isFalse();
    }

    @Test
    void missing_ack_within_timeout_becomes_notify_error() {
        properties.getKafka().setSendTimeout(Duration.ofMillis(50));
        when(kafkaTemplate.send(eq(TOPIC), anyString(), any())).thenReturn(new CompletableFuture<>());

        assertThrows(NotifyException.class,
                () -> notifier.sendEmailVerification("frank@example.com", "https://app.vouch.dev/verify?token=abc"));
    }

    @Test
    void synchronous_send_failure_becomes_notify_error() {
        when(kafkaTemplate.send(eq(TOPIC), anyString(), any())).thenThrow(new KafkaException("serialization failed"));

        assertThrows(NotifyException.class,
                () -> notifier.sendEmailVerification("frank@example.com", "https://app.vouch.dev/verify?token=abc"));
    }

    private CompletableFuture<SendResult<String, Object>> acked() {
        ProducerRecord<String, Object> record = new ProducerRecord<>(TOPIC, "key", Map.of());
        RecordMetadata metadata = new RecordMetadata(new TopicPartition(TOPIC, 0), 12L, 0, NOW.toEpochMilli(), 3, 40);
        return CompletableFuture.completedFuture(new SendResult<>(record, metadata));
    }
}
