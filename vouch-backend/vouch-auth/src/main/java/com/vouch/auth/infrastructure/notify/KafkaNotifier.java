package com.vouch.auth.infrastructure.notify;

import com.vouch.auth.config.NotifierProperties;
import com.vouch.auth.domain.exception.NotifyException;
import com.vouch.auth.domain.model.EventType;
import com.vouch.auth.domain.model.RequestSecurityContext;
import com.vouch.auth.domain.notify.Notifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.KafkaException;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Kafka Notifier - publishes delivery events for the mail service to render and send.
 * Waits for the broker acknowledgement so a failed publish surfaces as NotifyException.
 */
@Component
@ConditionalOnProperty(prefix = "vouch.notifier", name = "type", havingValue = "kafka", matchIfMissing = true)
@Slf4j
public class KafkaNotifier implements Notifier {

    private final KafkaTemplate<String, Object> kafkaTemplate;
    private final NotifierProperties properties;
    private final Clock clock;

    public KafkaNotifier(KafkaTemplate<String, Object> kafkaTemplate, NotifierProperties properties, Clock clock) {
        this.kafkaTemplate = kafkaTemplate;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Publish PASSWORD_RESET_CODE_REQUESTED
     * Carries the plaintext code plus where the request came from
     */
    @Override
    public void sendPasswordResetCode(String email, String code, RequestSecurityContext securityContext) {
        Map<String, Object> eventData = new HashMap<>();
        eventData.put("eventType", EventType.PASSWORD_RESET_CODE_REQUESTED.toString());
        eventData.put("email", email);
        eventData.put("code", code);  // Raw code for email
        eventData.put("requestIp", securityContext.getRequestIp());
        eventData.put("userAgent", securityContext.getUserAgent());
        eventData.put("requestTime", securityContext.getRequestTime().toEpochMilli());
        eventData.put("timestamp", clock.millis());

        publish(EventType.PASSWORD_RESET_CODE_REQUESTED, email, eventData);
    }

    /**
     * Publish EMAIL_VERIFICATION_REQUESTED with the ready-to-click link
     */
    @Override
    public void sendEmailVerification(String email, String verificationUrl) {
        Map<String, Object> eventData = new HashMap<>();
        eventData.put("eventType", EventType.EMAIL_VERIFICATION_REQUESTED.toString());
        eventData.put("email", email);
        eventData.put("verificationUrl", verificationUrl);
        eventData.put("timestamp", clock.millis());

        publish(EventType.EMAIL_VERIFICATION_REQUESTED, email, eventData);
    }

    private void publish(EventType eventType, String key, Map<String, Object> eventData) {
        String topic = properties.getKafka().getTopic();
        long timeoutMillis = properties.getKafka().getSendTimeout().toMillis();

        log.info("[EVENT_PUBLISH_START] Publishing {} event | email={} | topic={}", eventType, key, topic);
        try {
            SendResult<String, Object> result = kafkaTemplate.send(topic, key, eventData)
                    .get(timeoutMillis, TimeUnit.MILLISECONDS);

            log.info("[EVENT_PUBLISHED] {} event published successfully | topic={} | partition={} | offset={}",
                    eventType, topic,
                    result.getRecordMetadata().partition(),
                    result.getRecordMetadata().offset());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotifyException("Interrupted while publishing " + eventType, e);
        } catch (ExecutionException e) {
            log.warn("[EVENT_PUBLISH_FAILED] Failed to publish {} event | topic={} | error={}",
                    eventType, topic, e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
            throw new NotifyException("Failed to publish " + eventType, e.getCause() != null ? e.getCause() : e);
        } catch (TimeoutException e) {
            log.warn("[EVENT_PUBLISH_TIMEOUT] No broker ack for {} event within {}ms | topic={}",
                    eventType, timeoutMillis, topic);
            throw new NotifyException("Timed out publishing " + eventType, e);
        } catch (KafkaException e) {
            log.warn("[EVENT_PUBLISH_FAILED] Failed to publish {} event | topic={} | error={}",
                    eventType, topic, e.getMessage(), e);
            throw new NotifyException("Failed to publish " + eventType, e);
        }
    }
}
