package com.vouch.auth.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

@Data
@ConfigurationProperties(prefix = "vouch.notifier")
public class NotifierProperties {

    /** kafka or logging */
    private String type = "kafka";

    private final Kafka kafka = new Kafka();

    @Data
    public static class Kafka {
        private String topic = "auth.notifications";
        private Duration sendTimeout = Duration.ofSeconds(5);
    }
}
