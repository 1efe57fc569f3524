package com.monitoring.platform.config;

import com.monitoring.platform.domain.Severity;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Alerting settings: rate limiting, delivery bounds and per-channel endpoints.
 * Channel {@code minSeverity} values define the default fan-out and should widen with severity
 * (email &le; slack &le; webhook &le; sms).
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "monitoring.alerting")
public class AlertingProperties {

    /** Source name stamped on pipeline alerts. */
    private String source = "monitoring-platform";
    private long rateLimitWindowSeconds = 300;
    private long deliveryTimeoutMs = 30_000;
    private int deliveryThreads = 4;

    private Email email = new Email();
    private Slack slack = new Slack();
    private Webhook webhook = new Webhook();
    private Sms sms = new Sms();

    @Data
    public static class Email {
        private boolean enabled = false;
        private String from;
        private List<String> recipients = new ArrayList<>();
        private Severity minSeverity = Severity.INFO;
    }

    @Data
    public static class Slack {
        private boolean enabled = false;
        private String webhookUrl;
        private Severity minSeverity = Severity.MEDIUM;
    }

    @Data
    public static class Webhook {
        private boolean enabled = false;
        private String url;
        private Severity minSeverity = Severity.HIGH;
    }

    @Data
    public static class Sms {
        private boolean enabled = false;
        private String accountSid;
        private String authToken;
        private String fromNumber;
        private String toNumber;
        private Severity minSeverity = Severity.CRITICAL;
    }
}
