package com.monitoring.platform.notification.channel;

import com.monitoring.platform.config.AlertingProperties;
import com.monitoring.platform.domain.Severity;
import com.monitoring.platform.notification.ChannelType;
import com.monitoring.platform.notification.NotificationPayload;
import com.twilio.Twilio;
import com.twilio.rest.api.v2010.account.Message;
import com.twilio.type.PhoneNumber;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.retry.RetryRegistry;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * SMS through Twilio. Off unless account credentials and both numbers are configured.
 */
@Slf4j
@Component
public class SmsNotificationChannel extends AbstractNotificationChannel {

    static final int MAX_BODY_LENGTH = 320;

    private final AlertingProperties.Sms config;

    public SmsNotificationChannel(AlertingProperties properties,
                                  CircuitBreakerRegistry circuitBreakerRegistry, RetryRegistry retryRegistry) {
        super(ChannelType.SMS, circuitBreakerRegistry, retryRegistry);
        this.config = properties.getSms();
    }

    @PostConstruct
    public void init() {
        if (isEnabled()) {
            Twilio.init(config.getAccountSid(), config.getAuthToken());
            log.info("Twilio SMS channel initialized for {}", config.getToNumber());
        } else {
            log.info("Twilio SMS channel is DISABLED.");
        }
    }

    @Override
    public boolean isEnabled() {
        return config.isEnabled()
                && notBlank(config.getAccountSid()) && notBlank(config.getAuthToken())
                && notBlank(config.getFromNumber()) && notBlank(config.getToNumber());
    }

    @Override
    public Severity getMinSeverity() {
        return config.getMinSeverity();
    }

    @Override
    protected String send(NotificationPayload payload) {
        Message message = Message.creator(
                new PhoneNumber(config.getToNumber()),
                new PhoneNumber(config.getFromNumber()),
                renderBody(payload)
        ).create();
        return "SMS sent, sid=" + message.getSid();
    }

    static String renderBody(NotificationPayload payload) {
        String body = String.format(Locale.ROOT, "[%s] %s%nSource: %s%nTime: %s%n%s",
                payload.getSeverity().name(),
                payload.getTitle(),
                payload.getSource(),
                formatTime(payload.getTimestamp()),
                payload.getMessage() != null ? payload.getMessage() : "");
        return body.length() > MAX_BODY_LENGTH ? body.substring(0, MAX_BODY_LENGTH - 3) + "..." : body;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
