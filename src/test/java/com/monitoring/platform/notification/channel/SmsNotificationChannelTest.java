package com.monitoring.platform.notification.channel;

import com.monitoring.platform.config.AlertingProperties;
import com.monitoring.platform.domain.Severity;
import com.monitoring.platform.notification.NotificationPayload;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static com.monitoring.platform.notification.channel.ChannelTestSupport.breakers;
import static com.monitoring.platform.notification.channel.ChannelTestSupport.payload;
import static com.monitoring.platform.notification.channel.ChannelTestSupport.retries;
import static org.assertj.core.api.Assertions.assertThat;

class SmsNotificationChannelTest {

    @Test
    void requiresCredentialsAndBothNumbers() {
        AlertingProperties properties = new AlertingProperties();
        properties.getSms().setEnabled(true);
        properties.getSms().setAccountSid("AC123");
        properties.getSms().setAuthToken("token");
        properties.getSms().setFromNumber("+15550001111");
        SmsNotificationChannel channel = new SmsNotificationChannel(properties, breakers(), retries(1));

        assertThat(channel.isEnabled()).isFalse();
        assertThat(channel.deliver(payload(Severity.CRITICAL)).getError()).isEqualTo("sms not configured");

        properties.getSms().setToNumber("+15552223333");
        assertThat(channel.isEnabled()).isTrue();
        assertThat(channel.getMinSeverity()).isEqualTo(Severity.CRITICAL);
    }

    @Test
    void bodyCarriesSeverityTitleAndSource() {
        String body = SmsNotificationChannel.renderBody(payload(Severity.CRITICAL));

        assertThat(body).startsWith("[CRITICAL] Monitoring Platform Alert - CRITICAL");
        assertThat(body).contains("Source: monitoring-platform");
    }

    @Test
    void longBodiesAreTruncated() {
        NotificationPayload longPayload = NotificationPayload.builder()
                .title("t")
                .message("x".repeat(1_000))
                .severity(Severity.CRITICAL)
                .source("s")
                .timestamp(Instant.EPOCH)
                .build();

        String body = SmsNotificationChannel.renderBody(longPayload);

        assertThat(body).hasSize(SmsNotificationChannel.MAX_BODY_LENGTH).endsWith("...");
    }
}
