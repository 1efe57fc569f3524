package com.monitoring.platform.config;

import com.monitoring.platform.anomaly.AnomalyRule;
import com.monitoring.platform.anomaly.ErrorRateAnomalyRule;
import com.monitoring.platform.notification.NotificationChannel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.event.EventListener;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared infrastructure for the alert pipeline: clock, delivery pool, HTTP client for the
 * webhook-style channels and the default anomaly rule.
 */
@Slf4j
@Configuration
public class NotificationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(name = "notificationExecutor", destroyMethod = "shutdown")
    public ExecutorService notificationExecutor(AlertingProperties properties) {
        AtomicInteger counter = new AtomicInteger();
        ThreadFactory threadFactory = runnable -> {
            Thread thread = new Thread(runnable, "notification-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
        return Executors.newFixedThreadPool(Math.max(1, properties.getDeliveryThreads()), threadFactory);
    }

    @Bean(name = "notificationRestTemplate")
    public RestTemplate notificationRestTemplate(
            @Value("${monitoring.alerting.http-timeout-ms:10000}") int timeoutMs) {
        SimpleClientHttpRequestFactory factory = new SimpleClientHttpRequestFactory();
        factory.setConnectTimeout(timeoutMs);
        factory.setReadTimeout(timeoutMs);
        return new RestTemplate(factory);
    }

    @Bean
    @ConditionalOnMissingBean(AnomalyRule.class)
    public AnomalyRule errorRateAnomalyRule(
            @Value("${monitoring.processing.anomaly-threshold:0.5}") double threshold, Clock clock) {
        log.info("Using error-rate anomaly rule with threshold {}", threshold);
        return new ErrorRateAnomalyRule(threshold, clock);
    }

    /**
     * Logs which channels will receive alerts. Enabled-but-incomplete channels are flagged here
     * rather than failing startup, because the remaining channels can still deliver.
     */
    @Bean
    public ChannelStatusReporter channelStatusReporter(List<NotificationChannel> channels, AlertingProperties properties) {
        return new ChannelStatusReporter(channels, properties);
    }

    @Slf4j
    public static class ChannelStatusReporter {

        private final List<NotificationChannel> channels;
        private final AlertingProperties properties;

        ChannelStatusReporter(List<NotificationChannel> channels, AlertingProperties properties) {
            this.channels = channels;
            this.properties = properties;
        }

        @EventListener(ApplicationReadyEvent.class)
        public void report() {
            for (NotificationChannel channel : channels) {
                log.info("Notification channel {}: {} (min severity {})",
                        channel.getChannelType(), channel.isEnabled() ? "ENABLED" : "DISABLED", channel.getMinSeverity());
            }
            warnIfIncomplete("email", properties.getEmail().isEnabled(),
                    properties.getEmail().getFrom() != null && !properties.getEmail().getRecipients().isEmpty());
            warnIfIncomplete("slack", properties.getSlack().isEnabled(), hasText(properties.getSlack().getWebhookUrl()));
            warnIfIncomplete("webhook", properties.getWebhook().isEnabled(), hasText(properties.getWebhook().getUrl()));
            AlertingProperties.Sms sms = properties.getSms();
            warnIfIncomplete("sms", sms.isEnabled(), hasText(sms.getAccountSid()) && hasText(sms.getAuthToken())
                    && hasText(sms.getFromNumber()) && hasText(sms.getToNumber()));
            if (channels.stream().noneMatch(NotificationChannel::isEnabled)) {
                log.warn("No notification channels are enabled; anomalies will be logged only");
            }
        }

        private static void warnIfIncomplete(String name, boolean enabled, boolean complete) {
            if (enabled && !complete) {
                log.warn("Channel {} is enabled but not fully configured; it will be skipped", name);
            }
        }

        private static boolean hasText(String value) {
            return value != null && !value.isBlank();
        }
    }
}
