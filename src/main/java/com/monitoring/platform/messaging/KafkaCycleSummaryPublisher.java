package com.monitoring.platform.messaging;

import com.monitoring.platform.orchestrator.CycleSummary;
import com.monitoring.platform.orchestrator.CycleSummaryListener;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.support.SendResult;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * Publishes cycle summaries to Kafka for downstream monitoring dashboards. Keyed by cycle id.
 * Send failures are logged only; publishing never affects the cycle outcome.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "monitoring.kafka.cycle-summaries.enabled", havingValue = "true")
public class KafkaCycleSummaryPublisher implements CycleSummaryListener {

    private final KafkaTemplate<String, CycleSummary> cycleSummaryKafkaTemplate;

    @Value("${monitoring.kafka.cycle-summaries.topic:monitoring-cycle-summaries}")
    private String topic = "monitoring-cycle-summaries";

    @Override
    public void onCycleCompleted(CycleSummary summary) {
        CompletableFuture<SendResult<String, CycleSummary>> future =
                cycleSummaryKafkaTemplate.send(topic, summary.getCycleId(), summary);
        future.whenComplete((result, ex) -> {
            if (ex != null) {
                log.error("Failed to publish cycle summary {}", summary.getCycleId(), ex);
            } else {
                log.debug("Published cycle summary {} partition={} offset={}", summary.getCycleId(),
                        result.getRecordMetadata().partition(), result.getRecordMetadata().offset());
            }
        });
    }
}
