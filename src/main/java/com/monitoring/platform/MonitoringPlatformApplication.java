package com.monitoring.platform;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Telemetry correlation and alerting service. Periodically correlates infrastructure and
 * application metrics, scores anomalies and notifies the configured channels.
 */
@SpringBootApplication
@EnableScheduling
public class MonitoringPlatformApplication {

    public static void main(String[] args) {
        SpringApplication.run(MonitoringPlatformApplication.class, args);
    }
}
