package com.monitoring.platform.api;

import com.monitoring.platform.notification.DispatchResult;
import com.monitoring.platform.notification.NotificationChannel;
import com.monitoring.platform.notification.NotificationDispatcher;
import com.monitoring.platform.notification.NotificationPayload;
import com.monitoring.platform.notification.NotificationPayloadFactory;
import com.monitoring.platform.orchestrator.CycleSummary;
import com.monitoring.platform.orchestrator.MonitoringCycleOrchestrator;
import com.monitoring.platform.orchestrator.RecentCyclesStore;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Operator API: trigger a cycle, inspect recent cycles, verify channel configuration.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/monitoring")
@RequiredArgsConstructor
@Tag(name = "Monitoring", description = "Processing cycles and alert channel checks")
public class MonitoringController {

    private final MonitoringCycleOrchestrator orchestrator;
    private final RecentCyclesStore recentCyclesStore;
    private final NotificationDispatcher dispatcher;
    private final NotificationPayloadFactory payloadFactory;

    @PostMapping("/cycles/run")
    @Operation(summary = "Run a cycle now", description = "Runs one fetch/correlate/score/dispatch cycle and returns its summary. Waits for a running cycle to finish first.")
    public ResponseEntity<CycleSummary> runCycle() {
        log.info("Manual processing cycle requested");
        return ResponseEntity.ok(orchestrator.runCycle());
    }

    @GetMapping("/cycles")
    @Operation(summary = "List recent cycles", description = "Returns recent cycle summaries, newest first (in-memory; last 50)")
    public ResponseEntity<List<CycleSummary>> listCycles(@RequestParam(defaultValue = "20") int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive");
        }
        return ResponseEntity.ok(recentCyclesStore.getRecent(limit));
    }

    @PostMapping("/alerts/test")
    @Operation(summary = "Send a test alert", description = "Builds an alert from the request and sends it through the dispatcher only, bypassing correlation and scoring. Subject to the source rate limit.")
    public ResponseEntity<DispatchResult> sendTestAlert(@Valid @RequestBody(required = false) TestAlertRequest request) {
        TestAlertRequest req = request != null ? request : new TestAlertRequest();
        NotificationPayload payload = payloadFactory.testAlert(req.getTitle(), req.getMessage(), req.getSeverity());
        log.info("Test alert requested: alertId={} severity={} channels={}",
                payload.getAlertId(), payload.getSeverity(), req.getChannels());
        return ResponseEntity.ok(dispatcher.dispatch(payload, req.getChannels()));
    }

    @GetMapping("/channels")
    @Operation(summary = "Channel status", description = "Enabled flag and minimum severity of every notification channel")
    public ResponseEntity<List<ChannelStatusDto>> channels() {
        List<ChannelStatusDto> status = dispatcher.getChannels().values().stream()
                .map(MonitoringController::toStatus)
                .collect(Collectors.toList());
        return ResponseEntity.ok(status);
    }

    private static ChannelStatusDto toStatus(NotificationChannel channel) {
        return ChannelStatusDto.builder()
                .channel(channel.getChannelType())
                .enabled(channel.isEnabled())
                .minSeverity(channel.getMinSeverity())
                .build();
    }
}
