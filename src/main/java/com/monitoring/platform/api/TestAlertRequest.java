package com.monitoring.platform.api;

import com.monitoring.platform.domain.Severity;
import com.monitoring.platform.notification.ChannelType;
import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Operator test alert. Every field is optional: defaults produce an INFO "system check" alert
 * routed by severity.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Schema(description = "Test alert sent directly through the notification dispatcher")
public class TestAlertRequest {

    @Size(max = 200)
    @Schema(description = "Alert title", example = "Test Alert - System Check")
    private String title;

    @Size(max = 4000)
    @Schema(description = "Alert body")
    private String message;

    @Schema(description = "Severity, defaults to INFO", example = "HIGH")
    private Severity severity;

    @Schema(description = "Channels to use; empty means all channels eligible for the severity")
    private List<ChannelType> channels;
}
