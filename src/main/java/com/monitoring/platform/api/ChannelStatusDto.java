package com.monitoring.platform.api;

import com.monitoring.platform.domain.Severity;
import com.monitoring.platform.notification.ChannelType;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ChannelStatusDto {

    ChannelType channel;
    boolean enabled;
    Severity minSeverity;
}
