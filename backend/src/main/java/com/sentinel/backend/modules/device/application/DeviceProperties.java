package com.sentinel.backend.modules.device.application;

import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * @param onlineWindow a device counts as online when its last heartbeat is within this window
 */
@ConfigurationProperties(prefix = "app.devices")
public record DeviceProperties(@DefaultValue("5m") Duration onlineWindow) {
}
