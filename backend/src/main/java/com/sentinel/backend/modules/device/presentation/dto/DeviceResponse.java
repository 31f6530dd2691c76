package com.sentinel.backend.modules.device.presentation.dto;

import java.time.OffsetDateTime;
import java.util.Map;

import com.sentinel.backend.modules.account.domain.Account;
import com.sentinel.backend.modules.device.domain.Device;

public record DeviceResponse(
        Long id,
        Long accountId,
        String accountName,
        String name,
        String type,
        String operatingSystem,
        String osVersion,
        String hostname,
        String localIp,
        String publicIp,
        String macAddress,
        String processor,
        String memoryTotal,
        String diskTotal,
        boolean virtualMachine,
        String virtualType,
        boolean active,
        boolean online,
        OffsetDateTime lastHeartbeatAt,
        OffsetDateTime registeredAt,
        Map<String, String> extraInfo
) {

    public static DeviceResponse from(Device device, OffsetDateTime onlineThreshold) {
        Account account = device.getAccount();
        return new DeviceResponse(
                device.getId(),
                account != null ? account.getId() : null,
                account != null ? account.getName() : null,
                device.getName(),
                device.getType(),
                device.getOperatingSystem(),
                device.getOsVersion(),
                device.getHostname(),
                device.getLocalIp(),
                device.getPublicIp(),
                device.getMacAddress(),
                device.getProcessor(),
                device.getMemoryTotal(),
                device.getDiskTotal(),
                device.isVirtualMachine(),
                device.getVirtualType(),
                device.isActive(),
                device.isOnlineAt(onlineThreshold),
                device.getLastHeartbeatAt(),
                device.getCreatedAt(),
                device.getExtraInfo()
        );
    }
}
