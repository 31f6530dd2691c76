package com.sentinel.backend.modules.connection.presentation.dto;

import java.time.OffsetDateTime;

import com.sentinel.backend.modules.connection.domain.NetworkConnection;

public record ConnectionResponse(
        Long id,
        Long accountId,
        Long deviceId,
        String localIp,
        String remoteIp,
        Integer localPort,
        Integer remotePort,
        String protocol,
        String status,
        String process,
        Integer pid,
        OffsetDateTime recordedAt,
        Integer durationSeconds,
        long bytesSent,
        long bytesReceived
) {

    public static ConnectionResponse from(NetworkConnection connection) {
        return new ConnectionResponse(
                connection.getId(),
                connection.getAccount() != null ? connection.getAccount().getId() : null,
                connection.getDevice() != null ? connection.getDevice().getId() : null,
                connection.getLocalIp(),
                connection.getRemoteIp(),
                connection.getLocalPort(),
                connection.getRemotePort(),
                connection.getProtocol(),
                connection.getStatus(),
                connection.getProcessName(),
                connection.getPid(),
                connection.getRecordedAt(),
                connection.getDurationSeconds(),
                connection.getBytesSent(),
                connection.getBytesReceived()
        );
    }
}
