package com.sentinel.backend.modules.connection.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import com.sentinel.backend.global.error.ProblemException;
import com.sentinel.backend.modules.account.domain.Account;
import com.sentinel.backend.modules.account.infrastructure.persistence.AccountRepository;
import com.sentinel.backend.modules.connection.domain.NetworkConnection;
import com.sentinel.backend.modules.connection.infrastructure.persistence.NetworkConnectionRepository;
import com.sentinel.backend.modules.connection.presentation.dto.ConnectionEntry;
import com.sentinel.backend.modules.connection.presentation.dto.ConnectionPageResponse;
import com.sentinel.backend.modules.connection.presentation.dto.ConnectionResponse;
import com.sentinel.backend.modules.connection.presentation.dto.RecordConnectionsRequest;
import com.sentinel.backend.modules.device.domain.Device;
import com.sentinel.backend.modules.device.infrastructure.persistence.DeviceRepository;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(noRollbackFor = ProblemException.class)
public class ConnectionLogService {

    private static final Logger log = LoggerFactory.getLogger(ConnectionLogService.class);

    static final int DEFAULT_PAGE_SIZE = 100;
    static final int MAX_PAGE_SIZE = 500;

    private static final OffsetDateTime EARLIEST = OffsetDateTime.of(1970, 1, 1, 0, 0, 0, 0, ZoneOffset.UTC);
    private static final OffsetDateTime LATEST = OffsetDateTime.of(9999, 12, 31, 0, 0, 0, 0, ZoneOffset.UTC);

    private final NetworkConnectionRepository connectionRepository;
    private final DeviceRepository deviceRepository;
    private final AccountRepository accountRepository;
    private final Clock clock;

    public ConnectionLogService(
            NetworkConnectionRepository connectionRepository,
            DeviceRepository deviceRepository,
            AccountRepository accountRepository,
            Clock clock
    ) {
        this.connectionRepository = connectionRepository;
        this.deviceRepository = deviceRepository;
        this.accountRepository = accountRepository;
        this.clock = clock;
    }

    public int record(RecordConnectionsRequest request, Long accountId) {
        Device device = null;
        if (request.deviceId() != null) {
            device = deviceRepository.findById(request.deviceId())
                    .orElseThrow(() -> ProblemException.notFound("DEVICE_NOT_FOUND", "Device not found"));
        }
        Account account = accountId != null ? accountRepository.getReferenceById(accountId) : null;
        OffsetDateTime now = OffsetDateTime.now(clock);

        List<NetworkConnection> rows = new ArrayList<>(request.connections().size());
        for (ConnectionEntry entry : request.connections()) {
            NetworkConnection connection = new NetworkConnection();
            connection.setAccount(account);
            connection.setDevice(device);
            connection.setLocalIp(entry.localIp());
            connection.setRemoteIp(entry.remoteIp());
            connection.setLocalPort(entry.localPort());
            connection.setRemotePort(entry.remotePort());
            connection.setProtocol(upperOrDefault(entry.protocol(), NetworkConnection.DEFAULT_PROTOCOL));
            connection.setStatus(upperOrDefault(entry.status(), NetworkConnection.DEFAULT_STATUS));
            connection.setProcessName(entry.process());
            connection.setPid(entry.pid());
            connection.setDurationSeconds(entry.durationSeconds());
            connection.setBytesSent(entry.bytesSent() != null ? entry.bytesSent() : 0L);
            connection.setBytesReceived(entry.bytesReceived() != null ? entry.bytesReceived() : 0L);
            connection.setRecordedAt(now);
            rows.add(connection);
        }
        connectionRepository.saveAll(rows);
        log.debug("Recorded {} connection(s) for device {}", rows.size(), request.deviceId());
        return rows.size();
    }

    @Transactional(readOnly = true)
    public ConnectionPageResponse list(Long deviceId, Long accountId, OffsetDateTime from, OffsetDateTime to,
                                       int page, int size) {
        int safePage = Math.max(page, 0);
        int safeSize = size <= 0 ? DEFAULT_PAGE_SIZE : Math.min(size, MAX_PAGE_SIZE);
        Page<NetworkConnection> result = connectionRepository.search(
                deviceId,
                accountId,
                from != null ? from : EARLIEST,
                to != null ? to : LATEST,
                PageRequest.of(safePage, safeSize)
        );
        List<ConnectionResponse> items = result.getContent().stream()
                .map(ConnectionResponse::from)
                .toList();
        return new ConnectionPageResponse(items, safePage, safeSize, result.getTotalElements(), result.getTotalPages());
    }

    @Transactional(readOnly = true)
    public long countConnections() {
        return connectionRepository.count();
    }

    private static String upperOrDefault(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        return value.trim().toUpperCase(Locale.ROOT);
    }
}
