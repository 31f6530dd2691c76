package com.sentinel.backend.modules.device.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.sentinel.backend.global.error.ProblemException;
import com.sentinel.backend.modules.account.domain.Account;
import com.sentinel.backend.modules.account.infrastructure.persistence.AccountRepository;
import com.sentinel.backend.modules.audit.application.AuditActions;
import com.sentinel.backend.modules.audit.application.AuditLogService;
import com.sentinel.backend.modules.device.domain.Device;
import com.sentinel.backend.modules.device.infrastructure.persistence.DeviceRepository;
import com.sentinel.backend.modules.device.presentation.dto.DevicePageResponse;
import com.sentinel.backend.modules.device.presentation.dto.DeviceResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Device inventory fed by client-reported system information. A report is matched to an existing
 * device by MAC address first, then by hostname.
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class DeviceService {

    private static final Logger log = LoggerFactory.getLogger(DeviceService.class);

    static final String UNKNOWN_HOSTNAME = "unknown";
    static final int MAX_FIELD_LENGTH = 255;
    static final int DEFAULT_PAGE_SIZE = 50;
    static final int MAX_PAGE_SIZE = 100;

    private final DeviceRepository deviceRepository;
    private final AccountRepository accountRepository;
    private final AuditLogService auditLogService;
    private final DeviceProperties properties;
    private final Clock clock;

    public DeviceService(
            DeviceRepository deviceRepository,
            AccountRepository accountRepository,
            AuditLogService auditLogService,
            DeviceProperties properties,
            Clock clock
    ) {
        this.deviceRepository = deviceRepository;
        this.accountRepository = accountRepository;
        this.auditLogService = auditLogService;
        this.properties = properties;
        this.clock = clock;
    }

    public DeviceResponse register(Map<String, Object> systemInfo, Long accountId, String ipAddress) {
        Map<String, Object> info = systemInfo != null ? systemInfo : Map.of();
        OffsetDateTime now = OffsetDateTime.now(clock);
        String hostname = text(info, "hostname", "computador");
        if (hostname == null) {
            hostname = UNKNOWN_HOSTNAME;
        }
        String mac = text(info, "mac_address", "macAddress");
        Account owner = accountId != null ? accountRepository.findById(accountId).orElse(null) : null;

        Optional<Device> existing = Optional.empty();
        if (mac != null) {
            existing = deviceRepository.findFirstByMacAddressOrderByIdAsc(mac);
        }
        if (existing.isEmpty()) {
            existing = deviceRepository.findFirstByHostnameOrderByIdAsc(hostname);
        }

        String publicIp = ipAddress != null ? ipAddress : text(info, "ip_publico", "public_ip");
        if (existing.isPresent()) {
            Device device = existing.get();
            device.setLastHeartbeatAt(now);
            device.setLocalIp(text(info, "ip_local", "local_ip"));
            device.setPublicIp(publicIp);
            if (owner != null) {
                device.setAccount(owner);
            }
            return DeviceResponse.from(deviceRepository.save(device), onlineThreshold(now));
        }

        Device device = new Device();
        device.setAccount(owner);
        device.setName(Optional.ofNullable(text(info, "nome", "name")).orElse(hostname));
        device.setType(Optional.ofNullable(text(info, "tipo", "type")).orElse(Device.DEFAULT_TYPE));
        device.setOperatingSystem(text(info, "sistema", "sistema_operacional", "operating_system"));
        device.setOsVersion(text(info, "versao", "os_version"));
        device.setHostname(hostname);
        device.setLocalIp(text(info, "ip_local", "local_ip"));
        device.setPublicIp(publicIp);
        device.setMacAddress(mac);
        device.setProcessor(text(info, "processador", "processor"));
        device.setMemoryTotal(text(info, "memoria", "memory"));
        device.setDiskTotal(text(info, "disco", "disk"));
        device.setVirtualMachine(Boolean.parseBoolean(text(info, "is_virtual")));
        device.setVirtualType(text(info, "virtual_type"));
        device.setLastHeartbeatAt(now);
        device.setExtraInfo(scalars(info));

        Device saved = deviceRepository.save(device);
        log.info("Device {} registered ({})", saved.getId(), hostname);
        auditLogService.record(accountId, AuditActions.DEVICE_REGISTERED,
                "Device " + saved.getId() + " registered: " + hostname, ipAddress);
        return DeviceResponse.from(saved, onlineThreshold(now));
    }

    public void heartbeat(Long deviceId) {
        Device device = load(deviceId);
        device.setLastHeartbeatAt(OffsetDateTime.now(clock));
    }

    @Transactional(readOnly = true)
    public DevicePageResponse list(Long accountId, Boolean active, int page, int size) {
        int safePage = Math.max(page, 0);
        int safeSize = size <= 0 ? DEFAULT_PAGE_SIZE : Math.min(size, MAX_PAGE_SIZE);
        OffsetDateTime threshold = onlineThreshold(OffsetDateTime.now(clock));

        Page<Device> result = deviceRepository.search(accountId, active, PageRequest.of(safePage, safeSize));
        List<DeviceResponse> items = result.getContent().stream()
                .map(device -> DeviceResponse.from(device, threshold))
                .toList();
        return new DevicePageResponse(items, safePage, safeSize, result.getTotalElements(), result.getTotalPages());
    }

    @Transactional(readOnly = true)
    public DeviceResponse get(Long deviceId) {
        return DeviceResponse.from(load(deviceId), onlineThreshold(OffsetDateTime.now(clock)));
    }

    @Transactional(readOnly = true)
    public long countDevices() {
        return deviceRepository.count();
    }

    @Transactional(readOnly = true)
    public long countOnline() {
        return deviceRepository.countByLastHeartbeatAtAfter(onlineThreshold(OffsetDateTime.now(clock)));
    }

    private OffsetDateTime onlineThreshold(OffsetDateTime now) {
        return now.minus(properties.onlineWindow());
    }

    private Device load(Long deviceId) {
        return deviceRepository.findById(deviceId)
                .orElseThrow(() -> ProblemException.notFound("DEVICE_NOT_FOUND", "Device not found"));
    }

    static String text(Map<String, ?> info, String... keys) {
        for (String key : keys) {
            Object value = info.get(key);
            if (value != null && !(value instanceof Map) && !(value instanceof Collection)) {
                String text = String.valueOf(value).trim();
                if (!text.isEmpty()) {
                    return text.length() <= MAX_FIELD_LENGTH ? text : text.substring(0, MAX_FIELD_LENGTH);
                }
            }
        }
        return null;
    }

    private static Map<String, String> scalars(Map<String, Object> info) {
        Map<String, String> result = new LinkedHashMap<>();
        info.forEach((key, value) -> {
            if (key != null && value != null && !(value instanceof Map) && !(value instanceof Collection)) {
                result.put(key, String.valueOf(value));
            }
        });
        return result;
    }
}
