package com.sentinel.backend.modules.device.domain;

import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

import com.sentinel.backend.global.jpa.AbstractTimestampedEntity;
import com.sentinel.backend.modules.account.domain.Account;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;

import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "device")
public class Device extends AbstractTimestampedEntity {

    public static final String DEFAULT_TYPE = "desktop";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "account_id")
    private Account account;

    @Column(name = "name", length = 255)
    private String name;

    @Column(name = "device_type", length = 255)
    private String type = DEFAULT_TYPE;

    @Column(name = "operating_system", length = 255)
    private String operatingSystem;

    @Column(name = "os_version", length = 255)
    private String osVersion;

    @Column(name = "hostname", length = 255)
    private String hostname;

    @Column(name = "local_ip", length = 255)
    private String localIp;

    @Column(name = "public_ip", length = 255)
    private String publicIp;

    @Column(name = "mac_address", length = 255)
    private String macAddress;

    @Column(name = "processor", length = 255)
    private String processor;

    @Column(name = "memory_total", length = 255)
    private String memoryTotal;

    @Column(name = "disk_total", length = 255)
    private String diskTotal;

    @Column(name = "is_virtual", nullable = false)
    private boolean virtualMachine;

    @Column(name = "virtual_type", length = 255)
    private String virtualType;

    @Column(name = "active", nullable = false)
    private boolean active = true;

    @Column(name = "last_heartbeat_at")
    private OffsetDateTime lastHeartbeatAt;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "extra_info", columnDefinition = "jsonb")
    private Map<String, String> extraInfo = new LinkedHashMap<>();

    public Long getId() {
        return id;
    }

    public Account getAccount() {
        return account;
    }

    public void setAccount(Account account) {
        this.account = account;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getOperatingSystem() {
        return operatingSystem;
    }

    public void setOperatingSystem(String operatingSystem) {
        this.operatingSystem = operatingSystem;
    }

    public String getOsVersion() {
        return osVersion;
    }

    public void setOsVersion(String osVersion) {
        this.osVersion = osVersion;
    }

    public String getHostname() {
        return hostname;
    }

    public void setHostname(String hostname) {
        this.hostname = hostname;
    }

    public String getLocalIp() {
        return localIp;
    }

    public void setLocalIp(String localIp) {
        this.localIp = localIp;
    }

    public String getPublicIp() {
        return publicIp;
    }

    public void setPublicIp(String publicIp) {
        this.publicIp = publicIp;
    }

    public String getMacAddress() {
        return macAddress;
    }

    public void setMacAddress(String macAddress) {
        this.macAddress = macAddress;
    }

    public String getProcessor() {
        return processor;
    }

    public void setProcessor(String processor) {
        this.processor = processor;
    }

    public String getMemoryTotal() {
        return memoryTotal;
    }

    public void setMemoryTotal(String memoryTotal) {
        this.memoryTotal = memoryTotal;
    }

    public String getDiskTotal() {
        return diskTotal;
    }

    public void setDiskTotal(String diskTotal) {
        this.diskTotal = diskTotal;
    }

    public boolean isVirtualMachine() {
        return virtualMachine;
    }

    public void setVirtualMachine(boolean virtualMachine) {
        this.virtualMachine = virtualMachine;
    }

    public String getVirtualType() {
        return virtualType;
    }

    public void setVirtualType(String virtualType) {
        this.virtualType = virtualType;
    }

    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        this.active = active;
    }

    public OffsetDateTime getLastHeartbeatAt() {
        return lastHeartbeatAt;
    }

    public void setLastHeartbeatAt(OffsetDateTime lastHeartbeatAt) {
        this.lastHeartbeatAt = lastHeartbeatAt;
    }

    public Map<String, String> getExtraInfo() {
        return extraInfo;
    }

    public void setExtraInfo(Map<String, String> extraInfo) {
        this.extraInfo = extraInfo;
    }

    public boolean isOnlineAt(OffsetDateTime threshold) {
        return lastHeartbeatAt != null && lastHeartbeatAt.isAfter(threshold);
    }
}
