package com.sentinel.backend.modules.device.presentation;

import com.sentinel.backend.global.security.SecurityUtils;
import com.sentinel.backend.global.web.ClientIpResolver;
import com.sentinel.backend.modules.device.application.DeviceService;
import com.sentinel.backend.modules.device.presentation.dto.DevicePageResponse;
import com.sentinel.backend.modules.device.presentation.dto.DeviceResponse;
import com.sentinel.backend.modules.device.presentation.dto.RegisterDeviceRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/devices")
public class DeviceController {

    private final DeviceService deviceService;
    private final ClientIpResolver clientIpResolver;

    public DeviceController(DeviceService deviceService, ClientIpResolver clientIpResolver) {
        this.deviceService = deviceService;
        this.clientIpResolver = clientIpResolver;
    }

    @Operation(summary = "Register or refresh a device", description = "Matches by MAC address, then hostname.")
    @PostMapping("/register")
    public ResponseEntity<DeviceResponse> register(
            @Valid @RequestBody RegisterDeviceRequest request,
            HttpServletRequest httpRequest
    ) {
        DeviceResponse response = deviceService.register(request.systemInfo(), SecurityUtils.currentAccountId(),
                clientIpResolver.resolve(httpRequest));
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Device heartbeat")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Heartbeat recorded"),
            @ApiResponse(responseCode = "404", description = "Unknown device")
    })
    @PostMapping("/{deviceId}/heartbeat")
    public ResponseEntity<Void> heartbeat(@PathVariable("deviceId") Long deviceId) {
        deviceService.heartbeat(deviceId);
        return ResponseEntity.noContent().build();
    }

    @Operation(summary = "List devices", description = "Most recent heartbeat first, with an online flag.")
    @GetMapping
    public ResponseEntity<DevicePageResponse> list(
            @RequestParam(name = "accountId", required = false) Long accountId,
            @RequestParam(name = "active", required = false) Boolean active,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "50") int size
    ) {
        return ResponseEntity.ok(deviceService.list(accountId, active, page, size));
    }

    @Operation(summary = "Get device")
    @GetMapping("/{deviceId}")
    public ResponseEntity<DeviceResponse> get(@PathVariable("deviceId") Long deviceId) {
        return ResponseEntity.ok(deviceService.get(deviceId));
    }
}
