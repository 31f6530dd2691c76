package com.sentinel.backend.modules.connection.presentation;

import java.time.OffsetDateTime;

import com.sentinel.backend.global.security.SecurityUtils;
import com.sentinel.backend.modules.connection.application.ConnectionLogService;
import com.sentinel.backend.modules.connection.presentation.dto.ConnectionPageResponse;
import com.sentinel.backend.modules.connection.presentation.dto.RecordConnectionsRequest;
import com.sentinel.backend.modules.connection.presentation.dto.RecordConnectionsResponse;

import io.swagger.v3.oas.annotations.Operation;

import jakarta.validation.Valid;

import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/connections")
public class ConnectionController {

    private final ConnectionLogService connectionLogService;

    public ConnectionController(ConnectionLogService connectionLogService) {
        this.connectionLogService = connectionLogService;
    }

    @Operation(summary = "Record a batch of connections")
    @PostMapping("/record")
    public ResponseEntity<RecordConnectionsResponse> record(@Valid @RequestBody RecordConnectionsRequest request) {
        int recorded = connectionLogService.record(request, SecurityUtils.currentAccountId());
        return ResponseEntity.ok(new RecordConnectionsResponse(true, recorded));
    }

    @Operation(summary = "List connections", description = "Newest first, filtered by device, account and time window.")
    @GetMapping
    public ResponseEntity<ConnectionPageResponse> list(
            @RequestParam(name = "deviceId", required = false) Long deviceId,
            @RequestParam(name = "accountId", required = false) Long accountId,
            @RequestParam(name = "from", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime from,
            @RequestParam(name = "to", required = false)
            @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) OffsetDateTime to,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "100") int size
    ) {
        return ResponseEntity.ok(connectionLogService.list(deviceId, accountId, from, to, page, size));
    }
}
