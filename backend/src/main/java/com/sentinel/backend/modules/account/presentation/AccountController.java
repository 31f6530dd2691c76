package com.sentinel.backend.modules.account.presentation;

import java.net.URI;

import com.sentinel.backend.global.security.SecurityUtils;
import com.sentinel.backend.global.web.ClientIpResolver;
import com.sentinel.backend.modules.account.application.AccountService;
import com.sentinel.backend.modules.account.presentation.dto.AccountPageResponse;
import com.sentinel.backend.modules.account.presentation.dto.AccountResponse;
import com.sentinel.backend.modules.account.presentation.dto.CreateAccountRequest;
import com.sentinel.backend.modules.account.presentation.dto.UpdateAccountRequest;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/accounts")
public class AccountController {

    private final AccountService accountService;
    private final ClientIpResolver clientIpResolver;

    public AccountController(AccountService accountService, ClientIpResolver clientIpResolver) {
        this.accountService = accountService;
        this.clientIpResolver = clientIpResolver;
    }

    @Operation(summary = "List accounts", description = "Newest first, optionally filtered by active flag and free text.")
    @GetMapping
    public ResponseEntity<AccountPageResponse> list(
            @RequestParam(name = "active", required = false) Boolean active,
            @RequestParam(name = "search", required = false) String search,
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "20") int size
    ) {
        return ResponseEntity.ok(accountService.list(active, search, page, size));
    }

    @Operation(summary = "Get account")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "Unknown account")
    })
    @GetMapping("/{accountId}")
    public ResponseEntity<AccountResponse> get(@PathVariable("accountId") Long accountId) {
        return ResponseEntity.ok(accountService.get(accountId));
    }

    @Operation(summary = "Create account")
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Created"),
            @ApiResponse(responseCode = "409", description = "Email already registered")
    })
    @PostMapping
    public ResponseEntity<AccountResponse> create(@Valid @RequestBody CreateAccountRequest request) {
        AccountResponse response = accountService.create(request);
        return ResponseEntity.created(URI.create("/api/accounts/" + response.id())).body(response);
    }

    @Operation(summary = "Update account", description = "Only the fields present in the body are changed.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Updated"),
            @ApiResponse(responseCode = "404", description = "Unknown account"),
            @ApiResponse(responseCode = "409", description = "Email already registered")
    })
    @PatchMapping("/{accountId}")
    public ResponseEntity<AccountResponse> update(
            @PathVariable("accountId") Long accountId,
            @Valid @RequestBody UpdateAccountRequest request,
            HttpServletRequest httpRequest
    ) {
        AccountResponse response = accountService.update(accountId, request,
                SecurityUtils.currentAccountId(), clientIpResolver.resolve(httpRequest));
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Delete account", description = "Deactivates by default; hard=true removes the account.")
    @ApiResponses({
            @ApiResponse(responseCode = "204", description = "Deleted or deactivated"),
            @ApiResponse(responseCode = "404", description = "Unknown account")
    })
    @DeleteMapping("/{accountId}")
    public ResponseEntity<Void> delete(
            @PathVariable("accountId") Long accountId,
            @RequestParam(name = "hard", defaultValue = "false") boolean hard,
            HttpServletRequest httpRequest
    ) {
        accountService.delete(accountId, hard, SecurityUtils.currentAccountId(), clientIpResolver.resolve(httpRequest));
        return ResponseEntity.noContent().build();
    }
}
