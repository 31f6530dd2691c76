package com.sentinel.backend.modules.session.presentation;

import java.util.Optional;

import com.sentinel.backend.global.error.ProblemException;
import com.sentinel.backend.global.security.SecurityUtils;
import com.sentinel.backend.global.security.SessionPrincipal;
import com.sentinel.backend.global.web.ClientIpResolver;
import com.sentinel.backend.global.web.SessionCookies;
import com.sentinel.backend.modules.session.application.AuthService;
import com.sentinel.backend.modules.session.application.AuthService.LoginResult;
import com.sentinel.backend.modules.session.application.SessionRegistry;
import com.sentinel.backend.modules.session.presentation.dto.LoginRequest;
import com.sentinel.backend.modules.session.presentation.dto.LoginResponse;
import com.sentinel.backend.modules.session.presentation.dto.LogoutRequest;
import com.sentinel.backend.modules.session.presentation.dto.SuccessResponse;
import com.sentinel.backend.modules.session.presentation.dto.ValidateResponse;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService authService;
    private final SessionRegistry sessionRegistry;
    private final SessionCookies sessionCookies;
    private final ClientIpResolver clientIpResolver;

    public AuthController(
            AuthService authService,
            SessionRegistry sessionRegistry,
            SessionCookies sessionCookies,
            ClientIpResolver clientIpResolver
    ) {
        this.authService = authService;
        this.sessionRegistry = sessionRegistry;
        this.sessionCookies = sessionCookies;
        this.clientIpResolver = clientIpResolver;
    }

    @Operation(summary = "Log in with email and password", description = "Returns the session token and sets the session cookies.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Authenticated"),
            @ApiResponse(responseCode = "401", description = "Invalid credentials")
    })
    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request, HttpServletRequest httpRequest) {
        LoginResult result = authService.login(request, clientIpResolver.resolve(httpRequest),
                httpRequest.getHeader(HttpHeaders.USER_AGENT));
        HttpHeaders cookies = sessionCookies.issue(result.session().session().getId(), result.session().token(),
                sessionRegistry.defaultTtl());
        return ResponseEntity.ok().headers(cookies).body(result.response());
    }

    @Operation(summary = "Log out", description = "Token from bearer header, session cookie or body. Always succeeds.")
    @PostMapping("/logout")
    public ResponseEntity<SuccessResponse> logout(
            @RequestBody(required = false) LogoutRequest request,
            HttpServletRequest httpRequest
    ) {
        Optional<String> token = sessionCookies.resolveToken(httpRequest);
        if (token.isEmpty() && request != null && request.token() != null && !request.token().isBlank()) {
            token = Optional.of(request.token());
        }
        token.ifPresent(value -> authService.logout(value, clientIpResolver.resolve(httpRequest)));
        return ResponseEntity.ok().headers(sessionCookies.clear()).body(SuccessResponse.ok());
    }

    @Operation(summary = "Validate the current session")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Session valid"),
            @ApiResponse(responseCode = "401", description = "Missing, expired or revoked session")
    })
    @GetMapping("/validate")
    public ResponseEntity<ValidateResponse> validate() {
        SessionPrincipal principal = SecurityUtils.currentPrincipal()
                .orElseThrow(() -> ProblemException.unauthorized("INVALID_SESSION", "Session invalid or expired"));
        return ResponseEntity.ok(authService.describe(principal));
    }
}
