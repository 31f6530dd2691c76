package com.sentinel.backend.modules.identity.presentation;

import com.sentinel.backend.global.error.ProblemException;
import com.sentinel.backend.global.web.ClientIpResolver;
import com.sentinel.backend.global.web.SessionCookies;
import com.sentinel.backend.modules.identity.application.AcceptTermsService;
import com.sentinel.backend.modules.identity.application.AcceptTermsService.AcceptTermsResult;
import com.sentinel.backend.modules.identity.application.IpIdentityService;
import com.sentinel.backend.modules.identity.presentation.dto.AcceptTermsRequest;
import com.sentinel.backend.modules.identity.presentation.dto.AcceptTermsResponse;
import com.sentinel.backend.modules.identity.presentation.dto.IdentityPageResponse;
import com.sentinel.backend.modules.identity.presentation.dto.MyDataResponse;
import com.sentinel.backend.modules.identity.presentation.dto.UserInfoResponse;
import com.sentinel.backend.modules.session.application.SessionRegistry;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class IdentityController {

    private final AcceptTermsService acceptTermsService;
    private final IpIdentityService identityService;
    private final SessionRegistry sessionRegistry;
    private final SessionCookies sessionCookies;
    private final ClientIpResolver clientIpResolver;

    public IdentityController(
            AcceptTermsService acceptTermsService,
            IpIdentityService identityService,
            SessionRegistry sessionRegistry,
            SessionCookies sessionCookies,
            ClientIpResolver clientIpResolver
    ) {
        this.acceptTermsService = acceptTermsService;
        this.identityService = identityService;
        this.sessionRegistry = sessionRegistry;
        this.sessionCookies = sessionCookies;
        this.clientIpResolver = clientIpResolver;
    }

    @Operation(summary = "Accept terms", description = "Creates or reuses the identity of the caller's address and opens a session.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Identity resolved, session cookies set"),
            @ApiResponse(responseCode = "400", description = "Terms explicitly declined")
    })
    @PostMapping("/accept_terms")
    public ResponseEntity<AcceptTermsResponse> acceptTerms(
            @RequestBody(required = false) AcceptTermsRequest request,
            HttpServletRequest httpRequest
    ) {
        AcceptTermsResult result = acceptTermsService.accept(request, clientIpResolver.resolve(httpRequest),
                httpRequest.getHeader(HttpHeaders.USER_AGENT));
        HttpHeaders cookies = sessionCookies.issue(result.session().session().getId(), result.session().token(),
                sessionRegistry.defaultTtl());
        return ResponseEntity.ok().headers(cookies).body(result.response());
    }

    @Operation(summary = "List identities", description = "Admin view of every known address, most recently seen first.")
    @GetMapping("/identities")
    public ResponseEntity<IdentityPageResponse> list(
            @RequestParam(name = "page", defaultValue = "0") int page,
            @RequestParam(name = "size", defaultValue = "50") int size
    ) {
        return ResponseEntity.ok(identityService.list(page, size));
    }

    @Operation(summary = "Identity of the caller's address")
    @GetMapping("/user_info")
    public ResponseEntity<UserInfoResponse> userInfo(HttpServletRequest httpRequest) {
        String ip = clientIpResolver.resolve(httpRequest);
        UserInfoResponse response = identityService.get(ip)
                .map(identity -> UserInfoResponse.of(identity, ip))
                .orElseGet(() -> UserInfoResponse.unknown(ip));
        return ResponseEntity.ok(response);
    }

    @Operation(summary = "Data collected for the caller's address")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Found"),
            @ApiResponse(responseCode = "404", description = "No identity for this address")
    })
    @GetMapping("/my_data")
    public ResponseEntity<MyDataResponse> myData(HttpServletRequest httpRequest) {
        String ip = clientIpResolver.resolve(httpRequest);
        return identityService.get(ip)
                .map(MyDataResponse::of)
                .map(ResponseEntity::ok)
                .orElseThrow(() -> ProblemException.notFound("IDENTITY_NOT_FOUND", "No data found for your address"));
    }
}
