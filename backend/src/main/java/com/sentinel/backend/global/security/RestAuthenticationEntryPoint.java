package com.sentinel.backend.global.security;

import java.io.IOException;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.backend.global.error.ApiErrorResponse;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

/**
 * Answers unauthenticated requests to protected routes. A request whose token was presented but
 * rejected gets {@code INVALID_SESSION}; a request without any token gets {@code UNAUTHORIZED}.
 */
@Component
public class RestAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private final ObjectMapper objectMapper;

    public RestAuthenticationEntryPoint(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response, AuthenticationException authException)
            throws IOException {
        boolean rejected = Boolean.TRUE.equals(request.getAttribute(SessionAuthenticationFilter.REJECTED_TOKEN_ATTRIBUTE));
        ApiErrorResponse body = rejected
                ? ApiErrorResponse.of(HttpStatus.UNAUTHORIZED, "INVALID_SESSION", "Session is invalid or expired",
                        request.getRequestURI())
                : ApiErrorResponse.of(HttpStatus.UNAUTHORIZED, "UNAUTHORIZED", "Authentication required",
                        request.getRequestURI());

        response.setStatus(HttpStatus.UNAUTHORIZED.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write(objectMapper.writeValueAsString(body));
    }
}
