package com.sentinel.backend.global.web;

import java.time.Duration;
import java.util.Optional;

import jakarta.servlet.http.Cookie;
import jakarta.servlet.http.HttpServletRequest;

import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseCookie;
import org.springframework.stereotype.Component;

import com.sentinel.backend.modules.session.application.SessionProperties;

/**
 * Reads and writes the {@code session_id} / {@code session_token} cookie pair and the bearer header.
 */
@Component
public class SessionCookies {

    public static final String SESSION_ID_COOKIE = "session_id";
    public static final String SESSION_TOKEN_COOKIE = "session_token";

    private static final String BEARER_PREFIX = "Bearer ";

    private final SessionProperties properties;

    public SessionCookies(SessionProperties properties) {
        this.properties = properties;
    }

    public HttpHeaders issue(Long sessionId, String token, Duration maxAge) {
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.SET_COOKIE, build(SESSION_ID_COOKIE, String.valueOf(sessionId), maxAge).toString());
        headers.add(HttpHeaders.SET_COOKIE, build(SESSION_TOKEN_COOKIE, token, maxAge).toString());
        return headers;
    }

    public HttpHeaders clear() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.SET_COOKIE, build(SESSION_ID_COOKIE, "", Duration.ZERO).toString());
        headers.add(HttpHeaders.SET_COOKIE, build(SESSION_TOKEN_COOKIE, "", Duration.ZERO).toString());
        return headers;
    }

    /**
     * Bearer header first, then the {@code session_token} cookie.
     */
    public Optional<String> resolveToken(HttpServletRequest request) {
        String authorization = request.getHeader(HttpHeaders.AUTHORIZATION);
        if (authorization != null && authorization.startsWith(BEARER_PREFIX)) {
            String token = authorization.substring(BEARER_PREFIX.length()).trim();
            if (!token.isEmpty()) {
                return Optional.of(token);
            }
        }
        return readCookie(request, SESSION_TOKEN_COOKIE);
    }

    public Optional<String> readCookie(HttpServletRequest request, String name) {
        Cookie[] cookies = request.getCookies();
        if (cookies == null) {
            return Optional.empty();
        }
        for (Cookie cookie : cookies) {
            if (name.equals(cookie.getName()) && cookie.getValue() != null && !cookie.getValue().isBlank()) {
                return Optional.of(cookie.getValue());
            }
        }
        return Optional.empty();
    }

    private ResponseCookie build(String name, String value, Duration maxAge) {
        return ResponseCookie.from(name, value)
                .httpOnly(true)
                .secure(properties.secureCookies())
                .sameSite(properties.sameSite())
                .path("/")
                .maxAge(maxAge)
                .build();
    }
}
