package com.sentinel.backend.global.web;

import java.util.Arrays;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import jakarta.servlet.http.HttpServletRequest;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/**
 * Resolves the caller address of a servlet request.
 * <p>
 * Forwarding headers are honoured only when the direct peer is a configured trusted proxy;
 * in that case the rightmost untrusted entry of {@code X-Forwarded-For} wins, then {@code X-Real-IP}.
 * </p>
 */
@Component
public class ClientIpResolver {

    public static final String UNKNOWN = "unknown";

    private static final Pattern IP_PATTERN = Pattern.compile("^[0-9a-fA-F.:\\[\\]%]+$");
    private static final int MAX_IP_LENGTH = 64;

    private final Set<String> trustedProxies;

    public ClientIpResolver(
            @Value("${app.network.trusted-proxies:127.0.0.1,::1,0:0:0:0:0:0:0:1}") String trustedProxies
    ) {
        this.trustedProxies = Arrays.stream(trustedProxies.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }

    public String resolve(HttpServletRequest request) {
        String remoteIp = request.getRemoteAddr();
        if (remoteIp == null || remoteIp.isBlank()) {
            remoteIp = UNKNOWN;
        }

        if (!trustedProxies.contains(remoteIp)) {
            return remoteIp;
        }

        String forwardedFor = request.getHeader("X-Forwarded-For");
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String[] hops = forwardedFor.split(",");
            for (int i = hops.length - 1; i >= 0; i--) {
                String hop = hops[i].trim();
                if (isValidIp(hop) && !trustedProxies.contains(hop)) {
                    return hop;
                }
            }
        }

        String realIp = request.getHeader("X-Real-IP");
        if (realIp != null && isValidIp(realIp.trim())) {
            return realIp.trim();
        }

        return remoteIp;
    }

    static boolean isValidIp(String ip) {
        return ip != null
                && !ip.isBlank()
                && ip.length() <= MAX_IP_LENGTH
                && IP_PATTERN.matcher(ip).matches();
    }
}
