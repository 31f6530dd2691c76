package com.sentinel.backend.global.web;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;

class ClientIpResolverTest {

    private final ClientIpResolver resolver = new ClientIpResolver("127.0.0.1,10.1.1.1");

    @Test
    void directPeerWinsWhenNotTrusted() {
        MockHttpServletRequest request = request("203.0.113.9");
        request.addHeader("X-Forwarded-For", "198.51.100.1");

        assertThat(resolver.resolve(request)).isEqualTo("203.0.113.9");
    }

    @Test
    void rightmostUntrustedForwardedHopWinsBehindTrustedProxy() {
        MockHttpServletRequest request = request("127.0.0.1");
        request.addHeader("X-Forwarded-For", "198.51.100.1, 203.0.113.7, 10.1.1.1");

        assertThat(resolver.resolve(request)).isEqualTo("203.0.113.7");
    }

    @Test
    void realIpHeaderIsFallback() {
        MockHttpServletRequest request = request("127.0.0.1");
        request.addHeader("X-Forwarded-For", "not-an-ip");
        request.addHeader("X-Real-IP", " 203.0.113.8 ");

        assertThat(resolver.resolve(request)).isEqualTo("203.0.113.8");
    }

    @Test
    void missingPeerAddressIsUnknown() {
        assertThat(resolver.resolve(request(""))).isEqualTo(ClientIpResolver.UNKNOWN);
    }

    @Test
    void ipShapeCheck() {
        assertThat(ClientIpResolver.isValidIp("2001:db8::1")).isTrue();
        assertThat(ClientIpResolver.isValidIp("10.0.0.1")).isTrue();
        assertThat(ClientIpResolver.isValidIp("evil.example.com")).isFalse();
        assertThat(ClientIpResolver.isValidIp("1".repeat(65))).isFalse();
    }

    private static MockHttpServletRequest request(String remoteAddr) {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.setRemoteAddr(remoteAddr);
        return request;
    }
}
