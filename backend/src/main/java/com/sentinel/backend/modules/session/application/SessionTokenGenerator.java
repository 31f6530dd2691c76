package com.sentinel.backend.modules.session.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;

import org.springframework.stereotype.Component;

/**
 * Issues opaque session tokens and derives the hash under which they are stored.
 * Raw tokens are never persisted.
 */
@Component
public class SessionTokenGenerator {

    static final int TOKEN_BYTES = 64;

    private final SecureRandom secureRandom;

    public SessionTokenGenerator() {
        this(new SecureRandom());
    }

    SessionTokenGenerator(SecureRandom secureRandom) {
        this.secureRandom = secureRandom;
    }

    public String newToken() {
        byte[] bytes = new byte[TOKEN_BYTES];
        secureRandom.nextBytes(bytes);
        return Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
    }

    public String hash(String token) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hashed = digest.digest(token.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(hashed);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
