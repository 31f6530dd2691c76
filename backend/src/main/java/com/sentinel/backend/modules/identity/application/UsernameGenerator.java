package com.sentinel.backend.modules.identity.application;

import java.security.SecureRandom;
import java.util.List;
import java.util.Random;
import java.util.function.Predicate;

import org.springframework.stereotype.Component;

/**
 * Generates display usernames of the form {@code <Adjective><Noun><4 digits>}.
 */
@Component
public class UsernameGenerator {

    static final int MAX_ATTEMPTS = 10;

    private static final List<String> ADJECTIVES = List.of(
            "Agile", "Bold", "Brave", "Bright", "Calm", "Clever", "Cosmic", "Crimson", "Daring", "Eager",
            "Fierce", "Gentle", "Golden", "Happy", "Jolly", "Keen", "Lucky", "Mighty", "Noble", "Quick",
            "Quiet", "Rapid", "Silent", "Silver", "Sly", "Swift", "Vivid", "Wild", "Wise", "Zesty"
    );

    private static final List<String> NOUNS = List.of(
            "Badger", "Bear", "Condor", "Dolphin", "Eagle", "Falcon", "Fox", "Gecko", "Hawk", "Jaguar",
            "Koala", "Lynx", "Otter", "Owl", "Panda", "Panther", "Raven", "Shark", "Tiger", "Wolf"
    );

    private final Random random;

    public UsernameGenerator() {
        this(new SecureRandom());
    }

    UsernameGenerator(Random random) {
        this.random = random;
    }

    public String generate() {
        return ADJECTIVES.get(random.nextInt(ADJECTIVES.size()))
                + NOUNS.get(random.nextInt(NOUNS.size()))
                + String.format("%04d", random.nextInt(10_000));
    }

    /**
     * Draws until {@code taken} rejects a candidate; after {@link #MAX_ATTEMPTS} draws a six-digit
     * suffix is used instead.
     */
    public String generate(Predicate<String> taken) {
        for (int attempt = 0; attempt < MAX_ATTEMPTS; attempt++) {
            String candidate = generate();
            if (!taken.test(candidate)) {
                return candidate;
            }
        }
        return ADJECTIVES.get(random.nextInt(ADJECTIVES.size()))
                + NOUNS.get(random.nextInt(NOUNS.size()))
                + String.format("%06d", random.nextInt(1_000_000));
    }
}
