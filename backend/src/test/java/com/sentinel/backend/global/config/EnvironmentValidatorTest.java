package com.sentinel.backend.global.config;

import static org.assertj.core.api.Assertions.assertThatCode;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.springframework.mock.env.MockEnvironment;

class EnvironmentValidatorTest {

    @Test
    void completeEnvironmentPasses() {
        MockEnvironment environment = baseEnvironment();

        assertThatCode(() -> new EnvironmentValidator(environment).validateEnvironment()).doesNotThrowAnyException();
    }

    @Test
    void missingDatasourceFails() {
        MockEnvironment environment = new MockEnvironment()
                .withProperty("app.session.ttl", "24h")
                .withProperty("app.cors.allowed-origins", "http://localhost:5173");

        assertThrows(IllegalStateException.class, () -> new EnvironmentValidator(environment).validateEnvironment());
    }

    @Test
    void unparseableOrExcessiveTtlFails() {
        assertThrows(IllegalStateException.class,
                () -> new EnvironmentValidator(baseEnvironment().withProperty("app.session.ttl", "soon")).validateEnvironment());
        assertThrows(IllegalStateException.class,
                () -> new EnvironmentValidator(baseEnvironment().withProperty("app.session.ttl", "400d")).validateEnvironment());
    }

    private static MockEnvironment baseEnvironment() {
        return new MockEnvironment()
                .withProperty("spring.datasource.url", "jdbc:postgresql://localhost:5432/sentinel")
                .withProperty("app.session.ttl", "24h")
                .withProperty("app.cors.allowed-origins", "http://localhost:5173");
    }
}
