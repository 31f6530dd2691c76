package com.sentinel.backend.support;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

import org.junit.jupiter.api.AfterEach;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;

/**
 * Shared PostgreSQL container for DB-backed integration tests. The container is started once per JVM
 * and Flyway migrates it when the first Spring context starts. Concrete classes carry
 * {@code @Testcontainers(disabledWithoutDocker = true)} so they are skipped on hosts without Docker.
 */
public abstract class AbstractPostgresIntegrationTest {

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16.4")
            .withDatabaseName("sentinel_test")
            .withUsername("sentinel")
            .withPassword("sentinel");

    @DynamicPropertySource
    static void configureDatasource(DynamicPropertyRegistry registry) {
        startContainer();
        registry.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        registry.add("spring.datasource.username", POSTGRES::getUsername);
        registry.add("spring.datasource.password", POSTGRES::getPassword);
        registry.add("app.admin.enabled", () -> "false");
    }

    private static synchronized void startContainer() {
        if (!POSTGRES.isRunning()) {
            POSTGRES.start();
        }
    }

    @AfterEach
    void truncateTables() {
        try (Connection connection = DriverManager.getConnection(
                POSTGRES.getJdbcUrl(),
                POSTGRES.getUsername(),
                POSTGRES.getPassword());
             Statement stmt = connection.createStatement()) {
            stmt.execute("""
                    TRUNCATE TABLE audit_entry, chat_message, network_connection, device,
                        client_session, ip_identity, account RESTART IDENTITY CASCADE
                    """);
        } catch (SQLException ex) {
            throw new IllegalStateException("Failed to reset tables after test", ex);
        }
    }
}
