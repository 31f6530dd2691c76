package com.sentinel.backend.modules.account;

import static com.sentinel.backend.support.SessionTestClient.bearer;
import static com.sentinel.backend.support.SessionTestClient.login;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.backend.modules.account.domain.AccessLevel;
import com.sentinel.backend.modules.account.domain.Account;
import com.sentinel.backend.modules.account.infrastructure.persistence.AccountRepository;
import com.sentinel.backend.support.AbstractPostgresIntegrationTest;
import com.sentinel.backend.support.TestAccountFactory;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class AccountAdminIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private TestAccountFactory testAccountFactory;

    @Autowired
    private AccountRepository accountRepository;

    private Account admin;
    private String adminToken;

    @BeforeEach
    void setUp() throws Exception {
        admin = testAccountFactory.ensureAdmin();
        adminToken = login(mockMvc, objectMapper, TestAccountFactory.ADMIN_EMAIL, TestAccountFactory.ADMIN_PASSWORD);
    }

    @Test
    void adminCreatesListsAndFetchesAccounts() throws Exception {
        mockMvc.perform(post("/api/accounts")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "name", "Carla Souza",
                                "email", "Carla@Example.com",
                                "password", "secret1",
                                "company", "Acme"))))
                .andExpect(status().isCreated())
                .andExpect(header().exists(HttpHeaders.LOCATION))
                .andExpect(jsonPath("$.email").value("carla@example.com"))
                .andExpect(jsonPath("$.accessLevel").value("USER"))
                .andExpect(jsonPath("$.hasPassword").value(true));

        mockMvc.perform(get("/api/accounts")
                        .param("search", "carla")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(1))
                .andExpect(jsonPath("$.items[0].company").value("Acme"));
    }

    @Test
    void duplicateEmailIsConflictRegardlessOfCase() throws Exception {
        mockMvc.perform(post("/api/accounts")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "name", "Clone", "email", "ADMIN@sistema.local", "password", "secret1"))))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.code").value("DUPLICATE_EMAIL"));
    }

    @Test
    void invalidPayloadIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/accounts")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("name", "", "email", "not-an-email"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void softAndHardDelete() throws Exception {
        Account soft = testAccountFactory.ensureAccount("Soft", "soft@example.com", "secret1", AccessLevel.USER);
        Account hard = testAccountFactory.ensureAccount("Hard", "hard@example.com", "secret1", AccessLevel.USER);

        mockMvc.perform(delete("/api/accounts/{id}", soft.getId()).header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isNoContent());
        mockMvc.perform(delete("/api/accounts/{id}", hard.getId())
                        .param("hard", "true")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isNoContent());

        assertThat(accountRepository.findById(soft.getId())).get().extracting(Account::isActive).isEqualTo(false);
        assertThat(accountRepository.findById(hard.getId())).isEmpty();

        mockMvc.perform(get("/api/audit/logs")
                        .param("severity", "WARNING")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.logs.length()").value(2));
    }

    @Test
    void adminCannotDeleteThemselves() throws Exception {
        mockMvc.perform(delete("/api/accounts/{id}", admin.getId()).header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("SELF_DEACTIVATION_FORBIDDEN"));
    }

    @Test
    void rejectedSelfDeactivationDoesNotCommitOtherChanges() throws Exception {
        String originalName = admin.getName();

        mockMvc.perform(patch("/api/accounts/{id}", admin.getId())
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of(
                                "name", "Hijacked", "accessLevel", "USER", "active", false))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("SELF_DEACTIVATION_FORBIDDEN"));

        Account reloaded = accountRepository.findById(admin.getId()).orElseThrow();
        assertThat(reloaded.getName()).isEqualTo(originalName);
        assertThat(reloaded.getAccessLevel()).isEqualTo(AccessLevel.ADMIN);
        assertThat(reloaded.isActive()).isTrue();
    }

    @Test
    void adminRoutesRequireAdminRole() throws Exception {
        testAccountFactory.ensureAccount("Dan", "dan@example.com", "secret1", AccessLevel.USER);
        String userToken = login(mockMvc, objectMapper, "dan@example.com", "secret1");

        mockMvc.perform(get("/api/accounts"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.code").value("UNAUTHORIZED"));
        mockMvc.perform(get("/api/accounts").header(HttpHeaders.AUTHORIZATION, bearer(userToken)))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.code").value("FORBIDDEN"));
        mockMvc.perform(get("/api/audit/logs").header(HttpHeaders.AUTHORIZATION, bearer(userToken)))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/stats").header(HttpHeaders.AUTHORIZATION, bearer(userToken)))
                .andExpect(status().isForbidden());
    }

    @Test
    void unknownSeverityIsRejected() throws Exception {
        mockMvc.perform(get("/api/audit/logs")
                        .param("severity", "LOUD")
                        .header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_SEVERITY"));
    }
}
