package com.sentinel.backend.modules.identity;

import static com.sentinel.backend.support.SessionTestClient.bearer;
import static com.sentinel.backend.support.SessionTestClient.login;
import static com.sentinel.backend.support.SessionTestClient.remoteAddr;
import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sentinel.backend.modules.identity.application.IpIdentityService;
import com.sentinel.backend.modules.identity.application.IpIdentityService.IdentityResolution;
import com.sentinel.backend.modules.identity.domain.IpIdentity;
import com.sentinel.backend.modules.identity.infrastructure.persistence.IpIdentityRepository;
import com.sentinel.backend.support.AbstractPostgresIntegrationTest;
import com.sentinel.backend.support.TestAccountFactory;

import jakarta.servlet.http.Cookie;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;
import org.testcontainers.junit.jupiter.Testcontainers;

@SpringBootTest
@AutoConfigureMockMvc
@Testcontainers(disabledWithoutDocker = true)
class IdentityIntegrationTest extends AbstractPostgresIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private IpIdentityService identityService;

    @Autowired
    private IpIdentityRepository identityRepository;

    @Autowired
    private TestAccountFactory testAccountFactory;

    @Test
    void repeatedAcceptFromSameAddressCountsVisits() throws Exception {
        String username = null;
        for (int visit = 1; visit <= 3; visit++) {
            JsonNode body = acceptTerms("10.0.0.5", Map.of("accept_terms", true));
            assertThat(body.path("success").asBoolean()).isTrue();
            assertThat(body.path("total_visits").asInt()).isEqualTo(visit);
            assertThat(body.path("is_new_user").asBoolean()).isEqualTo(visit == 1);
            if (username == null) {
                username = body.path("username").asText();
            }
            assertThat(body.path("username").asText()).isEqualTo(username);
        }

        assertThat(username).matches("[A-Z][a-z]+[A-Z][a-z]+\\d{4}");
        assertThat(identityRepository.count()).isEqualTo(1);
    }

    @Test
    void systemInfoIsStoredAndReturnedByMyData() throws Exception {
        acceptTerms("10.0.0.6", Map.of("system_info", Map.of("os", "Linux", "cores", 8, "gpu", Map.of("vendor", "x"))));

        mockMvc.perform(get("/api/my_data").with(remoteAddr("10.0.0.6")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.data.ip").value("10.0.0.6"))
                .andExpect(jsonPath("$.data.total_visits").value(1))
                .andExpect(jsonPath("$.data.system_info.os").value("Linux"))
                .andExpect(jsonPath("$.data.system_info.cores").value("8"))
                .andExpect(jsonPath("$.data.system_info.gpu").doesNotExist());
    }

    @Test
    void userInfoForUnknownAddressReportsAbsence() throws Exception {
        mockMvc.perform(get("/api/user_info").with(remoteAddr("10.9.9.9")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.exists").value(false))
                .andExpect(jsonPath("$.username").doesNotExist());

        mockMvc.perform(get("/api/my_data").with(remoteAddr("10.9.9.9")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("IDENTITY_NOT_FOUND"));

        assertThat(identityRepository.count()).isZero();
    }

    @Test
    void declinedTermsCreateNothing() throws Exception {
        mockMvc.perform(post("/api/accept_terms")
                        .with(remoteAddr("10.0.0.7"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("accept_terms", false))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("TERMS_NOT_ACCEPTED"));

        assertThat(identityRepository.count()).isZero();
    }

    @Test
    void acceptTermsOpensAnonymousSession() throws Exception {
        MvcResult result = mockMvc.perform(post("/api/accept_terms")
                        .with(remoteAddr("10.0.0.8"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isOk())
                .andReturn();
        Cookie token = result.getResponse().getCookie("session_token");
        assertThat(token).isNotNull();
        String username = objectMapper.readTree(result.getResponse().getContentAsString()).path("username").asText();

        mockMvc.perform(get("/api/auth/validate").cookie(token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valido").value(true))
                .andExpect(jsonPath("$.cliente.anonymous").value(true))
                .andExpect(jsonPath("$.cliente.username").value(username));

        mockMvc.perform(get("/api/accounts").cookie(token))
                .andExpect(status().isForbidden());
    }

    @Test
    void adminListsIdentitiesMostRecentlySeenFirst() throws Exception {
        acceptTerms("10.0.1.1", Map.of("system_info", Map.of("os", "Linux")));
        acceptTerms("10.0.1.2", Map.of());
        acceptTerms("10.0.1.1", Map.of());
        testAccountFactory.ensureAdmin();
        String adminToken = login(mockMvc, objectMapper, TestAccountFactory.ADMIN_EMAIL, TestAccountFactory.ADMIN_PASSWORD);

        mockMvc.perform(get("/api/identities").header(HttpHeaders.AUTHORIZATION, bearer(adminToken)))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalElements").value(2))
                .andExpect(jsonPath("$.items[0].ip").value("10.0.1.1"))
                .andExpect(jsonPath("$.items[0].total_visits").value(2))
                .andExpect(jsonPath("$.items[0].system_info.os").value("Linux"))
                .andExpect(jsonPath("$.items[1].ip").value("10.0.1.2"));

        MvcResult guest = mockMvc.perform(post("/api/accept_terms")
                        .with(remoteAddr("10.0.1.3"))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andReturn();
        mockMvc.perform(get("/api/identities").cookie(guest.getResponse().getCookie("session_token")))
                .andExpect(status().isForbidden());
        mockMvc.perform(get("/api/identities"))
                .andExpect(status().isUnauthorized());
    }

    @Test
    void equivalentAddressFormsShareOneIdentity() {
        IdentityResolution first = identityService.getOrCreate("2001:db8::1", null, null);
        IdentityResolution second = identityService.getOrCreate("[2001:DB8:0:0:0:0:0:1]:8443", null, null);

        assertThat(second.isNew()).isFalse();
        assertThat(second.identity().getId()).isEqualTo(first.identity().getId());
        assertThat(second.identity().getTotalVisits()).isEqualTo(2);
    }

    @Test
    void concurrentFirstContactCreatesOneIdentity() throws Exception {
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<IdentityResolution>> futures = new ArrayList<>();
            for (int i = 0; i < threads; i++) {
                Callable<IdentityResolution> task = () -> {
                    start.await();
                    return identityService.getOrCreate("10.0.0.42", "load-test", null);
                };
                futures.add(executor.submit(task));
            }
            start.countDown();

            int created = 0;
            for (Future<IdentityResolution> future : futures) {
                if (future.get(30, TimeUnit.SECONDS).isNew()) {
                    created++;
                }
            }
            assertThat(created).isEqualTo(1);
        } finally {
            executor.shutdownNow();
        }

        assertThat(identityRepository.count()).isEqualTo(1);
        IpIdentity identity = identityRepository.findByIpAddress("10.0.0.42").orElseThrow();
        assertThat(identity.getTotalVisits()).isEqualTo(threads);
    }

    private JsonNode acceptTerms(String address, Map<String, Object> body) throws Exception {
        MvcResult result = mockMvc.perform(post("/api/accept_terms")
                        .with(remoteAddr(address))
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(body)))
                .andExpect(status().isOk())
                .andReturn();
        return objectMapper.readTree(result.getResponse().getContentAsString());
    }
}
