package com.sentinel.backend.modules.identity.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.sentinel.backend.global.error.ProblemException;
import com.sentinel.backend.modules.identity.application.IpIdentityService.IdentityResolution;
import com.sentinel.backend.modules.identity.domain.IpIdentity;
import com.sentinel.backend.modules.identity.infrastructure.persistence.IpIdentityRepository;
import com.sentinel.backend.modules.identity.presentation.dto.IdentityPageResponse;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.test.util.ReflectionTestUtils;

@ExtendWith(MockitoExtension.class)
class IpIdentityServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    @Mock
    private IpIdentityRepository identityRepository;

    @Mock
    private UsernameGenerator usernameGenerator;

    private IpIdentityService service;

    @BeforeEach
    void setUp() {
        service = new IpIdentityService(identityRepository, usernameGenerator, new IdentityProperties(3, 10),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void firstContactInsertsAndCountsOneVisit() {
        IpIdentity created = identity("10.0.0.5", "SwiftFox0001");
        when(identityRepository.findByIpAddressForUpdate("10.0.0.5"))
                .thenReturn(Optional.empty(), Optional.of(created));
        when(usernameGenerator.generate(any())).thenReturn("SwiftFox0001");
        when(identityRepository.insertIfAbsent(eq("10.0.0.5"), eq("SwiftFox0001"), any(OffsetDateTime.class)))
                .thenReturn(1);

        IdentityResolution resolution = service.getOrCreate("10.0.0.5", "curl/8", Map.of("os", "linux"));

        assertThat(resolution.isNew()).isTrue();
        assertThat(resolution.identity().getTotalVisits()).isEqualTo(1);
        assertThat(resolution.identity().getMetadata())
                .containsEntry("os", "linux")
                .containsEntry(IpIdentity.USER_AGENT_KEY, "curl/8");
    }

    @Test
    void returningAddressSkipsInsert() {
        IpIdentity existing = identity("10.0.0.5", "SwiftFox0001");
        existing.recordVisit(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC).minusDays(1), null, null);
        when(identityRepository.findByIpAddressForUpdate("10.0.0.5")).thenReturn(Optional.of(existing));

        IdentityResolution resolution = service.getOrCreate("10.0.0.5:4431", null, null);

        assertThat(resolution.isNew()).isFalse();
        assertThat(resolution.identity().getTotalVisits()).isEqualTo(2);
        assertThat(resolution.identity().getLastSeenAt()).isEqualTo(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC));
        verify(identityRepository, never()).insertIfAbsent(anyString(), anyString(), any());
    }

    @Test
    void repeatedContactsCountVisitsOnOneIdentity() {
        IpIdentity created = identity("10.0.0.5", "SwiftFox0001");
        when(identityRepository.findByIpAddressForUpdate("10.0.0.5"))
                .thenReturn(Optional.empty(), Optional.of(created));
        when(usernameGenerator.generate(any())).thenReturn("SwiftFox0001");
        when(identityRepository.insertIfAbsent(eq("10.0.0.5"), eq("SwiftFox0001"), any(OffsetDateTime.class)))
                .thenReturn(1);

        List<Integer> visits = new ArrayList<>();
        List<Boolean> fresh = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            IdentityResolution resolution = service.getOrCreate("10.0.0.5", null, null);
            visits.add(resolution.identity().getTotalVisits());
            fresh.add(resolution.isNew());
        }

        assertThat(visits).containsExactly(1, 2, 3);
        assertThat(fresh).containsExactly(true, false, false);
        verify(identityRepository, times(1)).insertIfAbsent(anyString(), anyString(), any());
    }

    @Test
    void lostInsertRaceReadsWinnersRow() {
        IpIdentity winner = identity("10.0.0.5", "CalmOwl1234");
        when(identityRepository.findByIpAddressForUpdate("10.0.0.5"))
                .thenReturn(Optional.empty(), Optional.of(winner));
        when(usernameGenerator.generate(any())).thenReturn("BoldBear0002");
        when(identityRepository.insertIfAbsent(eq("10.0.0.5"), eq("BoldBear0002"), any(OffsetDateTime.class)))
                .thenReturn(0);

        IdentityResolution resolution = service.getOrCreate("10.0.0.5", null, null);

        assertThat(resolution.isNew()).isFalse();
        assertThat(resolution.identity().getUsername()).isEqualTo("CalmOwl1234");
    }

    @Test
    void giveUpAfterRepeatedUsernameCollisions() {
        when(identityRepository.findByIpAddressForUpdate("10.0.0.5")).thenReturn(Optional.empty());
        when(usernameGenerator.generate(any())).thenReturn("BoldBear0002");
        when(identityRepository.insertIfAbsent(eq("10.0.0.5"), eq("BoldBear0002"), any(OffsetDateTime.class)))
                .thenReturn(0);

        assertThrows(IllegalStateException.class, () -> service.getOrCreate("10.0.0.5", null, null));
        verify(identityRepository, times(IpIdentityService.MAX_INSERT_ATTEMPTS))
                .insertIfAbsent(anyString(), anyString(), any());
    }

    @Test
    void listClampsPageSizeAndMapsIdentities() {
        IpIdentity identity = identity("10.0.0.5", "SwiftFox0001");
        identity.recordVisit(OffsetDateTime.ofInstant(NOW, ZoneOffset.UTC), null, Map.of("os", "linux"));
        when(identityRepository.findAllByOrderByLastSeenAtDescIdDesc(PageRequest.of(0, IpIdentityService.MAX_PAGE_SIZE)))
                .thenReturn(new PageImpl<>(List.of(identity), PageRequest.of(0, IpIdentityService.MAX_PAGE_SIZE), 1));

        IdentityPageResponse page = service.list(-3, 10_000);

        assertThat(page.page()).isZero();
        assertThat(page.size()).isEqualTo(IpIdentityService.MAX_PAGE_SIZE);
        assertThat(page.totalElements()).isEqualTo(1);
        assertThat(page.items()).singleElement().satisfies(item -> {
            assertThat(item.username()).isEqualTo("SwiftFox0001");
            assertThat(item.ip()).isEqualTo("10.0.0.5");
            assertThat(item.totalVisits()).isEqualTo(1);
            assertThat(item.systemInfo()).containsEntry("os", "linux");
        });
    }

    @Test
    void unusableAddressIsRejected() {
        ProblemException ex = assertThrows(ProblemException.class, () -> service.getOrCreate("  ", null, null));

        assertThat(ex.getCode()).isEqualTo("INVALID_IP");
    }

    @Test
    void sanitizeKeepsBoundedScalars() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("nested", Map.of("a", 1));
        metadata.put("list", List.of(1, 2));
        metadata.put("cores", 8);
        metadata.put("nothing", null);
        metadata.put("platform", "a-very-long-platform-name");
        metadata.put("touch", true);
        metadata.put("extra", "dropped by entry cap");

        Map<String, String> sanitized = service.sanitize(metadata);

        assertThat(sanitized).containsOnlyKeys("cores", "platform", "touch");
        assertThat(sanitized.get("cores")).isEqualTo("8");
        assertThat(sanitized.get("platform")).isEqualTo("a-very-lon");
    }

    private static IpIdentity identity(String ip, String username) {
        IpIdentity identity = new IpIdentity();
        ReflectionTestUtils.setField(identity, "id", 1L);
        ReflectionTestUtils.setField(identity, "ipAddress", ip);
        ReflectionTestUtils.setField(identity, "username", username);
        return identity;
    }
}
