package com.sentinel.backend.modules.identity.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.sentinel.backend.global.error.ProblemException;
import com.sentinel.backend.modules.identity.domain.IpIdentity;
import com.sentinel.backend.modules.identity.infrastructure.persistence.IpIdentityRepository;
import com.sentinel.backend.modules.identity.presentation.dto.IdentityPageResponse;
import com.sentinel.backend.modules.identity.presentation.dto.IdentitySummaryResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Maps client addresses to persistent pseudonymous identities.
 * <p>
 * Creation relies on the unique index over {@code ip_address}: the insert is a no-op when another
 * request got there first, and the row is then read under a write lock so visit counting is serialized
 * per address.
 * </p>
 */
@Service
@Transactional(noRollbackFor = ProblemException.class)
public class IpIdentityService {

    private static final Logger log = LoggerFactory.getLogger(IpIdentityService.class);

    static final int MAX_INSERT_ATTEMPTS = 5;
    static final int DEFAULT_PAGE_SIZE = 50;
    static final int MAX_PAGE_SIZE = 200;

    private final IpIdentityRepository identityRepository;
    private final UsernameGenerator usernameGenerator;
    private final IdentityProperties properties;
    private final Clock clock;

    public IpIdentityService(
            IpIdentityRepository identityRepository,
            UsernameGenerator usernameGenerator,
            IdentityProperties properties,
            Clock clock
    ) {
        this.identityRepository = identityRepository;
        this.usernameGenerator = usernameGenerator;
        this.properties = properties;
        this.clock = clock;
    }

    public IdentityResolution getOrCreate(String ipAddress, String userAgent, Map<String, ?> metadata) {
        String key = IpAddressNormalizer.normalize(ipAddress);
        if (key == null) {
            throw ProblemException.badRequest("INVALID_IP", "Client address could not be determined");
        }
        OffsetDateTime now = OffsetDateTime.now(clock);

        boolean created = false;
        Optional<IpIdentity> locked = identityRepository.findByIpAddressForUpdate(key);
        // zero rows inserted with no row to lock means the generated username was taken; draw again
        for (int attempt = 0; locked.isEmpty() && attempt < MAX_INSERT_ATTEMPTS; attempt++) {
            String username = usernameGenerator.generate(identityRepository::existsByUsername);
            created = identityRepository.insertIfAbsent(key, username, now) == 1;
            locked = identityRepository.findByIpAddressForUpdate(key);
        }
        IpIdentity identity = locked.orElseThrow(() ->
                new IllegalStateException("Could not create identity for " + key));

        identity.recordVisit(now, truncate(userAgent), sanitize(metadata));
        if (created) {
            log.info("New identity {} for {}", identity.getUsername(), key);
        }
        return new IdentityResolution(identity, created);
    }

    @Transactional(readOnly = true)
    public Optional<IpIdentity> get(String ipAddress) {
        String key = IpAddressNormalizer.normalize(ipAddress);
        if (key == null) {
            return Optional.empty();
        }
        return identityRepository.findByIpAddress(key);
    }

    /**
     * Every known identity, most recently seen first.
     */
    @Transactional(readOnly = true)
    public IdentityPageResponse list(int page, int size) {
        int safePage = Math.max(page, 0);
        int safeSize = size <= 0 ? DEFAULT_PAGE_SIZE : Math.min(size, MAX_PAGE_SIZE);

        Page<IpIdentity> result = identityRepository.findAllByOrderByLastSeenAtDescIdDesc(PageRequest.of(safePage, safeSize));
        List<IdentitySummaryResponse> items = result.getContent().stream()
                .map(IdentitySummaryResponse::from)
                .toList();
        return new IdentityPageResponse(items, safePage, safeSize, result.getTotalElements(), result.getTotalPages());
    }

    @Transactional(readOnly = true)
    public long countIdentities() {
        return identityRepository.count();
    }

    /**
     * Keeps scalar entries only, rendered as strings. Nested objects, arrays and nulls are dropped.
     */
    Map<String, String> sanitize(Map<String, ?> metadata) {
        Map<String, String> result = new LinkedHashMap<>();
        if (metadata == null) {
            return result;
        }
        for (Map.Entry<String, ?> entry : metadata.entrySet()) {
            if (result.size() >= properties.maxMetadataEntries()) {
                break;
            }
            Object value = entry.getValue();
            if (entry.getKey() == null || value == null || value instanceof Map || value instanceof Collection
                    || value.getClass().isArray()) {
                continue;
            }
            String text = String.valueOf(value);
            if (text.length() > properties.maxMetadataValueLength()) {
                text = text.substring(0, properties.maxMetadataValueLength());
            }
            result.put(entry.getKey(), text);
        }
        return result;
    }

    private String truncate(String userAgent) {
        if (userAgent == null || userAgent.length() <= properties.maxMetadataValueLength()) {
            return userAgent;
        }
        return userAgent.substring(0, properties.maxMetadataValueLength());
    }

    public record IdentityResolution(IpIdentity identity, boolean isNew) {
    }
}
