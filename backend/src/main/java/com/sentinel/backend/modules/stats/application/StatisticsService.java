package com.sentinel.backend.modules.stats.application;

import java.time.Clock;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.temporal.ChronoUnit;

import com.sentinel.backend.modules.account.infrastructure.persistence.AccountRepository;
import com.sentinel.backend.modules.chat.application.ChatService;
import com.sentinel.backend.modules.connection.application.ConnectionLogService;
import com.sentinel.backend.modules.device.application.DeviceService;
import com.sentinel.backend.modules.identity.application.IpIdentityService;
import com.sentinel.backend.modules.session.application.SessionRegistry;
import com.sentinel.backend.modules.stats.presentation.dto.StatisticsResponse;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
@Transactional(readOnly = true)
public class StatisticsService {

    static final Duration RECENT_ACCESS_WINDOW = Duration.ofMinutes(30);

    private final AccountRepository accountRepository;
    private final DeviceService deviceService;
    private final ConnectionLogService connectionLogService;
    private final ChatService chatService;
    private final SessionRegistry sessionRegistry;
    private final IpIdentityService identityService;
    private final Clock clock;

    public StatisticsService(
            AccountRepository accountRepository,
            DeviceService deviceService,
            ConnectionLogService connectionLogService,
            ChatService chatService,
            SessionRegistry sessionRegistry,
            IpIdentityService identityService,
            Clock clock
    ) {
        this.accountRepository = accountRepository;
        this.deviceService = deviceService;
        this.connectionLogService = connectionLogService;
        this.chatService = chatService;
        this.sessionRegistry = sessionRegistry;
        this.identityService = identityService;
        this.clock = clock;
    }

    public StatisticsResponse collect() {
        OffsetDateTime now = OffsetDateTime.now(clock);
        OffsetDateTime startOfDay = now.truncatedTo(ChronoUnit.DAYS);
        return new StatisticsResponse(
                accountRepository.count(),
                accountRepository.countByLastAccessAtAfter(now.minus(RECENT_ACCESS_WINDOW)),
                deviceService.countDevices(),
                deviceService.countOnline(),
                connectionLogService.countConnections(),
                chatService.countSince(startOfDay),
                sessionRegistry.countActiveSessions(),
                identityService.countIdentities(),
                now
        );
    }
}
