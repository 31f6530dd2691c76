package com.sentinel.backend.global.security;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

import com.sentinel.backend.global.web.SessionCookies;
import com.sentinel.backend.modules.account.domain.Account;
import com.sentinel.backend.modules.identity.domain.IpIdentity;
import com.sentinel.backend.modules.session.application.SessionRegistry;
import com.sentinel.backend.modules.session.domain.ClientSession;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.web.authentication.WebAuthenticationDetailsSource;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Authenticates requests carrying a session token in the bearer header or the session cookie.
 * An invalid or expired token leaves the request unauthenticated; protected routes then answer 401.
 */
@Component
public class SessionAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(SessionAuthenticationFilter.class);

    public static final String ROLE_GUEST = "ROLE_GUEST";
    public static final String REJECTED_TOKEN_ATTRIBUTE = SessionAuthenticationFilter.class.getName() + ".REJECTED";

    private final SessionRegistry sessionRegistry;
    private final SessionCookies sessionCookies;

    public SessionAuthenticationFilter(SessionRegistry sessionRegistry, SessionCookies sessionCookies) {
        this.sessionRegistry = sessionRegistry;
        this.sessionCookies = sessionCookies;
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        Optional<String> token = sessionCookies.resolveToken(request);
        if (token.isPresent()) {
            Optional<ClientSession> session = sessionRegistry.validateSession(token.get());
            if (session.isPresent()) {
                authenticate(request, session.get(), token.get());
            } else {
                log.debug("Ignoring invalid session token on {}", request.getRequestURI());
                request.setAttribute(REJECTED_TOKEN_ATTRIBUTE, Boolean.TRUE);
                SecurityContextHolder.clearContext();
            }
        }

        filterChain.doFilter(request, response);
    }

    private void authenticate(HttpServletRequest request, ClientSession session, String token) {
        Account account = session.getAccount();
        IpIdentity identity = session.getIpIdentity();
        SessionPrincipal principal = new SessionPrincipal(
                session.getId(),
                account != null ? account.getId() : null,
                identity != null ? identity.getId() : null,
                session.displayName(),
                account != null ? account.getAccessLevel() : null
        );
        String role = account != null
                ? "ROLE_" + account.getAccessLevel().name().toUpperCase(Locale.ROOT)
                : ROLE_GUEST;

        UsernamePasswordAuthenticationToken authentication =
                new UsernamePasswordAuthenticationToken(principal, token, List.of(new SimpleGrantedAuthority(role)));
        authentication.setDetails(new WebAuthenticationDetailsSource().buildDetails(request));
        SecurityContextHolder.getContext().setAuthentication(authentication);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getServletPath();
        if (request.getMethod().equalsIgnoreCase("OPTIONS")) {
            return true;
        }
        return path.equals("/api/auth/login")
                || path.startsWith("/health")
                || path.equals("/readyz")
                || path.startsWith("/actuator/health");
    }
}
