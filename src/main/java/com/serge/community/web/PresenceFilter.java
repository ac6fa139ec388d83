package com.serge.community.web;

import com.serge.community.service.PresenceTracker;
import com.serge.community.service.SessionService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.security.oauth2.server.resource.authentication.JwtAuthenticationToken;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Marks the calling member as active. Registered after the security filter chain, so the
 * bearer token is already validated. Presence is bookkeeping: a failure never fails the request.
 */
@Component
@RequiredArgsConstructor
public class PresenceFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(PresenceFilter.class);

    private final SessionService sessions;
    private final PresenceTracker presence;

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        Authentication auth = SecurityContextHolder.getContext().getAuthentication();
        if (auth instanceof JwtAuthenticationToken token) {
            try {
                sessions.resolveAccount(token.getToken()).ifPresent(presence::touchActivity);
            } catch (RuntimeException e) {
                log.warn("presence.touch_failed subject={} err={}", token.getName(), e.toString());
            }
        }
        filterChain.doFilter(request, response);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path == null || !path.startsWith("/api/") || path.startsWith("/api/admin/");
    }
}
