package com.serge.community.config;

import jakarta.servlet.http.HttpServletRequest;
import org.springframework.security.oauth2.server.resource.web.BearerTokenResolver;
import org.springframework.security.oauth2.server.resource.web.DefaultBearerTokenResolver;
import org.springframework.security.web.util.matcher.AntPathRequestMatcher;
import org.springframework.security.web.util.matcher.RequestMatcher;

/**
 * Standard bearer resolution everywhere except logout, which reads its own token so that
 * an expired or tampered one still ends in 204 rather than a resource-server 401.
 */
class LogoutTolerantBearerTokenResolver implements BearerTokenResolver {
    static final String LOGOUT_PATH = "/api/auth/logout";

    private final BearerTokenResolver delegate = new DefaultBearerTokenResolver();
    private final RequestMatcher logout = new AntPathRequestMatcher(LOGOUT_PATH, "POST");

    @Override
    public String resolve(HttpServletRequest request) {
        if (logout.matches(request)) {
            return null;
        }
        return delegate.resolve(request);
    }
}
