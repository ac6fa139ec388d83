package com.serge.community.config.logging;

import io.micrometer.common.util.StringUtils;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.util.ContentCachingRequestWrapper;
import org.springframework.web.util.ContentCachingResponseWrapper;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * One structured line per HTTP request. Bodies are only logged at DEBUG, with
 * credentials and bearer tokens masked.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class HttpLoggingFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(HttpLoggingFilter.class);
    private static final int MAX_LOG_BYTES = 4096;
    private static final Pattern SECRET_FIELDS =
            Pattern.compile("(\"(?:password|accessToken)\"\\s*:\\s*\")[^\"]*(\")");
    private static final Pattern CONFIRM_PATH = Pattern.compile("(/api/auth/confirm/)[^/?]+");

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain) throws ServletException, IOException {
        long start = System.currentTimeMillis();

        ContentCachingRequestWrapper req = new ContentCachingRequestWrapper(request);
        ContentCachingResponseWrapper resp = new ContentCachingResponseWrapper(response);
        try {
            filterChain.doFilter(req, resp);
        } finally {
            long durationMs = System.currentTimeMillis() - start;
            String user = request.getUserPrincipal() != null ? request.getUserPrincipal().getName() : "-";
            String ip = Optional.ofNullable(request.getHeader("X-Forwarded-For"))
                    .orElseGet(request::getRemoteAddr);
            String ua = Optional.ofNullable(request.getHeader("User-Agent")).orElse("-");
            String qs = req.getQueryString();

            log.info("http_request method={} path={} query={} status={} duration_ms={} user={} ip={} ua=\"{}\"",
                    req.getMethod(),
                    maskPath(req.getRequestURI()),
                    qs == null ? "-" : qs,
                    resp.getStatus(),
                    durationMs,
                    user,
                    ip,
                    ua.replace('"', ' '));

            if (log.isDebugEnabled()) {
                logBody("http.request.body", req.getContentType(), req.getContentAsByteArray(), req.getCharacterEncoding());
                logBody("http.response.body", resp.getContentType(), resp.getContentAsByteArray(), resp.getCharacterEncoding());
            }
            // the cached body has to reach the client
            resp.copyBodyToResponse();
        }
    }

    private static void logBody(String event, String contentType, byte[] bytes, String encoding) {
        if (!isTextual(contentType)) return;
        String body = toDisplayString(bytes, charsetOrUtf8(encoding));
        if (!body.isEmpty()) {
            log.debug("{} {}: {}", event, contentType, body);
        }
    }

    /** Confirmation codes are single-use secrets; keep them out of access logs. */
    static String maskPath(String uri) {
        if (uri == null) return "-";
        return CONFIRM_PATH.matcher(uri).replaceAll("$1***");
    }

    static String maskSecrets(String body) {
        return SECRET_FIELDS.matcher(body).replaceAll("$1***$2");
    }

    private static Charset charsetOrUtf8(String enc) {
        try {
            return enc == null ? StandardCharsets.UTF_8 : Charset.forName(enc);
        } catch (Exception e) {
            log.warn("http.log.bad_encoding encoding={}", enc, e);
            return StandardCharsets.UTF_8;
        }
    }

    private static String toDisplayString(byte[] bytes, Charset cs) {
        if (bytes == null || bytes.length == 0) return "";
        int len = Math.min(bytes.length, MAX_LOG_BYTES);
        String s = new String(bytes, 0, len, cs);
        s = s.replaceAll("[\\r\\n\\t]+", " ").replaceAll("\\s{2,}", " ").trim();
        s = maskSecrets(s);
        if (bytes.length > MAX_LOG_BYTES) s += "...(truncated)";
        return s;
    }

    private static boolean isTextual(String contentType) {
        if (StringUtils.isBlank(contentType)) return false;
        MediaType mt = MediaType.parseMediaType(contentType);
        return MediaType.APPLICATION_JSON.includes(mt)
                || MediaType.TEXT_PLAIN.includes(mt)
                || MediaType.TEXT_HTML.includes(mt)
                || MediaType.APPLICATION_FORM_URLENCODED.includes(mt);
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String path = request.getRequestURI();
        return path != null && path.startsWith("/actuator/health");
    }
}
