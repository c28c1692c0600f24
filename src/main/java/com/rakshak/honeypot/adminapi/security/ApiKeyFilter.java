package com.rakshak.honeypot.adminapi.security;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * API 金鑰檢查
 * /api/honeypot 檢查 x-api-key，/api/admin 檢查 X-Admin-Key；設定值為空時不檢查
 */
@Component
public class ApiKeyFilter extends OncePerRequestFilter {

    private static final Logger logger = LoggerFactory.getLogger(ApiKeyFilter.class);

    static final String HONEYPOT_PREFIX = "/api/honeypot";
    static final String ADMIN_PREFIX = "/api/admin";

    @Value("${honeypot.api-key:}")
    private String honeypotApiKey;

    @Value("${admin.api-key:}")
    private String adminApiKey;

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri == null || !(uri.startsWith(HONEYPOT_PREFIX) || uri.startsWith(ADMIN_PREFIX));
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        boolean admin = request.getRequestURI().startsWith(ADMIN_PREFIX);
        String expected = admin ? adminApiKey : honeypotApiKey;

        if (expected == null || expected.trim().isEmpty()) {
            filterChain.doFilter(request, response);
            return;
        }

        String key = request.getHeader(admin ? "X-Admin-Key" : "x-api-key");
        if (key != null && key.equals(expected)) {
            filterChain.doFilter(request, response);
            return;
        }

        logger.warn("API 金鑰驗證失敗: uri={}, remote={}", request.getRequestURI(), request.getRemoteAddr());
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json;charset=UTF-8");
        response.getWriter().write("{\"success\":false,\"message\":\"Unauthorized\"}");
    }
}
