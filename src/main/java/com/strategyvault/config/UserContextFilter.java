package com.strategyvault.config;

import com.strategyvault.util.ApiConstants;
import com.strategyvault.util.CurrentUserContext;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.core.annotation.Order;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Set;

@Component
@Order(1)
public class UserContextFilter extends OncePerRequestFilter {

    private static final Set<String> PROTECTED_PREFIXES = Set.of(
            "/api/vault",
            "/api/strategies",
            "/api/admin"
    );

    // Read-only endpoints that anyone may call without identifying
    private static final Set<String> PUBLIC_GETS = Set.of(
            "/api/vault/total-value",
            "/api/vault/metrics",
            "/api/vault/events",
            "/api/vault/preview",
            "/api/strategies",
            "/api/strategies/rebalance/preview"
    );

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        // Skip user enforcement for CORS preflight requests
        if ("OPTIONS".equalsIgnoreCase(request.getMethod())) {
            filterChain.doFilter(request, response);
            return;
        }

        String path = request.getRequestURI();
        String userId = request.getHeader(ApiConstants.USER_HEADER);
        boolean publicRead = "GET".equalsIgnoreCase(request.getMethod()) && PUBLIC_GETS.contains(path);
        boolean requiresUser = !publicRead && PROTECTED_PREFIXES.stream().anyMatch(path::startsWith);

        try {
            if (requiresUser && (userId == null || userId.isBlank())) {
                response.setStatus(HttpServletResponse.SC_BAD_REQUEST);
                response.setContentType(MediaType.APPLICATION_JSON_VALUE);
                String body = "{\"success\":false,\"message\":\"Missing X-User-Id header\"}";
                response.getOutputStream().write(body.getBytes(StandardCharsets.UTF_8));
                return;
            }
            if (userId != null && !userId.isBlank()) {
                CurrentUserContext.setUserId(userId.trim());
            }
            filterChain.doFilter(request, response);
        } finally {
            CurrentUserContext.clear();
        }
    }
}
