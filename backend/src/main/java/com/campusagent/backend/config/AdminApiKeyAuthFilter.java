package com.campusagent.backend.config;

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
 * Guards destructive catalog operations under /admin/** with the
 * X-Admin-Api-Key header. With no key configured every request passes.
 */
@Component
public class AdminApiKeyAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(AdminApiKeyAuthFilter.class);

    static final String ADMIN_API_KEY_HEADER = "X-Admin-Api-Key";

    private final String adminApiKey;

    public AdminApiKeyAuthFilter(@Value("${admin.api.key:}") String adminApiKey) {
        this.adminApiKey = adminApiKey;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/admin/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        if (adminApiKey == null || adminApiKey.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        String providedKey = request.getHeader(ADMIN_API_KEY_HEADER);
        if (providedKey == null || providedKey.isBlank()) {
            reject(response, "Missing " + ADMIN_API_KEY_HEADER + " header");
            return;
        }
        if (!adminApiKey.equals(providedKey)) {
            log.warn("Rejected admin request to {} with an invalid key", request.getRequestURI());
            reject(response, "Invalid API key");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, String message) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType("application/json");
        response.getWriter().write("{\"error\":\"" + message + "\"}");
    }
}
