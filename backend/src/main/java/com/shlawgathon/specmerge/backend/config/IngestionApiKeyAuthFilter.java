package com.shlawgathon.specmerge.backend.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Authenticates extraction and defect feeds using the X-Ingestion-Api-Key header.
 * Only applies to /internal/** endpoints.
 */
@Component
public class IngestionApiKeyAuthFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(IngestionApiKeyAuthFilter.class);

    public static final String INGESTION_API_KEY_HEADER = "X-Ingestion-Api-Key";

    private final String ingestionApiKey;

    public IngestionApiKeyAuthFilter(@Value("${ingestion.api.key:}") String ingestionApiKey) {
        this.ingestionApiKey = ingestionApiKey;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return !request.getRequestURI().startsWith("/internal/");
    }

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {

        // No key configured: development mode
        if (ingestionApiKey == null || ingestionApiKey.isBlank()) {
            filterChain.doFilter(request, response);
            return;
        }

        String providedKey = request.getHeader(INGESTION_API_KEY_HEADER);

        if (providedKey == null || providedKey.isBlank()) {
            reject(response, "Missing " + INGESTION_API_KEY_HEADER + " header");
            return;
        }

        if (!ingestionApiKey.equals(providedKey)) {
            log.warn("[INGEST] Rejected call to {} with invalid API key", request.getRequestURI());
            reject(response, "Invalid API key");
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, String message) throws IOException {
        response.setStatus(HttpServletResponse.SC_UNAUTHORIZED);
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        response.getWriter().write("{\"error\":\"" + message + "\"}");
    }
}
