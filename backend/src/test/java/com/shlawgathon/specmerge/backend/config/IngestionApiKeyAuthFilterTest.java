package com.shlawgathon.specmerge.backend.config;

import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.*;

class IngestionApiKeyAuthFilterTest {

    private final IngestionApiKeyAuthFilter filter = new IngestionApiKeyAuthFilter("secret-key");

    @Test
    void shouldRejectInternalCallWithoutKey() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/internal/extractions");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertEquals(401, response.getStatus());
        assertTrue(response.getContentAsString().contains("Missing X-Ingestion-Api-Key header"));
        assertNull(chain.getRequest());
    }

    @Test
    void shouldRejectInternalCallWithWrongKey() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/internal/defects");
        request.addHeader(IngestionApiKeyAuthFilter.INGESTION_API_KEY_HEADER, "guess");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertEquals(401, response.getStatus());
        assertTrue(response.getContentAsString().contains("Invalid API key"));
        assertNull(chain.getRequest());
    }

    @Test
    void shouldPassInternalCallWithValidKey() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/internal/extractions");
        request.addHeader(IngestionApiKeyAuthFilter.INGESTION_API_KEY_HEADER, "secret-key");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertEquals(200, response.getStatus());
        assertSame(request, chain.getRequest());
    }

    @Test
    void shouldIgnorePublicPaths() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/specs");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertSame(request, chain.getRequest());
    }

    @Test
    void shouldAllowEverythingWhenNoKeyConfigured() throws Exception {
        IngestionApiKeyAuthFilter openFilter = new IngestionApiKeyAuthFilter("");
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/internal/extractions");
        MockFilterChain chain = new MockFilterChain();

        openFilter.doFilter(request, new MockHttpServletResponse(), chain);

        assertSame(request, chain.getRequest());
    }
}
