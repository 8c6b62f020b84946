/*
 * Copyright (C) 2025 Consejo Router
 * SPDX-License-Identifier: AGPL-3.0-only
 */

package com.consejo.config;

import com.consejo.application.ratelimit.RateLimitDecision;
import com.consejo.application.ratelimit.RateLimiter;
import com.consejo.support.MutableClock;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class RateLimitFilterTest {
    private static final long NOW = 1_700_000_000L;

    @Mock
    private RateLimiter rateLimiter;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private RateLimitFilter filter;

    @BeforeEach
    void setUp() {
        filter = new RateLimitFilter(rateLimiter, objectMapper, MutableClock.at(NOW), new AppProperties(null, null, null, null, null));
    }

    @Test
    void authenticatedCallerPassesWithHeaders() throws Exception {
        when(rateLimiter.checkLimit("user-42", false, false)).thenReturn(new RateLimitDecision(true, 100, 99, NOW + 2800));
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/routing/plan");
        request.addHeader(CallerIdentity.USER_ID_HEADER, "user-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertNotNull(chain.getRequest());
        assertEquals("100", response.getHeader(RateLimitFilter.LIMIT_HEADER));
        assertEquals("99", response.getHeader(RateLimitFilter.REMAINING_HEADER));
        assertEquals(String.valueOf(NOW + 2800), response.getHeader(RateLimitFilter.RESET_HEADER));
    }

    @Test
    void adminRoleIsRecognised() throws Exception {
        when(rateLimiter.checkLimit("ops", false, true)).thenReturn(new RateLimitDecision(true, 1000, 999, NOW + 10));
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/routing/plan");
        request.addHeader(CallerIdentity.USER_ID_HEADER, "ops");
        request.addHeader(CallerIdentity.USER_ROLE_HEADER, "Admin");

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());
    }

    @Test
    void demoCallerOverQuotaGets429() throws Exception {
        when(rateLimiter.checkLimit("203.0.113.7", true, false)).thenReturn(new RateLimitDecision(false, 3, 0, NOW + 120));
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/routing/plan");
        request.addHeader(CallerIdentity.FORWARDED_FOR_HEADER, "203.0.113.7, 10.0.0.1");
        MockHttpServletResponse response = new MockHttpServletResponse();
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, response, chain);

        assertNull(chain.getRequest());
        assertEquals(429, response.getStatus());
        assertEquals("120", response.getHeader(RateLimitFilter.RETRY_AFTER_HEADER));
        assertEquals("0", response.getHeader(RateLimitFilter.REMAINING_HEADER));
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertEquals("RATE_LIMIT_EXCEEDED", body.get("code").asText());
    }

    @Test
    void demoCallerWithoutForwardingUsesRemoteAddress() throws Exception {
        when(rateLimiter.checkLimit("127.0.0.1", true, false)).thenReturn(new RateLimitDecision(true, 3, 2, NOW + 10));
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/routing/plan");
        request.setRemoteAddr("127.0.0.1");

        filter.doFilter(request, new MockHttpServletResponse(), new MockFilterChain());
    }

    @Test
    void otherPathsAreNotLimited() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/models");
        MockFilterChain chain = new MockFilterChain();

        filter.doFilter(request, new MockHttpServletResponse(), chain);

        assertNotNull(chain.getRequest());
        verifyNoInteractions(rateLimiter);
    }

    @Test
    void disabledLimiterLetsEverythingThrough() throws Exception {
        AppProperties disabled = new AppProperties(null, null,
                new AppProperties.RateLimit(false, 3600, 100, 3, 1000, null), null, null);
        RateLimitFilter off = new RateLimitFilter(rateLimiter, objectMapper, MutableClock.at(NOW), disabled);
        MockFilterChain chain = new MockFilterChain();

        off.doFilter(new MockHttpServletRequest("POST", "/api/routing/plan"), new MockHttpServletResponse(), chain);

        assertNotNull(chain.getRequest());
        verifyNoInteractions(rateLimiter);
    }
}
