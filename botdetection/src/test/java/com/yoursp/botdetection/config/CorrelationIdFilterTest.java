package com.yoursp.botdetection.config;

import jakarta.servlet.FilterChain;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class CorrelationIdFilterTest {

    private final CorrelationIdFilter filter = new CorrelationIdFilter();

    @Test
    void reusesWellFormedRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Request-Id", "req-42");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();
        FilterChain chain = (req, res) -> seen.set(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY));

        filter.doFilter(request, response, chain);

        assertEquals("req-42", seen.get());
        assertEquals("req-42", response.getHeader("X-Request-Id"));
        assertNull(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY));
    }

    @Test
    void replacesMalformedRequestId() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest();
        request.addHeader("X-Request-Id", "evil\nINFO forged line");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();
        FilterChain chain = (req, res) -> seen.set(MDC.get(CorrelationIdFilter.CORRELATION_ID_KEY));

        filter.doFilter(request, response, chain);

        assertNotNull(seen.get());
        assertNotEquals("evil\nINFO forged line", seen.get());
        assertEquals(36, seen.get().length());
    }
}
