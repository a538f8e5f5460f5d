package com.example.userservice.common.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.concurrent.atomic.AtomicReference;
import javax.servlet.FilterChain;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class AccessLogFilterTest {

    private final AccessLogFilter filter = new AccessLogFilter("X-Request-Id");

    @Test
    void shouldReuseCallerRequestIdForChainAndResponse() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/users/abc");
        request.addHeader("X-Request-Id", " req-42 ");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seenRequestId = new AtomicReference<>();

        FilterChain chain = (req, res) -> seenRequestId.set(MDC.get(AccessLogFilter.MDC_REQUEST_ID));
        filter.doFilter(request, response, chain);

        assertEquals("req-42", seenRequestId.get());
        assertEquals("req-42", response.getHeader("X-Request-Id"));
    }

    @Test
    void shouldGenerateRequestIdWhenHeaderIsMissing() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/users");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> { });

        String generated = response.getHeader("X-Request-Id");
        assertEquals(32, generated.length());
        assertTrue(generated.matches("[0-9a-f]+"));
    }

    @Test
    void shouldClearRequestIdAndErrorCodeAfterRequest() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("DELETE", "/api/users/abc");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> {
            MDC.put(AccessLogFilter.MDC_ERROR_CODE, "USER_NOT_FOUND");
            ((MockHttpServletResponse) res).setStatus(404);
        });

        assertNull(MDC.get(AccessLogFilter.MDC_REQUEST_ID));
        assertNull(MDC.get(AccessLogFilter.MDC_ERROR_CODE));
    }
}
