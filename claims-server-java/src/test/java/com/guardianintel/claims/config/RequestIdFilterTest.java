package com.guardianintel.claims.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.util.concurrent.atomic.AtomicReference;

import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockFilterChain;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;

public class RequestIdFilterTest {

    private final RequestIdFilter filter = new RequestIdFilter();

    private String traceIdSeenFor(String suppliedHeader, MockHttpServletResponse response) throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/claims");
        if (suppliedHeader != null) {
            request.addHeader(RequestIdFilter.REQUEST_ID_HEADER, suppliedHeader);
        }
        AtomicReference<String> seen = new AtomicReference<>();
        filter.doFilter(request, response, new MockFilterChain(new HttpServlet() {
            @Override
            protected void service(HttpServletRequest req, HttpServletResponse resp) {
                seen.set(MDC.get(RequestIdFilter.TRACE_ID));
            }
        }));
        return seen.get();
    }

    @Test
    public void testWellFormedIdIsReusedAndEchoed() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        String seen = traceIdSeenFor("dash-42.a", response);

        assertEquals("dash-42.a", seen);
        assertEquals("dash-42.a", response.getHeader(RequestIdFilter.REQUEST_ID_HEADER));
        assertNull(MDC.get(RequestIdFilter.TRACE_ID));
    }

    @Test
    public void testMalformedIdIsReplaced() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        String seen = traceIdSeenFor("abc\r\nINFO forged line", response);

        assertNotEquals("abc\r\nINFO forged line", seen);
        assertEquals(36, seen.length());
        assertEquals(seen, response.getHeader(RequestIdFilter.REQUEST_ID_HEADER));
    }

    @Test
    public void testMissingIdIsGenerated() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        String seen = traceIdSeenFor(null, response);

        assertEquals(36, seen.length());
    }
}
