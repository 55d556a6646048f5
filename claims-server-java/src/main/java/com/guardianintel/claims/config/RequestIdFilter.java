package com.guardianintel.claims.config;

import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;

import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;

/**
 * Tags every request with a trace id in the MDC and echoes it back in
 * {@code X-Request-ID}. Claim operations, carrier calls and error bodies made for
 * the request all carry that id.
 * <p>
 * A caller-supplied id is reused only when it is a short token; anything else
 * (free text, CR/LF, overlong values) would end up verbatim in log lines, so a
 * fresh id replaces it.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@Slf4j
public class RequestIdFilter extends OncePerRequestFilter {

    public static final String TRACE_ID = "trace_id";
    public static final String REQUEST_ID_HEADER = "X-Request-ID";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        String traceId = resolveTraceId(request.getHeader(REQUEST_ID_HEADER));
        MDC.put(TRACE_ID, traceId);
        response.setHeader(REQUEST_ID_HEADER, traceId);
        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(TRACE_ID);
        }
    }

    static String resolveTraceId(String supplied) {
        if (supplied != null && ACCEPTED_ID.matcher(supplied).matches()) {
            return supplied;
        }
        if (supplied != null && !supplied.isEmpty()) {
            log.debug("Ignoring malformed {} header ({} chars)", REQUEST_ID_HEADER, supplied.length());
        }
        return UUID.randomUUID().toString();
    }
}
