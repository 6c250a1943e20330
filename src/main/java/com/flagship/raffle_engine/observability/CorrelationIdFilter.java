package com.flagship.raffle_engine.observability;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.MDC;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/**
 * Puts the request's correlation id into MDC and echoes it on the response,
 * so a client can quote it when asking about an entry or payout.
 * {@link CorrelationContext#clear()} also drops the raffle and payout keys the
 * services set, so nothing leaks to the next request on the same thread.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {
        try {
            String correlationId = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
            CorrelationContext.setCorrelationId(correlationId);
            String effective = CorrelationContext.getCorrelationId();

            MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, effective);
            response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, effective);

            filterChain.doFilter(request, response);
        } finally {
            CorrelationContext.clear();
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return request.getRequestURI().startsWith("/actuator");
    }
}
