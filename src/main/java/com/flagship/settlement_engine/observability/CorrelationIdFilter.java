package com.flagship.settlement_engine.observability;

import com.flagship.settlement_engine.common.actor.Actor;
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
import java.util.Locale;

/**
 * Tags every log line of a request with its correlation id and, when the caller
 * identified itself, with {@code role:id}. Scanner apps using agent codes send no
 * identity, so the actor key is simply absent for them.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class CorrelationIdFilter extends OncePerRequestFilter {

    @Override
    protected void doFilterInternal(HttpServletRequest request,
                                    HttpServletResponse response,
                                    FilterChain filterChain)
            throws ServletException, IOException {

        String incoming = request.getHeader(CorrelationContext.CORRELATION_ID_HEADER);
        String correlationId = incoming != null && !incoming.isBlank()
            ? incoming
            : CorrelationContext.generateCorrelationId();
        response.setHeader(CorrelationContext.CORRELATION_ID_HEADER, correlationId);
        MDC.put(CorrelationContext.CORRELATION_ID_MDC_KEY, correlationId);

        String actorId = request.getHeader(Actor.ID_HEADER);
        if (actorId != null) {
            String role = request.getHeader(Actor.ROLE_HEADER);
            MDC.put(CorrelationContext.ACTOR_MDC_KEY, (role != null ? role.toLowerCase(Locale.ROOT) : "unknown") + ":" + actorId);
        }

        try {
            filterChain.doFilter(request, response);
        } finally {
            MDC.remove(CorrelationContext.CORRELATION_ID_MDC_KEY);
            MDC.remove(CorrelationContext.ACTOR_MDC_KEY);
            CorrelationContext.clearBusinessKeys();
        }
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        String uri = request.getRequestURI();
        return uri.startsWith("/actuator") || uri.equals("/health");
    }
}
