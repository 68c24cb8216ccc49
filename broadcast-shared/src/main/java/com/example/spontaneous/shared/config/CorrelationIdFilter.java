package com.example.spontaneous.shared.config;

import com.example.spontaneous.shared.util.Constants;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

import java.util.UUID;

@Component
public class CorrelationIdFilter implements WebFilter {

    @Override
    public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
        String correlationId = exchange.getRequest().getHeaders().getFirst(Constants.CORRELATION_ID_HEADER);
        if (correlationId == null || correlationId.isEmpty()) {
            correlationId = UUID.randomUUID().toString();
        }

        String finalCorrelationId = correlationId;
        exchange.getResponse().getHeaders().set(Constants.CORRELATION_ID_HEADER, finalCorrelationId);
        MDC.put(Constants.CORRELATION_ID_KEY, finalCorrelationId);
        return chain.filter(exchange)
                .contextWrite(context -> context.put(Constants.CORRELATION_ID_KEY, finalCorrelationId))
                .doFinally(signalType -> MDC.remove(Constants.CORRELATION_ID_KEY));
    }
}
