package com.example.spontaneous.shared.util;

import io.micrometer.context.ContextRegistry;
import org.slf4j.MDC;
import reactor.core.publisher.Hooks;

/**
 * Carries the MDC correlation id across Reactor thread hops, e.g. onto the JDBC scheduler.
 */
public final class CorrelationContext {

    private CorrelationContext() {}

    public static void install() {
        ContextRegistry.getInstance().registerThreadLocalAccessor(
                Constants.CORRELATION_ID_KEY,
                () -> MDC.get(Constants.CORRELATION_ID_KEY),
                value -> MDC.put(Constants.CORRELATION_ID_KEY, value),
                () -> MDC.remove(Constants.CORRELATION_ID_KEY));
        Hooks.enableAutomaticContextPropagation();
    }
}
