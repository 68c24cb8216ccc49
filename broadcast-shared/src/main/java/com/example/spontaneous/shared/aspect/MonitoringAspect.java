package com.example.spontaneous.shared.aspect;

import com.example.spontaneous.shared.config.MonitoringConfig;
import com.example.spontaneous.shared.exception.BroadcastException;
import io.opentelemetry.api.trace.Span;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.stereotype.Component;

import java.lang.reflect.Method;

/**
 * Times every {@link Monitored} method and counts calls by outcome. Domain rejections
 * (a {@link BroadcastException}) are counted as "rejected" and do not count as errors.
 */
@Aspect
@Component
@RequiredArgsConstructor
@Slf4j
public class MonitoringAspect {

    private final MonitoringConfig.BroadcastMetricsCollector metricsCollector;

    @Around("@within(com.example.spontaneous.shared.aspect.Monitored) || @annotation(com.example.spontaneous.shared.aspect.Monitored)")
    public Object monitorMethod(ProceedingJoinPoint joinPoint) throws Throwable {
        MethodSignature signature = (MethodSignature) joinPoint.getSignature();
        Method method = signature.getMethod();

        Monitored monitoredAnnotation = method.getAnnotation(Monitored.class);
        if (monitoredAnnotation == null) {
            monitoredAnnotation = method.getDeclaringClass().getAnnotation(Monitored.class);
        }
        if (monitoredAnnotation == null) {
            return joinPoint.proceed();
        }

        String operationType = monitoredAnnotation.value();
        String className = joinPoint.getTarget().getClass().getSimpleName();
        String methodName = signature.getName();
        long startTime = System.currentTimeMillis();

        try {
            Object result = joinPoint.proceed();
            long duration = System.currentTimeMillis() - startTime;
            record(operationType, className, methodName, "success", duration);
            log.debug("{}.{} ({}) completed in {}ms", className, methodName, operationType, duration);
            return result;
        } catch (BroadcastException e) {
            long duration = System.currentTimeMillis() - startTime;
            record(operationType, className, methodName, "rejected", duration);
            log.debug("{}.{} ({}) rejected after {}ms: {}", className, methodName, operationType, duration, e.getMessage());
            throw e;
        } catch (Exception e) {
            long duration = System.currentTimeMillis() - startTime;
            record(operationType, className, methodName, "error", duration);
            metricsCollector.incrementCounter("broadcast.errors", "type", operationType, "class", className, "method", methodName);

            Span currentSpan = Span.current();
            if (currentSpan.getSpanContext().isValid()) {
                currentSpan.recordException(e);
            }
            log.error("{}.{} ({}) failed after {}ms: {}", className, methodName, operationType, duration, e.getMessage());
            throw e;
        }
    }

    private void record(String operationType, String className, String methodName, String status, long duration) {
        metricsCollector.recordTimer("broadcast." + operationType + ".latency", duration, "class", className, "method", methodName, "status", status);
        metricsCollector.incrementCounter("broadcast." + operationType + ".calls", "class", className, "method", methodName, "status", status);
    }
}
