package com.example.spontaneous.shared.aspect;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

@Target({ElementType.METHOD, ElementType.TYPE})
@Retention(RetentionPolicy.RUNTIME)
public @interface Monitored {
    /**
     * Operation category used in the metric names, e.g. "service" or "scheduler".
     */
    String value();
}
