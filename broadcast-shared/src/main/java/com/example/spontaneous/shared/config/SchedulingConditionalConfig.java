package com.example.spontaneous.shared.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Scheduled jobs run unless {@code broadcast.scheduling.enabled=false}, which lets a
 * node serve requests without taking part in sweeps.
 */
@Configuration
@EnableScheduling
@ConditionalOnProperty(prefix = "broadcast.scheduling", name = "enabled", havingValue = "true", matchIfMissing = true)
public class SchedulingConditionalConfig {
}
