package com.example.spontaneous.lifecycle;

import com.example.spontaneous.shared.util.CorrelationContext;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jdbc.repository.config.EnableJdbcRepositories;

/**
 * Hosts the broadcast lifecycle engine: the HTTP API, the expiry sweeper, the retention
 * purge and the after-commit hand-off of join requests to the notification topic.
 */
@SpringBootApplication(scanBasePackages = "com.example.spontaneous")
@EnableJdbcRepositories(basePackages = "com.example.spontaneous.shared.repository")
public class BroadcastLifecycleApplication {

    static {
        CorrelationContext.install();
    }

    public static void main(String[] args) {
        SpringApplication.run(BroadcastLifecycleApplication.class, args);
    }
}
