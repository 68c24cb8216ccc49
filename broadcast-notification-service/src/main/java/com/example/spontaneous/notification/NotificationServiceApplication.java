package com.example.spontaneous.notification;

import com.example.spontaneous.shared.util.CorrelationContext;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.data.jdbc.repository.config.EnableJdbcRepositories;
import org.springframework.kafka.annotation.EnableKafka;

/**
 * Consumes join-request events, tells broadcast creators about them and keeps a record of
 * events that ended up on the dead-letter topic.
 */
@SpringBootApplication(scanBasePackages = "com.example.spontaneous")
@EnableKafka
@EnableJdbcRepositories(basePackages = {
        "com.example.spontaneous.shared.repository",
        "com.example.spontaneous.notification.repository"
})
public class NotificationServiceApplication {

    static {
        CorrelationContext.install();
    }

    public static void main(String[] args) {
        SpringApplication.run(NotificationServiceApplication.class, args);
    }
}
