package com.example.spontaneous.shared.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
public class AppProperties {

    private final Cache cache = new Cache();
    private final Expiry expiry = new Expiry();
    private final JoinRequests joinRequests = new JoinRequests();
    private final Search search = new Search();
    private final Store store = new Store();
    private final Kafka kafka = new Kafka();

    @Data
    public static class Cache {
        private boolean enabled = true;
        @NotBlank
        private String activeListingKey = "broadcast:active-listing";
        @NotNull
        private Duration activeListingTtl = Duration.ofSeconds(30);
        /** Delay of the second eviction after a listing change; zero turns it off. */
        @NotNull
        private Duration secondEvictionDelay = Duration.ofSeconds(5);
    }

    @Data
    public static class Expiry {
        /** Milliseconds between sweeps; read directly by the scheduler annotation. */
        @Positive
        private long sweepInterval = 60000L;
        /** How long EXPIRED broadcasts are kept before the purge job deletes them. */
        @NotNull
        private Duration retention = Duration.ofDays(7);
        @NotBlank
        private String purgeCron = "0 0 * * * *";
    }

    @Data
    public static class JoinRequests {
        /** When false, a request that was already accepted or rejected cannot be decided again. */
        private boolean allowRedecision = true;
    }

    @Data
    public static class Search {
        @Positive
        private int defaultPageSize = 20;
        @Positive
        @Max(1000)
        private int maxPageSize = 100;
    }

    @Data
    public static class Store {
        @NotNull
        private Duration transactionTimeout = Duration.ofSeconds(5);
    }

    @Data
    public static class Kafka {
        private final Topic topic = new Topic();
        private final Consumer consumer = new Consumer();
        private final Retry retry = new Retry();

        @Data
        public static class Topic {
            @NotBlank
            private String nameJoinRequests = "join-request-notifications";
            @Positive
            private int partitions = 3;
            @Positive
            private short replicationFactor = 1;
        }

        @Data
        public static class Consumer {
            @NotBlank
            private String groupNotification = "join-request-notification-group";
            @NotBlank
            private String groupDlt = "join-request-dlt-group";
            @Positive
            private int concurrency = 3;
        }

        @Data
        public static class Retry {
            @Positive
            private int maxAttempts = 3;
            @Positive
            private long backoffDelay = 1000L;
        }
    }
}
