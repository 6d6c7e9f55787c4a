package com.example.campaign.shared.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import lombok.Data;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
public class AppProperties {

    private final Scheduler scheduler = new Scheduler();
    private final Drafts drafts = new Drafts();
    private final Segments segments = new Segments();
    private final Delivery delivery = new Delivery();
    private final Push push = new Push();
    private final Outbox outbox = new Outbox();
    private final Kafka kafka = new Kafka();

    @Data
    public static class Scheduler {
        @Positive
        private long sweepIntervalMs = 60000L;
        @Positive
        private int batchLimit = 100;
    }

    @Data
    public static class Drafts {
        @Positive
        private int retentionDays = 31;
        @NotBlank
        private String cleanupCron = "0 0 2 * * *";
    }

    @Data
    public static class Segments {
        @Positive
        private int engagementWindowDays = 30;
        @Positive
        private int newSubscriberDays = 7;
        @Positive
        private int recentSubscriberDays = 30;
        @NotNull
        private Duration valuesCacheTtl = Duration.ofMinutes(5);
        @Positive
        private long valuesCacheMaxSize = 100;
    }

    @Data
    public static class Delivery {
        @NotBlank
        private String workerId;
        @Positive
        private int batchSize = 500;
        @Positive
        private int concurrency = 50;
        @Positive
        private int maxConcurrentCampaigns = 2;
        @Min(1)
        private int maxAttempts = 5;
        @NotNull
        private Duration initialBackoff = Duration.ofSeconds(30);
        @NotNull
        private Duration maxBackoff = Duration.ofMinutes(30);
        @NotNull
        private Duration leaseDuration = Duration.ofMinutes(5);
        @Positive
        private long pollIntervalMs = 5000L;
        @Positive
        private int pollLimit = 20;
        @Positive
        private long retryPollIntervalMs = 10000L;
        @Positive
        private int retryBatchSize = 200;
        @NotNull
        private Duration stalePendingAfter = Duration.ofMinutes(15);
    }

    @Data
    public static class Push {
        @NotBlank
        private String gatewayUrl = "http://localhost:8090/push";
        @NotNull
        private Duration timeout = Duration.ofSeconds(10);
        @Positive
        private int ttlSeconds = 86400;
    }

    @Data
    public static class Outbox {
        @Positive
        private int batchSize = 100;
    }

    @Data
    public static class Kafka {
        private final Topic topic = new Topic();
        private final Consumer consumer = new Consumer();

        @Data
        public static class Topic {
            @NotBlank
            private String nameDispatch = "campaign-dispatch";
            @Positive
            private int partitions = 3;
            @Positive
            private short replicationFactor = 1;
        }

        @Data
        public static class Consumer {
            @NotBlank
            private String groupDispatch = "campaign-dispatch-group";
        }
    }
}
