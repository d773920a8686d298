package com.smartpay.resilience.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Resilience layer configuration, bound from {@code smartpay.resilience.*}.
 */
@Data
@ConfigurationProperties(prefix = "smartpay.resilience")
public class ResilienceProperties {

    private Background background = new Background();

    private DeadLetter deadLetter = new DeadLetter();

    private Retry retry = new Retry();

    private CircuitBreaker circuitBreaker = new CircuitBreaker();

    private History history = new History();

    private Events events = new Events();

    @Data
    public static class Background {
        /**
         * Start the sweeper together with the application context
         */
        private boolean enabled = true;

        /**
         * Period of the DLQ reprocessing / history trimming / breaker promotion tick
         */
        private Duration processingInterval = Duration.ofSeconds(30);

        private Duration metricsCollectionInterval = Duration.ofSeconds(60);
    }

    @Data
    public static class DeadLetter {
        private int maxSize = 1000;

        /**
         * Reprocessing attempts after which an item is marked failed
         */
        private int maxReprocessAttempts = 3;

        private Duration reprocessBackoff = Duration.ofMinutes(1);
    }

    @Data
    public static class Retry {
        private int maxRetries = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double backoffFactor = 2.0;
        private boolean jitterEnabled = true;

        /**
         * Additional named strategies, keyed by strategy name
         */
        private Map<String, Strategy> strategies = new LinkedHashMap<>();
    }

    @Data
    public static class Strategy {
        private int maxRetries = 3;
        private Duration initialDelay = Duration.ofSeconds(1);
        private Duration maxDelay = Duration.ofSeconds(30);
        private double backoffFactor = 2.0;
        private boolean jitterEnabled = true;
    }

    @Data
    public static class CircuitBreaker {
        private int defaultFailureThreshold = 5;
        private int defaultSuccessThreshold = 3;
        private Duration defaultRecoveryTimeout = Duration.ofSeconds(60);
        private int defaultMaxConcurrentCalls = 100;

        /**
         * Breakers registered at startup, keyed by breaker name. Unset values fall back to the defaults above.
         */
        private Map<String, Instance> instances = new LinkedHashMap<>();
    }

    @Data
    public static class Instance {
        private Integer failureThreshold;
        private Integer successThreshold;
        private Duration timeout;
        private Integer maxConcurrentCalls;
        private int volumeThreshold;
        private double errorRateThreshold;
    }

    @Data
    public static class History {
        private Duration retention = Duration.ofHours(24);
        private int maxEntries = 10_000;
    }

    @Data
    public static class Events {
        /**
         * Value of the {@code source} field on every published event
         */
        private String source = "resilience-service";

        private Kafka kafka = new Kafka();
    }

    @Data
    public static class Kafka {
        private boolean enabled = false;
        private String topic = "resilience-events";
        /**
         * Events waiting for the Kafka send thread; further events are dropped
         */
        private int sendQueueCapacity = 1000;
    }
}
