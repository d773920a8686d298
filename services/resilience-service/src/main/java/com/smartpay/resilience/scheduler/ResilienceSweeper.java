package com.smartpay.resilience.scheduler;

import com.smartpay.resilience.circuitbreaker.CircuitBreakerRegistry;
import com.smartpay.resilience.circuitbreaker.CircuitBreakerState;
import com.smartpay.resilience.circuitbreaker.CircuitBreakerStatus;
import com.smartpay.resilience.dlq.DeadLetterQueue;
import com.smartpay.resilience.dlq.DeadLetterReprocessResult;
import com.smartpay.resilience.history.ErrorHistory;
import com.smartpay.resilience.history.ErrorMetrics;
import com.smartpay.resilience.retry.CancellationToken;
import com.smartpay.resilience.retry.OperationCancelledException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Periodic background work: reprocesses the dead letter queue, trims error
 * history past its retention, promotes expired open breakers to half-open,
 * and logs a metrics snapshot.
 *
 * <p>Owns its scheduler and a {@link CancellationToken}; {@link #stop()}
 * cancels the token so an in-flight tick abandons its remaining work.
 */
@Slf4j
public class ResilienceSweeper {

    private static final long SHUTDOWN_TIMEOUT_SECONDS = 30;

    private final DeadLetterQueue deadLetterQueue;
    private final ErrorHistory errorHistory;
    private final CircuitBreakerRegistry circuitBreakers;
    private final boolean enabled;
    private final Duration processingInterval;
    private final Duration metricsInterval;
    private final Duration historyRetention;

    private ScheduledExecutorService scheduler;
    private volatile CancellationToken token = CancellationToken.create();

    public ResilienceSweeper(DeadLetterQueue deadLetterQueue, ErrorHistory errorHistory,
                             CircuitBreakerRegistry circuitBreakers, boolean enabled,
                             Duration processingInterval, Duration metricsInterval, Duration historyRetention) {
        this.deadLetterQueue = deadLetterQueue;
        this.errorHistory = errorHistory;
        this.circuitBreakers = circuitBreakers;
        this.enabled = enabled;
        this.processingInterval = processingInterval;
        this.metricsInterval = metricsInterval;
        this.historyRetention = historyRetention;
    }

    @PostConstruct
    public void init() {
        if (enabled) {
            start();
        } else {
            log.info("Background resilience processing disabled");
        }
    }

    public synchronized void start() {
        if (isRunning()) {
            return;
        }
        token = CancellationToken.create();
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "resilience-sweeper");
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::tick,
            processingInterval.toMillis(), processingInterval.toMillis(), TimeUnit.MILLISECONDS);
        scheduler.scheduleAtFixedRate(this::collectMetrics,
            metricsInterval.toMillis(), metricsInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Resilience sweeper started: processingInterval={}, metricsInterval={}, historyRetention={}",
            processingInterval, metricsInterval, historyRetention);
    }

    @PreDestroy
    public synchronized void stop() {
        if (scheduler == null || scheduler.isShutdown()) {
            return;
        }
        log.info("Shutting down resilience sweeper");
        token.cancel("sweeper stopped");
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("Resilience sweeper shutdown completed");
    }

    public synchronized boolean isRunning() {
        return scheduler != null && !scheduler.isShutdown();
    }

    /**
     * One sweep. A failing step is logged and does not prevent the others.
     */
    public void tick() {
        CancellationToken current = token;
        try {
            DeadLetterReprocessResult result = deadLetterQueue.reprocess(current);
            if (result.isCancelled()) {
                log.info("Sweep cancelled during dead letter reprocessing");
                return;
            }
        } catch (OperationCancelledException e) {
            log.info("Sweep cancelled: {}", e.getMessage());
            return;
        } catch (RuntimeException e) {
            log.error("Dead letter reprocessing failed", e);
        }

        if (current.isCancelled()) {
            return;
        }
        try {
            int removed = errorHistory.trim(historyRetention);
            if (removed > 0) {
                log.info("Trimmed expired error history: removed={}", removed);
            }
        } catch (RuntimeException e) {
            log.error("Error history trimming failed", e);
        }

        if (current.isCancelled()) {
            return;
        }
        try {
            circuitBreakers.promoteExpired();
        } catch (RuntimeException e) {
            log.error("Circuit breaker promotion failed", e);
        }
    }

    void collectMetrics() {
        try {
            ErrorMetrics metrics = errorHistory.metrics(metricsInterval);
            long open = circuitBreakers.statuses().stream()
                .map(CircuitBreakerStatus::getState)
                .filter(state -> state != CircuitBreakerState.CLOSED)
                .count();
            log.info("Resilience metrics: errors={}, errorRatePerHour={}, recoveryRate={}, deadLetters={}, breakers={}, notClosed={}",
                metrics.getTotalErrors(), String.format("%.2f", metrics.getErrorRate()),
                String.format("%.1f", metrics.getRecoveryRate()), deadLetterQueue.size(),
                circuitBreakers.size(), open);
        } catch (RuntimeException e) {
            log.error("Resilience metrics collection failed", e);
        }
    }
}
