package com.smartpay.resilience.circuitbreaker;

import com.smartpay.resilience.exception.CallNotPermittedException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Closed / Open / Half-Open state machine guarding one named operation.
 *
 * <p>All counters and the state field are guarded by a per-breaker lock, so
 * transitions on one breaker are linearizable while different breakers never
 * contend. Admission (including the Open to Half-Open move and the in-flight
 * increment) is a single critical section: while Half-Open, at most one probe
 * call is ever in flight.
 *
 * <p>Every state change starts a new episode. A call only moves the state
 * counters of the episode it was admitted in, so calls admitted while Closed
 * that complete after the breaker opened or went Half-Open cannot close it.
 *
 * <p>Lifetime counters cover admitted calls only; refused calls are counted
 * separately as rejections.
 */
public class CircuitBreaker {

    static final int RECENT_CALLS_LIMIT = 50;

    private final String name;
    private final Instant createdAt;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;

    private int failureThreshold;
    private int successThreshold;
    private Duration timeout;
    private int maxConcurrentCalls;
    private int volumeThreshold;
    private double errorRateThreshold;

    private int failureCount;
    private int successCount;
    private int currentCalls;
    private long episode;
    private boolean probeInFlight;
    private Instant lastFailureTime;
    private Instant nextAttemptTime;
    private Instant updatedAt;

    private long totalCalls;
    private long totalFailures;
    private long totalRejections;
    private long completedCalls;
    private long totalDurationNanos;

    // error-rate window, reset whenever the breaker enters CLOSED
    private long callsSinceClosed;
    private long failuresSinceClosed;

    private final Deque<CallResult> recentCalls = new ArrayDeque<>();

    CircuitBreaker(CircuitBreakerConfig config, Instant now) {
        config.validate();
        this.name = config.getName();
        this.createdAt = now;
        this.updatedAt = now;
        this.failureThreshold = config.getFailureThreshold();
        this.successThreshold = config.getSuccessThreshold();
        this.timeout = config.getTimeout();
        this.maxConcurrentCalls = config.getMaxConcurrentCalls();
        this.volumeThreshold = config.getVolumeThreshold();
        this.errorRateThreshold = config.getErrorRateThreshold();
    }

    public String getName() {
        return name;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public CircuitBreakerState getState() {
        lock.lock();
        try {
            return state;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Decide whether a call may run and, if so, count it as in flight.
     */
    Admission tryAcquire(Instant now) {
        lock.lock();
        try {
            StateTransition transition = null;

            if (state == CircuitBreakerState.OPEN) {
                if (nextAttemptTime == null || !now.isAfter(nextAttemptTime)) {
                    totalRejections++;
                    return Admission.rejected(new CircuitBreakerOpenException(name, state), null);
                }
                transition = enter(CircuitBreakerState.HALF_OPEN, now);
            }

            if (state == CircuitBreakerState.HALF_OPEN) {
                if (probeInFlight) {
                    totalRejections++;
                    return Admission.rejected(new CircuitBreakerOpenException(name, state), transition);
                }
                probeInFlight = true;
            } else if (maxConcurrentCalls > 0 && currentCalls >= maxConcurrentCalls) {
                totalRejections++;
                return Admission.rejected(new MaxConcurrentCallsExceededException(name, maxConcurrentCalls), transition);
            }

            currentCalls++;
            totalCalls++;
            return Admission.permitted(episode, transition);
        } finally {
            lock.unlock();
        }
    }

    StateTransition onSuccess(long admittedIn, Instant now, Duration duration) {
        lock.lock();
        try {
            release();
            recordCall(now, true, duration, null);
            if (!isCurrent(admittedIn)) {
                return null;
            }
            successCount++;

            if (state == CircuitBreakerState.HALF_OPEN && successCount >= successThreshold) {
                return enter(CircuitBreakerState.CLOSED, now);
            }
            if (state == CircuitBreakerState.CLOSED) {
                callsSinceClosed++;
                if (errorRateExceeded()) {
                    return enter(CircuitBreakerState.OPEN, now);
                }
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    StateTransition onFailure(long admittedIn, Instant now, Duration duration, String error) {
        lock.lock();
        try {
            release();
            totalFailures++;
            lastFailureTime = now;
            recordCall(now, false, duration, error);
            if (!isCurrent(admittedIn)) {
                return null;
            }
            failureCount++;

            switch (state) {
                case CLOSED -> {
                    callsSinceClosed++;
                    failuresSinceClosed++;
                    if (failureCount >= failureThreshold || errorRateExceeded()) {
                        return enter(CircuitBreakerState.OPEN, now);
                    }
                    return null;
                }
                case HALF_OPEN -> {
                    return enter(CircuitBreakerState.OPEN, now);
                }
                default -> {
                    return null;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Count a failure reported for this breaker's name outside a guarded call.
     * Only a CLOSED breaker reacts; lifetime call counters are left alone.
     */
    StateTransition recordFailure(Instant now) {
        lock.lock();
        try {
            lastFailureTime = now;
            if (state != CircuitBreakerState.CLOSED) {
                return null;
            }
            failureCount++;
            if (failureCount >= failureThreshold) {
                return enter(CircuitBreakerState.OPEN, now);
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Force OPEN regardless of counters. Re-arms the timeout if already open.
     */
    StateTransition trip(Instant now) {
        lock.lock();
        try {
            return enter(CircuitBreakerState.OPEN, now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Force CLOSED and zero the state counters. Lifetime counters are kept.
     */
    StateTransition reset(Instant now) {
        lock.lock();
        try {
            return enter(CircuitBreakerState.CLOSED, now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Move an OPEN breaker whose timeout has elapsed to HALF_OPEN.
     *
     * @return the transition, or null if nothing changed
     */
    StateTransition promoteIfExpired(Instant now) {
        lock.lock();
        try {
            if (state == CircuitBreakerState.OPEN && nextAttemptTime != null && now.isAfter(nextAttemptTime)) {
                return enter(CircuitBreakerState.HALF_OPEN, now);
            }
            return null;
        } finally {
            lock.unlock();
        }
    }

    void apply(CircuitBreakerUpdate update, Instant now) {
        lock.lock();
        try {
            CircuitBreakerConfig candidate = currentConfig().toBuilder().build();
            if (update.getFailureThreshold() != null) {
                candidate.setFailureThreshold(update.getFailureThreshold());
            }
            if (update.getSuccessThreshold() != null) {
                candidate.setSuccessThreshold(update.getSuccessThreshold());
            }
            if (update.getTimeout() != null) {
                candidate.setTimeout(update.getTimeout());
            }
            if (update.getMaxConcurrentCalls() != null) {
                candidate.setMaxConcurrentCalls(update.getMaxConcurrentCalls());
            }
            if (update.getVolumeThreshold() != null) {
                candidate.setVolumeThreshold(update.getVolumeThreshold());
            }
            if (update.getErrorRateThreshold() != null) {
                candidate.setErrorRateThreshold(update.getErrorRateThreshold());
            }
            candidate.validate();

            failureThreshold = candidate.getFailureThreshold();
            successThreshold = candidate.getSuccessThreshold();
            timeout = candidate.getTimeout();
            maxConcurrentCalls = candidate.getMaxConcurrentCalls();
            volumeThreshold = candidate.getVolumeThreshold();
            errorRateThreshold = candidate.getErrorRateThreshold();
            updatedAt = now;
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerConfig currentConfig() {
        lock.lock();
        try {
            return CircuitBreakerConfig.builder()
                .name(name)
                .failureThreshold(failureThreshold)
                .successThreshold(successThreshold)
                .timeout(timeout)
                .maxConcurrentCalls(maxConcurrentCalls)
                .volumeThreshold(volumeThreshold)
                .errorRateThreshold(errorRateThreshold)
                .build();
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerStatus status() {
        lock.lock();
        try {
            return CircuitBreakerStatus.builder()
                .name(name)
                .state(state)
                .failureCount(failureCount)
                .successCount(successCount)
                .currentCalls(currentCalls)
                .errorRate(percentage(totalFailures, totalCalls))
                .lastFailureTime(lastFailureTime)
                .nextAttemptTime(nextAttemptTime)
                .available(state == CircuitBreakerState.CLOSED)
                .build();
        } finally {
            lock.unlock();
        }
    }

    public CircuitBreakerMetrics metrics() {
        lock.lock();
        try {
            return CircuitBreakerMetrics.builder()
                .name(name)
                .state(state)
                .totalCalls(totalCalls)
                .totalFailures(totalFailures)
                .totalSuccesses(totalCalls - totalFailures)
                .totalRejections(totalRejections)
                .errorRate(percentage(totalFailures, totalCalls))
                .successRate(percentage(totalCalls - totalFailures, totalCalls))
                .averageResponseTime(completedCalls > 0
                    ? Duration.ofNanos(totalDurationNanos / completedCalls)
                    : Duration.ZERO)
                .recentCalls(List.copyOf(recentCalls))
                .build();
        } finally {
            lock.unlock();
        }
    }

    public Instant getUpdatedAt() {
        lock.lock();
        try {
            return updatedAt;
        } finally {
            lock.unlock();
        }
    }

    // Must hold lock
    private StateTransition enter(CircuitBreakerState target, Instant now) {
        CircuitBreakerState previous = state;
        state = target;
        updatedAt = now;
        episode++;
        probeInFlight = false;

        switch (target) {
            case OPEN -> {
                successCount = 0;
                nextAttemptTime = now.plus(timeout);
            }
            case HALF_OPEN -> {
                failureCount = 0;
                successCount = 0;
            }
            case CLOSED -> {
                failureCount = 0;
                successCount = 0;
                nextAttemptTime = null;
                callsSinceClosed = 0;
                failuresSinceClosed = 0;
            }
        }
        return new StateTransition(previous, target);
    }

    private void release() {
        if (currentCalls > 0) {
            currentCalls--;
        }
    }

    // Must hold lock. Ends the half-open probe when the completing call is it.
    private boolean isCurrent(long admittedIn) {
        if (admittedIn != episode) {
            return false;
        }
        if (state == CircuitBreakerState.HALF_OPEN) {
            probeInFlight = false;
        }
        return true;
    }

    private boolean errorRateExceeded() {
        if (volumeThreshold <= 0 || errorRateThreshold <= 0 || callsSinceClosed < volumeThreshold) {
            return false;
        }
        return percentage(failuresSinceClosed, callsSinceClosed) >= errorRateThreshold;
    }

    private void recordCall(Instant now, boolean success, Duration duration, String error) {
        completedCalls++;
        totalDurationNanos += duration.toNanos();
        if (recentCalls.size() >= RECENT_CALLS_LIMIT) {
            recentCalls.removeFirst();
        }
        recentCalls.addLast(CallResult.builder()
            .timestamp(now)
            .success(success)
            .duration(duration)
            .error(error)
            .build());
    }

    private static double percentage(long part, long whole) {
        return whole > 0 ? (double) part / whole * 100 : 0;
    }

    /**
     * Result of an admission check.
     */
    static final class Admission {

        private final CallNotPermittedException rejection;
        private final StateTransition transition;
        private final long episode;

        private Admission(CallNotPermittedException rejection, StateTransition transition, long episode) {
            this.rejection = rejection;
            this.transition = transition;
            this.episode = episode;
        }

        static Admission permitted(long episode, StateTransition transition) {
            return new Admission(null, transition, episode);
        }

        static Admission rejected(CallNotPermittedException rejection, StateTransition transition) {
            return new Admission(rejection, transition, -1);
        }

        long getEpisode() {
            return episode;
        }

        boolean isPermitted() {
            return rejection == null;
        }

        CallNotPermittedException getRejection() {
            return rejection;
        }

        StateTransition getTransition() {
            return transition;
        }
    }
}
