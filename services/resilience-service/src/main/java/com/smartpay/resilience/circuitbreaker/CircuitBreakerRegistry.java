package com.smartpay.resilience.circuitbreaker;

import com.smartpay.resilience.classification.ErrorClassifier;
import com.smartpay.resilience.event.ResilienceEventEmitter;
import com.smartpay.resilience.event.ResilienceEventTypes;
import com.smartpay.resilience.exception.CallNotPermittedException;
import com.smartpay.resilience.exception.ResilienceException;
import com.smartpay.resilience.history.ErrorRecorder;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Directory of named circuit breakers and the entry point for guarded calls.
 *
 * <p>The name map is only touched during registration and lookup; the guarded
 * operation always runs outside any registry or breaker lock, so calls to
 * different breakers proceed in parallel.
 *
 * <p>A guarded operation's own failure is always rethrown unchanged after it
 * has been counted, classified and recorded. Refusals are reported as
 * {@link CallNotPermittedException} subclasses and never invoke the operation.
 */
@Slf4j
public class CircuitBreakerRegistry {

    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final ErrorRecorder errorRecorder;
    private final ResilienceEventEmitter events;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final Function<String, CircuitBreakerConfig> defaultConfig;

    public CircuitBreakerRegistry(ErrorRecorder errorRecorder, ResilienceEventEmitter events,
                                  MeterRegistry meterRegistry, Clock clock) {
        this(errorRecorder, events, meterRegistry, clock, name -> CircuitBreakerConfig.builder().name(name).build());
    }

    /**
     * @param defaultConfig settings for breakers created on demand by {@link #recordFailure}
     */
    public CircuitBreakerRegistry(ErrorRecorder errorRecorder, ResilienceEventEmitter events,
                                  MeterRegistry meterRegistry, Clock clock,
                                  Function<String, CircuitBreakerConfig> defaultConfig) {
        this.errorRecorder = errorRecorder;
        this.events = events;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.defaultConfig = defaultConfig;
    }

    public CircuitBreaker register(CircuitBreakerConfig config) {
        CircuitBreaker breaker = new CircuitBreaker(config, clock.instant());
        if (breakers.putIfAbsent(breaker.getName(), breaker) != null) {
            throw new DuplicateCircuitBreakerException(breaker.getName());
        }
        registered(breaker, config);
        return breaker;
    }

    /**
     * Return the breaker named by {@code config}, registering it first if needed.
     * Concurrent callers for the same name all get the same instance.
     */
    public CircuitBreaker registerIfAbsent(CircuitBreakerConfig config) {
        config.validate();
        CircuitBreaker[] created = new CircuitBreaker[1];
        CircuitBreaker breaker = breakers.computeIfAbsent(config.getName(), name -> {
            created[0] = new CircuitBreaker(config, clock.instant());
            return created[0];
        });
        if (created[0] == breaker) {
            registered(breaker, config);
        }
        return breaker;
    }

    /**
     * Feed a failure handled outside a guarded call to the breaker of that name,
     * creating it from the default settings when it does not exist yet.
     */
    public void recordFailure(String name, Throwable error) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            breaker = registerIfAbsent(defaultConfig.apply(name));
        }
        StateTransition transition = breaker.recordFailure(clock.instant());
        publishTransition(breaker, transition, ErrorClassifier.messageOf(error));
    }

    private void registered(CircuitBreaker breaker, CircuitBreakerConfig config) {
        Gauge.builder("resilience.circuit_breaker.state", breaker, b -> b.getState().getGaugeValue())
            .description("Circuit breaker state (0 closed, 1 half-open, 2 open)")
            .tag("name", breaker.getName())
            .register(meterRegistry);

        log.info("Registered circuit breaker: name={}, failureThreshold={}, successThreshold={}, timeout={}, maxConcurrentCalls={}",
            config.getName(), config.getFailureThreshold(), config.getSuccessThreshold(),
            config.getTimeout(), config.getMaxConcurrentCalls());
        publishState(ResilienceEventTypes.BREAKER_REGISTERED, breaker, CircuitBreakerState.CLOSED, null);
    }

    public CircuitBreaker get(String name) {
        CircuitBreaker breaker = breakers.get(name);
        if (breaker == null) {
            throw new CircuitBreakerNotFoundException(name);
        }
        return breaker;
    }

    public Optional<CircuitBreaker> find(String name) {
        return Optional.ofNullable(breakers.get(name));
    }

    public boolean contains(String name) {
        return breakers.containsKey(name);
    }

    /**
     * Run {@code operation} under the named breaker. Unchecked failures of the
     * operation are rethrown as-is.
     */
    public <T> T execute(String name, Supplier<T> operation) {
        try {
            return executeChecked(name, operation::get);
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            // Supplier cannot throw checked exceptions
            throw new ResilienceException("Unexpected checked exception from " + name, e);
        }
    }

    public void run(String name, Runnable operation) {
        execute(name, () -> {
            operation.run();
            return null;
        });
    }

    /**
     * Run {@code operation} under the named breaker, rethrowing any exception
     * it raises unchanged.
     *
     * @throws CircuitBreakerNotFoundException if no breaker has that name
     * @throws CircuitBreakerOpenException if the breaker refuses the call
     * @throws MaxConcurrentCallsExceededException if the breaker is at capacity
     */
    public <T> T executeChecked(String name, Callable<T> operation) throws Exception {
        CircuitBreaker breaker = get(name);

        CircuitBreaker.Admission admission = breaker.tryAcquire(clock.instant());
        publishTransition(breaker, admission.getTransition(), null);
        if (!admission.isPermitted()) {
            CallNotPermittedException rejection = admission.getRejection();
            meterRegistry.counter("resilience.circuit_breaker.calls", "name", name, "outcome", "rejected").increment();
            log.warn("Call rejected: breaker={}, reason={}", name, rejection.getMessage());
            throw rejection;
        }

        long started = System.nanoTime();
        T result;
        try {
            result = operation.call();
        } catch (Throwable failure) {
            Duration duration = Duration.ofNanos(System.nanoTime() - started);
            String message = ErrorClassifier.messageOf(failure);
            StateTransition transition = breaker.onFailure(admission.getEpisode(), clock.instant(), duration, message);
            meterRegistry.counter("resilience.circuit_breaker.calls", "name", name, "outcome", "failure").increment();

            Map<String, Object> metadata = new HashMap<>();
            metadata.put("circuit_breaker", name);
            metadata.put("duration_ms", duration.toMillis());
            errorRecorder.record(name, failure, metadata);

            publishTransition(breaker, transition, message);
            publishCall(name, false, duration);
            throw failure;
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - started);
        StateTransition transition = breaker.onSuccess(admission.getEpisode(), clock.instant(), duration);
        meterRegistry.counter("resilience.circuit_breaker.calls", "name", name, "outcome", "success").increment();
        publishTransition(breaker, transition, null);
        publishCall(name, true, duration);
        return result;
    }

    public void trip(String name, String reason) {
        CircuitBreaker breaker = get(name);
        breaker.trip(clock.instant());
        log.warn("Circuit breaker manually tripped: name={}, reason={}", name, reason);
        publishState(ResilienceEventTypes.BREAKER_MANUAL_TRIP, breaker, CircuitBreakerState.OPEN, reason);
    }

    public void reset(String name) {
        CircuitBreaker breaker = get(name);
        breaker.reset(clock.instant());
        log.info("Circuit breaker manually reset: name={}", name);
        publishState(ResilienceEventTypes.BREAKER_MANUAL_RESET, breaker, CircuitBreakerState.CLOSED, null);
    }

    public void update(String name, CircuitBreakerUpdate update) {
        CircuitBreaker breaker = get(name);
        breaker.apply(update, clock.instant());
        log.info("Circuit breaker updated: name={}, update={}", name, update);
        publishState(ResilienceEventTypes.BREAKER_UPDATED, breaker, breaker.getState(), null);
    }

    public CircuitBreakerStatus status(String name) {
        return get(name).status();
    }

    public List<CircuitBreakerStatus> statuses() {
        return breakers.values().stream()
            .map(CircuitBreaker::status)
            .sorted(Comparator.comparing(CircuitBreakerStatus::getName))
            .toList();
    }

    public CircuitBreakerMetrics metrics(String name) {
        return get(name).metrics();
    }

    /**
     * Move every OPEN breaker whose timeout has elapsed to HALF_OPEN.
     *
     * @return number of breakers promoted
     */
    public int promoteExpired() {
        int promoted = 0;
        for (CircuitBreaker breaker : breakers.values()) {
            StateTransition transition = breaker.promoteIfExpired(clock.instant());
            if (transition != null) {
                promoted++;
                publishTransition(breaker, transition, null);
            }
        }
        return promoted;
    }

    public int size() {
        return breakers.size();
    }

    private void publishTransition(CircuitBreaker breaker, StateTransition transition, String cause) {
        if (transition == null || transition.getFrom() == transition.getTo()) {
            return;
        }
        String eventType = switch (transition.getTo()) {
            case OPEN -> ResilienceEventTypes.BREAKER_OPENED;
            case HALF_OPEN -> ResilienceEventTypes.BREAKER_HALF_OPEN;
            case CLOSED -> ResilienceEventTypes.BREAKER_CLOSED;
        };
        if (transition.getTo() == CircuitBreakerState.OPEN) {
            log.warn("Circuit breaker opened: name={}, from={}, cause={}",
                breaker.getName(), transition.getFrom().getValue(), cause);
        } else {
            log.info("Circuit breaker state changed: name={}, from={}, to={}",
                breaker.getName(), transition.getFrom().getValue(), transition.getTo().getValue());
        }
        Map<String, Object> data = baseData(breaker, transition.getTo());
        data.put("previous_state", transition.getFrom().getValue());
        if (cause != null) {
            data.put("cause", cause);
        }
        events.emit(eventType, data);
    }

    private void publishState(String eventType, CircuitBreaker breaker, CircuitBreakerState state, String reason) {
        Map<String, Object> data = baseData(breaker, state);
        if (reason != null) {
            data.put("reason", reason);
        }
        events.emit(eventType, data);
    }

    private void publishCall(String name, boolean success, Duration duration) {
        Map<String, Object> data = new HashMap<>();
        data.put("circuit_breaker", name);
        data.put("success", success);
        data.put("duration_ms", duration.toMillis());
        events.emit(ResilienceEventTypes.BREAKER_CALL_EXECUTED, data);
        log.debug("Guarded call completed: breaker={}, success={}, durationMs={}", name, success, duration.toMillis());
    }

    private static Map<String, Object> baseData(CircuitBreaker breaker, CircuitBreakerState state) {
        Map<String, Object> data = new HashMap<>();
        data.put("circuit_breaker", breaker.getName());
        data.put("state", state.getValue());
        return data;
    }
}
