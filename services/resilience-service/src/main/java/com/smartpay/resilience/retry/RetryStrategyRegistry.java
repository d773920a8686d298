package com.smartpay.resilience.retry;

import lombok.extern.slf4j.Slf4j;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named retry strategies, defined at startup. Always contains
 * {@value RetryStrategy#DEFAULT}.
 */
@Slf4j
public class RetryStrategyRegistry {

    private final Map<String, RetryStrategy> strategies = new ConcurrentHashMap<>();

    public RetryStrategyRegistry(RetryStrategy defaultStrategy) {
        register(defaultStrategy.toBuilder().name(RetryStrategy.DEFAULT).build());
        register(RetryStrategy.aggressive());
        register(RetryStrategy.conservative());
    }

    /**
     * Add a strategy. Defined strategies never change.
     *
     * @throws IllegalStateException if a strategy with that name already exists
     */
    public void register(RetryStrategy strategy) {
        strategy.validate();
        if (strategies.putIfAbsent(strategy.getName(), strategy) != null) {
            throw new IllegalStateException("Retry strategy " + strategy.getName() + " is already defined");
        }
        log.debug("Registered retry strategy: name={}, maxRetries={}, initialDelay={}, maxDelay={}, backoffFactor={}",
            strategy.getName(), strategy.getMaxRetries(), strategy.getInitialDelay(),
            strategy.getMaxDelay(), strategy.getBackoffFactor());
    }

    /**
     * @param name strategy name; null selects the default strategy
     * @throws IllegalArgumentException if no strategy has that name
     */
    public RetryStrategy get(String name) {
        if (name == null) {
            return strategies.get(RetryStrategy.DEFAULT);
        }
        RetryStrategy strategy = strategies.get(name);
        if (strategy == null) {
            throw new IllegalArgumentException("Unknown retry strategy: " + name);
        }
        return strategy;
    }

    public RetryStrategy getDefault() {
        return strategies.get(RetryStrategy.DEFAULT);
    }

    public Set<String> names() {
        return new TreeSet<>(strategies.keySet());
    }
}
