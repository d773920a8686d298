package com.smartpay.resilience.config;

import com.smartpay.resilience.circuitbreaker.CircuitBreakerConfig;
import com.smartpay.resilience.circuitbreaker.CircuitBreakerRegistry;
import com.smartpay.resilience.circuitbreaker.CircuitBreakerState;
import com.smartpay.resilience.dlq.DeadLetterQueue;
import com.smartpay.resilience.event.LoggingResilienceEventPublisher;
import com.smartpay.resilience.event.ResilienceEventPublisher;
import com.smartpay.resilience.retry.RetryStrategy;
import com.smartpay.resilience.retry.RetryStrategyRegistry;
import com.smartpay.resilience.scheduler.ResilienceSweeper;
import com.smartpay.resilience.service.ErrorHandlingService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ResilienceConfiguration Tests")
class ResilienceConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withUserConfiguration(ResilienceConfiguration.class, ErrorHandlingService.class)
        .withPropertyValues("smartpay.resilience.background.enabled=false");

    @Test
    @DisplayName("Should wire every component with defaults")
    void shouldWireDefaults() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context).hasSingleBean(ErrorHandlingService.class);
            assertThat(context).hasSingleBean(ResilienceSweeper.class);
            assertThat(context.getBean(ResilienceEventPublisher.class))
                .isInstanceOf(LoggingResilienceEventPublisher.class);
            assertThat(context.getBean(DeadLetterQueue.class).capacity()).isEqualTo(1000);
            assertThat(context.getBean(ResilienceSweeper.class).isRunning()).isFalse();

            RetryStrategy defaults = context.getBean(RetryStrategyRegistry.class).getDefault();
            assertThat(defaults.getMaxRetries()).isEqualTo(3);
            assertThat(defaults.getInitialDelay()).isEqualTo(Duration.ofSeconds(1));
        });
    }

    @Test
    @DisplayName("Should register configured breakers and strategies")
    void shouldApplyConfiguredInstances() {
        contextRunner
            .withPropertyValues(
                "smartpay.resilience.circuit-breaker.default-failure-threshold=7",
                "smartpay.resilience.circuit-breaker.instances.xrpl.failure-threshold=2",
                "smartpay.resilience.circuit-breaker.instances.xrpl.timeout=15s",
                "smartpay.resilience.circuit-breaker.instances.ledger.max-concurrent-calls=5",
                "smartpay.resilience.retry.strategies.payments.max-retries=6",
                "smartpay.resilience.dead-letter.max-size=25")
            .run(context -> {
                CircuitBreakerRegistry registry = context.getBean(CircuitBreakerRegistry.class);
                CircuitBreakerConfig xrpl = registry.get("xrpl").currentConfig();
                assertThat(xrpl.getFailureThreshold()).isEqualTo(2);
                assertThat(xrpl.getTimeout()).isEqualTo(Duration.ofSeconds(15));
                CircuitBreakerConfig ledger = registry.get("ledger").currentConfig();
                assertThat(ledger.getFailureThreshold()).isEqualTo(7);
                assertThat(ledger.getMaxConcurrentCalls()).isEqualTo(5);

                assertThat(context.getBean(RetryStrategyRegistry.class).get("payments").getMaxRetries())
                    .isEqualTo(6);
                assertThat(context.getBean(DeadLetterQueue.class).capacity()).isEqualTo(25);
            });
    }

    @Test
    @DisplayName("Handled errors open a per-service breaker built from the defaults")
    void shouldOpenServiceBreakerFromHandledErrors() {
        contextRunner
            .withPropertyValues(
                "smartpay.resilience.circuit-breaker.default-failure-threshold=2",
                "smartpay.resilience.circuit-breaker.default-recovery-timeout=30s")
            .run(context -> {
                ErrorHandlingService service = context.getBean(ErrorHandlingService.class);
                CircuitBreakerRegistry registry = context.getBean(CircuitBreakerRegistry.class);

                service.handleError("wallet.debit", new RuntimeException("connection refused"), null);
                assertThat(registry.status("wallet").getState()).isEqualTo(CircuitBreakerState.CLOSED);
                service.handleError("wallet.credit", new RuntimeException("connection refused"), null);

                assertThat(registry.status("wallet").getState()).isEqualTo(CircuitBreakerState.OPEN);
                assertThat(registry.get("wallet").currentConfig().getTimeout()).isEqualTo(Duration.ofSeconds(30));
            });
    }

    @Test
    @DisplayName("Redefining a built-in retry strategy fails startup")
    void shouldFailOnDuplicateStrategy() {
        contextRunner
            .withPropertyValues("smartpay.resilience.retry.strategies.aggressive.max-retries=9")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    @DisplayName("Invalid breaker settings fail startup")
    void shouldFailOnInvalidBreaker() {
        contextRunner
            .withPropertyValues("smartpay.resilience.circuit-breaker.instances.xrpl.failure-threshold=0")
            .run(context -> assertThat(context).hasFailed());
    }
}
