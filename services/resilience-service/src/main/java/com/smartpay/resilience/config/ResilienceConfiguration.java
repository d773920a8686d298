package com.smartpay.resilience.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.smartpay.resilience.circuitbreaker.CircuitBreakerConfig;
import com.smartpay.resilience.circuitbreaker.CircuitBreakerRegistry;
import com.smartpay.resilience.classification.ErrorClassifier;
import com.smartpay.resilience.dlq.DeadLetterQueue;
import com.smartpay.resilience.event.KafkaResilienceEventPublisher;
import com.smartpay.resilience.event.LoggingResilienceEventPublisher;
import com.smartpay.resilience.event.ResilienceEventEmitter;
import com.smartpay.resilience.event.ResilienceEventPublisher;
import com.smartpay.resilience.history.ErrorHistory;
import com.smartpay.resilience.history.ErrorRecorder;
import com.smartpay.resilience.recovery.RecoveryService;
import com.smartpay.resilience.retry.RetryExecutor;
import com.smartpay.resilience.retry.RetryStrategy;
import com.smartpay.resilience.retry.RetryStrategyRegistry;
import com.smartpay.resilience.scheduler.ResilienceSweeper;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.time.Clock;
import java.util.Map;

/**
 * Wires the resilience layer from {@link ResilienceProperties}.
 */
@Slf4j
@Configuration
@EnableConfigurationProperties(ResilienceProperties.class)
public class ResilienceConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnProperty(prefix = "smartpay.resilience.events.kafka", name = "enabled", havingValue = "true")
    public ThreadPoolTaskExecutor resilienceEventExecutor(ResilienceProperties properties) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setQueueCapacity(properties.getEvents().getKafka().getSendQueueCapacity());
        executor.setThreadNamePrefix("resilience-events-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(5);
        return executor;
    }

    @Bean
    @ConditionalOnProperty(prefix = "smartpay.resilience.events.kafka", name = "enabled", havingValue = "true")
    public ResilienceEventPublisher kafkaResilienceEventPublisher(KafkaTemplate<String, String> kafkaTemplate,
                                                                  ObjectProvider<ObjectMapper> objectMapper,
                                                                  ThreadPoolTaskExecutor resilienceEventExecutor,
                                                                  ResilienceProperties properties) {
        ObjectMapper mapper = objectMapper.getIfAvailable(ResilienceConfiguration::defaultObjectMapper);
        log.info("Publishing resilience events to Kafka topic {}", properties.getEvents().getKafka().getTopic());
        return new KafkaResilienceEventPublisher(kafkaTemplate, mapper, properties.getEvents().getKafka().getTopic(),
            resilienceEventExecutor);
    }

    @Bean
    @ConditionalOnMissingBean(ResilienceEventPublisher.class)
    public ResilienceEventPublisher loggingResilienceEventPublisher() {
        return new LoggingResilienceEventPublisher();
    }

    @Bean
    public ResilienceEventEmitter resilienceEventEmitter(ResilienceEventPublisher publisher, Clock clock,
                                                         ResilienceProperties properties) {
        return new ResilienceEventEmitter(publisher, clock, properties.getEvents().getSource());
    }

    @Bean
    public ErrorClassifier errorClassifier() {
        return new ErrorClassifier();
    }

    @Bean
    public ErrorHistory errorHistory(Clock clock, ResilienceProperties properties) {
        return new ErrorHistory(clock, properties.getHistory().getMaxEntries());
    }

    @Bean
    public ErrorRecorder errorRecorder(ErrorClassifier classifier, ErrorHistory history,
                                       ResilienceEventEmitter events, MeterRegistry meterRegistry, Clock clock) {
        return new ErrorRecorder(classifier, history, events, meterRegistry, clock);
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ErrorRecorder errorRecorder, ResilienceEventEmitter events,
                                                         MeterRegistry meterRegistry, Clock clock,
                                                         ResilienceProperties properties) {
        ResilienceProperties.CircuitBreaker defaults = properties.getCircuitBreaker();
        CircuitBreakerRegistry registry = new CircuitBreakerRegistry(errorRecorder, events, meterRegistry, clock,
            name -> breakerConfig(name, defaults.getInstances().getOrDefault(name, new ResilienceProperties.Instance()),
                defaults));
        for (Map.Entry<String, ResilienceProperties.Instance> entry : defaults.getInstances().entrySet()) {
            registry.register(breakerConfig(entry.getKey(), entry.getValue(), defaults));
        }
        return registry;
    }

    @Bean
    public RetryStrategyRegistry retryStrategyRegistry(ResilienceProperties properties) {
        ResilienceProperties.Retry retry = properties.getRetry();
        RetryStrategyRegistry registry = new RetryStrategyRegistry(RetryStrategy.builder()
            .name(RetryStrategy.DEFAULT)
            .maxRetries(retry.getMaxRetries())
            .initialDelay(retry.getInitialDelay())
            .maxDelay(retry.getMaxDelay())
            .backoffFactor(retry.getBackoffFactor())
            .jitterEnabled(retry.isJitterEnabled())
            .build());
        retry.getStrategies().forEach((name, strategy) -> registry.register(RetryStrategy.builder()
            .name(name)
            .maxRetries(strategy.getMaxRetries())
            .initialDelay(strategy.getInitialDelay())
            .maxDelay(strategy.getMaxDelay())
            .backoffFactor(strategy.getBackoffFactor())
            .jitterEnabled(strategy.isJitterEnabled())
            .build()));
        return registry;
    }

    @Bean
    public DeadLetterQueue deadLetterQueue(ResilienceEventEmitter events, MeterRegistry meterRegistry, Clock clock,
                                           ResilienceProperties properties) {
        ResilienceProperties.DeadLetter deadLetter = properties.getDeadLetter();
        return new DeadLetterQueue(deadLetter.getMaxSize(), deadLetter.getMaxReprocessAttempts(),
            deadLetter.getReprocessBackoff(), events, meterRegistry, clock);
    }

    @Bean
    public RetryExecutor retryExecutor(RetryStrategyRegistry strategies, DeadLetterQueue deadLetterQueue,
                                       ErrorRecorder errorRecorder, MeterRegistry meterRegistry) {
        return new RetryExecutor(strategies, deadLetterQueue, errorRecorder, meterRegistry);
    }

    @Bean
    public RecoveryService recoveryService(DeadLetterQueue deadLetterQueue, CircuitBreakerRegistry circuitBreakers) {
        return new RecoveryService(deadLetterQueue, circuitBreakers);
    }

    @Bean
    public ResilienceSweeper resilienceSweeper(DeadLetterQueue deadLetterQueue, ErrorHistory errorHistory,
                                               CircuitBreakerRegistry circuitBreakers,
                                               ResilienceProperties properties) {
        ResilienceProperties.Background background = properties.getBackground();
        return new ResilienceSweeper(deadLetterQueue, errorHistory, circuitBreakers, background.isEnabled(),
            background.getProcessingInterval(), background.getMetricsCollectionInterval(),
            properties.getHistory().getRetention());
    }

    static CircuitBreakerConfig breakerConfig(String name, ResilienceProperties.Instance instance,
                                              ResilienceProperties.CircuitBreaker defaults) {
        return CircuitBreakerConfig.builder()
            .name(name)
            .failureThreshold(instance.getFailureThreshold() != null
                ? instance.getFailureThreshold() : defaults.getDefaultFailureThreshold())
            .successThreshold(instance.getSuccessThreshold() != null
                ? instance.getSuccessThreshold() : defaults.getDefaultSuccessThreshold())
            .timeout(instance.getTimeout() != null
                ? instance.getTimeout() : defaults.getDefaultRecoveryTimeout())
            .maxConcurrentCalls(instance.getMaxConcurrentCalls() != null
                ? instance.getMaxConcurrentCalls() : defaults.getDefaultMaxConcurrentCalls())
            .volumeThreshold(instance.getVolumeThreshold())
            .errorRateThreshold(instance.getErrorRateThreshold())
            .build();
    }

    private static ObjectMapper defaultObjectMapper() {
        return new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
