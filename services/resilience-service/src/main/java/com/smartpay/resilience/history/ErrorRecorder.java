package com.smartpay.resilience.history;

import com.smartpay.resilience.classification.ErrorClassifier;
import com.smartpay.resilience.classification.ErrorCode;
import com.smartpay.resilience.classification.ErrorSeverity;
import com.smartpay.resilience.event.ResilienceEventEmitter;
import com.smartpay.resilience.event.ResilienceEventTypes;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Turns a raw failure into an {@link ErrorContext}: classifies it, appends it
 * to the {@link ErrorHistory}, counts it and announces it.
 */
@Slf4j
public class ErrorRecorder {

    static final String USER_ID_KEY = "user_id";
    static final String REQUEST_ID_KEY = "request_id";

    private final ErrorClassifier classifier;
    private final ErrorHistory history;
    private final ResilienceEventEmitter events;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    public ErrorRecorder(ErrorClassifier classifier, ErrorHistory history, ResilienceEventEmitter events,
                         MeterRegistry meterRegistry, Clock clock) {
        this.classifier = classifier;
        this.history = history;
        this.events = events;
        this.meterRegistry = meterRegistry;
        this.clock = clock;

        Gauge.builder("resilience.error_history.size", history, ErrorHistory::size)
            .description("Classified errors currently retained in history")
            .register(meterRegistry);
    }

    public ErrorContext record(String operation, Throwable error, Map<String, Object> metadata) {
        return record(operation, error, metadata, 0);
    }

    public ErrorContext record(String operation, Throwable error, Map<String, Object> metadata, int retryCount) {
        Map<String, Object> meta = metadata != null ? Map.copyOf(withoutNulls(metadata)) : Map.of();
        ErrorCode code = classifier.classify(error);
        ErrorSeverity severity = classifier.severityOf(code);

        ErrorContext context = ErrorContext.builder()
            .id(UUID.randomUUID())
            .operation(operation)
            .serviceName(serviceNameOf(operation))
            .message(ErrorClassifier.messageOf(error))
            .code(code)
            .severity(severity)
            .timestamp(clock.instant())
            .metadata(meta)
            .stackTrace(stackTraceOf(error))
            .userId(uuidOf(meta.get(USER_ID_KEY)))
            .requestId(uuidOf(meta.get(REQUEST_ID_KEY)))
            .retryCount(retryCount)
            .build();

        history.record(context);
        meterRegistry.counter("resilience.errors",
            "code", code.getCode(),
            "severity", severity.getValue()).increment();

        Map<String, Object> data = new HashMap<>();
        data.put("error_id", context.getId().toString());
        data.put("operation", operation);
        data.put("service_name", context.getServiceName());
        data.put("error_code", code.getCode());
        data.put("severity", severity.getValue());
        data.put("error_message", context.getMessage());
        events.emit(ResilienceEventTypes.ERROR_OCCURRED, data);

        log.info("Error handled: operation={}, code={}, severity={}, message={}",
            operation, code.getCode(), severity.getValue(), context.getMessage());
        return context;
    }

    /**
     * Service part of an operation name of the form {@code service.operation}.
     */
    public static String serviceNameOf(String operation) {
        if (operation == null || operation.isBlank()) {
            return "unknown";
        }
        int dot = operation.indexOf('.');
        return dot > 0 ? operation.substring(0, dot) : operation;
    }

    private static UUID uuidOf(Object value) {
        if (value instanceof UUID uuid) {
            return uuid;
        }
        if (value instanceof String text) {
            try {
                return UUID.fromString(text);
            } catch (IllegalArgumentException e) {
                log.debug("Ignoring malformed correlation id: {}", text);
            }
        }
        return null;
    }

    private static Map<String, Object> withoutNulls(Map<String, Object> metadata) {
        Map<String, Object> copy = new HashMap<>();
        metadata.forEach((k, v) -> {
            if (k != null && v != null) {
                copy.put(k, v);
            }
        });
        return copy;
    }

    private static String stackTraceOf(Throwable error) {
        if (error == null) {
            return null;
        }
        StringWriter writer = new StringWriter();
        error.printStackTrace(new PrintWriter(writer));
        return writer.toString();
    }
}
