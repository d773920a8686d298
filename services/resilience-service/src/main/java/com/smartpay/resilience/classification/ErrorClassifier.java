package com.smartpay.resilience.classification;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Maps raw failures to an {@link ErrorCode} and an {@link ErrorSeverity}.
 *
 * <p>Classification runs in two stages. The code comes from ordered,
 * case-insensitive keyword matching over the failure message (the first rule
 * that matches wins). The severity is a function of the code alone. The
 * classifier is stateless and safe to share between threads.
 */
public class ErrorClassifier {

    private static final List<Map.Entry<ErrorCode, List<String>>> RULES = List.of(
        Map.entry(ErrorCode.TIMEOUT, List.of("timeout")),
        Map.entry(ErrorCode.NETWORK_FAILURE, List.of("network", "connection")),
        Map.entry(ErrorCode.AUTHORIZATION_FAILURE, List.of("unauthorized", "forbidden")),
        Map.entry(ErrorCode.RESOURCE_NOT_FOUND, List.of("not found")),
        Map.entry(ErrorCode.VALIDATION_FAILURE, List.of("validation")),
        Map.entry(ErrorCode.BLOCKCHAIN_ERROR, List.of("blockchain", "xrpl")),
        Map.entry(ErrorCode.DATABASE_ERROR, List.of("database", "sql"))
    );

    /**
     * Classify a failure. A {@link CodedException} keeps its own code;
     * anything else is classified by {@link #classifyMessage(String)}.
     */
    public ErrorCode classify(Throwable error) {
        if (error == null) {
            return ErrorCode.INTERNAL_ERROR;
        }
        if (error instanceof CodedException coded && coded.getErrorCode() != null) {
            return coded.getErrorCode();
        }
        return classifyMessage(messageOf(error));
    }

    public ErrorCode classifyMessage(String message) {
        if (message == null || message.isBlank()) {
            return ErrorCode.INTERNAL_ERROR;
        }
        String normalized = message.toLowerCase(Locale.ROOT);
        for (Map.Entry<ErrorCode, List<String>> rule : RULES) {
            for (String keyword : rule.getValue()) {
                if (normalized.contains(keyword)) {
                    return rule.getKey();
                }
            }
        }
        return ErrorCode.INTERNAL_ERROR;
    }

    public ErrorSeverity severityOf(ErrorCode code) {
        if (code == null) {
            return ErrorSeverity.LOW;
        }
        return switch (code) {
            case RESOURCE_EXHAUSTED -> ErrorSeverity.CRITICAL;
            case AUTHORIZATION_FAILURE, BLOCKCHAIN_ERROR, DATABASE_ERROR -> ErrorSeverity.HIGH;
            case NETWORK_FAILURE, TIMEOUT -> ErrorSeverity.MEDIUM;
            default -> ErrorSeverity.LOW;
        };
    }

    public ErrorSeverity severityOf(Throwable error) {
        return severityOf(classify(error));
    }

    /**
     * Message text used for classification and reporting. Falls back to the
     * exception class name when the exception carries no message.
     */
    public static String messageOf(Throwable error) {
        if (error == null) {
            return "unknown error";
        }
        String message = error.getMessage();
        return message != null ? message : error.getClass().getSimpleName();
    }
}
