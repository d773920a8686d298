package com.smartpay.resilience.history;

import com.smartpay.resilience.classification.ErrorCode;
import com.smartpay.resilience.classification.ErrorSeverity;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.util.Map;

/**
 * Aggregated view of the error history over a time window.
 */
@Data
@Builder
public class ErrorMetrics {

    private Duration timeRange;
    private long totalErrors;
    private Map<ErrorCode, Long> errorsByCode;
    private Map<ErrorSeverity, Long> errorsBySeverity;
    private Map<String, Long> errorsByOperation;
    private Map<String, Long> errorsByService;

    /**
     * Errors per hour over the window
     */
    private double errorRate;

    /**
     * Percentage of errors in the window that have been resolved
     */
    private double recoveryRate;

    private Duration averageResolutionTime;
}
