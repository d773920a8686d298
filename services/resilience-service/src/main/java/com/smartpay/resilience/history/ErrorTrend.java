package com.smartpay.resilience.history;

import com.smartpay.resilience.classification.ErrorCode;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Error counts for one day-long bucket.
 */
@Data
@Builder
public class ErrorTrend {

    private Instant date;
    private long errorCount;
    private double errorRate;
    private List<ErrorCode> topErrorCodes;
    private double recoveryRate;
}
