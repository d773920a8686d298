package com.smartpay.resilience.history;

import com.smartpay.resilience.classification.ErrorCode;
import com.smartpay.resilience.classification.ErrorSeverity;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * In-memory, time-ordered log of classified failures.
 *
 * <p>Bounded two ways: entries older than the retention are dropped by
 * {@link #trim(Duration)}, and appends beyond {@code maxEntries} drop the
 * oldest entry.
 */
@Slf4j
public class ErrorHistory {

    private static final Duration TREND_BUCKET = Duration.ofDays(1);
    private static final int TOP_ERROR_CODES = 3;

    private final List<ErrorContext> entries = new ArrayList<>();
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Clock clock;
    private final int maxEntries;

    public ErrorHistory(Clock clock, int maxEntries) {
        this.clock = clock;
        this.maxEntries = maxEntries;
    }

    public void record(ErrorContext context) {
        lock.writeLock().lock();
        try {
            if (maxEntries > 0 && entries.size() >= maxEntries) {
                entries.remove(0);
            }
            entries.add(context);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<ErrorContext> find(UUID id) {
        lock.readLock().lock();
        try {
            return entries.stream().filter(e -> e.getId().equals(id)).findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ErrorContext> snapshot() {
        lock.readLock().lock();
        try {
            return List.copyOf(entries);
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Aggregate errors recorded within {@code window} of now.
     */
    public ErrorMetrics metrics(Duration window) {
        Instant cutoff = clock.instant().minus(window);

        Map<ErrorCode, Long> byCode = new EnumMap<>(ErrorCode.class);
        Map<ErrorSeverity, Long> bySeverity = new EnumMap<>(ErrorSeverity.class);
        Map<String, Long> byOperation = new HashMap<>();
        Map<String, Long> byService = new HashMap<>();
        long total = 0;
        long resolved = 0;
        Duration resolutionTotal = Duration.ZERO;

        lock.readLock().lock();
        try {
            for (ErrorContext context : entries) {
                if (!context.getTimestamp().isAfter(cutoff)) {
                    continue;
                }
                total++;
                byCode.merge(context.getCode(), 1L, Long::sum);
                bySeverity.merge(context.getSeverity(), 1L, Long::sum);
                byOperation.merge(context.getOperation(), 1L, Long::sum);
                byService.merge(context.getServiceName(), 1L, Long::sum);
                if (context.isResolved() && context.getResolvedAt() != null) {
                    resolved++;
                    resolutionTotal = resolutionTotal.plus(
                        Duration.between(context.getTimestamp(), context.getResolvedAt()));
                }
            }
        } finally {
            lock.readLock().unlock();
        }

        double hours = window.toMillis() / 3_600_000.0;
        return ErrorMetrics.builder()
            .timeRange(window)
            .totalErrors(total)
            .errorsByCode(byCode)
            .errorsBySeverity(bySeverity)
            .errorsByOperation(byOperation)
            .errorsByService(byService)
            .errorRate(hours > 0 ? total / hours : 0)
            .recoveryRate(total > 0 ? (double) resolved / total * 100 : 0)
            .averageResolutionTime(resolved > 0 ? resolutionTotal.dividedBy(resolved) : Duration.ZERO)
            .build();
    }

    /**
     * Bucket the log into consecutive one-day intervals {@code [day, day + 1d)}
     * starting at {@code start}. The last bucket may extend past {@code end}.
     */
    public List<ErrorTrend> trends(Instant start, Instant end) {
        List<ErrorContext> copy = snapshot();
        List<ErrorTrend> trends = new ArrayList<>();

        for (Instant day = start; day.isBefore(end); day = day.plus(TREND_BUCKET)) {
            Instant next = day.plus(TREND_BUCKET);
            Map<ErrorCode, Long> byCode = new EnumMap<>(ErrorCode.class);
            long count = 0;
            long resolved = 0;

            for (ErrorContext context : copy) {
                Instant ts = context.getTimestamp();
                if (ts.isBefore(day) || !ts.isBefore(next)) {
                    continue;
                }
                count++;
                byCode.merge(context.getCode(), 1L, Long::sum);
                if (context.isResolved()) {
                    resolved++;
                }
            }

            List<ErrorCode> top = byCode.entrySet().stream()
                .sorted(Map.Entry.<ErrorCode, Long>comparingByValue(Comparator.reverseOrder())
                    .thenComparing(Map.Entry.comparingByKey()))
                .limit(TOP_ERROR_CODES)
                .map(Map.Entry::getKey)
                .toList();

            trends.add(ErrorTrend.builder()
                .date(day)
                .errorCount(count)
                .errorRate(count / 24.0)
                .topErrorCodes(top)
                .recoveryRate(count > 0 ? (double) resolved / count * 100 : 0)
                .build());
        }
        return trends;
    }

    /**
     * Drop entries older than {@code retention}.
     *
     * @return number of entries removed
     */
    public int trim(Duration retention) {
        Instant cutoff = clock.instant().minus(retention);
        lock.writeLock().lock();
        try {
            int before = entries.size();
            entries.removeIf(e -> !e.getTimestamp().isAfter(cutoff));
            int removed = before - entries.size();
            if (removed > 0) {
                log.debug("Trimmed error history: removed={}, remaining={}", removed, entries.size());
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
