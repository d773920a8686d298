package com.smartpay.resilience.event;

/**
 * Event type names published by the resilience layer.
 */
public final class ResilienceEventTypes {

    public static final String BREAKER_REGISTERED = "circuit_breaker.registered";
    public static final String BREAKER_OPENED = "circuit_breaker.opened";
    public static final String BREAKER_CLOSED = "circuit_breaker.closed";
    public static final String BREAKER_HALF_OPEN = "circuit_breaker.half_open";
    public static final String BREAKER_MANUAL_TRIP = "circuit_breaker.manual_trip";
    public static final String BREAKER_MANUAL_RESET = "circuit_breaker.manual_reset";
    public static final String BREAKER_UPDATED = "circuit_breaker.updated";
    public static final String BREAKER_CALL_EXECUTED = "circuit_breaker.call_executed";

    public static final String ERROR_OCCURRED = "error.occurred";

    public static final String DEAD_LETTER_ADDED = "dead.letter.added";
    public static final String DEAD_LETTER_EVICTED = "dead.letter.evicted";
    public static final String DEAD_LETTER_RESOLVED = "dead.letter.resolved";
    public static final String DEAD_LETTER_FAILED = "dead.letter.failed";
    public static final String DEAD_LETTER_MANUAL_REVIEW = "dead.letter.manual_review";

    private ResilienceEventTypes() {
    }
}
