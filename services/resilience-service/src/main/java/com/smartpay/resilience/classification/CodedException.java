package com.smartpay.resilience.classification;

/**
 * Implemented by exceptions that already know their {@link ErrorCode}.
 * The classifier uses the carried code instead of matching the message.
 */
public interface CodedException {

    ErrorCode getErrorCode();
}
