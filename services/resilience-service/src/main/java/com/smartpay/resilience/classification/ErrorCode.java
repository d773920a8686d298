package com.smartpay.resilience.classification;

/**
 * Error taxonomy for failures handled by the resilience layer.
 */
public enum ErrorCode {

    NETWORK_FAILURE("network_failure"),
    TIMEOUT("timeout"),
    VALIDATION_FAILURE("validation_failure"),
    AUTHENTICATION_FAILURE("authentication_failure"),
    AUTHORIZATION_FAILURE("authorization_failure"),
    RESOURCE_NOT_FOUND("resource_not_found"),
    RESOURCE_EXHAUSTED("resource_exhausted"),
    INTERNAL_ERROR("internal_error"),
    EXTERNAL_SERVICE_ERROR("external_service_error"),
    BLOCKCHAIN_ERROR("blockchain_error"),
    DATABASE_ERROR("database_error"),
    CONFIGURATION_ERROR("configuration_error");

    private final String code;

    ErrorCode(String code) {
        this.code = code;
    }

    /**
     * Wire representation used in events and logs
     */
    public String getCode() {
        return code;
    }
}
