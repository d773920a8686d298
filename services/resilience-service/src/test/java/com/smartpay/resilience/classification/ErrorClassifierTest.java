package com.smartpay.resilience.classification;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.EnumSource;

import java.sql.SQLException;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ErrorClassifier Tests")
class ErrorClassifierTest {

    private final ErrorClassifier classifier = new ErrorClassifier();

    @Nested
    @DisplayName("Code classification")
    class CodeTests {

        @ParameterizedTest(name = "\"{0}\" -> {1}")
        @CsvSource({
            "Request timeout after 30s, TIMEOUT",
            "Network unreachable, NETWORK_FAILURE",
            "Connection refused, NETWORK_FAILURE",
            "401 Unauthorized, AUTHORIZATION_FAILURE",
            "Forbidden: missing scope, AUTHORIZATION_FAILURE",
            "Account not found, RESOURCE_NOT_FOUND",
            "Validation failed for amount, VALIDATION_FAILURE",
            "Blockchain node rejected transaction, BLOCKCHAIN_ERROR",
            "XRPL ledger closed, BLOCKCHAIN_ERROR",
            "Database is read-only, DATABASE_ERROR",
            "SQL syntax error, DATABASE_ERROR",
            "Something odd happened, INTERNAL_ERROR"
        })
        void shouldClassifyByMessageKeywords(String message, ErrorCode expected) {
            assertThat(classifier.classifyMessage(message)).isEqualTo(expected);
        }

        @Test
        @DisplayName("Earlier rules win when several keywords match")
        void shouldApplyRulesInOrder() {
            assertThat(classifier.classifyMessage("database connection timeout")).isEqualTo(ErrorCode.TIMEOUT);
            assertThat(classifier.classifyMessage("database connection lost")).isEqualTo(ErrorCode.NETWORK_FAILURE);
        }

        @Test
        @DisplayName("Null or messageless failures fall back sensibly")
        void shouldHandleMissingMessages() {
            assertThat(classifier.classify(null)).isEqualTo(ErrorCode.INTERNAL_ERROR);
            assertThat(classifier.classifyMessage("  ")).isEqualTo(ErrorCode.INTERNAL_ERROR);
            // class name is used when there is no message
            assertThat(classifier.classify(new TimeoutException())).isEqualTo(ErrorCode.TIMEOUT);
            assertThat(classifier.classify(new SQLException())).isEqualTo(ErrorCode.DATABASE_ERROR);
        }

        @Test
        @DisplayName("Coded exceptions keep their own code")
        void shouldPreferCarriedCode() {
            RuntimeException exhausted = new QuotaException("connection pool timeout");

            assertThat(classifier.classify(exhausted)).isEqualTo(ErrorCode.RESOURCE_EXHAUSTED);
            assertThat(classifier.severityOf(exhausted)).isEqualTo(ErrorSeverity.CRITICAL);
        }

        @Test
        @DisplayName("Same input always yields the same classification")
        void shouldBeDeterministic() {
            RuntimeException error = new RuntimeException("XRPL connection timeout");
            ErrorCode first = classifier.classify(error);
            ErrorSeverity firstSeverity = classifier.severityOf(error);

            for (int i = 0; i < 100; i++) {
                assertThat(classifier.classify(error)).isEqualTo(first);
                assertThat(classifier.severityOf(error)).isEqualTo(firstSeverity);
            }
        }
    }

    @Nested
    @DisplayName("Severity derivation")
    class SeverityTests {

        @ParameterizedTest(name = "{0} -> {1}")
        @CsvSource({
            "RESOURCE_EXHAUSTED, CRITICAL",
            "AUTHORIZATION_FAILURE, HIGH",
            "BLOCKCHAIN_ERROR, HIGH",
            "DATABASE_ERROR, HIGH",
            "NETWORK_FAILURE, MEDIUM",
            "TIMEOUT, MEDIUM",
            "VALIDATION_FAILURE, LOW",
            "INTERNAL_ERROR, LOW"
        })
        void shouldDeriveSeverityFromCode(ErrorCode code, ErrorSeverity expected) {
            assertThat(classifier.severityOf(code)).isEqualTo(expected);
        }

        @ParameterizedTest
        @EnumSource(ErrorCode.class)
        void shouldAssignSeverityToEveryCode(ErrorCode code) {
            assertThat(classifier.severityOf(code)).isNotNull();
        }

        @Test
        void shouldCompareSeverityLevels() {
            assertThat(ErrorSeverity.CRITICAL.isHigherThan(ErrorSeverity.HIGH)).isTrue();
            assertThat(ErrorSeverity.LOW.isHigherThan(ErrorSeverity.MEDIUM)).isFalse();
        }
    }

    private static class QuotaException extends RuntimeException implements CodedException {

        QuotaException(String message) {
            super(message);
        }

        @Override
        public ErrorCode getErrorCode() {
            return ErrorCode.RESOURCE_EXHAUSTED;
        }
    }
}
