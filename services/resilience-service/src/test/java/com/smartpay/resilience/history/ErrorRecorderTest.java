package com.smartpay.resilience.history;

import com.smartpay.resilience.classification.ErrorClassifier;
import com.smartpay.resilience.classification.ErrorCode;
import com.smartpay.resilience.classification.ErrorSeverity;
import com.smartpay.resilience.event.ResilienceEventEmitter;
import com.smartpay.resilience.event.ResilienceEventPublisher;
import com.smartpay.resilience.event.ResilienceEventTypes;
import com.smartpay.resilience.support.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
@DisplayName("ErrorRecorder Tests")
class ErrorRecorderTest {

    @Mock
    private ResilienceEventPublisher publisher;

    @Captor
    private ArgumentCaptor<Map<String, Object>> payloadCaptor;

    private MutableClock clock;
    private SimpleMeterRegistry meterRegistry;
    private ErrorHistory history;
    private ErrorRecorder recorder;

    @BeforeEach
    void setUp() {
        clock = MutableClock.at("2024-03-01T10:00:00Z");
        meterRegistry = new SimpleMeterRegistry();
        history = new ErrorHistory(clock, 100);
        recorder = new ErrorRecorder(new ErrorClassifier(), history,
            new ResilienceEventEmitter(publisher, clock, "resilience-service"), meterRegistry, clock);
    }

    @Test
    @DisplayName("Should classify, store, count and announce a failure")
    void shouldRecordFailure() {
        // given
        UUID userId = UUID.randomUUID();
        UUID requestId = UUID.randomUUID();
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("user_id", userId.toString());
        metadata.put("request_id", requestId);
        metadata.put("amount", 250);
        metadata.put("ignored", null);

        // when
        ErrorContext context = recorder.record("xrpl.submit_payment",
            new IllegalStateException("XRPL node unreachable"), metadata, 2);

        // then
        assertThat(context.getCode()).isEqualTo(ErrorCode.BLOCKCHAIN_ERROR);
        assertThat(context.getSeverity()).isEqualTo(ErrorSeverity.HIGH);
        assertThat(context.getServiceName()).isEqualTo("xrpl");
        assertThat(context.getMessage()).isEqualTo("XRPL node unreachable");
        assertThat(context.getTimestamp()).isEqualTo(clock.instant());
        assertThat(context.getUserId()).isEqualTo(userId);
        assertThat(context.getRequestId()).isEqualTo(requestId);
        assertThat(context.getRetryCount()).isEqualTo(2);
        assertThat(context.getMetadata()).containsEntry("amount", 250).doesNotContainKey("ignored");
        assertThat(context.getStackTrace()).contains("IllegalStateException");
        assertThat(context.isResolved()).isFalse();

        assertThat(history.find(context.getId())).contains(context);
        assertThat(meterRegistry.get("resilience.errors")
            .tags("code", "blockchain_error", "severity", "high").counter().count()).isEqualTo(1.0);
        assertThat(meterRegistry.get("resilience.error_history.size").gauge().value()).isEqualTo(1.0);

        verify(publisher).publish(eq(ResilienceEventTypes.ERROR_OCCURRED), payloadCaptor.capture());
        Map<String, Object> payload = payloadCaptor.getValue();
        assertThat(payload)
            .containsEntry("error_id", context.getId().toString())
            .containsEntry("error_code", "blockchain_error")
            .containsEntry("severity", "high")
            .containsEntry("source", "resilience-service")
            .containsKeys("event_id", "timestamp");
    }

    @Test
    @DisplayName("Malformed correlation ids are ignored")
    void shouldIgnoreMalformedIds() {
        ErrorContext context = recorder.record("wallet.debit", new RuntimeException("boom"),
            Map.of("user_id", "not-a-uuid"));

        assertThat(context.getUserId()).isNull();
        assertThat(context.getMetadata()).containsEntry("user_id", "not-a-uuid");
    }

    @Test
    @DisplayName("Null metadata and null errors are tolerated")
    void shouldTolerateNulls() {
        ErrorContext context = recorder.record("wallet", null, null);

        assertThat(context.getCode()).isEqualTo(ErrorCode.INTERNAL_ERROR);
        assertThat(context.getMessage()).isEqualTo("unknown error");
        assertThat(context.getMetadata()).isEmpty();
        assertThat(context.getStackTrace()).isNull();
    }

    @Test
    void shouldDeriveServiceName() {
        assertThat(ErrorRecorder.serviceNameOf("wallet.debit.retry")).isEqualTo("wallet");
        assertThat(ErrorRecorder.serviceNameOf("wallet")).isEqualTo("wallet");
        assertThat(ErrorRecorder.serviceNameOf(".hidden")).isEqualTo(".hidden");
        assertThat(ErrorRecorder.serviceNameOf(" ")).isEqualTo("unknown");
        assertThat(ErrorRecorder.serviceNameOf(null)).isEqualTo("unknown");
    }
}
