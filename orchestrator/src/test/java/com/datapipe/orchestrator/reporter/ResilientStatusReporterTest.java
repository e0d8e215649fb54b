package com.datapipe.orchestrator.reporter;

import com.datapipe.orchestrator.config.OrchestratorConfig;
import com.datapipe.orchestrator.model.RunStatus;
import com.datapipe.orchestrator.service.StatusUpdate;
import com.datapipe.orchestrator.service.StatusUpdateResult;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class ResilientStatusReporterTest {

    private static final StatusUpdate UPDATE =
            StatusUpdate.forStage(1L, "Data Generation", RunStatus.RUNNING);

    @Mock StatusReporter delegate;

    SimpleMeterRegistry     meters;
    ResilientStatusReporter reporter;

    @BeforeEach
    void setUp() {
        meters   = new SimpleMeterRegistry();
        reporter = new ResilientStatusReporter(delegate,
                OrchestratorConfig.retryTemplate(3, Duration.ZERO).retryOn(TransportException.class).build(),
                meters);
    }

    @Test
    void report_transientFailure_retriedUntilDelivered() {
        when(delegate.report(any()))
                .thenThrow(new TransportException("503"))
                .thenReturn(StatusUpdateResult.UPDATED);

        assertThat(reporter.report(UPDATE)).hasValue(StatusUpdateResult.UPDATED);
        verify(delegate, times(2)).report(UPDATE);
        assertThat(meters.find("datapipe.status.report.failures").counter()).isNull();
    }

    @Test
    void report_retriesExhausted_returnsEmptyAndCounts() {
        when(delegate.report(any())).thenThrow(new TransportException("down"));

        assertThat(reporter.report(UPDATE)).isEmpty();
        verify(delegate, times(3)).report(UPDATE);
        assertThat(meters.counter("datapipe.status.report.failures", "status", "running").count())
                .isEqualTo(1.0);
    }

    @Test
    void report_nonTransportError_notRetriedButSwallowed() {
        when(delegate.report(any())).thenThrow(new IllegalStateException("bug"));

        assertThat(reporter.report(UPDATE)).isEmpty();
        verify(delegate, times(1)).report(UPDATE);
    }

    @Test
    void report_notFound_passedThroughWithoutRetry() {
        when(delegate.report(any())).thenReturn(StatusUpdateResult.STAGE_NOT_FOUND);

        assertThat(reporter.report(UPDATE)).hasValue(StatusUpdateResult.STAGE_NOT_FOUND);
        verify(delegate, times(1)).report(UPDATE);
    }
}
