package com.datapipe.orchestrator.reporter;

import com.datapipe.orchestrator.service.StatusUpdate;
import com.datapipe.orchestrator.service.StatusUpdateResult;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.support.RetryTemplate;

import java.util.Optional;

/**
 * Wraps a StatusReporter with bounded retries on TransportException.
 *
 * When every attempt fails, or the delegate fails with anything else, the
 * update is logged at ERROR and counted in
 * {@code datapipe.status.report.failures}, and the caller gets an empty
 * result. A lost status report never aborts the stage that produced it.
 */
public class ResilientStatusReporter {

    private static final Logger log = LoggerFactory.getLogger(ResilientStatusReporter.class);

    private final StatusReporter delegate;
    private final RetryTemplate  retryTemplate;
    private final MeterRegistry  meterRegistry;

    public ResilientStatusReporter(StatusReporter delegate,
                                   RetryTemplate retryTemplate,
                                   MeterRegistry meterRegistry) {
        this.delegate      = delegate;
        this.retryTemplate = retryTemplate;
        this.meterRegistry = meterRegistry;
    }

    /**
     * Deliver an update, retrying transport failures.
     *
     * @return the protocol outcome, or empty when delivery failed for good
     */
    public Optional<StatusUpdateResult> report(StatusUpdate update) {
        try {
            StatusUpdateResult result = retryTemplate.execute(ctx -> {
                if (ctx.getRetryCount() > 0) {
                    log.warn("Retrying status update {} (attempt {})", describe(update), ctx.getRetryCount() + 1);
                }
                return delegate.report(update);
            });
            if (!result.isSuccess()) {
                log.warn("Status update {} rejected: {}", describe(update), result.value());
            }
            return Optional.of(result);
        } catch (RuntimeException e) {
            // TransportException once retries are exhausted, or anything the
            // delegate throws that is not worth retrying.
            meterRegistry.counter("datapipe.status.report.failures",
                    "status", update.status().value()).increment();
            log.error("Dropping status update {} after retries: {}", describe(update), e.getMessage(), e);
            return Optional.empty();
        }
    }

    private static String describe(StatusUpdate update) {
        return "[pipeline=" + update.pipelineId()
                + (update.stageName() != null ? ", stage=" + update.stageName() : "")
                + ", status=" + update.status().value() + "]";
    }
}
