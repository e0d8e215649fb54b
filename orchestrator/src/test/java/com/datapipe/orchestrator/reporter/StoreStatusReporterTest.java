package com.datapipe.orchestrator.reporter;

import com.datapipe.orchestrator.model.RunStatus;
import com.datapipe.orchestrator.service.StatusUpdate;
import com.datapipe.orchestrator.service.StatusUpdateResult;
import com.datapipe.orchestrator.service.StatusUpdateService;
import org.junit.jupiter.api.Test;
import org.springframework.dao.QueryTimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.*;

class StoreStatusReporterTest {

    StatusUpdateService service  = mock(StatusUpdateService.class);
    StoreStatusReporter reporter = new StoreStatusReporter(service);

    @Test
    void report_returnsProtocolOutcome() {
        StatusUpdate update = StatusUpdate.forStage(1L, "Data Export", RunStatus.RUNNING);
        when(service.apply(update)).thenReturn(StatusUpdateResult.STAGE_NOT_FOUND);

        assertThat(reporter.report(update)).isEqualTo(StatusUpdateResult.STAGE_NOT_FOUND);
    }

    @Test
    void report_databaseError_becomesTransportException() {
        StatusUpdate update = StatusUpdate.forPipeline(1L, RunStatus.RUNNING, null, null);
        when(service.apply(update)).thenThrow(new QueryTimeoutException("lock timeout"));

        assertThatThrownBy(() -> reporter.report(update))
                .isInstanceOf(TransportException.class)
                .hasCauseInstanceOf(QueryTimeoutException.class);
    }
}
