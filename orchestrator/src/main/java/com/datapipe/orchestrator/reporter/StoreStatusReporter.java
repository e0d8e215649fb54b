package com.datapipe.orchestrator.reporter;

import com.datapipe.orchestrator.service.StatusUpdate;
import com.datapipe.orchestrator.service.StatusUpdateResult;
import com.datapipe.orchestrator.service.StatusUpdateService;
import org.springframework.dao.DataAccessException;

/**
 * In-process delivery: calls the status update protocol directly.
 * Database failures surface as TransportException so they get the same
 * retry treatment as a failed HTTP callback.
 */
public class StoreStatusReporter implements StatusReporter {

    private final StatusUpdateService statusUpdateService;

    public StoreStatusReporter(StatusUpdateService statusUpdateService) {
        this.statusUpdateService = statusUpdateService;
    }

    @Override
    public StatusUpdateResult report(StatusUpdate update) {
        try {
            return statusUpdateService.apply(update);
        } catch (DataAccessException e) {
            throw new TransportException("Could not persist status update for pipeline "
                    + update.pipelineId(), e);
        }
    }
}
