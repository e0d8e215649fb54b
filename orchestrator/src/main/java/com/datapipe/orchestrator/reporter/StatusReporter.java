package com.datapipe.orchestrator.reporter;

import com.datapipe.orchestrator.service.StatusUpdate;
import com.datapipe.orchestrator.service.StatusUpdateResult;

/**
 * Delivers status updates from a running pipeline to the status update
 * protocol.
 *
 * The runner only sees this interface, so the transport (in-process call,
 * HTTP callback) can change without touching stage logic.
 */
public interface StatusReporter {

    /**
     * Deliver one update.
     *
     * @return the protocol's outcome (NotFound is a result, not an error)
     * @throws TransportException when the update could not be delivered
     */
    StatusUpdateResult report(StatusUpdate update);
}
