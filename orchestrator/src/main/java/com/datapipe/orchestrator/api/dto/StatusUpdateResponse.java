package com.datapipe.orchestrator.api.dto;

import com.datapipe.orchestrator.service.StatusUpdateResult;

/** Response body for POST /api/status-update. */
public record StatusUpdateResponse(boolean success, StatusUpdateResult outcome) {

    public static StatusUpdateResponse of(StatusUpdateResult result) {
        return new StatusUpdateResponse(result.isSuccess(), result);
    }
}
