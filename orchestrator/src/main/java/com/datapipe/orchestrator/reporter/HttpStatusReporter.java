package com.datapipe.orchestrator.reporter;

import com.datapipe.orchestrator.service.StatusUpdate;
import com.datapipe.orchestrator.service.StatusUpdateResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Delivers status updates by POSTing them to a status-update endpoint,
 * e.g. when the runner lives in a different process than the store.
 *
 * Body: {pipeline_id, stage_name?, status, error_message?, records_processed?}
 * A 404 is a NotFound outcome; any other non-2xx or I/O error is a
 * TransportException.
 */
public class HttpStatusReporter implements StatusReporter {

    private static final Logger log = LoggerFactory.getLogger(HttpStatusReporter.class);

    private final HttpClient   http;
    private final ObjectMapper json;
    private final URI          callbackUrl;
    private final Duration     timeout;

    public HttpStatusReporter(URI callbackUrl, ObjectMapper objectMapper, Duration timeout) {
        this(HttpClient.newBuilder()
                        .version(HttpClient.Version.HTTP_1_1)
                        .connectTimeout(Duration.ofSeconds(5))
                        .build(),
                callbackUrl, objectMapper, timeout);
    }

    HttpStatusReporter(HttpClient http, URI callbackUrl, ObjectMapper objectMapper, Duration timeout) {
        this.http        = http;
        this.callbackUrl = callbackUrl;
        this.json        = objectMapper;
        this.timeout     = timeout;
    }

    @Override
    public StatusUpdateResult report(StatusUpdate update) {
        String body = toJson(update);
        HttpResponse<String> resp;
        try {
            HttpRequest req = HttpRequest.newBuilder()
                    .uri(callbackUrl)
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .header("Accept",       "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body))
                    .build();
            resp = http.send(req, HttpResponse.BodyHandlers.ofString());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransportException("Interrupted while posting status update to " + callbackUrl, e);
        } catch (Exception e) {
            throw new TransportException("Status update POST to " + callbackUrl + " failed", e);
        }

        if (resp.statusCode() == 404) {
            return parseOutcome(resp.body(), update.isStageUpdate()
                    ? StatusUpdateResult.STAGE_NOT_FOUND
                    : StatusUpdateResult.PIPELINE_NOT_FOUND);
        }
        if (resp.statusCode() < 200 || resp.statusCode() >= 300) {
            throw new TransportException("Status update POST to " + callbackUrl
                    + " failed with HTTP " + resp.statusCode() + ": " + resp.body());
        }
        return StatusUpdateResult.UPDATED;
    }

    private StatusUpdateResult parseOutcome(String body, StatusUpdateResult fallback) {
        try {
            JsonNode outcome = json.readTree(body).path("outcome");
            return outcome.isTextual() ? StatusUpdateResult.fromValue(outcome.asText()) : fallback;
        } catch (Exception e) {
            log.debug("Could not read outcome from 404 body '{}': {}", body, e.getMessage());
            return fallback;
        }
    }

    private String toJson(StatusUpdate update) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("pipeline_id", update.pipelineId());
        if (update.stageName() != null)        payload.put("stage_name", update.stageName());
        payload.put("status", update.status().value());
        if (update.errorMessage() != null)     payload.put("error_message", update.errorMessage());
        if (update.recordsProcessed() != null) payload.put("records_processed", update.recordsProcessed());
        try {
            return json.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new TransportException("JSON serialization of status update failed", e);
        }
    }
}
