package com.datapipe.orchestrator.api;

import com.datapipe.orchestrator.api.dto.CreatePipelineRequest;
import com.datapipe.orchestrator.api.dto.PipelineResponse;
import com.datapipe.orchestrator.api.dto.StageResponse;
import com.datapipe.orchestrator.api.dto.StatusUpdateRequest;
import com.datapipe.orchestrator.api.dto.StatusUpdateResponse;
import com.datapipe.orchestrator.api.dto.TriggerRequest;
import com.datapipe.orchestrator.api.dto.TriggerResponse;
import com.datapipe.orchestrator.model.Pipeline;
import com.datapipe.orchestrator.runner.PipelineLauncher;
import com.datapipe.orchestrator.service.PipelineStore;
import com.datapipe.orchestrator.service.StatusUpdateResult;
import com.datapipe.orchestrator.service.StatusUpdateService;
import com.datapipe.orchestrator.service.ValidationException;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

/**
 * REST API for pipelines.
 *
 * POST   /api/pipelines               create a pipeline with its pending stages
 * GET    /api/pipelines?skip&limit    list, newest first
 * GET    /api/pipelines/{id}          one pipeline with its stages
 * GET    /api/pipelines/{id}/stages   stages in execution order
 * DELETE /api/pipelines/{id}          delete a pipeline and its stages
 * POST   /api/status-update           apply a status update (runner callback)
 * POST   /api/trigger                 run an existing pipeline in the background
 * POST   /api/trigger-pipeline        create a pipeline and run it
 */
@RestController
@RequestMapping("/api")
public class PipelineController {

    private final PipelineStore       store;
    private final StatusUpdateService statusUpdateService;
    private final PipelineLauncher    launcher;

    public PipelineController(PipelineStore store,
                              StatusUpdateService statusUpdateService,
                              PipelineLauncher launcher) {
        this.store               = store;
        this.statusUpdateService = statusUpdateService;
        this.launcher            = launcher;
    }

    /**
     * Example:
     *   curl -X POST http://localhost:8080/api/pipelines \
     *     -H "Content-Type: application/json" \
     *     -d '{"name":"nightly","description":"sample run"}'
     */
    @PostMapping("/pipelines")
    public ResponseEntity<PipelineResponse> create(@RequestBody CreatePipelineRequest req) {
        Pipeline pipeline = store.createPipeline(req.name(), req.description());
        return ResponseEntity.status(HttpStatus.CREATED).body(PipelineResponse.from(pipeline));
    }

    @GetMapping("/pipelines")
    public List<PipelineResponse> list(@RequestParam(defaultValue = "0") int skip,
                                       @RequestParam(defaultValue = "100") int limit) {
        return store.listPipelines(skip, limit).stream()
                .map(PipelineResponse::from)
                .toList();
    }

    @GetMapping("/pipelines/{id}")
    public PipelineResponse get(@PathVariable Long id) {
        return store.getPipeline(id)
                .map(PipelineResponse::from)
                .orElseThrow(() -> notFound(id));
    }

    @GetMapping("/pipelines/{id}/stages")
    public List<StageResponse> getStages(@PathVariable Long id) {
        store.getPipeline(id).orElseThrow(() -> notFound(id));
        return store.getStages(id).stream()
                .map(StageResponse::from)
                .toList();
    }

    @DeleteMapping("/pipelines/{id}")
    public ResponseEntity<Void> delete(@PathVariable Long id) {
        if (!store.deletePipeline(id)) {
            throw notFound(id);
        }
        return ResponseEntity.noContent().build();
    }

    /**
     * Runner callback. Unknown pipeline or stage is a 404 whose body still
     * says which one was missing, so a remote reporter can tell them apart.
     */
    @PostMapping("/status-update")
    public ResponseEntity<StatusUpdateResponse> updateStatus(@RequestBody StatusUpdateRequest req) {
        StatusUpdateResult result = statusUpdateService.apply(req.toStatusUpdate());
        HttpStatus status = result.isSuccess() ? HttpStatus.OK : HttpStatus.NOT_FOUND;
        return ResponseEntity.status(status).body(StatusUpdateResponse.of(result));
    }

    /**
     * Trigger a pending pipeline. Returns 202 right away; the stages run on
     * the pipeline-run pool.
     *
     * HTTP 202 accepted
     * HTTP 404 pipeline not found
     * HTTP 409 pipeline is not pending (already triggered or finished)
     */
    @PostMapping("/trigger")
    public ResponseEntity<TriggerResponse> trigger(@RequestBody TriggerRequest req) {
        if (req.pipelineId() == null) {
            throw new ValidationException("pipeline_id is required");
        }
        return launcher.trigger(req.pipelineId())
                .map(receipt -> ResponseEntity.accepted().body(TriggerResponse.from(receipt)))
                .orElseThrow(() -> notFound(req.pipelineId()));
    }

    @PostMapping("/trigger-pipeline")
    public ResponseEntity<TriggerResponse> createAndTrigger() {
        return ResponseEntity.accepted().body(TriggerResponse.from(launcher.createAndTrigger()));
    }

    private static ResponseStatusException notFound(Long id) {
        return new ResponseStatusException(HttpStatus.NOT_FOUND, "Pipeline not found: " + id);
    }
}
