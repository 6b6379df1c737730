package com.codegraph.core.service.api.controller;

import com.codegraph.core.service.api.dto.ApiResponse;
import com.codegraph.core.service.api.dto.EnhancementRequest;
import com.codegraph.core.service.pipeline.Job;
import com.codegraph.core.service.pipeline.PipelineOrchestrator;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Controller for enhancement jobs.
 *
 * Submission is asynchronous: POST /jobs returns the pending job and clients poll
 * GET /jobs/{jobId} until it reaches a terminal state.
 */
@Slf4j
@RestController
@RequestMapping("/jobs")
@Tag(name = "Enhancement Jobs", description = "Endpoints for submitting and tracking repository enhancement jobs")
@RequiredArgsConstructor
public class JobController {

    private final PipelineOrchestrator orchestrator;

    @PostMapping
    @Operation(
            summary = "Submit an enhancement job",
            description = "Queues a repository for indexing, analysis and change proposals"
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "202", description = "Job accepted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "400", description = "Invalid request"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "429", description = "Job queue full")
    })
    public ResponseEntity<ApiResponse<Job>> submit(@Valid @RequestBody EnhancementRequest request) {
        log.debug("Received enhancement request for {}", request.getRepoUrl());
        Job job = orchestrator.submit(request);
        return ResponseEntity.accepted().body(ApiResponse.success(job));
    }

    @GetMapping("/{jobId}")
    @Operation(summary = "Get job status", description = "Returns the latest snapshot of a job")
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Job found"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Job not found")
    })
    public ResponseEntity<ApiResponse<Job>> getStatus(
            @Parameter(description = "Job ID") @PathVariable String jobId) {
        return ResponseEntity.ok(ApiResponse.success(orchestrator.getStatus(jobId)));
    }

    @GetMapping
    @Operation(summary = "List jobs", description = "Returns all retained jobs, newest first")
    public ResponseEntity<ApiResponse<List<Job>>> list() {
        return ResponseEntity.ok(ApiResponse.success(orchestrator.list()));
    }

    @PostMapping("/{jobId}/cancel")
    @Operation(
            summary = "Cancel a job",
            description = "Cancels a pending job at once; a running job stops at its next stage"
    )
    @ApiResponses({
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200", description = "Cancellation accepted"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "404", description = "Job not found")
    })
    public ResponseEntity<ApiResponse<Job>> cancel(
            @Parameter(description = "Job ID") @PathVariable String jobId) {
        log.debug("Cancel requested for job {}", jobId);
        return ResponseEntity.ok(ApiResponse.success(orchestrator.cancel(jobId)));
    }
}
