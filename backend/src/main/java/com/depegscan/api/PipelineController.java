package com.depegscan.api;

import com.depegscan.service.ExposurePipelineService;
import com.depegscan.service.PipelineSummary;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Manual trigger and status of the analysis pipeline.
 */
@RestController
@RequestMapping("/api/v1/pipeline")
@RequiredArgsConstructor
public class PipelineController {

    private final ExposurePipelineService pipelineService;

    /**
     * Runs the pipeline synchronously. 409 when a run is already in progress.
     */
    @PostMapping("/run")
    public ResponseEntity<PipelineSummary> run() {
        return pipelineService.tryRun()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.status(HttpStatus.CONFLICT).build());
    }

    /**
     * Summary of the last finished run; 204 when nothing ran yet.
     */
    @GetMapping("/last")
    public ResponseEntity<PipelineSummary> last() {
        return pipelineService.lastSummary()
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }
}
