package com.phillippitts.mathscrap.presentation.controller;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.phillippitts.mathscrap.domain.ImageAnalysis;
import com.phillippitts.mathscrap.service.orchestration.MathPipelineService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;

/**
 * Image analysis. The request thread is released immediately; the response completes when the
 * pipeline finishes on its own executor.
 */
@RestController
@RequestMapping("/api/images")
class ImageController {

    private final MathPipelineService pipeline;

    ImageController(MathPipelineService pipeline) {
        this.pipeline = pipeline;
    }

    @PostMapping("/analyze")
    CompletableFuture<ImageAnalysis> analyze(@Valid @RequestBody AnalyzeRequest request) {
        return pipeline.processImageAsync(request.jobId(), Path.of(request.path()));
    }

    /**
     * @param jobId job the image belongs to (optional)
     * @param path  image file readable by the server
     */
    record AnalyzeRequest(@JsonProperty("job_id") @JsonAlias("jobId") String jobId, @NotBlank String path) {
    }
}
