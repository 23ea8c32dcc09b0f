package com.phillippitts.mathscrap.presentation.controller;

import com.phillippitts.mathscrap.domain.BackendTag;
import com.phillippitts.mathscrap.domain.ImageAnalysis;
import com.phillippitts.mathscrap.domain.RecognitionResult;
import com.phillippitts.mathscrap.service.orchestration.MathPipelineService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.request;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ImageController.class)
class ImageControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private MathPipelineService pipeline;

    @Test
    void analyzeCompletesAsynchronously() throws Exception {
        // Arrange
        RecognitionResult recognized = new RecognitionResult("x^{2} + 5x + 6 = 0", 0.75,
                BackendTag.RULE_FALLBACK, "x squared plus 5x plus 6 equals 0");
        ImageAnalysis analysis = ImageAnalysis.success("job-7", "/data/quadratic.png", recognized, null, false);
        when(pipeline.processImageAsync(eq("job-7"), eq(Path.of("/data/quadratic.png"))))
                .thenReturn(CompletableFuture.completedFuture(analysis));

        // Act
        MvcResult pending = mvc.perform(post("/api/images/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"job_id\": \"job-7\", \"path\": \"/data/quadratic.png\"}"))
                .andExpect(request().asyncStarted())
                .andReturn();

        // Assert
        mvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.job_id").value("job-7"))
                .andExpect(jsonPath("$.image").value("/data/quadratic.png"))
                .andExpect(jsonPath("$.recognition.source").value("fallback_ocr"))
                .andExpect(jsonPath("$.recognition.confidence").value(0.75))
                .andExpect(jsonPath("$.garbled").value(false))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void unreadableImageIsReportedInBody() throws Exception {
        when(pipeline.processImageAsync(any(), any())).thenReturn(CompletableFuture.completedFuture(
                ImageAnalysis.failure(null, "/data/missing.png", "Unreadable image (/data/missing.png): gone")));

        MvcResult pending = mvc.perform(post("/api/images/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\": \"/data/missing.png\"}"))
                .andReturn();

        mvc.perform(asyncDispatch(pending))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.error").value("Unreadable image (/data/missing.png): gone"))
                .andExpect(jsonPath("$.recognition").doesNotExist());
    }

    @Test
    void saturatedPipelineAnswers503() throws Exception {
        when(pipeline.processImageAsync(any(), any())).thenThrow(new RejectedExecutionException("pipeline full"));

        mvc.perform(post("/api/images/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"path\": \"/data/quadratic.png\"}"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.errorCode").value("ServiceBusy"));
    }

    @Test
    void blankPathIsRejected() throws Exception {
        mvc.perform(post("/api/images/analyze")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"job_id\": \"job-7\", \"path\": \" \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidRequest"));

        verify(pipeline, never()).processImageAsync(any(), any());
    }
}
