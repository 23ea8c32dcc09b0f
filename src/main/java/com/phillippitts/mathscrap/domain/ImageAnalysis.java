package com.phillippitts.mathscrap.domain;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Result payload for one image of a job. Always structurally valid: an unreadable image
 * carries {@code error} and no recognition or validation.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ImageAnalysis(
        @JsonProperty("job_id") String jobId,
        @JsonProperty("image") String imagePath,
        Recognition recognition,
        ValidationResult validation,
        boolean garbled,
        String error
) {

    public ImageAnalysis {
        Objects.requireNonNull(imagePath, "imagePath");
    }

    public static ImageAnalysis success(String jobId, String imagePath, RecognitionResult result,
                                        ValidationResult validation, boolean garbled) {
        return new ImageAnalysis(jobId, imagePath, Recognition.of(result), validation, garbled, null);
    }

    public static ImageAnalysis failure(String jobId, String imagePath, String error) {
        return new ImageAnalysis(jobId, imagePath, null, null, false, error);
    }

    /**
     * Recognition payload in the wire shape {@code {latex, confidence, text, source}}.
     */
    public record Recognition(String latex, double confidence, String text, String source) {

        static Recognition of(RecognitionResult result) {
            return new Recognition(result.markup(), result.confidence(),
                    result.readableText(), result.sourceTag().sourceId());
        }
    }
}
