package com.phillippitts.mathscrap.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Input image limits (prefix {@code image.validation}).
 *
 * @param maxFileBytes largest accepted file size (default 20 MB)
 * @param maxPixels    largest accepted width * height (default 40 megapixels)
 */
@ConfigurationProperties(prefix = "image.validation")
@Validated
public record ImageValidationProperties(
        @Positive @DefaultValue("20971520") long maxFileBytes,
        @Positive @DefaultValue("40000000") long maxPixels
) {

    @ConstructorBinding
    public ImageValidationProperties {
    }

    public ImageValidationProperties() {
        this(20L * 1024 * 1024, 40_000_000L);
    }
}
