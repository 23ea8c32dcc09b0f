package com.phillippitts.mathscrap.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Recognition cascade settings (prefix {@code ocr.cascade}).
 *
 * @param recognitionTimeoutMs caller-side timeout for one backend recognition call;
 *                             a timed-out call is treated as a backend failure
 */
@ConfigurationProperties(prefix = "ocr.cascade")
@Validated
public record CascadeProperties(
        @Positive @DefaultValue("45000")
        long recognitionTimeoutMs
) {

    @ConstructorBinding
    public CascadeProperties {
    }

    public CascadeProperties() {
        this(45_000L);
    }
}
