package com.phillippitts.mathscrap.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Limits beyond which readable text collapses to the "complex expression" sentence
 * (prefix {@code markup.readable}).
 */
@ConfigurationProperties(prefix = "markup.readable")
@Validated
public record ReadableProperties(
        @Positive @DefaultValue("200") int maxLength,
        @Positive @DefaultValue("10") int maxParentheses
) {

    @ConstructorBinding
    public ReadableProperties {
    }

    public ReadableProperties() {
        this(200, 10);
    }
}
