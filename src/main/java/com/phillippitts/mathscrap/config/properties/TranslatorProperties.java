package com.phillippitts.mathscrap.config.properties;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.ConstructorBinding;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Length window for symbolic translation (prefix {@code markup.translator}). The window
 * applies to the rewritten expression with whitespace removed.
 */
@ConfigurationProperties(prefix = "markup.translator")
@Validated
public record TranslatorProperties(
        @Positive @DefaultValue("2") int minLength,
        @Positive @DefaultValue("200") int maxLength
) {

    @ConstructorBinding
    public TranslatorProperties {
        if (minLength > maxLength) {
            throw new IllegalArgumentException("minLength must not exceed maxLength");
        }
    }

    public TranslatorProperties() {
        this(2, 200);
    }
}
