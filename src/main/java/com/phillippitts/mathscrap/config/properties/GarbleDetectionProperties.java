package com.phillippitts.mathscrap.config.properties;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Thresholds and weights for hallucinated-markup detection (prefix {@code markup.garble}).
 *
 * <p>Each indicator fires when its count strictly exceeds the configured limit and adds its
 * weight to the score. Markup is garbled once the score reaches {@link #getDecisionThreshold()}.
 * The brace and fraction indicators default to a weight that reaches the threshold on their own.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "markup.garble")
public class GarbleDetectionProperties {

    private int maxOpenBraces = 20;
    private int maxCloseBraces = 20;
    private int braceWeight = 2;

    private int maxFractions = 8;
    private int fractionWeight = 2;

    private int maxScriptstyle = 5;
    private int maxOverUnderBraces = 3;
    private int maxRoots = 6;
    private int maxDots = 10;
    private int maxLength = 500;
    private int maxMathrm = 8;
    private int maxOverlines = 5;

    private int repetitionWeight = 2;
    private int nestedScriptFractionWeight = 3;

    @Positive
    private int decisionThreshold = 2;

    @DecimalMin("0.0")
    @DecimalMax("1.0")
    private double forcedConfidence = 0.4;

    public int getMaxOpenBraces() {
        return maxOpenBraces;
    }

    public void setMaxOpenBraces(int maxOpenBraces) {
        this.maxOpenBraces = maxOpenBraces;
    }

    public int getMaxCloseBraces() {
        return maxCloseBraces;
    }

    public void setMaxCloseBraces(int maxCloseBraces) {
        this.maxCloseBraces = maxCloseBraces;
    }

    public int getBraceWeight() {
        return braceWeight;
    }

    public void setBraceWeight(int braceWeight) {
        this.braceWeight = braceWeight;
    }

    public int getMaxFractions() {
        return maxFractions;
    }

    public void setMaxFractions(int maxFractions) {
        this.maxFractions = maxFractions;
    }

    public int getFractionWeight() {
        return fractionWeight;
    }

    public void setFractionWeight(int fractionWeight) {
        this.fractionWeight = fractionWeight;
    }

    public int getMaxScriptstyle() {
        return maxScriptstyle;
    }

    public void setMaxScriptstyle(int maxScriptstyle) {
        this.maxScriptstyle = maxScriptstyle;
    }

    public int getMaxOverUnderBraces() {
        return maxOverUnderBraces;
    }

    public void setMaxOverUnderBraces(int maxOverUnderBraces) {
        this.maxOverUnderBraces = maxOverUnderBraces;
    }

    public int getMaxRoots() {
        return maxRoots;
    }

    public void setMaxRoots(int maxRoots) {
        this.maxRoots = maxRoots;
    }

    public int getMaxDots() {
        return maxDots;
    }

    public void setMaxDots(int maxDots) {
        this.maxDots = maxDots;
    }

    public int getMaxLength() {
        return maxLength;
    }

    public void setMaxLength(int maxLength) {
        this.maxLength = maxLength;
    }

    public int getMaxMathrm() {
        return maxMathrm;
    }

    public void setMaxMathrm(int maxMathrm) {
        this.maxMathrm = maxMathrm;
    }

    public int getMaxOverlines() {
        return maxOverlines;
    }

    public void setMaxOverlines(int maxOverlines) {
        this.maxOverlines = maxOverlines;
    }

    public int getRepetitionWeight() {
        return repetitionWeight;
    }

    public void setRepetitionWeight(int repetitionWeight) {
        this.repetitionWeight = repetitionWeight;
    }

    public int getNestedScriptFractionWeight() {
        return nestedScriptFractionWeight;
    }

    public void setNestedScriptFractionWeight(int nestedScriptFractionWeight) {
        this.nestedScriptFractionWeight = nestedScriptFractionWeight;
    }

    public int getDecisionThreshold() {
        return decisionThreshold;
    }

    public void setDecisionThreshold(int decisionThreshold) {
        this.decisionThreshold = decisionThreshold;
    }

    public double getForcedConfidence() {
        return forcedConfidence;
    }

    public void setForcedConfidence(double forcedConfidence) {
        this.forcedConfidence = forcedConfidence;
    }
}
