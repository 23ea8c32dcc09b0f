package com.phillippitts.mathscrap.presentation.controller;

import com.phillippitts.mathscrap.domain.SolveResult;
import com.phillippitts.mathscrap.domain.ValidationResult;
import com.phillippitts.mathscrap.service.validation.ExpressionValidationService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Symbolic validation and equation solving for markup supplied directly by the client.
 */
@RestController
@RequestMapping("/api/expressions")
class ExpressionController {

    private final ExpressionValidationService validationService;

    ExpressionController(ExpressionValidationService validationService) {
        this.validationService = validationService;
    }

    @PostMapping("/validate")
    ValidationResult validate(@Valid @RequestBody MarkupRequest request) {
        return validationService.validate(request.latex());
    }

    @PostMapping("/solve")
    SolveResult solve(@Valid @RequestBody MarkupRequest request) {
        return validationService.solve(request.latex());
    }

    /**
     * @param latex markup to analyze; may be empty but not missing
     */
    record MarkupRequest(@NotNull String latex) {
    }
}
