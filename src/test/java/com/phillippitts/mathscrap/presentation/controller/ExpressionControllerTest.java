package com.phillippitts.mathscrap.presentation.controller;

import com.phillippitts.mathscrap.domain.AnalysisReport;
import com.phillippitts.mathscrap.domain.ExpressionClass;
import com.phillippitts.mathscrap.domain.SolveResult;
import com.phillippitts.mathscrap.domain.ValidationResult;
import com.phillippitts.mathscrap.service.validation.ExpressionValidationService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(ExpressionController.class)
class ExpressionControllerTest {

    @Autowired
    private MockMvc mvc;

    @MockBean
    private ExpressionValidationService validationService;

    @Test
    void validateReturnsWireShape() throws Exception {
        // Arrange
        AnalysisReport report = new AnalysisReport(ExpressionClass.SUM, Set.of("x"), Set.of("1"), 1,
                true, true, false, Set.of(), null);
        when(validationService.validate("x + 1"))
                .thenReturn(ValidationResult.valid("x + 1", "x + 1", report, "x + 1"));

        // Act & Assert
        mvc.perform(post("/api/expressions/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latex\": \"x + 1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.sympy_expression").value("x + 1"))
                .andExpect(jsonPath("$.original_latex").value("x + 1"))
                .andExpect(jsonPath("$.analysis.is_polynomial").value(true))
                .andExpect(jsonPath("$.analysis.degree").value(1))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void invalidMarkupIsStillOk() throws Exception {
        when(validationService.validate("x + * y"))
                .thenReturn(ValidationResult.invalid("unparseable_expression", "x + * y",
                        ExpressionValidationService.UNPARSEABLE_ERROR));

        mvc.perform(post("/api/expressions/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latex\": \"x + * y\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.error").value("Could not parse LaTeX expression"))
                .andExpect(jsonPath("$.analysis").doesNotExist());
    }

    @Test
    void missingLatexIsRejected() throws Exception {
        mvc.perform(post("/api/expressions/validate")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidRequest"));

        verify(validationService, never()).validate(anyString());
    }

    @Test
    void malformedJsonIsRejected() throws Exception {
        mvc.perform(post("/api/expressions/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latex\": "))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.errorCode").value("InvalidRequest"));
    }

    @Test
    void solveReturnsSolutionsPerVariable() throws Exception {
        // Arrange
        SolveResult result = new SolveResult(true, "Eq(x**2 + 5*x + 6, 0)", List.of("x"),
                Map.of("x", List.of("-3", "-2")), List.of(), "x^{2} + 5x + 6 = 0", null);
        when(validationService.solve("x^2+5x+6=0")).thenReturn(result);

        // Act & Assert
        mvc.perform(post("/api/expressions/solve")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"latex\": \"x^2+5x+6=0\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.solvable").value(true))
                .andExpect(jsonPath("$.solutions.x[0]").value("-3"))
                .andExpect(jsonPath("$.solutions.x[1]").value("-2"))
                .andExpect(jsonPath("$.original_latex").value("x^{2} + 5x + 6 = 0"));
    }
}
