package com.phillippitts.mathscrap.service.validation;

import com.phillippitts.mathscrap.domain.AnalysisReport;
import com.phillippitts.mathscrap.domain.CanonicalMarkup;
import com.phillippitts.mathscrap.domain.SolveResult;
import com.phillippitts.mathscrap.domain.ValidationResult;
import com.phillippitts.mathscrap.service.markup.MarkupNormalizer;
import com.phillippitts.mathscrap.service.symbolic.EquationSolver;
import com.phillippitts.mathscrap.service.symbolic.ExpressionAnalyzer;
import com.phillippitts.mathscrap.service.symbolic.ExpressionPrinter;
import com.phillippitts.mathscrap.service.symbolic.ExpressionSimplifier;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression;
import com.phillippitts.mathscrap.service.symbolic.SymbolicExpression.UnparseableMarker;
import com.phillippitts.mathscrap.service.symbolic.SymbolicTranslator;
import com.phillippitts.mathscrap.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Service;

import java.util.Objects;

/**
 * Symbolic validation of markup: translate, analyze, simplify.
 *
 * <p>Raw markup is normalized first, so results always refer to canonical markup. An
 * unparseable translation is a normal outcome and yields an invalid result carrying the
 * placeholder name; it is never thrown.
 */
@Service
public class ExpressionValidationService {

    private static final Logger LOG = LogManager.getLogger(ExpressionValidationService.class);

    public static final String UNPARSEABLE_ERROR = "Could not parse LaTeX expression";

    private final MarkupNormalizer normalizer;
    private final SymbolicTranslator translator;
    private final ExpressionAnalyzer analyzer;
    private final ExpressionSimplifier simplifier;
    private final EquationSolver solver;

    public ExpressionValidationService(MarkupNormalizer normalizer,
                                       SymbolicTranslator translator,
                                       ExpressionAnalyzer analyzer,
                                       ExpressionSimplifier simplifier,
                                       EquationSolver solver) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer");
        this.translator = Objects.requireNonNull(translator, "translator");
        this.analyzer = Objects.requireNonNull(analyzer, "analyzer");
        this.simplifier = Objects.requireNonNull(simplifier, "simplifier");
        this.solver = Objects.requireNonNull(solver, "solver");
    }

    /** Normalizes raw markup, then validates it. */
    public ValidationResult validate(String markup) {
        return validate(normalizer.normalize(markup));
    }

    public ValidationResult validate(CanonicalMarkup markup) {
        SymbolicExpression expression = translator.translate(markup);
        if (expression instanceof UnparseableMarker marker) {
            LOG.debug("Markup '{}' translated to placeholder {}",
                    LogSanitizer.preview(markup.value()), marker.placeholder());
            return ValidationResult.invalid(marker.placeholder(), markup.value(), UNPARSEABLE_ERROR);
        }
        String printed = ExpressionPrinter.print(expression);
        try {
            AnalysisReport analysis = analyzer.analyze(expression);
            String simplified = simplifier.simplifyToString(expression);
            return ValidationResult.valid(printed, simplified, analysis, markup.value());
        } catch (ArithmeticException | IllegalArgumentException e) {
            LOG.warn("Analysis of {} failed: {}", LogSanitizer.preview(printed), e.getMessage());
            return ValidationResult.invalid(printed, markup.value(), e.getMessage());
        }
    }

    /** Normalizes raw markup, then solves it as an equation. */
    public SolveResult solve(String markup) {
        return solver.solve(normalizer.normalize(markup).value());
    }
}
