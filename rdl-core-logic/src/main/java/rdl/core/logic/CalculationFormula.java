package rdl.core.logic;

import java.util.Objects;

/// A FORMULA field together with its parsed form.
public record CalculationFormula(String id, String rawExpression, ExpressionAst parsedExpression, String sourceLocation) {

    public CalculationFormula {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(rawExpression, "rawExpression must not be null");
        Objects.requireNonNull(parsedExpression, "parsedExpression must not be null");
        Objects.requireNonNull(sourceLocation, "sourceLocation must not be null");
    }
}
