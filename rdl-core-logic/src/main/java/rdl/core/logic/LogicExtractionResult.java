package rdl.core.logic;

import java.util.List;
import java.util.Objects;

/// Everything extracted from one document: its field codes, the conditional branches of its
/// IF fields, its formulas, and warnings about fields that could not be decomposed.
public record LogicExtractionResult(
        List<FieldCode> fieldCodes,
        List<ConditionalBranch> conditions,
        List<CalculationFormula> formulas,
        List<String> warnings) {

    public LogicExtractionResult {
        Objects.requireNonNull(fieldCodes, "fieldCodes must not be null");
        Objects.requireNonNull(conditions, "conditions must not be null");
        Objects.requireNonNull(formulas, "formulas must not be null");
        Objects.requireNonNull(warnings, "warnings must not be null");
        fieldCodes = List.copyOf(fieldCodes);
        conditions = List.copyOf(conditions);
        formulas = List.copyOf(formulas);
        warnings = List.copyOf(warnings);
    }
}
