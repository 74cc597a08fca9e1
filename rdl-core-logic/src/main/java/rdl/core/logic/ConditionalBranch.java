package rdl.core.logic;

import java.util.Objects;

/// A condition/true-value/false-value triple taken from an IF field or a nested `IIf` node.
/// `falseValue` is null when the source had no false branch; `sourceLocation` is the id of
/// the originating [FieldCode].
public record ConditionalBranch(
        String id,
        ExpressionAst condition,
        ExpressionAst trueValue,
        ExpressionAst falseValue,
        String sourceLocation) {

    public ConditionalBranch {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(condition, "condition must not be null");
        Objects.requireNonNull(trueValue, "trueValue must not be null");
        Objects.requireNonNull(sourceLocation, "sourceLocation must not be null");
    }

    /// Builds a branch from the children of a conditional node.
    static ConditionalBranch of(String id, ExpressionAst.Conditional conditional, String sourceLocation) {
        return new ConditionalBranch(id, conditional.condition(), conditional.trueValue(),
                conditional.falseValue(), sourceLocation);
    }
}
