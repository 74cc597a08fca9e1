package rdl.core.translation;

import rdl.core.logic.ExpressionAst;
import rdl.core.logic.ExpressionAst.FieldReference;
import rdl.core.logic.ExpressionAst.ParameterReference;

import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.logging.Logger;

/// Entry point of the translation module: AST to checked report expression.
public final class LogicTranslation {

    private static final Logger LOG = Logger.getLogger(LogicTranslation.class.getName());

    private final ExpressionGenerator generator;
    private final ExpressionOptimizer optimizer;
    private final SandboxValidator validator;

    public LogicTranslation() {
        this(new ExpressionGenerator(), new ExpressionOptimizer(), new SandboxValidator());
    }

    public LogicTranslation(ExpressionGenerator generator, ExpressionOptimizer optimizer, SandboxValidator validator) {
        this.generator = Objects.requireNonNull(generator, "generator must not be null");
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer must not be null");
        this.validator = Objects.requireNonNull(validator, "validator must not be null");
    }

    /// Generates the expression for an AST. Sandbox violations are logged, not thrown.
    public String translateToExpression(ExpressionAst ast) {
        LOG.fine("Translating AST to expression");
        final String expression = generator.generate(ast);
        final ValidationResult validation = validator.validate(expression);
        if (!validation.isValid()) {
            LOG.warning(() -> "Generated expression has sandbox violations: " + expression
                    + ", violations: " + String.join("; ", validation.violations()));
        }
        return expression;
    }

    public String optimizeExpression(String expression) {
        LOG.fine(() -> "Optimizing expression: " + expression);
        return optimizer.optimize(expression);
    }

    public ValidationResult validateExpression(String expression) {
        LOG.fine(() -> "Validating expression: " + expression);
        return validator.validate(expression);
    }

    /// Generates, optimizes and validates in one pass.
    public CompiledExpression compile(ExpressionAst ast) {
        Objects.requireNonNull(ast, "ast must not be null");
        final String expression = optimizer.optimize(generator.generate(ast));
        final ValidationResult validation = validator.validate(expression);

        final Set<String> fields = new TreeSet<>();
        final Set<String> parameters = new TreeSet<>();
        for (final ExpressionAst node : ast.preOrder()) {
            if (node.nodeType() == ExpressionAst.NodeType.FIELD_REFERENCE) {
                fields.add(((FieldReference) node).name());
            } else if (node.nodeType() == ExpressionAst.NodeType.PARAMETER_REFERENCE) {
                parameters.add(((ParameterReference) node).name());
            }
        }
        LOG.fine(() -> "Compiled " + expression + " reading fields " + fields + " and parameters " + parameters);
        return new CompiledExpression(expression, validation.isValid(), validation.errors(), validation.warnings(),
                fields, parameters);
    }
}
