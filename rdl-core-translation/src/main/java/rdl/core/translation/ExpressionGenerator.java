package rdl.core.translation;

import rdl.core.logic.ExpressionAst;
import rdl.core.logic.ExpressionAst.*;

import java.math.BigDecimal;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Renders an [ExpressionAst] as a report expression.
///
/// | node | rendering |
/// |---|---|
/// | FieldReference(n) | `Fields!n.Value` |
/// | ParameterReference(n) | `Parameters!n.Value` |
/// | GlobalReference(n) | `Globals!n` |
/// | Literal string | `"s"` with embedded quotes doubled |
/// | Literal number / boolean | `42`, `2.5`, `True`, `False` |
/// | BinaryOperation | `l op r` |
/// | UnaryOperation | `op operand` |
/// | FunctionCall / Aggregate | `name(a, b)` |
/// | Conditional | `IIf(c, t, f)` with `Nothing` for a missing false value |
///
/// Rendering is total: every AST yields text. Whether that text is acceptable to the report
/// sandbox is decided separately by [SandboxValidator].
public final class ExpressionGenerator {

    private static final Logger LOG = Logger.getLogger(ExpressionGenerator.class.getName());

    private static final DateTimeFormatter DATE_LITERAL = DateTimeFormatter.ofPattern("M/d/yyyy", Locale.ROOT);

    private static final Map<String, String> OPERATORS = Map.ofEntries(
            Map.entry("AND", "And"),
            Map.entry("OR", "Or"),
            Map.entry("NOT", "Not"),
            Map.entry("!=", "<>"),
            Map.entry("%", "Mod"),
            Map.entry("MOD", "Mod"));

    /// Foreign function names mapped onto their report equivalents.
    private static final Map<String, String> FUNCTIONS = Map.ofEntries(
            Map.entry("ISNULL", "IsNothing"),
            Map.entry("IFNULL", "If"),
            Map.entry("COALESCE", "If"),
            Map.entry("LENGTH", "Len"),
            Map.entry("LEN", "Len"),
            Map.entry("SUBSTRING", "Mid"),
            Map.entry("SUBSTR", "Mid"),
            Map.entry("UPPER", "UCase"),
            Map.entry("LOWER", "LCase"),
            Map.entry("TRIM", "Trim"),
            Map.entry("NOW", "Now"),
            Map.entry("GETDATE", "Now"),
            Map.entry("TODAY", "Today"),
            Map.entry("YEAR", "Year"),
            Map.entry("MONTH", "Month"),
            Map.entry("DAY", "Day"),
            Map.entry("FORMAT", "Format"));

    /// Renders the AST as a complete expression with the leading `=` sigil.
    public String generate(ExpressionAst ast) {
        Objects.requireNonNull(ast, "ast must not be null");
        final String body = render(ast);
        final String expression = body.startsWith("=") ? body : "=" + body;
        LOG.fine(() -> "Generated expression: " + expression);
        return expression;
    }

    /// Renders the AST without the `=` sigil, as it appears nested in a larger expression.
    public String render(ExpressionAst node) {
        Objects.requireNonNull(node, "node must not be null");
        return switch (node.nodeType()) {
            case LITERAL -> renderLiteral(((Literal) node).value());
            case FIELD_REFERENCE -> "Fields!" + ((FieldReference) node).name() + ".Value";
            case PARAMETER_REFERENCE -> "Parameters!" + ((ParameterReference) node).name() + ".Value";
            case GLOBAL_REFERENCE -> "Globals!" + ((GlobalReference) node).name();
            case BINARY_OPERATION -> {
                final var binary = (BinaryOperation) node;
                yield render(binary.left()) + " " + translateOperator(binary.operatorSymbol()) + " " + render(binary.right());
            }
            case UNARY_OPERATION -> {
                final var unary = (UnaryOperation) node;
                final String op = unary.operatorSymbol().isBlank() ? "Not" : translateOperator(unary.operatorSymbol());
                yield op + " " + render(unary.operand());
            }
            case FUNCTION_CALL -> {
                final var call = (FunctionCall) node;
                yield translateFunctionName(call.name()) + "(" + renderArguments(call.arguments()) + ")";
            }
            case CONDITIONAL -> {
                final var conditional = (Conditional) node;
                final String falseValue = conditional.falseValue() == null ? "Nothing" : render(conditional.falseValue());
                yield Conditional.IIF + "(" + render(conditional.condition()) + ", "
                        + render(conditional.trueValue()) + ", " + falseValue + ")";
            }
            case AGGREGATE -> {
                final var aggregate = (Aggregate) node;
                yield aggregate.function() + "(" + renderArguments(aggregate.arguments()) + ")";
            }
        };
    }

    private String renderArguments(List<ExpressionAst> arguments) {
        final var sb = new StringBuilder();
        for (int i = 0; i < arguments.size(); i++) {
            if (i > 0) sb.append(", ");
            sb.append(render(arguments.get(i)));
        }
        return sb.toString();
    }

    static String renderLiteral(Object value) {
        if (value == null) {
            return "Nothing";
        }
        if (value instanceof String) {
            return "\"" + ((String) value).replace("\"", "\"\"") + "\"";
        }
        if (value instanceof Boolean) {
            return (Boolean) value ? "True" : "False";
        }
        if (value instanceof Double || value instanceof Float) {
            final double d = ((Number) value).doubleValue();
            if (Double.isNaN(d) || Double.isInfinite(d)) {
                return value.toString();
            }
            return BigDecimal.valueOf(d).stripTrailingZeros().toPlainString();
        }
        if (value instanceof BigDecimal) {
            return ((BigDecimal) value).toPlainString();
        }
        if (value instanceof TemporalAccessor && ((TemporalAccessor) value).isSupported(ChronoField.EPOCH_DAY)) {
            return "#" + DATE_LITERAL.format((TemporalAccessor) value) + "#";
        }
        return value.toString();
    }

    private static String translateOperator(String op) {
        return OPERATORS.getOrDefault(op.toUpperCase(Locale.ROOT), op);
    }

    private static String translateFunctionName(String name) {
        return FUNCTIONS.getOrDefault(name.toUpperCase(Locale.ROOT), name);
    }
}
