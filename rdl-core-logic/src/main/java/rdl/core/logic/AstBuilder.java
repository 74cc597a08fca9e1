package rdl.core.logic;

import rdl.core.logic.ExpressionAst.*;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Builds an [ExpressionAst] from a report-style expression string.
///
/// Recognition is a fixed decision list, first match wins:
/// 1. `Fields!Name.Value` -> FieldReference
/// 2. `Parameters!Name.Value` -> ParameterReference
/// 3. `Globals!Name` -> GlobalReference
/// 4. `Name(...)` ending in `)` -> FunctionCall, arguments split on top-level commas
/// 5. binary operator scan over [#BINARY_OPERATORS] -> BinaryOperation
/// 6. anything else -> string Literal
///
/// Step 5 is a textual scan, not a precedence parser: the first operator in list order that
/// occurs strictly inside the text splits it, so `A+B*C` splits on `+` and `A*B+C` also
/// splits on `+`. Step 4 only looks at the first `(` and the last character, so
/// `Sum(A) + Sum(B)` is a call of `Sum` with the single argument `A) + Sum(B`.
/// Callers depend on this split behaviour.
public final class AstBuilder {

    private static final Logger LOG = Logger.getLogger(AstBuilder.class.getName());

    /// Operators in scan order.
    static final List<String> BINARY_OPERATORS = List.of(
            " And ", " Or ", ">=", "<=", "<>", "=", ">", "<", "+", "-", "*", "/");

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(?:\\.[A-Za-z_][A-Za-z0-9_]*)*");

    /// Parses an expression into an AST. Never fails: unrecognised text becomes a literal.
    /// @param expression the expression text; null or blank yields `Literal("")`
    /// @return the root node
    public ExpressionAst build(String expression) {
        if (expression == null || expression.isBlank()) {
            return new Literal("");
        }
        final String text = expression.strip();
        LOG.finer(() -> "Building AST for: " + text);

        if (startsWithIgnoreCase(text, "Fields!")) {
            return new FieldReference(secondSegment(text, "[!.]"), Metadata.source(text));
        }
        if (startsWithIgnoreCase(text, "Parameters!")) {
            return new ParameterReference(secondSegment(text, "[!.]"), Metadata.source(text));
        }
        if (startsWithIgnoreCase(text, "Globals!")) {
            return new GlobalReference(secondSegment(text, "!"), Metadata.source(text));
        }

        final ExpressionAst call = tryParseFunctionCall(text);
        if (call != null) {
            return call;
        }

        final ExpressionAst binary = tryParseBinaryOperation(text);
        if (binary != null) {
            return binary;
        }

        return new Literal(text);
    }

    /// Splits on the separator pattern, drops empty segments and returns the second one,
    /// or the whole text when there is none.
    private static String secondSegment(String text, String separator) {
        final List<String> parts = new ArrayList<>();
        for (final String part : text.split(separator)) {
            if (!part.isEmpty()) {
                parts.add(part);
            }
        }
        return parts.size() > 1 ? parts.get(1) : text;
    }

    private ExpressionAst tryParseFunctionCall(String text) {
        final int open = text.indexOf('(');
        if (open <= 0 || text.charAt(text.length() - 1) != ')') {
            return null;
        }
        final String name = text.substring(0, open).strip();
        if (!IDENTIFIER.matcher(name).matches()) {
            return null;
        }

        final List<ExpressionAst> arguments = new ArrayList<>();
        for (final String argument : splitArguments(text.substring(open + 1, text.length() - 1))) {
            arguments.add(build(argument));
        }
        LOG.finer(() -> "Function call " + name + " with " + arguments.size() + " argument(s)");
        return new FunctionCall(name, arguments, Metadata.source(text));
    }

    /// Splits an argument list on commas at parenthesis depth zero.
    static List<String> splitArguments(String args) {
        final List<String> out = new ArrayList<>();
        if (args.isBlank()) {
            return out;
        }
        int depth = 0;
        final var current = new StringBuilder();
        for (int i = 0; i < args.length(); i++) {
            final char c = args.charAt(i);
            if (c == '(') {
                depth++;
            } else if (c == ')') {
                depth--;
            } else if (c == ',' && depth == 0) {
                out.add(current.toString().strip());
                current.setLength(0);
                continue;
            }
            current.append(c);
        }
        if (current.length() > 0) {
            out.add(current.toString().strip());
        }
        return out;
    }

    private ExpressionAst tryParseBinaryOperation(String text) {
        for (final String op : BINARY_OPERATORS) {
            final int index = indexOfIgnoreCase(text, op);
            if (index > 0 && index < text.length() - op.length()) {
                final String left = text.substring(0, index).strip();
                final String right = text.substring(index + op.length()).strip();
                LOG.finer(() -> "Binary split on '" + op.strip() + "' at " + index);
                return new BinaryOperation(op.strip(), build(left), build(right), Metadata.source(text));
            }
        }
        return null;
    }

    private static boolean startsWithIgnoreCase(String text, String prefix) {
        return text.regionMatches(true, 0, prefix, 0, prefix.length());
    }

    private static int indexOfIgnoreCase(String text, String needle) {
        final int last = text.length() - needle.length();
        for (int i = 0; i <= last; i++) {
            if (text.regionMatches(true, i, needle, 0, needle.length())) {
                return i;
            }
        }
        return -1;
    }
}
