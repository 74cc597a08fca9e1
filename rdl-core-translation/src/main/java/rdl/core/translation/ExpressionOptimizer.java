package rdl.core.translation;

import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Peephole simplifications over generated expression text.
///
/// Passes run once each, in order:
/// 1. `((x))` -> `(x)` for a parenthesis-free `x`, one layer per call
/// 2. `Not Not x` -> `x`
/// 3. `IIf(True, a, b)` -> `a` and `IIf(False, a, b)` -> `b`
///
/// The constant fold matches the exact spelling `IIf(True,` / `IIf(False,` and operands
/// without parentheses or commas; other spellings are left untouched.
public final class ExpressionOptimizer {

    private static final Logger LOG = Logger.getLogger(ExpressionOptimizer.class.getName());

    private static final Pattern DOUBLE_PARENS = Pattern.compile("\\(\\(([^()]+)\\)\\)");

    private static final Pattern DOUBLE_NOT = Pattern.compile("\\bNot\\s+Not\\s+", Pattern.CASE_INSENSITIVE);

    private static final Pattern IIF_TRUE = Pattern.compile("IIf\\(True,\\s*([^(),]+?)\\s*,\\s*[^(),]+?\\s*\\)");

    private static final Pattern IIF_FALSE = Pattern.compile("IIf\\(False,\\s*[^(),]+?\\s*,\\s*([^(),]+?)\\s*\\)");

    /// Optimizes an expression. Blank input is returned unchanged.
    public String optimize(String expression) {
        if (expression == null || expression.isBlank()) {
            return expression;
        }
        String optimized = DOUBLE_PARENS.matcher(expression).replaceAll("($1)");
        optimized = DOUBLE_NOT.matcher(optimized).replaceAll("");
        optimized = IIF_TRUE.matcher(optimized).replaceAll("$1");
        optimized = IIF_FALSE.matcher(optimized).replaceAll("$1");

        if (!optimized.equals(expression)) {
            final String result = optimized;
            LOG.fine(() -> "Optimized expression from '" + expression + "' to '" + result + "'");
        }
        return optimized;
    }
}
