package rdl.core.logic;

/// Exception thrown when an instruction or expression cannot be turned into an AST.
/// Most malformed input degrades to a literal; this is reserved for input that cannot be
/// rendered into any meaningful target reference, such as a MERGEFIELD without a name.
public class ExpressionSyntaxException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final String expression;
    private final int position;

    /// Creates a new syntax exception for the given expression.
    public ExpressionSyntaxException(String message, String expression) {
        this(message, expression, -1);
    }

    /// Creates a new syntax exception with position information.
    public ExpressionSyntaxException(String message, String expression, int position) {
        super(formatMessage(message, expression, position));
        this.expression = expression;
        this.position = position;
    }

    /// Returns the expression that was being parsed.
    public String expression() {
        return expression;
    }

    /// Returns the position in the expression where the error occurred, or -1 if unknown.
    public int position() {
        return position;
    }

    private static String formatMessage(String message, String expression, int position) {
        if (expression == null) {
            return message;
        }
        final var sb = new StringBuilder(message);
        if (position >= 0) {
            sb.append(" at position ").append(position);
        }
        sb.append(" in expression: ").append(expression);
        return sb.toString();
    }
}
