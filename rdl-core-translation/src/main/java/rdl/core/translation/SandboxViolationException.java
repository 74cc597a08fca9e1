package rdl.core.translation;

import java.util.List;

/// Thrown by [SandboxValidator#validateOrThrow] when an expression breaks the sandbox rules.
/// Carries every violation found, not just the first.
public class SandboxViolationException extends RuntimeException {

    @java.io.Serial
    private static final long serialVersionUID = 1L;

    private final String expression;
    private final List<String> violations;

    public SandboxViolationException(String expression, List<String> violations) {
        super("Expression violates sandbox security rules: " + String.join(", ", violations));
        this.expression = expression;
        this.violations = List.copyOf(violations);
    }

    public String expression() {
        return expression;
    }

    public List<String> violations() {
        return violations;
    }
}
