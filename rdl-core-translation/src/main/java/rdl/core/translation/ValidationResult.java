package rdl.core.translation;

import java.util.List;

/// Result of sandbox validation.
/// Immutable; `isValid` is true exactly when there are no violations. Warnings may be present
/// on a valid result.
public record ValidationResult(boolean isValid, List<ValidationMessage> messages, List<String> violations) {

    private static final ValidationResult SUCCESS = new ValidationResult(true, List.of(), List.of());

    public ValidationResult {
        messages = List.copyOf(messages);
        violations = List.copyOf(violations);
        if (isValid != violations.isEmpty()) {
            throw new IllegalArgumentException("isValid must be " + violations.isEmpty()
                    + " for " + violations.size() + " violation(s)");
        }
    }

    /// Result with no findings at all.
    public static ValidationResult success() {
        return SUCCESS;
    }

    /// Builds a result whose validity follows from the violations.
    public static ValidationResult of(List<ValidationMessage> messages, List<String> violations) {
        if (messages.isEmpty() && violations.isEmpty()) {
            return SUCCESS;
        }
        return new ValidationResult(violations.isEmpty(), messages, violations);
    }

    public List<ValidationMessage> errors() {
        return withSeverity(Severity.ERROR);
    }

    public List<ValidationMessage> warnings() {
        return withSeverity(Severity.WARNING);
    }

    private List<ValidationMessage> withSeverity(Severity severity) {
        return messages.stream().filter(m -> m.severity() == severity).toList();
    }
}
