package rdl.core.translation;

import java.util.Objects;

/// One finding of the sandbox validator.
/// @param severity how serious the finding is
/// @param code stable identifier such as `SANDBOX001`
/// @param text human readable description, surfaced verbatim to end users
/// @param location where in the report the expression lives, null when unknown
public record ValidationMessage(Severity severity, String code, String text, String location) {

    public ValidationMessage {
        Objects.requireNonNull(severity, "severity must not be null");
        Objects.requireNonNull(code, "code must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    public static ValidationMessage error(String code, String text) {
        return new ValidationMessage(Severity.ERROR, code, text, null);
    }

    public static ValidationMessage warning(String code, String text) {
        return new ValidationMessage(Severity.WARNING, code, text, null);
    }
}
