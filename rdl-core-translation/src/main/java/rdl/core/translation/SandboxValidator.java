package rdl.core.translation;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Static check of a report expression against a [SandboxPolicy].
///
/// Three independent scans, all findings accumulated:
/// 1. deny-list match -> `SANDBOX001` error
/// 2. call of a function outside the allow-list -> `SANDBOX002` warning
/// 3. dotted `Namespace.Member` access outside the allowed namespaces -> `SANDBOX003` error
///
/// Only errors are violations. Nothing is executed or type-checked.
public final class SandboxValidator {

    private static final Logger LOG = Logger.getLogger(SandboxValidator.class.getName());

    public static final String PROHIBITED_PATTERN = "SANDBOX001";
    public static final String UNKNOWN_FUNCTION = "SANDBOX002";
    public static final String NAMESPACE_ACCESS = "SANDBOX003";

    private static final Pattern FUNCTION_CALL = Pattern.compile("(\\w+)\\s*\\(");

    private static final Pattern NAMESPACE = Pattern.compile("[A-Z][a-z]+(?:\\.[A-Z][a-z]+)+");

    /// Report collections whose members are always accessible.
    private static final List<String> BUILT_IN_COLLECTIONS = List.of(
            "Fields.", "Parameters.", "Globals.", "User.", "Code.", "ReportItems.");

    /// Call-site names that are collection access paths rather than functions.
    private static final List<String> ACCESS_PATH_PREFIXES = List.of(
            "Fields", "Parameters", "Globals", "User", "Code");

    private final SandboxPolicy policy;

    public SandboxValidator() {
        this(SandboxPolicy.fromSystemProperties());
    }

    public SandboxValidator(SandboxPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public SandboxPolicy policy() {
        return policy;
    }

    /// Validates an expression. Never throws for non-null input.
    public ValidationResult validate(String expression) {
        Objects.requireNonNull(expression, "expression must not be null");
        final List<ValidationMessage> messages = new ArrayList<>();
        final List<String> violations = new ArrayList<>();

        for (final Pattern pattern : policy.prohibitedPatterns()) {
            if (pattern.matcher(expression).find()) {
                violations.add("Prohibited pattern detected: " + pattern.pattern());
                messages.add(ValidationMessage.error(PROHIBITED_PATTERN,
                        "Expression contains prohibited pattern: " + pattern.pattern()));
            }
        }

        for (final String function : functionCalls(expression)) {
            if (!policy.isAllowedFunction(function) && !startsWithAny(function, ACCESS_PATH_PREFIXES)) {
                messages.add(ValidationMessage.warning(UNKNOWN_FUNCTION,
                        "Unknown function call: " + function + ". Ensure it's a valid report function."));
            }
        }

        for (final String qualified : namespaceAccesses(expression)) {
            if (!policy.isAllowedNamespace(qualified)) {
                violations.add("Access to namespace not allowed: " + qualified);
                messages.add(ValidationMessage.error(NAMESPACE_ACCESS,
                        "Access to namespace '" + qualified + "' is not allowed in the report sandbox"));
            }
        }

        final ValidationResult result = ValidationResult.of(messages, violations);
        if (!result.isValid()) {
            LOG.warning(() -> "Expression validation failed: " + expression
                    + ", violations: " + String.join("; ", violations));
        } else {
            LOG.fine(() -> "Expression passed sandbox validation with " + messages.size() + " message(s): " + expression);
        }
        return result;
    }

    /// Validates an expression and fails on the first invalid result.
    /// @throws SandboxViolationException carrying every violation
    public void validateOrThrow(String expression) {
        final ValidationResult result = validate(expression);
        if (!result.isValid()) {
            throw new SandboxViolationException(expression, result.violations());
        }
    }

    private static Set<String> functionCalls(String expression) {
        final Set<String> names = new LinkedHashSet<>();
        final Matcher m = FUNCTION_CALL.matcher(expression);
        while (m.find()) {
            names.add(m.group(1));
        }
        return names;
    }

    private static Set<String> namespaceAccesses(String expression) {
        final Set<String> names = new LinkedHashSet<>();
        final Matcher m = NAMESPACE.matcher(expression);
        int from = 0;
        while (from < expression.length() && m.find(from)) {
            final int end = endOfQualifiedName(expression, m.end());
            final String candidate = expression.substring(m.start(), end);
            if (!startsWithAny(candidate, BUILT_IN_COLLECTIONS) && !isFieldPropertyAccess(candidate)) {
                names.add(candidate);
            }
            from = end;
        }
        return names;
    }

    /// Extends a match over the rest of its dotted identifier, so `Amount.Is` becomes
    /// `Amount.IsMissing` and `Microsoft.Visual` becomes `Microsoft.VisualBasic.Strings.Left`.
    private static int endOfQualifiedName(String expression, int end) {
        int i = end;
        while (i < expression.length()) {
            final char c = expression.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '_') {
                i++;
            } else if (c == '.' && i + 1 < expression.length() && Character.isLetter(expression.charAt(i + 1))) {
                i++;
            } else {
                break;
            }
        }
        return i;
    }

    /// `Name.Value` or `Name.IsMissing`, the tail of `Fields!Name.Value`.
    private static boolean isFieldPropertyAccess(String candidate) {
        final String[] parts = candidate.split("\\.");
        return parts.length == 2
                && ("Value".equalsIgnoreCase(parts[1]) || "IsMissing".equalsIgnoreCase(parts[1]));
    }

    private static boolean startsWithAny(String text, List<String> prefixes) {
        for (final String prefix : prefixes) {
            if (text.regionMatches(true, 0, prefix, 0, prefix.length())) {
                return true;
            }
        }
        return false;
    }
}
