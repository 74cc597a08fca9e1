package rdl.core.translation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// What generated report expressions may use.
///
/// - `allowedFunctions`: built-in function names, compared case-insensitively; calling
///   anything else is only a warning
/// - `allowedNamespaces`: qualified prefixes that dotted names must start with
/// - `prohibitedPatterns`: regular expressions that make an expression invalid wherever
///   they match
///
/// [#DEFAULT] holds the report engine's built-ins. Deployments that register custom code can
/// widen the function list with [#withAdditionalFunctions] or the
/// `rdl.sandbox.additionalFunctions` system property; the deny-list and namespaces are fixed.
public record SandboxPolicy(Set<String> allowedFunctions, List<String> allowedNamespaces,
                            List<Pattern> prohibitedPatterns) {

    private static final Logger LOG = Logger.getLogger(SandboxPolicy.class.getName());

    /// Comma separated function names added to the default allow-list.
    public static final String ADDITIONAL_FUNCTIONS_PROPERTY = "rdl.sandbox.additionalFunctions";

    private static final List<String> BUILT_IN_FUNCTIONS = List.of(
            // conditional
            "IIf", "If", "Switch", "Choose",
            // type checks
            "IsNothing", "IsNumeric", "IsDate", "IsArray",
            // conversion
            "CStr", "CInt", "CLng", "CDbl", "CDec", "CBool", "CDate", "CByte", "CShort", "Val", "Str",
            // string
            "Len", "Left", "Right", "Mid", "Trim", "LTrim", "RTrim", "UCase", "LCase", "StrComp",
            "InStr", "InStrRev", "Replace", "Split", "Join", "Space", "String", "Asc", "Chr", "Format",
            // math
            "Abs", "Int", "Fix", "Round", "Sgn", "Sqr", "Log", "Exp", "Sin", "Cos", "Tan", "Atn",
            "Rnd", "Randomize",
            // date and time
            "Now", "Today", "Year", "Month", "Day", "Hour", "Minute", "Second", "Weekday",
            "WeekdayName", "DateAdd", "DateDiff", "DatePart", "DateSerial", "DateValue",
            "TimeSerial", "TimeValue", "Timer", "MonthName", "FormatDateTime",
            // aggregates
            "Sum", "Avg", "Count", "CountDistinct", "CountRows", "Max", "Min", "First", "Last",
            "Previous", "RunningValue", "RowNumber", "Aggregate", "StDev", "StDevP", "Var", "VarP",
            // arrays
            "Array", "UBound", "LBound",
            // lookups
            "Lookup", "LookupSet", "MultiLookup");

    private static final List<String> BUILT_IN_NAMESPACES = List.of(
            "System.Convert",
            "System.Math",
            "System.String",
            "System.DateTime",
            "System.TimeSpan",
            "Microsoft.VisualBasic.Strings",
            "Microsoft.VisualBasic.DateAndTime",
            "Microsoft.VisualBasic.Conversion",
            "Microsoft.VisualBasic.Financial",
            "Microsoft.VisualBasic.Information",
            "Microsoft.VisualBasic.Interaction");

    private static final List<String> DENY_LIST = List.of(
            "System\\.IO\\.",
            "System\\.Net\\.",
            "System\\.Reflection\\.",
            "System\\.Diagnostics\\.",
            "System\\.Threading\\.",
            "System\\.Security\\.",
            "Process\\.",
            "File\\.",
            "Directory\\.",
            "Assembly\\.",
            "AppDomain\\.",
            "Activator\\.",
            "Type\\.GetType",
            "Invoke\\s*\\(",
            "CreateObject\\s*\\(",
            "GetObject\\s*\\(",
            "Shell\\s*\\(",
            "Environ\\s*\\(");

    public static final SandboxPolicy DEFAULT = new SandboxPolicy(
            new LinkedHashSet<>(BUILT_IN_FUNCTIONS),
            BUILT_IN_NAMESPACES,
            DENY_LIST.stream().map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE)).toList());

    public SandboxPolicy {
        final Set<String> normalized = new LinkedHashSet<>();
        for (final String function : allowedFunctions) {
            normalized.add(function.toUpperCase(Locale.ROOT));
        }
        allowedFunctions = Set.copyOf(normalized);
        allowedNamespaces = List.copyOf(allowedNamespaces);
        prohibitedPatterns = List.copyOf(prohibitedPatterns);
    }

    /// True when `name` is an allowed function, ignoring case.
    public boolean isAllowedFunction(String name) {
        return allowedFunctions.contains(name.toUpperCase(Locale.ROOT));
    }

    /// True when the dotted name starts with an allowed namespace, ignoring case.
    public boolean isAllowedNamespace(String qualifiedName) {
        for (final String namespace : allowedNamespaces) {
            if (qualifiedName.regionMatches(true, 0, namespace, 0, namespace.length())) {
                return true;
            }
        }
        return false;
    }

    /// A copy of this policy whose function allow-list also contains `functions`.
    public SandboxPolicy withAdditionalFunctions(Collection<String> functions) {
        final Set<String> widened = new LinkedHashSet<>(allowedFunctions);
        widened.addAll(functions);
        return new SandboxPolicy(widened, allowedNamespaces, prohibitedPatterns);
    }

    /// [#DEFAULT] widened by the functions named in the `rdl.sandbox.additionalFunctions`
    /// system property.
    public static SandboxPolicy fromSystemProperties() {
        final String property = System.getProperty(ADDITIONAL_FUNCTIONS_PROPERTY);
        if (property == null || property.isBlank()) {
            return DEFAULT;
        }
        final List<String> extra = new ArrayList<>();
        Arrays.stream(property.split(","))
                .map(String::strip)
                .filter(name -> !name.isEmpty())
                .forEach(extra::add);
        LOG.config(() -> "Sandbox allows additional functions: " + extra);
        return DEFAULT.withAdditionalFunctions(extra);
    }
}
