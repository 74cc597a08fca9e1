package rdl.core.logic;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Classifies raw field instructions by keyword and pulls out their modifier switches.
public final class FieldInstructions {

    private static final Logger LOG = Logger.getLogger(FieldInstructions.class.getName());

    /// `\# "0.00"`, `\@ "yyyy-MM-dd"`, `\* MERGEFORMAT`, `\!`
    /// A bare value never starts with a backslash, so `\! \* MERGEFORMAT` is two switches.
    private static final Pattern SWITCH = Pattern.compile("\\\\([#@*!])\\s*(?:\"([^\"]*)\"|(?!\\\\)(\\S+))?");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    /// Prefix keywords in match priority order.
    private static final List<Map.Entry<String, FieldCodeType>> PREFIXES = List.of(
            Map.entry("MERGEFIELD", FieldCodeType.MERGE_FIELD),
            Map.entry("IF", FieldCodeType.IF),
            Map.entry("DATE", FieldCodeType.DATE),
            Map.entry("TIME", FieldCodeType.TIME),
            Map.entry("PAGE", FieldCodeType.PAGE),
            Map.entry("NUMPAGES", FieldCodeType.NUM_PAGES),
            Map.entry("=", FieldCodeType.FORMULA),
            Map.entry("FORMULA", FieldCodeType.FORMULA),
            Map.entry("SEQ", FieldCodeType.SEQUENCE),
            Map.entry("TOC", FieldCodeType.TABLE_OF_CONTENTS),
            Map.entry("HYPERLINK", FieldCodeType.HYPERLINK));

    private FieldInstructions() {}

    /// Maps instruction text to its field-code kind by prefix keyword, case-insensitively.
    /// @param instruction the raw instruction text
    /// @return the matching kind, or [FieldCodeType#UNKNOWN]
    public static FieldCodeType determineFieldType(String instruction) {
        Objects.requireNonNull(instruction, "instruction must not be null");
        final String upper = instruction.toUpperCase(Locale.ROOT).stripLeading();
        for (final var prefix : PREFIXES) {
            if (upper.startsWith(prefix.getKey())) {
                return prefix.getValue();
            }
        }
        return FieldCodeType.UNKNOWN;
    }

    /// Returns the bound field name of a MERGEFIELD instruction: the second whitespace-separated
    /// token. Null for other kinds or when the instruction carries no name.
    public static String extractFieldName(String instruction, FieldCodeType type) {
        Objects.requireNonNull(instruction, "instruction must not be null");
        if (type != FieldCodeType.MERGE_FIELD) {
            return null;
        }
        final String[] tokens = WHITESPACE.split(instruction.strip());
        return tokens.length > 1 ? tokens[1] : null;
    }

    /// Extracts `\X value` switches into a map keyed by the switch character.
    /// A switch without a value maps to the empty string; the last occurrence of a key wins.
    public static Map<String, String> extractSwitches(String instruction) {
        Objects.requireNonNull(instruction, "instruction must not be null");
        final Map<String, String> switches = new LinkedHashMap<>();
        final Matcher m = SWITCH.matcher(instruction);
        while (m.find()) {
            final String key = m.group(1);
            final String value = m.group(2) != null ? m.group(2) : m.group(3) != null ? m.group(3) : "";
            LOG.finer(() -> "Switch \\" + key + " = " + value);
            switches.put(key, value);
        }
        return switches;
    }
}
