package rdl.core.logic;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// One parsed occurrence of an embedded instruction.
///
/// `fieldName` is only meaningful for [FieldCodeType#MERGE_FIELD] and may be null.
/// `switches` maps the switch character (`#`, `@`, `*`, `!`) to its value.
/// `nestedFields` holds fields textually embedded inside this field's instruction.
public record FieldCode(
        String id,
        FieldCodeType type,
        String rawCode,
        String fieldName,
        Map<String, String> switches,
        List<FieldCode> nestedFields) {

    public FieldCode {
        Objects.requireNonNull(id, "id must not be null");
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(rawCode, "rawCode must not be null");
        switches = switches == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(switches));
        nestedFields = nestedFields == null ? List.of() : List.copyOf(nestedFields);
    }

    /// Convenience constructor for a field without switches or nested fields.
    public FieldCode(String id, FieldCodeType type, String rawCode, String fieldName) {
        this(id, type, rawCode, fieldName, Map.of(), List.of());
    }

    /// Returns the value of a switch, or the fallback when the switch is absent.
    public String switchValue(String key, String fallback) {
        final String value = switches.get(key);
        return value == null ? fallback : value;
    }
}
