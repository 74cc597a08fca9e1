package rdl.core.logic;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

/// Turns instruction text into [FieldCode] values with stable `field_N` ids.
///
/// One reader is meant to serve one conversion job so ids are numbered per document.
/// The counter is atomic, so a reader may also be shared between threads.
public final class FieldCodeReader {

    private static final Logger LOG = Logger.getLogger(FieldCodeReader.class.getName());

    private final AtomicInteger idCounter = new AtomicInteger();

    /// Reads a simple field instruction.
    /// @return the field code, or empty when the instruction is blank
    public Optional<FieldCode> read(String instruction) {
        return read(instruction, List.of());
    }

    /// Reads an instruction that textually contains the given already-read fields.
    /// @return the field code, or empty when the instruction is blank
    public Optional<FieldCode> read(String instruction, List<FieldCode> nestedFields) {
        if (instruction == null || instruction.isBlank()) {
            return Optional.empty();
        }
        final String text = instruction.strip();
        final String id = "field_" + idCounter.incrementAndGet();
        final FieldCodeType type = FieldInstructions.determineFieldType(text);
        final String fieldName = FieldInstructions.extractFieldName(text, type);
        final Map<String, String> switches = FieldInstructions.extractSwitches(text);

        LOG.fine(() -> "Read field " + id + ": type=" + type + ", name=" + fieldName + ", instruction=" + text);
        return Optional.of(new FieldCode(id, type, text, fieldName, switches, nestedFields));
    }
}
