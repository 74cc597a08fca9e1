package rdl.core.logic;

import java.util.Objects;

/// The field-character stream found inside the runs of a richly formatted document.
///
/// A complex field is written as `Begin`, instruction text, optional `Separate` followed by
/// the cached result text, then `End`. Fields may nest between any of these markers.
public sealed interface RunToken {

    /// Start of a field.
    record Begin() implements RunToken {}

    /// End of the instruction text, start of the cached result.
    record Separate() implements RunToken {}

    /// End of a field.
    record End() implements RunToken {}

    /// A fragment of instruction text (`w:instrText`).
    record InstructionText(String text) implements RunToken {
        public InstructionText {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    /// A fragment of displayed result text (`w:t`); never part of an instruction.
    record ResultText(String text) implements RunToken {
        public ResultText {
            Objects.requireNonNull(text, "text must not be null");
        }
    }

    static RunToken begin() {
        return new Begin();
    }

    static RunToken separate() {
        return new Separate();
    }

    static RunToken end() {
        return new End();
    }

    static RunToken instruction(String text) {
        return new InstructionText(text);
    }

    static RunToken result(String text) {
        return new ResultText(text);
    }
}
