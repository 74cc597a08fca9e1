package rdl.core.logic;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Reconstructs complex-field instructions from a Begin/Separate/End marker stream.
///
/// The scanner keeps an explicit state and an explicit stack of partially built
/// instructions, so arbitrarily deep nesting in malformed input never grows the call stack.
/// A nested field is emitted on its own and also attached to its parent, whose instruction
/// text receives `{ <nested instruction> }` at the point where the nested field occurred.
public final class ComplexFieldAssembler {

    private static final Logger LOG = Logger.getLogger(ComplexFieldAssembler.class.getName());

    enum State { NOT_IN_FIELD, IN_FIELD }

    /// An instruction under construction.
    private static final class Frame {
        final StringBuilder instruction = new StringBuilder();
        final List<FieldCode> nested = new ArrayList<>();
        boolean separated;
    }

    private final FieldCodeReader reader;

    public ComplexFieldAssembler(FieldCodeReader reader) {
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
    }

    /// Scans the token stream and returns every completed field in completion order
    /// (a nested field precedes the field that contains it).
    /// Fields still open at the end of the stream are dropped.
    /// @param tokens the field-character stream of a document part
    /// @return the completed field codes
    public List<FieldCode> assemble(List<RunToken> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        final List<FieldCode> fieldCodes = new ArrayList<>();
        final Deque<Frame> stack = new ArrayDeque<>();
        State state = State.NOT_IN_FIELD;

        for (final RunToken token : tokens) {
            if (token instanceof RunToken.Begin) {
                if (state == State.IN_FIELD) {
                    LOG.finer(() -> "Nested field begins at depth " + stack.size());
                }
                stack.push(new Frame());
                state = State.IN_FIELD;
            } else if (token instanceof RunToken.Separate) {
                if (state == State.IN_FIELD) {
                    stack.peek().separated = true;
                }
            } else if (token instanceof RunToken.InstructionText text) {
                if (state == State.IN_FIELD && !stack.peek().separated) {
                    stack.peek().instruction.append(text.text());
                }
            } else if (token instanceof RunToken.End) {
                if (state == State.NOT_IN_FIELD) {
                    LOG.finer(() -> "Ignoring End marker outside of a field");
                    continue;
                }
                final Frame frame = stack.pop();
                final Optional<FieldCode> fieldCode = reader.read(frame.instruction.toString(), frame.nested);
                fieldCode.ifPresent(fieldCodes::add);

                final Frame parent = stack.peek();
                if (parent == null) {
                    state = State.NOT_IN_FIELD;
                } else if (fieldCode.isPresent()) {
                    parent.nested.add(fieldCode.get());
                    if (!parent.separated) {
                        parent.instruction.append("{ ").append(fieldCode.get().rawCode()).append(" }");
                    }
                }
            }
            // ResultText never contributes to an instruction
        }

        if (!stack.isEmpty()) {
            final int open = stack.size();
            LOG.fine(() -> "Dropping " + open + " unterminated field(s) at end of stream");
        }
        LOG.fine(() -> "Assembled " + fieldCodes.size() + " complex field(s)");
        return fieldCodes;
    }
}
