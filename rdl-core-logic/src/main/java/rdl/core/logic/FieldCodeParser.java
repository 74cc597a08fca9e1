package rdl.core.logic;

import rdl.core.logic.ExpressionAst.*;

import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Builds the AST of a single [FieldCode] according to its kind.
///
/// | kind | AST |
/// |---|---|
/// | MERGEFIELD | `FieldReference(name)` |
/// | IF | `Conditional(BinaryOperation(op, left, right), true[, false])` |
/// | DATE | `FunctionCall("Format", [Globals!ExecutionTime, format])` |
/// | PAGE / NUMPAGES | `Globals!PageNumber` / `Globals!TotalPages` |
/// | FORMULA | `Literal(expression text)` |
/// | anything else | `Literal(rawCode)` |
///
/// IF operands are read with [#parseValue], which only understands embedded
/// `{ MERGEFIELD Name }` fields, quoted strings and numbers. It does not recognise the
/// `Fields!Name.Value` syntax handled by [AstBuilder].
public final class FieldCodeParser {

    private static final Logger LOG = Logger.getLogger(FieldCodeParser.class.getName());

    /// Format used by DATE fields without a `\@` switch.
    public static final String DEFAULT_DATE_FORMAT = "yyyy-MM-dd";

    private static final Pattern IF_FIELD = Pattern.compile(
            "IF\\s+(?<condition>.+?)\\s+(?<whenTrue>\"[^\"]*\"|\\S+)(?:\\s+(?<whenFalse>\"[^\"]*\"|\\S+))?",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    /// IF with a true value only, tried when the three-part split leaves no comparison.
    private static final Pattern IF_TRUE_ONLY = Pattern.compile(
            "IF\\s+(?<condition>.+?)\\s+(?<whenTrue>\"[^\"]*\"|\\S+)",
            Pattern.CASE_INSENSITIVE | Pattern.DOTALL);

    /// Formatting switches such as `\* MERGEFORMAT` that trail an instruction.
    private static final Pattern TRAILING_SWITCHES = Pattern.compile(
            "(?:\\s+\\\\[#@*!]\\s*(?:\"[^\"]*\"|(?!\\\\)\\S+)?)+$");

    private static final Pattern COMPARISON = Pattern.compile(
            "(?<left>.+?)\\s*(?<op>=|<>|!=|>=|<=|>|<)\\s*(?<right>.+)", Pattern.DOTALL);

    private static final Pattern MERGEFIELD_IN_VALUE = Pattern.compile(
            "\\{\\s*MERGEFIELD\\s+(\\w+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern QUOTED = Pattern.compile("^\"(.*)\"$", Pattern.DOTALL);

    private static final Pattern NUMBER = Pattern.compile("[-+]?(?:\\d+(?:\\.\\d*)?|\\.\\d+)(?:[eE][-+]?\\d+)?");

    private static final Pattern MERGEFIELD_NAME = Pattern.compile("MERGEFIELD\\s+(\\w+)", Pattern.CASE_INSENSITIVE);

    /// Parses a field code into an AST.
    /// @param fieldCode the classified field
    /// @return the AST of the field
    /// @throws ExpressionSyntaxException if a MERGEFIELD has no resolvable name
    public ExpressionAst parse(FieldCode fieldCode) {
        Objects.requireNonNull(fieldCode, "fieldCode must not be null");
        LOG.fine(() -> "Parsing field code: " + fieldCode.rawCode());

        return switch (fieldCode.type()) {
            case MERGE_FIELD -> parseMergeField(fieldCode);
            case IF -> parseIfField(fieldCode);
            case DATE -> parseDateField(fieldCode);
            case PAGE -> new GlobalReference("PageNumber", Metadata.of(fieldCode.rawCode(), "Integer"));
            case NUM_PAGES -> new GlobalReference("TotalPages", Metadata.of(fieldCode.rawCode(), "Integer"));
            case FORMULA -> parseFormula(fieldCode);
            case UNKNOWN, TIME, SEQUENCE, TABLE_OF_CONTENTS, HYPERLINK -> literal(fieldCode.rawCode());
        };
    }

    private ExpressionAst parseMergeField(FieldCode fieldCode) {
        String fieldName = fieldCode.fieldName();
        if (fieldName == null || fieldName.isEmpty()) {
            final Matcher m = MERGEFIELD_NAME.matcher(fieldCode.rawCode());
            fieldName = m.find() ? m.group(1) : null;
        }
        if (fieldName == null || fieldName.isEmpty()) {
            throw new ExpressionSyntaxException("Unable to extract field name from MERGEFIELD", fieldCode.rawCode());
        }
        return new FieldReference(fieldName, Metadata.of(fieldCode.rawCode(), "String"));
    }

    private ExpressionAst parseIfField(FieldCode fieldCode) {
        final String instruction = TRAILING_SWITCHES.matcher(fieldCode.rawCode().strip()).replaceFirst("");
        Matcher m = IF_FIELD.matcher(instruction);
        if (!m.matches()) {
            LOG.warning(() -> "Unable to parse IF field: " + fieldCode.rawCode());
            return literal(fieldCode.rawCode());
        }
        if (m.group("whenFalse") != null && !COMPARISON.matcher(m.group("condition").strip()).matches()) {
            final Matcher trueOnly = IF_TRUE_ONLY.matcher(instruction);
            if (trueOnly.matches() && COMPARISON.matcher(trueOnly.group("condition").strip()).matches()) {
                LOG.finer(() -> "IF field has a true value only: " + fieldCode.rawCode());
                m = trueOnly;
            }
        }

        final ExpressionAst condition = parseCondition(m.group("condition").strip());
        final ExpressionAst whenTrue = parseValue(m.group("whenTrue").strip());
        final String falseText = m.pattern() == IF_FIELD ? m.group("whenFalse") : null;
        final ExpressionAst whenFalse = falseText == null ? null : parseValue(falseText.strip());

        return new Conditional(condition, whenTrue, whenFalse, Metadata.source(fieldCode.rawCode()));
    }

    /// Parses `left op right`; anything else becomes a string literal of the condition text.
    ExpressionAst parseCondition(String condition) {
        final Matcher m = COMPARISON.matcher(condition);
        if (!m.matches()) {
            return literal(condition);
        }
        final ExpressionAst left = parseValue(m.group("left").strip());
        final String op = normalizeOperator(m.group("op"));
        final ExpressionAst right = parseValue(m.group("right").strip());
        return new BinaryOperation(op, left, right, Metadata.of(condition, "Boolean"));
    }

    /// Reads one IF operand: `{ MERGEFIELD Name }`, a quoted string, a number, or raw text.
    ExpressionAst parseValue(String value) {
        final Matcher merge = MERGEFIELD_IN_VALUE.matcher(value);
        if (merge.find()) {
            return new FieldReference(merge.group(1), Metadata.of(value, "String"));
        }
        final Matcher quoted = QUOTED.matcher(value);
        if (quoted.matches()) {
            return literal(quoted.group(1));
        }
        if (NUMBER.matcher(value).matches()) {
            return new Literal(Double.valueOf(value), Metadata.of(value, "Number"));
        }
        return literal(value);
    }

    private static String normalizeOperator(String op) {
        return "!=".equals(op) ? "<>" : op;
    }

    private ExpressionAst parseDateField(FieldCode fieldCode) {
        final String format = fieldCode.switchValue("@", DEFAULT_DATE_FORMAT);
        return new FunctionCall("Format",
                List.of(new GlobalReference("ExecutionTime"), literal(format)),
                Metadata.of(fieldCode.rawCode(), "String"));
    }

    private ExpressionAst parseFormula(FieldCode fieldCode) {
        final String raw = fieldCode.rawCode();
        int start = 0;
        while (start < raw.length() && (raw.charAt(start) == '=' || raw.charAt(start) == ' ')) {
            start++;
        }
        // TODO decompose formula bodies with AstBuilder once FORMULA syntax is mapped to report syntax
        return new Literal(raw.substring(start), Metadata.source(raw));
    }

    private static Literal literal(String value) {
        return new Literal(value, Metadata.of(value, "String"));
    }
}
