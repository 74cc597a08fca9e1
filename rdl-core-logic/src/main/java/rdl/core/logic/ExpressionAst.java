package rdl.core.logic;

import java.math.BigInteger;
import java.time.temporal.Temporal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/// AST representation for field-code logic and report expressions.
///
/// Every node is one of a closed set of records, each reporting its [NodeType] so that
/// consumers can switch exhaustively over the kind:
/// - Literal: a scalar (string, number, boolean, temporal or null)
/// - FieldReference / ParameterReference / GlobalReference: symbolic names
/// - BinaryOperation / UnaryOperation: an operator and its operands
/// - FunctionCall: a name and its arguments in call order
/// - Conditional: `IIf(condition, trueValue[, falseValue])`
/// - Aggregate: an aggregate function over an operand with an optional scope
///
/// Nodes are immutable and built top-down; children lists are defensive copies.
public sealed interface ExpressionAst {

    /// Tag of a node kind.
    enum NodeType {
        LITERAL,
        FIELD_REFERENCE,
        PARAMETER_REFERENCE,
        GLOBAL_REFERENCE,
        BINARY_OPERATION,
        UNARY_OPERATION,
        FUNCTION_CALL,
        CONDITIONAL,
        AGGREGATE
    }

    /// The kind of this node.
    NodeType nodeType();

    /// The node payload: literal scalar, symbolic name, function name or the `IIf` tag.
    /// Null for operations.
    Object value();

    /// Child nodes in their semantic order; empty for leaves.
    List<ExpressionAst> children();

    /// Source span and inferred data type, never null.
    Metadata metadata();

    /// The operator of a binary or unary operation, null otherwise.
    default String operatorSymbol() {
        return null;
    }

    /// Source text, optional positions and inferred data-type name of a node.
    record Metadata(String sourceText, Integer startPosition, Integer endPosition, String dataType) {

        /// Metadata carrying nothing.
        public static final Metadata NONE = new Metadata(null, null, null, null);

        public static Metadata of(String sourceText, String dataType) {
            return new Metadata(sourceText, null, null, dataType);
        }

        public static Metadata source(String sourceText) {
            return new Metadata(sourceText, null, null, null);
        }
    }

    record Literal(Object value, Metadata metadata) implements ExpressionAst {
        public Literal {
            metadata = metadata == null ? Metadata.of(value == null ? null : value.toString(), dataTypeOf(value)) : metadata;
        }

        /// Creates a literal whose data type is inferred from the runtime kind of the value.
        public Literal(Object value) {
            this(value, null);
        }

        @Override
        public NodeType nodeType() {
            return NodeType.LITERAL;
        }

        @Override
        public List<ExpressionAst> children() {
            return List.of();
        }

        /// Infers `Integer`, `Number`, `Boolean`, `DateTime` or `String` from a literal value.
        public static String dataTypeOf(Object value) {
            if (value instanceof Integer || value instanceof Long || value instanceof Short
                    || value instanceof Byte || value instanceof BigInteger) {
                return "Integer";
            }
            if (value instanceof Number) {
                return "Number";
            }
            if (value instanceof Boolean) {
                return "Boolean";
            }
            if (value instanceof Temporal) {
                return "DateTime";
            }
            return "String";
        }
    }

    record FieldReference(String name, Metadata metadata) implements ExpressionAst {
        public FieldReference {
            Objects.requireNonNull(name, "name must not be null");
            metadata = metadata == null ? Metadata.NONE : metadata;
        }

        public FieldReference(String name) {
            this(name, null);
        }

        @Override
        public NodeType nodeType() {
            return NodeType.FIELD_REFERENCE;
        }

        @Override
        public Object value() {
            return name;
        }

        @Override
        public List<ExpressionAst> children() {
            return List.of();
        }
    }

    record ParameterReference(String name, Metadata metadata) implements ExpressionAst {
        public ParameterReference {
            Objects.requireNonNull(name, "name must not be null");
            metadata = metadata == null ? Metadata.NONE : metadata;
        }

        public ParameterReference(String name) {
            this(name, null);
        }

        @Override
        public NodeType nodeType() {
            return NodeType.PARAMETER_REFERENCE;
        }

        @Override
        public Object value() {
            return name;
        }

        @Override
        public List<ExpressionAst> children() {
            return List.of();
        }
    }

    /// Reference to a report-wide value such as `PageNumber` or `ExecutionTime`.
    record GlobalReference(String name, Metadata metadata) implements ExpressionAst {
        public GlobalReference {
            Objects.requireNonNull(name, "name must not be null");
            metadata = metadata == null ? Metadata.NONE : metadata;
        }

        public GlobalReference(String name) {
            this(name, null);
        }

        @Override
        public NodeType nodeType() {
            return NodeType.GLOBAL_REFERENCE;
        }

        @Override
        public Object value() {
            return name;
        }

        @Override
        public List<ExpressionAst> children() {
            return List.of();
        }
    }

    record BinaryOperation(String operatorSymbol, ExpressionAst left, ExpressionAst right, Metadata metadata)
            implements ExpressionAst {
        public BinaryOperation {
            Objects.requireNonNull(operatorSymbol, "operatorSymbol must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
            metadata = metadata == null ? Metadata.NONE : metadata;
        }

        public BinaryOperation(String operatorSymbol, ExpressionAst left, ExpressionAst right) {
            this(operatorSymbol, left, right, null);
        }

        @Override
        public NodeType nodeType() {
            return NodeType.BINARY_OPERATION;
        }

        @Override
        public Object value() {
            return null;
        }

        @Override
        public List<ExpressionAst> children() {
            return List.of(left, right);
        }
    }

    record UnaryOperation(String operatorSymbol, ExpressionAst operand, Metadata metadata) implements ExpressionAst {
        public UnaryOperation {
            Objects.requireNonNull(operatorSymbol, "operatorSymbol must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
            metadata = metadata == null ? Metadata.NONE : metadata;
        }

        public UnaryOperation(String operatorSymbol, ExpressionAst operand) {
            this(operatorSymbol, operand, null);
        }

        @Override
        public NodeType nodeType() {
            return NodeType.UNARY_OPERATION;
        }

        @Override
        public Object value() {
            return null;
        }

        @Override
        public List<ExpressionAst> children() {
            return List.of(operand);
        }
    }

    record FunctionCall(String name, List<ExpressionAst> arguments, Metadata metadata) implements ExpressionAst {
        public FunctionCall {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(arguments, "arguments must not be null");
            arguments = List.copyOf(arguments); // defensive copy
            metadata = metadata == null ? Metadata.NONE : metadata;
        }

        public FunctionCall(String name, List<ExpressionAst> arguments) {
            this(name, arguments, null);
        }

        @Override
        public NodeType nodeType() {
            return NodeType.FUNCTION_CALL;
        }

        @Override
        public Object value() {
            return name;
        }

        @Override
        public List<ExpressionAst> children() {
            return arguments;
        }
    }

    /// `IIf(condition, trueValue, falseValue)`; `falseValue` may be null.
    record Conditional(ExpressionAst condition, ExpressionAst trueValue, ExpressionAst falseValue, Metadata metadata)
            implements ExpressionAst {

        /// Value tag carried by every conditional node.
        public static final String IIF = "IIf";

        public Conditional {
            Objects.requireNonNull(condition, "condition must not be null");
            Objects.requireNonNull(trueValue, "trueValue must not be null");
            metadata = metadata == null ? Metadata.NONE : metadata;
        }

        public Conditional(ExpressionAst condition, ExpressionAst trueValue, ExpressionAst falseValue) {
            this(condition, trueValue, falseValue, null);
        }

        @Override
        public NodeType nodeType() {
            return NodeType.CONDITIONAL;
        }

        @Override
        public Object value() {
            return IIF;
        }

        @Override
        public List<ExpressionAst> children() {
            return falseValue == null ? List.of(condition, trueValue) : List.of(condition, trueValue, falseValue);
        }
    }

    /// Aggregate such as `Sum(Fields!Amount.Value, "DataSet1")`; the first argument is the
    /// operand, an optional second argument the scope.
    record Aggregate(String function, List<ExpressionAst> arguments, Metadata metadata) implements ExpressionAst {
        public Aggregate {
            Objects.requireNonNull(function, "function must not be null");
            Objects.requireNonNull(arguments, "arguments must not be null");
            if (arguments.isEmpty() || arguments.size() > 2) {
                throw new IllegalArgumentException("Aggregate must have an operand and at most one scope, got "
                        + arguments.size() + " arguments");
            }
            arguments = List.copyOf(arguments); // defensive copy
            metadata = metadata == null ? Metadata.NONE : metadata;
        }

        public Aggregate(String function, List<ExpressionAst> arguments) {
            this(function, arguments, null);
        }

        @Override
        public NodeType nodeType() {
            return NodeType.AGGREGATE;
        }

        @Override
        public Object value() {
            return function;
        }

        @Override
        public List<ExpressionAst> children() {
            return arguments;
        }
    }

    /// Returns this node and all of its descendants in pre-order.
    default List<ExpressionAst> preOrder() {
        final List<ExpressionAst> out = new ArrayList<>();
        final var stack = new ArrayList<ExpressionAst>();
        stack.add(this);
        while (!stack.isEmpty()) {
            final ExpressionAst node = stack.remove(stack.size() - 1);
            out.add(node);
            final List<ExpressionAst> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.add(children.get(i));
            }
        }
        return out;
    }
}
