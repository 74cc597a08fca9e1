package rdl.core.logic;

import rdl.core.logic.ExpressionAst.*;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Groups IF fields into [ConditionalBranch] values and flattens conditionals nested
/// anywhere inside a branch.
public final class ConditionalAnalyzer {

    private static final Logger LOG = Logger.getLogger(ConditionalAnalyzer.class.getName());

    private final FieldCodeParser parser;

    public ConditionalAnalyzer(FieldCodeParser parser) {
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    /// Projects every IF field that parses into a conditional onto a branch `cond_N`.
    /// IF fields that degrade to a literal are skipped with a warning.
    public List<ConditionalBranch> analyzeConditions(List<FieldCode> fieldCodes) {
        Objects.requireNonNull(fieldCodes, "fieldCodes must not be null");
        final List<ConditionalBranch> branches = new ArrayList<>();
        for (final FieldCode fieldCode : fieldCodes) {
            if (fieldCode.type() != FieldCodeType.IF) {
                continue;
            }
            final ExpressionAst ast = parser.parse(fieldCode);
            if (!(ast instanceof Conditional)) {
                LOG.warning(() -> "Unable to extract conditional from field: " + fieldCode.rawCode());
                continue;
            }
            final String id = "cond_" + (branches.size() + 1);
            branches.add(ConditionalBranch.of(id, (Conditional) ast, fieldCode.id()));
        }
        LOG.fine(() -> "Analyzed " + branches.size() + " conditional branch(es)");
        return branches;
    }

    /// Returns the branch followed, in pre-order, by one branch per conditional found under
    /// its condition, true value or false value. Each synthesized branch is flattened in turn.
    /// A branch without nested conditionals yields a single-element list.
    public List<ConditionalBranch> flattenNestedConditions(ConditionalBranch branch) {
        Objects.requireNonNull(branch, "branch must not be null");
        final List<ConditionalBranch> out = new ArrayList<>();
        flatten(branch, out);
        return out;
    }

    private void flatten(ConditionalBranch branch, List<ConditionalBranch> out) {
        out.add(branch);
        collectNested(branch, "condition", branch.condition(), out);
        collectNested(branch, "true", branch.trueValue(), out);
        if (branch.falseValue() != null) {
            collectNested(branch, "false", branch.falseValue(), out);
        }
    }

    private void collectNested(ConditionalBranch parent, String slot, ExpressionAst root, List<ConditionalBranch> out) {
        int count = 0;
        final List<ExpressionAst> pending = new ArrayList<>();
        pending.add(root);
        while (!pending.isEmpty()) {
            final ExpressionAst node = pending.remove(pending.size() - 1);
            if (node instanceof Conditional) {
                count++;
                final String id = parent.id() + "_nested_" + slot + (count > 1 ? "_" + count : "");
                LOG.finer(() -> "Nested conditional " + id);
                // children of this node are covered by flattening the synthesized branch
                flatten(ConditionalBranch.of(id, (Conditional) node, parent.sourceLocation()), out);
                continue;
            }
            final List<ExpressionAst> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.add(children.get(i));
            }
        }
    }

    /// Removes branches whose condition, true value and false value equal those of an
    /// earlier branch. Ids and source locations are not compared.
    public static List<ConditionalBranch> distinctByLogic(List<ConditionalBranch> branches) {
        Objects.requireNonNull(branches, "branches must not be null");
        final Map<List<ExpressionAst>, ConditionalBranch> unique = new LinkedHashMap<>();
        for (final ConditionalBranch branch : branches) {
            final List<ExpressionAst> key = new ArrayList<>(3);
            key.add(branch.condition());
            key.add(branch.trueValue());
            key.add(branch.falseValue());
            unique.putIfAbsent(key, branch);
        }
        return List.copyOf(unique.values());
    }

    /// True when the branches could be expressed as one `Switch`: at least two branches whose
    /// conditions all compare the same field.
    public boolean canConvertToSwitch(List<ConditionalBranch> branches) {
        Objects.requireNonNull(branches, "branches must not be null");
        if (branches.size() < 2) {
            return false;
        }
        final String first = testedField(branches.get(0).condition());
        if (first == null) {
            return false;
        }
        for (final ConditionalBranch branch : branches) {
            if (!first.equals(testedField(branch.condition()))) {
                return false;
            }
        }
        return true;
    }

    private static String testedField(ExpressionAst condition) {
        if (condition instanceof BinaryOperation && ((BinaryOperation) condition).left() instanceof FieldReference) {
            return ((FieldReference) ((BinaryOperation) condition).left()).name();
        }
        return null;
    }
}
