package rdl.core.logic;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;
import java.util.logging.Logger;

/// Entry point of the decomposition phase: collects the field codes of a document, turns
/// IF fields into conditional branches and FORMULA fields into formulas, and builds ASTs for
/// free-standing expressions.
///
/// Instances are cheap; create one per conversion job so that field ids restart at `field_1`.
public final class LogicDecomposition {

    private static final Logger LOG = Logger.getLogger(LogicDecomposition.class.getName());

    private final FieldCodeParser fieldCodeParser;
    private final ConditionalAnalyzer conditionalAnalyzer;
    private final AstBuilder astBuilder;
    private final ComplexFieldAssembler assembler;

    public LogicDecomposition() {
        this(new FieldCodeParser(), new AstBuilder(), new FieldCodeReader());
    }

    public LogicDecomposition(FieldCodeParser fieldCodeParser, AstBuilder astBuilder, FieldCodeReader reader) {
        this.fieldCodeParser = Objects.requireNonNull(fieldCodeParser, "fieldCodeParser must not be null");
        this.astBuilder = Objects.requireNonNull(astBuilder, "astBuilder must not be null");
        this.conditionalAnalyzer = new ConditionalAnalyzer(fieldCodeParser);
        this.assembler = new ComplexFieldAssembler(Objects.requireNonNull(reader, "reader must not be null"));
    }

    /// Extracts field codes, conditions and formulas from a document.
    /// The calling thread's interrupt flag is checked once per field code.
    /// @throws CancellationException if the thread is interrupted during extraction
    public LogicExtractionResult extractFieldCodes(DocumentStructure document) {
        Objects.requireNonNull(document, "document must not be null");
        LOG.fine(() -> "Extracting field codes from " + document.pages().size() + " page(s)");

        final List<FieldCode> fieldCodes = new ArrayList<>();
        for (final var page : document.pages()) {
            for (final var paragraph : page.paragraphs()) {
                for (final var run : paragraph.runs()) {
                    if (run.fieldCode() == null) {
                        continue;
                    }
                    if (Thread.interrupted()) {
                        throw new CancellationException("Field-code extraction cancelled on page " + page.number());
                    }
                    fieldCodes.add(run.fieldCode());
                }
            }
        }

        final List<String> warnings = new ArrayList<>();
        final List<ConditionalBranch> conditions = conditionalAnalyzer.analyzeConditions(fieldCodes);
        final long ifCount = fieldCodes.stream().filter(f -> f.type() == FieldCodeType.IF).count();
        if (ifCount > conditions.size()) {
            warnings.add((ifCount - conditions.size()) + " IF field(s) could not be decomposed into conditions");
        }
        final List<CalculationFormula> formulas = extractFormulas(fieldCodes);

        LOG.info(() -> "Extracted " + fieldCodes.size() + " field codes, " + conditions.size()
                + " conditions, " + formulas.size() + " formulas");
        return new LogicExtractionResult(fieldCodes, conditions, formulas, warnings);
    }

    /// Reconstructs complex fields from a document part's field-character stream.
    public List<FieldCode> assembleFieldCodes(List<RunToken> tokens) {
        return assembler.assemble(tokens);
    }

    /// Builds the AST of a free-standing expression.
    public ExpressionAst buildAst(String expression) {
        LOG.fine(() -> "Building AST for expression: " + expression);
        return astBuilder.build(expression);
    }

    /// Flattens the nested conditionals of every branch and removes logical duplicates.
    public List<ConditionalBranch> identifyConditions(LogicExtractionResult result) {
        Objects.requireNonNull(result, "result must not be null");
        LOG.fine(() -> "Identifying conditions from " + result.fieldCodes().size() + " field codes");
        final List<ConditionalBranch> flattened = new ArrayList<>();
        for (final ConditionalBranch branch : result.conditions()) {
            flattened.addAll(conditionalAnalyzer.flattenNestedConditions(branch));
        }
        return ConditionalAnalyzer.distinctByLogic(flattened);
    }

    /// True when the branches all test the same field and could become one `Switch`.
    public boolean canConvertToSwitch(List<ConditionalBranch> branches) {
        return conditionalAnalyzer.canConvertToSwitch(branches);
    }

    private List<CalculationFormula> extractFormulas(List<FieldCode> fieldCodes) {
        final List<CalculationFormula> formulas = new ArrayList<>();
        for (final FieldCode fieldCode : fieldCodes) {
            if (fieldCode.type() != FieldCodeType.FORMULA) {
                continue;
            }
            final ExpressionAst ast = fieldCodeParser.parse(fieldCode);
            formulas.add(new CalculationFormula("formula_" + (formulas.size() + 1), fieldCode.rawCode(),
                    ast, fieldCode.id()));
        }
        return formulas;
    }
}
