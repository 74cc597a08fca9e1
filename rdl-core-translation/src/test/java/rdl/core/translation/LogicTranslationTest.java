package rdl.core.translation;

import org.junit.jupiter.api.Test;
import rdl.core.logic.ExpressionAst;
import rdl.core.logic.ExpressionAst.*;
import rdl.core.logic.FieldCodeParser;
import rdl.core.logic.FieldCodeReader;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class LogicTranslationTest extends TranslationTestBase {

    private final LogicTranslation translation = new LogicTranslation(
            new ExpressionGenerator(), new ExpressionOptimizer(), new SandboxValidator(SandboxPolicy.DEFAULT));

    @Test
    void translatesIfFieldEndToEnd() {
        final ExpressionAst ast = new FieldCodeParser().parse(new FieldCodeReader()
                .read("IF { MERGEFIELD Amount } > 100 \"High\" \"Low\"").orElseThrow());

        assertThat(translation.translateToExpression(ast))
                .isEqualTo("=IIf(Fields!Amount.Value > 100, \"High\", \"Low\")");
    }

    @Test
    void translationReturnsTextEvenWhenSandboxRejectsIt() {
        final var call = new FunctionCall("Shell", List.of(new Literal("cmd")));
        assertThat(translation.translateToExpression(call)).isEqualTo("=Shell(\"cmd\")");
    }

    @Test
    void compileOptimizesValidatesAndCollectsReferences() {
        final var ast = new Conditional(new Literal(true),
                new BinaryOperation("+", new FieldReference("Net"), new FieldReference("Tax")),
                new ParameterReference("Fallback"));

        final CompiledExpression compiled = translation.compile(ast);

        assertThat(compiled.expression()).isEqualTo("=Fields!Net.Value + Fields!Tax.Value");
        assertThat(compiled.isValid()).isTrue();
        assertThat(compiled.errors()).isEmpty();
        assertThat(compiled.warnings()).isEmpty();
        assertThat(compiled.referencedFields()).containsExactlyInAnyOrder("Net", "Tax");
        assertThat(compiled.referencedParameters()).containsExactly("Fallback");
    }

    @Test
    void compileReportsSandboxFindings() {
        final var ast = new FunctionCall("Foo", List.of(new FunctionCall("Shell", List.of(new Literal("x")))));

        final CompiledExpression compiled = translation.compile(ast);

        assertThat(compiled.isValid()).isFalse();
        assertThat(compiled.errors()).extracting(ValidationMessage::code).containsOnly(SandboxValidator.PROHIBITED_PATTERN);
        assertThat(compiled.warnings()).hasSize(2);
    }

    @Test
    void delegatesOptimizationAndValidation() {
        assertThat(translation.optimizeExpression("((Fields!A.Value))")).isEqualTo("(Fields!A.Value)");
        assertThat(translation.validateExpression("=Fields!A.Value").isValid()).isTrue();
    }
}
