package rdl.core.logic;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.IntRange;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static rdl.core.logic.RunToken.*;

class ComplexFieldAssemblerTest extends LogicTestBase {

    private final ComplexFieldAssembler assembler = new ComplexFieldAssembler(new FieldCodeReader());

    @Test
    void assemblesSimpleField() {
        final List<FieldCode> fields = assembler.assemble(List.of(
                begin(), instruction(" MERGEFIELD "), instruction("Name "), separate(), result("«Name»"), end()));

        assertThat(fields).hasSize(1);
        assertThat(fields.get(0).rawCode()).isEqualTo("MERGEFIELD Name");
        assertThat(fields.get(0).type()).isEqualTo(FieldCodeType.MERGE_FIELD);
        assertThat(fields.get(0).fieldName()).isEqualTo("Name");
    }

    @Test
    void nestedFieldIsEmittedFirstAndEmbeddedInParent() {
        final List<FieldCode> fields = assembler.assemble(List.of(
                begin(), instruction("IF "),
                begin(), instruction(" MERGEFIELD Amount "), separate(), result("150"), end(),
                instruction(" > 100 \"High\" \"Low\" "), separate(), result("High"), end()));

        assertThat(fields).extracting(FieldCode::type).containsExactly(FieldCodeType.MERGE_FIELD, FieldCodeType.IF);
        final FieldCode inner = fields.get(0);
        final FieldCode outer = fields.get(1);
        assertThat(outer.rawCode()).isEqualTo("IF { MERGEFIELD Amount } > 100 \"High\" \"Low\"");
        assertThat(outer.nestedFields()).containsExactly(inner);
    }

    @Test
    void resultTextAndInstructionsAfterSeparateAreIgnored() {
        final List<FieldCode> fields = assembler.assemble(List.of(
                begin(), instruction("PAGE"), separate(), instruction("junk"), result("3"), end()));

        assertThat(fields).singleElement().extracting(FieldCode::rawCode).isEqualTo("PAGE");
    }

    @Test
    void endOutsideOfFieldIsIgnored() {
        final List<FieldCode> fields = assembler.assemble(List.of(
                end(), begin(), instruction("NUMPAGES"), end(), end()));

        assertThat(fields).singleElement().extracting(FieldCode::type).isEqualTo(FieldCodeType.NUM_PAGES);
    }

    @Test
    void unterminatedFieldIsDropped() {
        final List<FieldCode> fields = assembler.assemble(List.of(
                begin(), instruction("PAGE"), end(), begin(), instruction("MERGEFIELD X")));

        assertThat(fields).singleElement().extracting(FieldCode::type).isEqualTo(FieldCodeType.PAGE);
    }

    @Test
    void emptyFieldProducesNothing() {
        assertThat(assembler.assemble(List.of(begin(), separate(), result("x"), end()))).isEmpty();
    }

    @Property(tries = 50)
    void deepNestingYieldsOneFieldPerLevel(@ForAll @IntRange(min = 1, max = 300) int depth) {
        final List<RunToken> tokens = new ArrayList<>();
        for (int i = 0; i < depth; i++) {
            tokens.add(begin());
            tokens.add(instruction("PAGE "));
        }
        for (int i = 0; i < depth; i++) {
            tokens.add(end());
        }

        final List<FieldCode> fields = new ComplexFieldAssembler(new FieldCodeReader()).assemble(tokens);

        assertThat(fields).hasSize(depth);
        assertThat(fields.get(0).rawCode()).isEqualTo("PAGE");
        assertThat(fields.get(0).nestedFields()).isEmpty();
        assertThat(fields.get(depth - 1).type()).isEqualTo(FieldCodeType.PAGE);
    }
}
