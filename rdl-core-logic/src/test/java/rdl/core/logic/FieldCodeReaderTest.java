package rdl.core.logic;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FieldCodeReaderTest extends LogicTestBase {

    @Test
    void numbersFieldsInReadOrder() {
        final var reader = new FieldCodeReader();
        assertThat(reader.read("PAGE").orElseThrow().id()).isEqualTo("field_1");
        assertThat(reader.read("NUMPAGES").orElseThrow().id()).isEqualTo("field_2");
    }

    @Test
    void blankInstructionReadsAsEmpty() {
        final var reader = new FieldCodeReader();
        assertThat(reader.read("  ")).isEmpty();
        assertThat(reader.read(null)).isEmpty();
        assertThat(reader.read("PAGE").orElseThrow().id()).isEqualTo("field_1");
    }

    @Test
    void populatesKindNameAndSwitches() {
        final FieldCode field = new FieldCodeReader().read("  MERGEFIELD Total \\# \"0.00\"  ").orElseThrow();
        assertThat(field.type()).isEqualTo(FieldCodeType.MERGE_FIELD);
        assertThat(field.rawCode()).isEqualTo("MERGEFIELD Total \\# \"0.00\"");
        assertThat(field.fieldName()).isEqualTo("Total");
        assertThat(field.switchValue("#", "none")).isEqualTo("0.00");
        assertThat(field.switchValue("@", "none")).isEqualTo("none");
        assertThat(field.nestedFields()).isEmpty();
    }

    @Test
    void keepsNestedFields() {
        final var reader = new FieldCodeReader();
        final FieldCode inner = reader.read("MERGEFIELD Amount").orElseThrow();
        final FieldCode outer = reader.read("IF { MERGEFIELD Amount } > 1 \"a\" \"b\"", List.of(inner)).orElseThrow();
        assertThat(outer.nestedFields()).containsExactly(inner);
        assertThat(outer.fieldName()).isNull();
    }
}
