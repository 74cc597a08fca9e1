package rdl.core.translation;

import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SandboxValidatorTest extends TranslationTestBase {

    private final SandboxValidator validator = new SandboxValidator(SandboxPolicy.DEFAULT);

    @Test
    void aggregateOverFieldIsValid() {
        final ValidationResult result = validator.validate("Sum(Fields!Amount.Value)");
        assertThat(result.isValid()).isTrue();
        assertThat(result.violations()).isEmpty();
        assertThat(result.messages()).isEmpty();
    }

    @Test
    void fileSystemAccessIsInvalid() {
        final ValidationResult result = validator.validate("System.IO.File.ReadAllText(\"x\")");
        assertThat(result.isValid()).isFalse();
        assertThat(result.violations()).isNotEmpty();
        assertThat(result.errors()).isNotEmpty();
        assertThat(result.errors()).extracting(ValidationMessage::code)
                .contains(SandboxValidator.PROHIBITED_PATTERN, SandboxValidator.NAMESPACE_ACCESS);
    }

    @Test
    void unknownFunctionIsOnlyAWarning() {
        final ValidationResult result = validator.validate("Foo(Fields!X.Value)");
        assertThat(result.isValid()).isTrue();
        assertThat(result.violations()).isEmpty();
        assertThat(result.messages()).singleElement().satisfies(message -> {
            assertThat(message.severity()).isEqualTo(Severity.WARNING);
            assertThat(message.code()).isEqualTo(SandboxValidator.UNKNOWN_FUNCTION);
            assertThat(message.text()).contains("Foo");
        });
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "=Shell(\"cmd\")",
            "=CreateObject (\"Scripting.FileSystemObject\")",
            "=system.net.WebClient",
            "=Type.GetType(\"X\")",
            "=Environ(\"PATH\")"
    })
    void deniedPatternsAreViolations(String expression) {
        final ValidationResult result = validator.validate(expression);
        assertThat(result.isValid()).isFalse();
        assertThat(result.errors()).extracting(ValidationMessage::code).contains(SandboxValidator.PROHIBITED_PATTERN);
    }

    @Test
    void allFindingsAreAccumulated() {
        final ValidationResult result = validator.validate("=Shell(\"a\") & Environ(\"b\") & Bar(1)");
        assertThat(result.violations()).hasSize(2);
        assertThat(result.errors()).hasSize(2);
        assertThat(result.warnings()).extracting(ValidationMessage::text)
                .anySatisfy(text -> assertThat(text).contains("Bar"));
    }

    @Test
    void namespaceAccessOutsideAllowListIsViolation() {
        final ValidationResult result = validator.validate("=Environment.Version");
        assertThat(result.isValid()).isFalse();
        assertThat(result.violations()).containsExactly("Access to namespace not allowed: Environment.Version");
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "=System.Math.Round(Fields!Price.Value, 2)",
            "=Microsoft.VisualBasic.Strings.Left(Fields!Name.Value, 3)",
            "=Fields!Amount.IsMissing",
            "=Parameters!Region.Value & Globals!PageNumber",
            "=Code.Helper.Format(1)",
            "=IIf(IsNothing(Fields!Total.Value), 0, Fields!Total.Value)"
    })
    void allowedNamesAndBuiltInCollectionsPass(String expression) {
        assertThat(validator.validate(expression).isValid()).isTrue();
    }

    @Test
    void functionNamesCompareCaseInsensitively() {
        assertThat(validator.validate("=sum(Fields!A.Value) + ucase(\"x\")").messages()).isEmpty();
    }

    @Test
    void validateOrThrowCarriesEveryViolation() {
        assertThatThrownBy(() -> validator.validateOrThrow("=Shell(\"x\") & Process.Start(\"y\")"))
                .isInstanceOf(SandboxViolationException.class)
                .hasMessageStartingWith("Expression violates sandbox security rules: ")
                .satisfies(e -> {
                    final var violation = (SandboxViolationException) e;
                    assertThat(violation.expression()).isEqualTo("=Shell(\"x\") & Process.Start(\"y\")");
                    assertThat(violation.violations()).hasSizeGreaterThanOrEqualTo(2);
                });
    }

    @Test
    void violationExceptionIsSerializable() throws Exception {
        final var original = new SandboxViolationException("=Shell(\"x\")", List.of("Prohibited pattern detected: Shell\\s*\\("));
        final var bytes = new java.io.ByteArrayOutputStream();
        try (var out = new java.io.ObjectOutputStream(bytes)) {
            out.writeObject(original);
        }
        try (var in = new java.io.ObjectInputStream(new java.io.ByteArrayInputStream(bytes.toByteArray()))) {
            final var copy = (SandboxViolationException) in.readObject();
            assertThat(copy.expression()).isEqualTo(original.expression());
            assertThat(copy.violations()).isEqualTo(original.violations());
            assertThat(copy).hasMessage(original.getMessage());
        }
    }

    @Test
    void validateOrThrowAcceptsValidExpression() {
        assertThatCode(() -> validator.validateOrThrow("=Fields!A.Value")).doesNotThrowAnyException();
    }

    @Test
    void additionalFunctionsSilenceWarnings() {
        final var widened = new SandboxValidator(SandboxPolicy.DEFAULT.withAdditionalFunctions(List.of("Foo")));
        assertThat(widened.validate("Foo(Fields!X.Value)").messages()).isEmpty();
    }

    @Property(tries = 300)
    void validityMatchesViolations(@ForAll String expression) {
        final ValidationResult result = validator.validate(expression);
        assertThat(result.isValid()).isEqualTo(result.violations().isEmpty());
        assertThat(result.errors()).hasSameSizeAs(result.violations());
    }
}
