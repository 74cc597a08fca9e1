package rdl.core.translation;

import java.util.List;
import java.util.Set;

/// A generated, optimized and validated report expression together with the data it reads.
/// @param expression the final expression text, starting with `=`
/// @param isValid true when the sandbox found no violations
/// @param errors error messages of the sandbox validation
/// @param warnings warning messages of the sandbox validation
/// @param referencedFields names of the dataset fields the expression reads
/// @param referencedParameters names of the report parameters the expression reads
public record CompiledExpression(String expression, boolean isValid, List<ValidationMessage> errors,
                                 List<ValidationMessage> warnings, Set<String> referencedFields,
                                 Set<String> referencedParameters) {

    public CompiledExpression {
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
        referencedFields = Set.copyOf(referencedFields);
        referencedParameters = Set.copyOf(referencedParameters);
    }
}
