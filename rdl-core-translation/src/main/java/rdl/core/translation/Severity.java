package rdl.core.translation;

/// Severity of a [ValidationMessage]. Only errors make an expression invalid.
public enum Severity {
    INFO,
    WARNING,
    ERROR
}
