package rdl.core.logic;

/// Kinds of embedded field instructions recognised in source documents.
public enum FieldCodeType {
    UNKNOWN,
    /// MERGEFIELD - data binding field
    MERGE_FIELD,
    /// IF - conditional field
    IF,
    DATE,
    /// PAGE - current page number
    PAGE,
    /// NUMPAGES - total page count
    NUM_PAGES,
    TIME,
    /// `= expression` or FORMULA
    FORMULA,
    /// SEQ - sequence numbering
    SEQUENCE,
    TABLE_OF_CONTENTS,
    HYPERLINK
}
