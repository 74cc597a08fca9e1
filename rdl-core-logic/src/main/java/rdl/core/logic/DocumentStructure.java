package rdl.core.logic;

import java.util.List;
import java.util.Objects;

/// Structural view of a decomposed source document: pages of paragraphs of runs.
/// A run may carry the field code found at its position.
public record DocumentStructure(List<Page> pages) {

    public DocumentStructure {
        Objects.requireNonNull(pages, "pages must not be null");
        pages = List.copyOf(pages); // defensive copy
    }

    public record Page(int number, List<Paragraph> paragraphs) {
        public Page {
            Objects.requireNonNull(paragraphs, "paragraphs must not be null");
            paragraphs = List.copyOf(paragraphs); // defensive copy
        }
    }

    public record Paragraph(List<Run> runs) {
        public Paragraph {
            Objects.requireNonNull(runs, "runs must not be null");
            runs = List.copyOf(runs); // defensive copy
        }
    }

    /// A run of text; `fieldCode` is null for plain text.
    public record Run(String text, FieldCode fieldCode) {
        public Run {
            Objects.requireNonNull(text, "text must not be null");
        }

        public static Run text(String text) {
            return new Run(text, null);
        }

        public static Run field(FieldCode fieldCode) {
            Objects.requireNonNull(fieldCode, "fieldCode must not be null");
            return new Run("", fieldCode);
        }
    }
}
