package org.cnfanalysis.dimacs;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class LineClassifierTest {

    private final LineClassifier classifier = new LineClassifier();

    @Test
    @DisplayName("Righe vuote e di soli spazi sono BLANK")
    void blankLines() {
        assertThat(classifier.classify("")).isEqualTo(LineKind.BLANK);
        assertThat(classifier.classify("   \t ")).isEqualTo(LineKind.BLANK);
    }

    @Test
    @DisplayName("Commenti, header, marcatore e dati sono riconosciuti dal primo carattere significativo")
    void classifiesByFirstSignificantCharacter() {
        assertThat(classifier.classify("c commento")).isEqualTo(LineKind.COMMENT);
        assertThat(classifier.classify("  c rientrato")).isEqualTo(LineKind.COMMENT);
        assertThat(classifier.classify("p cnf 3 2")).isEqualTo(LineKind.HEADER);
        assertThat(classifier.classify("%")).isEqualTo(LineKind.CLAUSE_TERMINATOR_MARKER);
        assertThat(classifier.classify("  %  ")).isEqualTo(LineKind.CLAUSE_TERMINATOR_MARKER);
        assertThat(classifier.classify("1 -2 0")).isEqualTo(LineKind.CLAUSE_DATA);
    }

    @Test
    @DisplayName("'%' seguito da altro contenuto non è un marcatore")
    void percentWithContentIsData() {
        assertThat(classifier.classify("% 0")).isEqualTo(LineKind.CLAUSE_DATA);
    }

    @Test
    @DisplayName("I prefissi di commento sono configurabili e precedono il marcatore")
    void customCommentPrefixes() {
        LineClassifier custom = new LineClassifier(Set.of('c', '#', '%'));

        assertThat(custom.classify("# nota")).isEqualTo(LineKind.COMMENT);
        assertThat(custom.classify("%")).isEqualTo(LineKind.COMMENT);
        assertThat(classifier.classify("# nota")).isEqualTo(LineKind.CLAUSE_DATA);
    }

    @Test
    @DisplayName("Un insieme di prefissi null è rifiutato")
    void rejectsNullPrefixes() {
        assertThatThrownBy(() -> new LineClassifier(null))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
