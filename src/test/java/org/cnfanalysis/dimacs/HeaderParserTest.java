package org.cnfanalysis.dimacs;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

class HeaderParserTest {

    private final HeaderParser parser = new HeaderParser();

    @Test
    @DisplayName("Header standard")
    void standardHeader() throws DimacsParseException {
        HeaderDeclaration header = parser.parse("p cnf 3 2", 1);

        assertThat(header.variables()).isEqualTo(3);
        assertThat(header.clauses()).isEqualTo(2);
        assertThat(header.lineNumber()).isEqualTo(1);
    }

    @Test
    @DisplayName("Parole chiave senza distinzione di maiuscole e spaziatura libera")
    void caseInsensitiveAndFreeSpacing() throws DimacsParseException {
        HeaderDeclaration header = parser.parse("  P\tCNF   120    4000  ", 5);

        assertThat(header.variables()).isEqualTo(120);
        assertThat(header.clauses()).isEqualTo(4000);
    }

    @Test
    @DisplayName("Il numero di clausole può superare il range di int")
    void largeClauseCount() throws DimacsParseException {
        assertThat(parser.parse("p cnf 1 5000000000", 1).clauses()).isEqualTo(5_000_000_000L);
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "p cnf 3", "p cnf", "p dnf 3 2", "p cnf 3 2 1", "p cnf -3 2", "p cnf x 2",
            "p cnf 3 2 c", "p cnf 99999999999 1", "p cnf 1 99999999999999999999",
            "pcnf 3 2", "p cnf3 2", "p cnf 3 2x", "pcnf3 2"
    })
    @DisplayName("Forme non valide sono MALFORMED_HEADER con il numero di riga")
    void malformedHeaders(String line) {
        assertThatThrownBy(() -> parser.parse(line, 9))
                .isInstanceOf(DimacsParseException.class)
                .satisfies(e -> {
                    DimacsParseException error = (DimacsParseException) e;
                    assertThat(error.getKind()).isEqualTo(ParseErrorKind.MALFORMED_HEADER);
                    assertThat(error.getLineNumber()).isEqualTo(9);
                });
    }
}
