package org.cnfanalysis.pipeline;

import org.cnfanalysis.dimacs.DimacsParseException;
import org.cnfanalysis.features.FeatureMap;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

class DimacsAnalyzerTest {

    @Test
    @DisplayName("Analisi da Reader con commenti personalizzati e terminatori CRLF")
    void analyzeReader() throws IOException, DimacsParseException {
        String cnf = """
                c generato
                # altro commento
                p cnf 4 3\r
                1 2 0\r
                -2 3 0
                4 -4 0
                """;
        AnalysisOptions options = AnalysisOptions.builder().commentPrefixes(Set.of('c', '#')).build();

        FeatureMap features = new DimacsAnalyzer(options).analyze(new StringReader(cnf));

        assertThat(features.getLong("clauses_count")).isEqualTo(3);
        assertThat(features.getLong("tautological_clauses_count")).isEqualTo(1);
        assertThat(features.getLong("connected_variable_components_count")).isEqualTo(2);
    }

    @Test
    @DisplayName("Gli errori di parsing si propagano al chiamante")
    void propagatesParseErrors() {
        DimacsAnalyzer analyzer = new DimacsAnalyzer(AnalysisOptions.defaults());

        assertThatThrownBy(() -> analyzer.analyze(new StringReader("1 2 0\n")))
                .isInstanceOf(DimacsParseException.class);
    }

    @Test
    @DisplayName("Un insieme di prefissi vuoto è rifiutato")
    void emptyCommentPrefixes() {
        assertThatThrownBy(() -> AnalysisOptions.builder().commentPrefixes(Set.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
