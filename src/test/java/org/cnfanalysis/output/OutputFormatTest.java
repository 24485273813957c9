package org.cnfanalysis.output;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.*;

class OutputFormatTest {

    @Test
    @DisplayName("nome.cnf diventa nome.stats.<formato>, altri nomi ricevono il suffisso")
    void outputNaming() {
        Path out = Paths.get("/tmp/out");

        assertThat(OutputFormat.JSON.outputPathFor(Paths.get("/data/problema.cnf"), out))
                .isEqualTo(out.resolve("problema.stats.json"));
        assertThat(OutputFormat.XML.outputPathFor(Paths.get("/data/problema.CNF"), out))
                .isEqualTo(out.resolve("problema.stats.xml"));
        assertThat(OutputFormat.JSON.outputPathFor(Paths.get("/data/istanza.dimacs"), out))
                .isEqualTo(out.resolve("istanza.dimacs.stats.json"));
    }

    @Test
    @DisplayName("Senza directory di output si scrive accanto all'input")
    void besideInput() {
        Path input = Paths.get("/data/problema.cnf");

        assertThat(OutputFormat.JSON.outputPathFor(input, null))
                .isEqualTo(Paths.get("/data/problema.stats.json"));
    }

    @Test
    @DisplayName("Riconoscimento del formato per nome")
    void fromName() {
        assertThat(OutputFormat.fromName("json")).isEqualTo(OutputFormat.JSON);
        assertThat(OutputFormat.fromName(" XML ")).isEqualTo(OutputFormat.XML);
        assertThatThrownBy(() -> OutputFormat.fromName("yaml")).isInstanceOf(IllegalArgumentException.class);
    }
}
