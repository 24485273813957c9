package org.cnfanalysis.batch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.cnfanalysis.output.OutputFormat;
import org.cnfanalysis.pipeline.AnalysisOptions;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

class BatchAnalyzerTest {

    @TempDir
    Path input;

    @TempDir
    Path output;

    private BatchOptions options(boolean toStdout, boolean skipExisting) {
        return new BatchOptions(AnalysisOptions.defaults(), OutputFormat.JSON, output,
                toStdout, skipExisting, 2, 30);
    }

    private Path write(String name, String content) throws IOException {
        return Files.writeString(input.resolve(name), content);
    }

    @Test
    @DisplayName("Un file non valido non interrompe gli altri ed è riportato come errore")
    void isolatesFailures() throws IOException {
        Path good = write("a.cnf", "p cnf 3 2\n1 -3 0\n2 3 -1 0\n");
        Path bad = write("b.cnf", "p cnf 1 2\n1 0\n");

        BatchResult result = new BatchAnalyzer(options(false, false)).analyzeAll(List.of(good, bad));

        assertThat(result.getTotalFiles()).isEqualTo(2);
        assertThat(result.getSuccessCount()).isEqualTo(1);
        assertThat(result.getErrorCount()).isEqualTo(1);
        assertThat(result.isFullySuccessful()).isFalse();
        assertThat(result.getFailures()).singleElement().asString().startsWith("b.cnf");
        assertThat(output.resolve("a.stats.json")).exists();
        assertThat(output.resolve("b.stats.json")).doesNotExist();
    }

    @Test
    @DisplayName("Il record scritto contiene nome file, hash e metriche")
    void writesRecord() throws IOException {
        Path good = write("a.cnf", "p cnf 3 2\n1 -3 0\n2 3 -1 0\n");

        new BatchAnalyzer(options(false, false)).analyzeAll(List.of(good));

        JsonNode record = new ObjectMapper().readTree(output.resolve("a.stats.json").toFile());
        assertThat(record.get("@filename").asText()).isEqualTo("a.cnf");
        assertThat(record.get("@md5sum").asText()).hasSize(32);
        assertThat(record.get("@sha1sum").asText()).hasSize(40);
        assertThat(record.get("clauses_count").asLong()).isEqualTo(2);
    }

    @Test
    @DisplayName("Con -skip un output già presente e non vuoto evita la rianalisi")
    void skipsExistingOutput() throws IOException {
        Path good = write("a.cnf", "p cnf 1 1\n1 0\n");
        Files.writeString(output.resolve("a.stats.json"), "{}");

        BatchResult result = new BatchAnalyzer(options(false, true)).analyzeAll(List.of(good));

        assertThat(result.getSkippedCount()).isEqualTo(1);
        assertThat(result.getSuccessCount()).isZero();
        assertThat(Files.readString(output.resolve("a.stats.json"))).isEqualTo("{}");
    }

    @Test
    @DisplayName("Con output su stdout nessun file viene creato")
    void writesToStdout() throws IOException {
        Path good = write("a.cnf", "p cnf 1 1\n1 0\n");
        ByteArrayOutputStream captured = new ByteArrayOutputStream();

        BatchResult result = new BatchAnalyzer(options(true, false),
                new PrintStream(captured, true, StandardCharsets.UTF_8)).analyzeAll(List.of(good));

        assertThat(result.isFullySuccessful()).isTrue();
        assertThat(captured.toString(StandardCharsets.UTF_8)).contains("\"@filename\" : \"a.cnf\"");
        assertThat(output.resolve("a.stats.json")).doesNotExist();
    }

    @Test
    @DisplayName("Ricerca dei soli file .cnf in ordine di nome")
    void findsCnfFiles() throws IOException {
        write("z.cnf", "");
        write("a.CNF", "");
        write("note.txt", "");

        assertThat(BatchAnalyzer.findCnfFiles(input))
                .extracting(path -> path.getFileName().toString())
                .containsExactly("a.CNF", "z.cnf");
    }
}
