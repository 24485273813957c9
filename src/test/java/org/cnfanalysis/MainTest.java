package org.cnfanalysis;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

class MainTest {

    @TempDir
    Path workspace;

    @Test
    @DisplayName("Directory analizzata: codice 0 e un output per file")
    void directoryRun() throws IOException {
        Path inputDir = Files.createDirectory(workspace.resolve("in"));
        Path outputDir = workspace.resolve("out");
        Files.writeString(inputDir.resolve("uno.cnf"), "p cnf 2 1\n1 -2 0\n");
        Files.writeString(inputDir.resolve("due.cnf"), "p cnf 2 1\n1 2 0\n");

        int exit = Main.run(new String[]{"-d", inputDir.toString(), "-o", outputDir.toString(), "-format=xml"});

        assertThat(exit).isZero();
        assertThat(outputDir.resolve("uno.stats.xml")).exists();
        assertThat(outputDir.resolve("due.stats.xml")).exists();
    }

    @Test
    @DisplayName("Un file non valido produce codice di uscita 1")
    void failingFile() throws IOException {
        Path cnf = Files.writeString(workspace.resolve("rotto.cnf"), "p cnf 1 2\n1 0\n");

        assertThat(Main.run(new String[]{"-f", cnf.toString()})).isEqualTo(1);
    }

    @Test
    @DisplayName("Dialetto multiriga e senza header tramite flag")
    void dialectFlags() throws IOException {
        Path cnf = Files.writeString(workspace.resolve("multi.cnf"), "1 2\n-1 0\n%\n0\n");

        assertThat(Main.run(new String[]{"-f", cnf.toString(), "-p", "-m"})).isZero();
        assertThat(workspace.resolve("multi.stats.json")).exists();
    }

    @Test
    @DisplayName("Parametri non validi, help e documentazione")
    void argumentHandling() {
        assertThat(Main.run(new String[]{})).isEqualTo(1);
        assertThat(Main.run(new String[]{"-sconosciuto"})).isEqualTo(1);
        assertThat(Main.run(new String[]{"-f", workspace.resolve("assente.cnf").toString()})).isEqualTo(1);
        assertThat(Main.run(new String[]{"-f", "x.cnf", "-d", "y"})).isEqualTo(1);
        assertThat(Main.run(new String[]{"-t", "0"})).isEqualTo(1);
        assertThat(Main.run(new String[]{"-h"})).isZero();
        assertThat(Main.run(new String[]{"-description"})).isZero();
    }
}
