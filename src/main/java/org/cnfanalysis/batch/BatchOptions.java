package org.cnfanalysis.batch;

import org.cnfanalysis.output.OutputFormat;
import org.cnfanalysis.pipeline.AnalysisOptions;

import java.nio.file.Path;

/**
 * Configurazione di un'esecuzione su più file.
 *
 * @param analysis opzioni della pipeline, uguali per ogni file
 * @param format formato di output
 * @param outputDirectory directory di destinazione, null per scrivere accanto all'input
 * @param toStdout true per scrivere i record su standard output invece che su file
 * @param skipExisting true per saltare i file con output già presente e non vuoto
 * @param threads numero di file analizzati in parallelo
 * @param timeoutSeconds tempo massimo per file
 */
public record BatchOptions(AnalysisOptions analysis, OutputFormat format, Path outputDirectory,
                           boolean toStdout, boolean skipExisting, int threads, int timeoutSeconds) {

    public BatchOptions {
        if (analysis == null || format == null) {
            throw new IllegalArgumentException("Opzioni di analisi e formato obbligatori");
        }
        if (threads < 1) {
            throw new IllegalArgumentException("Numero di thread non valido: " + threads);
        }
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException("Timeout non valido: " + timeoutSeconds);
        }
    }
}
