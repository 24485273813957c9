package org.cnfanalysis.pipeline;

import org.cnfanalysis.dimacs.DimacsParseException;
import org.cnfanalysis.features.FeatureMap;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.io.Reader;
import java.util.logging.Logger;

/**
 * Analisi completa di una sorgente testuale: una pipeline alimentata riga per riga
 * fino alla fine dell'input.
 */
public final class DimacsAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(DimacsAnalyzer.class.getName());

    private final AnalysisOptions options;

    public DimacsAnalyzer(AnalysisOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("AnalysisOptions non può essere null");
        }
        this.options = options;
    }

    /**
     * Legge l'intera sorgente senza chiuderla.
     *
     * @param source testo CNF
     * @return metriche del file
     * @throws IOException errore di lettura
     * @throws DimacsParseException input non conforme
     */
    public FeatureMap analyze(Reader source) throws IOException, DimacsParseException {
        AnalysisPipeline pipeline = AnalysisPipeline.open(options);
        BufferedReader reader = source instanceof BufferedReader
                ? (BufferedReader) source
                : new BufferedReader(source);

        String line;
        while ((line = reader.readLine()) != null) {
            // Un timeout del chiamante interrompe il thread: si abbandona il file
            if (Thread.currentThread().isInterrupted()) {
                throw new InterruptedIOException("Analisi interrotta alla riga " + pipeline.getLineNumber());
            }
            pipeline.feedLine(line);
        }

        FeatureMap features = pipeline.finish();
        LOGGER.fine("Analisi completata in " + pipeline.getLineNumber() + " righe");
        return features;
    }

    public AnalysisOptions getOptions() {
        return options;
    }
}
