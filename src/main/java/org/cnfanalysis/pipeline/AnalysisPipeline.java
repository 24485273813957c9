package org.cnfanalysis.pipeline;

import org.cnfanalysis.dimacs.DimacsParseException;
import org.cnfanalysis.dimacs.DimacsParser;
import org.cnfanalysis.features.FeatureMap;
import org.cnfanalysis.features.FeatureRecordAssembler;

import java.util.logging.Logger;

/**
 * PIPELINE DI ANALISI - Parser e aggregatori di un singolo file, in lockstep
 *
 * Ogni riga passata a {@link #feedLine} viene classificata, tokenizzata e, a ogni
 * clausola completata, distribuita a tutti gli aggregatori prima della riga
 * successiva. {@link #finish()} chiude l'input e restituisce le metriche.
 *
 * Un'istanza serve un solo file e non condivide stato con altre istanze.
 */
public final class AnalysisPipeline {

    private static final Logger LOGGER = Logger.getLogger(AnalysisPipeline.class.getName());

    private final AnalysisOptions options;
    private final FeatureRecordAssembler assembler;
    private final DimacsParser parser;
    private FeatureMap result;

    private AnalysisPipeline(AnalysisOptions options) {
        this.options = options;
        this.assembler = FeatureRecordAssembler.standard(options.isExtendedClauseTracking());
        this.parser = new DimacsParser(options.isHeaderValidation(), options.isMultiline(),
                options.getCommentPrefixes(), assembler);
    }

    /**
     * @param options politiche di dialetto e metriche opzionali
     * @return nuova pipeline pronta a ricevere righe
     */
    public static AnalysisPipeline open(AnalysisOptions options) {
        if (options == null) {
            throw new IllegalArgumentException("AnalysisOptions non può essere null");
        }
        LOGGER.finest("Apertura pipeline: " + options);
        return new AnalysisPipeline(options);
    }

    /**
     * @param line riga fisica senza terminatore
     * @throws DimacsParseException al primo errore fatale
     * @throws IllegalStateException se la pipeline è già stata chiusa
     */
    public void feedLine(String line) throws DimacsParseException {
        if (line == null) {
            throw new IllegalArgumentException("Riga null");
        }
        parser.feedLine(line);
    }

    /**
     * Chiude l'input, esegue i controlli sull'header e assembla le metriche.
     * Chiamate ripetute restituiscono la stessa mappa.
     *
     * @return metriche del file
     * @throws DimacsParseException se l'input è incompleto o incoerente con l'header
     */
    public FeatureMap finish() throws DimacsParseException {
        parser.finish();
        if (result == null) {
            result = assembler.assemble(parser.getHeader());
            LOGGER.fine("Metriche assemblate: " + result.size() + " valori su "
                    + parser.getObservedClauses() + " clausole");
        }
        return result;
    }

    public AnalysisOptions getOptions() {
        return options;
    }

    public long getLineNumber() {
        return parser.getLineNumber();
    }
}
