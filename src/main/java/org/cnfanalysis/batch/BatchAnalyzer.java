package org.cnfanalysis.batch;

import org.cnfanalysis.dimacs.DimacsParseException;
import org.cnfanalysis.features.FeatureMap;
import org.cnfanalysis.output.FeatureRecord;
import org.cnfanalysis.output.FeatureRecordWriter;
import org.cnfanalysis.output.FileDigests;
import org.cnfanalysis.pipeline.DimacsAnalyzer;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * ANALISI BATCH - Una pipeline indipendente per file, su un pool di thread
 *
 * FLUSSO PER FILE:
 * 1. Salto opzionale se l'output esiste già e non è vuoto
 * 2. Lettura unica: gli hash MD5/SHA-1 si calcolano sugli stessi byte analizzati
 * 3. Scrittura del record nel formato configurato, su file o standard output
 *
 * Un errore o un timeout su un file non interrompe gli altri: viene registrato
 * nel {@link BatchResult} e l'elaborazione prosegue.
 */
public final class BatchAnalyzer {

    private static final Logger LOGGER = Logger.getLogger(BatchAnalyzer.class.getName());

    private static final String CNF_EXTENSION = ".cnf";

    private final BatchOptions options;
    private final DimacsAnalyzer analyzer;
    private final FeatureRecordWriter writer;
    private final PrintStream stdout;

    public BatchAnalyzer(BatchOptions options) {
        this(options, System.out);
    }

    /**
     * @param stdout destinazione dei record quando {@link BatchOptions#toStdout()} è attivo
     */
    public BatchAnalyzer(BatchOptions options, PrintStream stdout) {
        if (options == null || stdout == null) {
            throw new IllegalArgumentException("Opzioni e stream di output obbligatori");
        }
        this.options = options;
        this.analyzer = new DimacsAnalyzer(options.analysis());
        this.writer = options.format().newWriter();
        this.stdout = stdout;
    }

    //region RICERCA FILE

    /**
     * @return file *.cnf della directory (non ricorsivo), in ordine di nome
     */
    public static List<Path> findCnfFiles(Path directory) throws IOException {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(path -> path.getFileName().toString().toLowerCase().endsWith(CNF_EXTENSION))
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        }
    }

    //endregion

    //region ESECUZIONE

    /**
     * Analizza i file in parallelo e attende ciascuno fino al timeout configurato.
     *
     * @param files file da analizzare
     * @return esito aggregato
     */
    public BatchResult analyzeAll(List<Path> files) {
        BatchResult result = new BatchResult(files.size());
        if (files.isEmpty()) {
            return result;
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(options.threads(), files.size()));
        try {
            List<Future<FileOutcome>> futures = new ArrayList<>();
            for (Path file : files) {
                futures.add(executor.submit(() -> analyzeFile(file)));
            }

            for (int i = 0; i < files.size(); i++) {
                collect(files.get(i), futures.get(i), result);
            }
        } finally {
            executor.shutdownNow();
        }

        LOGGER.info("Batch completato: " + result);
        return result;
    }

    private void collect(Path file, Future<FileOutcome> future, BatchResult result) {
        try {
            FileOutcome outcome = future.get(options.timeoutSeconds(), TimeUnit.SECONDS);
            if (outcome == FileOutcome.SKIPPED) {
                result.incrementSkipped();
            } else {
                result.incrementSuccess();
            }
        } catch (TimeoutException e) {
            future.cancel(true);
            LOGGER.warning("Timeout su " + file + " dopo " + options.timeoutSeconds() + " secondi");
            result.recordTimeout(file, options.timeoutSeconds());
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            LOGGER.log(Level.SEVERE, "Analisi fallita per " + file, cause);
            result.recordError(file, String.valueOf(cause.getMessage()));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            result.recordError(file, "attesa interrotta");
        }
    }

    /**
     * Analizza un singolo file e ne scrive il record.
     *
     * @throws IOException errore di lettura o scrittura
     * @throws DimacsParseException file non conforme
     */
    FileOutcome analyzeFile(Path file) throws IOException, DimacsParseException {
        Path output = options.format().outputPathFor(file, options.outputDirectory());
        if (options.skipExisting() && !options.toStdout() && isNonEmptyFile(output)) {
            LOGGER.info("Output già presente, file saltato: " + output);
            return FileOutcome.SKIPPED;
        }

        LOGGER.info("Analisi di " + file);
        FileDigests digests = new FileDigests();
        FeatureMap features;
        try (InputStream in = digests.wrap(Files.newInputStream(file));
             BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            features = analyzer.analyze(reader);
        }

        FeatureRecord record = FeatureRecord.of(file.getFileName().toString(), digests, features);
        if (options.toStdout()) {
            synchronized (stdout) {
                writer.write(record, stdout);
            }
        } else {
            try (OutputStream out = Files.newOutputStream(output)) {
                writer.write(record, out);
            }
            LOGGER.fine("Record scritto in " + output);
        }
        return FileOutcome.ANALYZED;
    }

    private static boolean isNonEmptyFile(Path path) throws IOException {
        return Files.isRegularFile(path) && Files.size(path) > 0;
    }

    //endregion

    enum FileOutcome {
        ANALYZED,
        SKIPPED
    }
}
