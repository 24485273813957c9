package org.cnfanalysis;

import org.cnfanalysis.batch.BatchAnalyzer;
import org.cnfanalysis.batch.BatchOptions;
import org.cnfanalysis.batch.BatchResult;
import org.cnfanalysis.dimacs.DimacsParseException;
import org.cnfanalysis.features.FeatureMap;
import org.cnfanalysis.features.MetricsDocumentation;
import org.cnfanalysis.output.FeatureRecord;
import org.cnfanalysis.output.OutputFormat;
import org.cnfanalysis.pipeline.AnalysisOptions;
import org.cnfanalysis.pipeline.DimacsAnalyzer;

import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * ANALIZZATORE STRUTTURALE DI FORMULE CNF
 *
 * PIPELINE DI ELABORAZIONE:
 * 1. INPUT: file DIMACS singolo, directory di file .cnf o standard input
 * 2. PARSING IN STREAMING: classificazione righe, validazione header, tokenizzazione clausole
 * 3. AGGREGAZIONE: conteggi, distribuzioni, fasce percentuali e componenti connesse in un solo passaggio
 * 4. OUTPUT: record JSON o XML con metadati (timestamp, nome file, MD5, SHA-1) e metriche
 *
 * MODALITÀ OPERATIVE SUPPORTATE:
 * - File singolo (-f), directory batch (-d), standard input (-)
 * - Dialetti tollerati: header assente (-p), clausole multiriga (-m)
 * - Timeout per file (-t), thread paralleli (-j), output personalizzato (-o)
 *
 * Codice di uscita: 0 se tutti i file sono stati analizzati, 1 altrimenti.
 */
public final class Main {

    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());

    //region CONFIGURAZIONE PARAMETRI APPLICAZIONE

    /**
     * Parametri linea di comando supportati
     * */
    private static final String HELP_PARAM = "-h";
    private static final String FILE_PARAM = "-f";
    private static final String DIR_PARAM = "-d";
    private static final String STDIN_PARAM = "-";
    private static final String OUTPUT_PARAM = "-o";
    private static final String TIMEOUT_PARAM = "-t";
    private static final String THREADS_PARAM = "-j";
    private static final String NO_HEADER_PARAM = "-p";
    private static final String MULTILINE_PARAM = "-m";
    private static final String EXTENDED_PARAM = "-x";
    private static final String FORMAT_PARAM = "-format=";
    private static final String STDOUT_PARAM = "-stdout";
    private static final String SKIP_PARAM = "-skip";
    private static final String DESCRIPTION_PARAM = "-description";

    /**
     * Configurazioni di default e limiti
     * */
    private static final int DEFAULT_TIMEOUT_SECONDS = 600;
    private static final int MIN_TIMEOUT_SECONDS = 1;
    private static final int DEFAULT_THREADS = 1;

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_FAILURE = 1;

    private static final String LOGGING_CONFIGURATION = "/logging.properties";

    /**
     * Previene istanziazione - classe utility
     * */
    private Main() {
        throw new UnsupportedOperationException("Classe utility non istanziabile");
    }

    //endregion

    //region PUNTO PRINCIPALE

    /**
     * Punto principale: analizza i parametri, esegue la modalità richiesta e
     * termina con il codice di uscita corrispondente all'esito.
     *
     * @param args parametri linea di comando forniti dall'utente
     */
    public static void main(String[] args) {
        configureLogging();
        System.exit(run(args));
    }

    /**
     * Esegue l'applicazione senza terminare la JVM.
     *
     * @param args parametri linea di comando
     * @return codice di uscita
     */
    static int run(String[] args) {
        if (args.length == 0) {
            System.err.println("[E] Nessun parametro fornito. Usa -h per visualizzare l'help.");
            return EXIT_FAILURE;
        }

        AnalyzerConfiguration config;
        try {
            config = new ArgumentParser().parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println("[E] Errore nella validazione dei parametri: " + e.getMessage());
            System.err.println("Usa -h per visualizzare l'help completo.");
            return EXIT_FAILURE;
        }
        if (config == null) {
            return EXIT_SUCCESS; // Help o documentazione mostrati
        }

        try {
            return executeMainPipeline(config);
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Errore critico nell'applicazione", e);
            System.err.println("[E] Errore critico nell'applicazione: " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    /**
     * Sceglie la modalità operativa e delega all'handler corrispondente.
     */
    private static int executeMainPipeline(AnalyzerConfiguration config) throws IOException {
        if (config.stdinMode) {
            return processStandardInput(config);
        }

        List<Path> files = new ArrayList<>();
        if (config.isFileMode) {
            files.add(Paths.get(config.inputPath));
        } else {
            files.addAll(BatchAnalyzer.findCnfFiles(Paths.get(config.inputPath)));
            if (files.isEmpty()) {
                System.err.println("[W] Nessun file .cnf trovato nella directory specificata.");
                return EXIT_SUCCESS;
            }
        }

        logConfigurationSummary(config, files.size());
        BatchResult result = new BatchAnalyzer(config.toBatchOptions()).analyzeAll(files);
        displayBatchSummary(result);
        return result.isFullySuccessful() ? EXIT_SUCCESS : EXIT_FAILURE;
    }

    /**
     * Carica la configurazione di java.util.logging dal classpath, se presente.
     */
    private static void configureLogging() {
        try (InputStream config = Main.class.getResourceAsStream(LOGGING_CONFIGURATION)) {
            if (config != null) {
                LogManager.getLogManager().readConfiguration(config);
            }
        } catch (IOException e) {
            System.err.println("[W] Configurazione di logging non caricata: " + e.getMessage());
        }
    }

    //endregion

    //region ELABORAZIONE STANDARD INPUT

    /**
     * Analizza lo standard input fino a EOF e scrive il record su standard output.
     * Gli hash non sono calcolati: non esiste un file di riferimento.
     */
    private static int processStandardInput(AnalyzerConfiguration config) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8));
        try {
            FeatureMap features = new DimacsAnalyzer(config.toAnalysisOptions()).analyze(reader);
            FeatureRecord record = FeatureRecord.of("stdin", null, features);
            config.format.newWriter().write(record, System.out);
            return EXIT_SUCCESS;
        } catch (DimacsParseException e) {
            System.err.println("[E] Input non valido (" + e.getKind() + "): " + e.getMessage());
            return EXIT_FAILURE;
        }
    }

    //endregion

    //region RIEPILOGHI

    /**
     * I riepiloghi vanno su standard error: standard output può contenere i record.
     */
    private static void logConfigurationSummary(AnalyzerConfiguration config, int fileCount) {
        System.err.println("[I] Modalità: " + (config.isFileMode ? "File singolo" : "Directory"));
        System.err.println("[I] Input: " + config.inputPath + " (" + fileCount + " file)");
        System.err.println("[I] Opzioni: " + config.toAnalysisOptions());
        System.err.println("[I] Output: " + (config.toStdout ? "standard output"
                : config.outputPath != null ? config.outputPath : "directory input")
                + ", formato " + config.format.getExtension());
        System.err.println("[I] Timeout: " + config.timeoutSeconds + " secondi, thread: " + config.threads);
    }

    private static void displayBatchSummary(BatchResult result) {
        System.err.println("\n-->> RIEPILOGO ANALISI <<--");
        System.err.println("File totali: " + result.getTotalFiles());
        System.err.println("Analizzati: " + result.getSuccessCount());
        System.err.println("Saltati: " + result.getSkippedCount());
        System.err.println("Errori: " + result.getErrorCount());
        System.err.println("Timeout: " + result.getTimeoutCount());
        for (String failure : result.getFailures()) {
            System.err.println("[E] " + failure);
        }
        System.err.println("==========================\n");
    }

    //endregion

    //region HELP E DOCUMENTAZIONE

    private static void printApplicationHelp() {
        System.out.println("\n::>> ANALIZZATORE CNF <<::");
        System.out.println("Metriche strutturali di formule CNF in formato DIMACS, senza risolverle\n");

        System.out.println("UTILIZZO:");
        System.out.println("  java -jar cnf-analysis.jar [opzioni]\n");

        System.out.println("INPUT (mutualmente esclusivi):");
        System.out.println("  -f <file>         Analizza un singolo file");
        System.out.println("  -d <directory>    Analizza tutti i file .cnf di una directory");
        System.out.println("  -                 Analizza lo standard input (record su standard output)\n");

        System.out.println("OPZIONI:");
        System.out.println("  -o <directory>    Directory di output (default: stessa dell'input)");
        System.out.println("  -t <secondi>      Timeout per file (min: 1, default: " + DEFAULT_TIMEOUT_SECONDS + ")");
        System.out.println("  -j <thread>       File analizzati in parallelo (default: " + DEFAULT_THREADS + ")");
        System.out.println("  -p                Nessuna validazione dell'header 'p cnf'");
        System.out.println("  -m                Clausole su più righe, marcatore di fine '%'");
        System.out.println("  -x                Tracciamento esteso: clausole distinte e coppie xor2");
        System.out.println("  -format=json|xml  Formato di output (default: json)");
        System.out.println("  -stdout           Scrive i record su standard output");
        System.out.println("  -skip             Salta i file con output già presente e non vuoto");
        System.out.println("  -description      Mostra la descrizione di tutte le metriche");
        System.out.println("  -h                Mostra questa guida\n");

        System.out.println("OUTPUT GENERATO:");
        System.out.println("  nome.cnf -> nome.stats.json (o .xml); altri nomi ricevono il suffisso .stats.<formato>\n");

        System.out.println("ESEMPI DI UTILIZZO:");
        System.out.println("  java -jar cnf-analysis.jar -f problema.cnf");
        System.out.println("  java -jar cnf-analysis.jar -d ./benchmark/ -o ./stats/ -j 4 -t 120 -skip");
        System.out.println("  cat problema.cnf | java -jar cnf-analysis.jar - -m -format=xml\n");
    }

    //endregion

    //region CLASSI DI SUPPORTO E CONFIGURAZIONE

    /**
     * Configurazione validata dell'applicazione.
     */
    private static final class AnalyzerConfiguration {
        final String inputPath;
        final String outputPath;
        final boolean isFileMode;
        final boolean stdinMode;
        final int timeoutSeconds;
        final int threads;
        final boolean headerValidation;
        final boolean multiline;
        final boolean extendedTracking;
        final OutputFormat format;
        final boolean toStdout;
        final boolean skipExisting;

        AnalyzerConfiguration(String inputPath, String outputPath, boolean isFileMode, boolean stdinMode,
                              int timeoutSeconds, int threads, boolean headerValidation, boolean multiline,
                              boolean extendedTracking, OutputFormat format, boolean toStdout, boolean skipExisting) {
            this.inputPath = inputPath;
            this.outputPath = outputPath;
            this.isFileMode = isFileMode;
            this.stdinMode = stdinMode;
            this.timeoutSeconds = timeoutSeconds;
            this.threads = threads;
            this.headerValidation = headerValidation;
            this.multiline = multiline;
            this.extendedTracking = extendedTracking;
            this.format = format;
            this.toStdout = toStdout;
            this.skipExisting = skipExisting;
        }

        AnalysisOptions toAnalysisOptions() {
            return AnalysisOptions.builder()
                    .headerValidation(headerValidation)
                    .multiline(multiline)
                    .extendedClauseTracking(extendedTracking)
                    .build();
        }

        BatchOptions toBatchOptions() {
            return new BatchOptions(toAnalysisOptions(), format,
                    outputPath != null ? Paths.get(outputPath) : null,
                    toStdout, skipExisting, threads, timeoutSeconds);
        }
    }

    /**
     * Parser dei parametri linea di comando con messaggi di errore per l'utente.
     */
    static final class ArgumentParser {

        /**
         * @return configurazione validata, null se è stato richiesto help o documentazione
         * @throws IllegalArgumentException se i parametri sono invalidi
         */
        AnalyzerConfiguration parse(String[] args) {
            String inputPath = null;
            String outputPath = null;
            boolean isFileMode = false;
            boolean isDirectoryMode = false;
            boolean stdinMode = false;
            int timeoutSeconds = DEFAULT_TIMEOUT_SECONDS;
            int threads = DEFAULT_THREADS;
            boolean headerValidation = true;
            boolean multiline = false;
            boolean extendedTracking = false;
            OutputFormat format = OutputFormat.JSON;
            boolean toStdout = false;
            boolean skipExisting = false;

            for (int i = 0; i < args.length; i++) {
                switch (args[i]) {
                    case HELP_PARAM -> {
                        printApplicationHelp();
                        return null;
                    }
                    case DESCRIPTION_PARAM -> {
                        System.out.print(MetricsDocumentation.render());
                        return null;
                    }
                    case FILE_PARAM -> {
                        validateExclusiveMode(isDirectoryMode || stdinMode, "file");
                        inputPath = getNextArgument(args, ++i, "file");
                        validateFileExists(inputPath);
                        isFileMode = true;
                    }
                    case DIR_PARAM -> {
                        validateExclusiveMode(isFileMode || stdinMode, "directory");
                        inputPath = getNextArgument(args, ++i, "directory");
                        validateDirectoryExists(inputPath);
                        isDirectoryMode = true;
                    }
                    case STDIN_PARAM -> {
                        validateExclusiveMode(isFileMode || isDirectoryMode, "standard input");
                        stdinMode = true;
                    }
                    case OUTPUT_PARAM -> {
                        outputPath = getNextArgument(args, ++i, "directory output");
                        validateOrCreateOutputDirectory(outputPath);
                    }
                    case TIMEOUT_PARAM -> timeoutSeconds = parsePositive(args, ++i, "timeout", MIN_TIMEOUT_SECONDS);
                    case THREADS_PARAM -> threads = parsePositive(args, ++i, "numero thread", 1);
                    case NO_HEADER_PARAM -> headerValidation = false;
                    case MULTILINE_PARAM -> multiline = true;
                    case EXTENDED_PARAM -> extendedTracking = true;
                    case STDOUT_PARAM -> toStdout = true;
                    case SKIP_PARAM -> skipExisting = true;
                    default -> {
                        if (args[i].startsWith(FORMAT_PARAM)) {
                            format = OutputFormat.fromName(args[i].substring(FORMAT_PARAM.length()));
                        } else {
                            throw new IllegalArgumentException("Parametro sconosciuto: " + args[i]);
                        }
                    }
                }
            }

            if (inputPath == null && !stdinMode) {
                throw new IllegalArgumentException("Specificare input con -f (file), -d (directory) o - (standard input)");
            }

            return new AnalyzerConfiguration(inputPath, outputPath, isFileMode, stdinMode, timeoutSeconds, threads,
                    headerValidation, multiline, extendedTracking, format, toStdout, skipExisting);
        }

        private void validateExclusiveMode(boolean otherModeActive, String currentMode) {
            if (otherModeActive) {
                throw new IllegalArgumentException("Modalità " + currentMode
                        + " non può essere combinata con altre modalità (file/directory/standard input sono mutualmente esclusive)");
            }
        }

        private String getNextArgument(String[] args, int currentIndex, String argumentType) {
            if (currentIndex >= args.length) {
                throw new IllegalArgumentException("Parametro " + args[currentIndex - 1] + " richiede " + argumentType);
            }
            return args[currentIndex];
        }

        private int parsePositive(String[] args, int currentIndex, String name, int minimum) {
            String value = getNextArgument(args, currentIndex, name);
            int parsed;
            try {
                parsed = Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Valore " + name + " non valido: " + value);
            }
            if (parsed < minimum) {
                throw new IllegalArgumentException("Valore minimo per " + name + ": " + minimum);
            }
            return parsed;
        }

        private void validateFileExists(String filePath) {
            File file = new File(filePath);
            if (!file.exists()) {
                throw new IllegalArgumentException("File non esistente: " + filePath);
            }
            if (!file.isFile()) {
                throw new IllegalArgumentException("Non è un file: " + filePath);
            }
            if (!file.canRead()) {
                throw new IllegalArgumentException("File non leggibile: " + filePath);
            }
        }

        private void validateDirectoryExists(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists()) {
                throw new IllegalArgumentException("Directory non esistente: " + dirPath);
            }
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Non è una directory: " + dirPath);
            }
        }

        private void validateOrCreateOutputDirectory(String dirPath) {
            File dir = new File(dirPath);
            if (!dir.exists() && !dir.mkdirs()) {
                throw new IllegalArgumentException("Impossibile creare directory: " + dirPath);
            }
            if (!dir.isDirectory()) {
                throw new IllegalArgumentException("Percorso non è una directory: " + dirPath);
            }
        }
    }

    //endregion
}
