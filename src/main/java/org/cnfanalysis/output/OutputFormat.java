package org.cnfanalysis.output;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Formati di output supportati, con estensione e writer associati.
 */
public enum OutputFormat {
    JSON("json"),
    XML("xml");

    private static final String CNF_EXTENSION = ".cnf";
    private static final String STATS_INFIX = ".stats.";

    private final String extension;

    OutputFormat(String extension) {
        this.extension = extension;
    }

    public String getExtension() {
        return extension;
    }

    public FeatureRecordWriter newWriter() {
        return switch (this) {
            case JSON -> new JsonFeatureRecordWriter();
            case XML -> new XmlFeatureRecordWriter();
        };
    }

    /**
     * Nome del file di output: 'nome.cnf' diventa 'nome.stats.json', altri nomi
     * ricevono il suffisso '.stats.json' (o '.stats.xml').
     *
     * @param input file analizzato
     * @param outputDirectory directory di destinazione, null per la directory dell'input
     */
    public Path outputPathFor(Path input, Path outputDirectory) {
        String name = input.getFileName().toString();
        String base = name.toLowerCase(Locale.ROOT).endsWith(CNF_EXTENSION)
                ? name.substring(0, name.length() - CNF_EXTENSION.length())
                : name;
        Path directory = outputDirectory != null ? outputDirectory : input.toAbsolutePath().getParent();
        return directory.resolve(base + STATS_INFIX + extension);
    }

    /**
     * @throws IllegalArgumentException per formati sconosciuti
     */
    public static OutputFormat fromName(String name) {
        if (name != null) {
            for (OutputFormat format : values()) {
                if (format.extension.equalsIgnoreCase(name.trim())) {
                    return format;
                }
            }
        }
        throw new IllegalArgumentException("Formato di output non supportato: " + name + " (ammessi: json, xml)");
    }
}
