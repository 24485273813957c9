package org.cnfanalysis.output;

import org.cnfanalysis.features.FeatureMap;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * RECORD DI OUTPUT - Metadati del file analizzato più le sue metriche
 *
 * I metadati hanno prefisso '@' e precedono le metriche. Gli hash sono null
 * quando l'input non proviene da un file (standard input).
 *
 * @param timestamp istante di produzione, serializzato in ISO-8601 UTC
 * @param version versione del formato del record
 * @param filename nome del file analizzato
 * @param md5sum MD5 esadecimale del file, null se non disponibile
 * @param sha1sum SHA-1 esadecimale del file, null se non disponibile
 * @param features metriche assemblate
 */
public record FeatureRecord(Instant timestamp, String version, String filename,
                            String md5sum, String sha1sum, FeatureMap features) {

    public static final String CURRENT_VERSION = "1.0.0";

    public FeatureRecord {
        if (timestamp == null || filename == null || features == null) {
            throw new IllegalArgumentException("timestamp, filename e features sono obbligatori");
        }
        if (version == null) {
            version = CURRENT_VERSION;
        }
    }

    public static FeatureRecord of(String filename, FileDigests digests, FeatureMap features) {
        return new FeatureRecord(Instant.now(), CURRENT_VERSION, filename,
                digests != null ? digests.md5Hex() : null,
                digests != null ? digests.sha1Hex() : null,
                features);
    }

    /**
     * @return metadati ('@timestamp', '@version', '@filename', hash) seguiti dalle metriche
     */
    public Map<String, Object> metadata() {
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("@timestamp", timestamp.toString());
        metadata.put("@version", version);
        metadata.put("@filename", filename);
        if (md5sum != null) {
            metadata.put("@md5sum", md5sum);
        }
        if (sha1sum != null) {
            metadata.put("@sha1sum", sha1sum);
        }
        return metadata;
    }

    public Map<String, Object> toOrderedMap() {
        Map<String, Object> all = metadata();
        all.putAll(features.asMap());
        return all;
    }
}
