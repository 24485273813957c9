package org.cnfanalysis.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

/**
 * Record in JSON indentato: un oggetto piatto con i metadati '@' seguiti dalle
 * metriche nell'ordine di assemblaggio.
 */
public final class JsonFeatureRecordWriter implements FeatureRecordWriter {

    private final ObjectWriter writer = new ObjectMapper().writerWithDefaultPrettyPrinter();

    @Override
    public void write(FeatureRecord record, OutputStream out) throws IOException {
        String json = writer.writeValueAsString(record.toOrderedMap());
        out.write(json.getBytes(StandardCharsets.UTF_8));
        out.write(System.lineSeparator().getBytes(StandardCharsets.UTF_8));
        out.flush();
    }
}
