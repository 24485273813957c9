package org.cnfanalysis.output;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Serializzazione di un {@link FeatureRecord} su uno stream, che resta aperto.
 */
public interface FeatureRecordWriter {

    void write(FeatureRecord record, OutputStream out) throws IOException;
}
