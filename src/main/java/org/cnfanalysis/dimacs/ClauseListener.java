package org.cnfanalysis.dimacs;

/**
 * Destinatario delle clausole completate dal parser.
 *
 * L'array dei letterali è un buffer riutilizzato dal parser: è valido solo
 * durante la chiamata e non deve essere conservato né modificato.
 */
@FunctionalInterface
public interface ClauseListener {

    /**
     * @param literals buffer con i letterali della clausola nelle prime {@code length} posizioni
     * @param length numero di letterali, 0 per la clausola vuota
     */
    void onClause(int[] literals, int length);
}
