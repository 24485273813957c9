package org.cnfanalysis.dimacs;

/**
 * Tipologie di errore fatale riconosciute durante la lettura di un file DIMACS.
 * Ogni errore interrompe l'elaborazione del solo file corrente.
 */
public enum ParseErrorKind {

    /** La riga di dichiarazione non rispetta la forma {@code p cnf <vars> <clauses>} */
    MALFORMED_HEADER,

    /** Clausola prima dell'header, oppure header duplicato */
    HEADER_OUT_OF_ORDER,

    /** Riga clausola non terminata da 0 (modalità riga singola) */
    MALFORMED_CLAUSE_LINE,

    /** Fine input con clausola ancora aperta (modalità multiriga) */
    UNTERMINATED_CLAUSE,

    /** Letterale che referenzia una variabile oltre il numero dichiarato */
    VARIABLE_OUT_OF_RANGE,

    /** Conteggi osservati incompatibili con quelli dichiarati nell'header */
    HEADER_COUNT_MISMATCH,

    /** Token non interpretabile come intero con segno */
    NON_INTEGER_TOKEN
}
