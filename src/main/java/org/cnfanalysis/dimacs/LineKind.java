package org.cnfanalysis.dimacs;

/**
 * Categoria di una riga fisica di un file DIMACS.
 */
public enum LineKind {
    COMMENT,
    HEADER,
    CLAUSE_DATA,
    CLAUSE_TERMINATOR_MARKER,
    BLANK
}
