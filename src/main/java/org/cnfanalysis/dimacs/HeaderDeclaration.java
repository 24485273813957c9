package org.cnfanalysis.dimacs;

/**
 * Dichiarazione {@code p cnf <variabili> <clausole>} letta dall'header.
 *
 * @param variables numero di variabili dichiarato
 * @param clauses numero di clausole dichiarato
 * @param lineNumber riga in cui compare la dichiarazione
 */
public record HeaderDeclaration(int variables, long clauses, long lineNumber) {
}
