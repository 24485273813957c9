package org.cnfanalysis.dimacs;

/**
 * Stati della macchina di parsing DIMACS.
 * ERROR è terminale e raggiungibile da qualsiasi altro stato.
 */
public enum ParserState {
    EXPECT_HEADER,
    EXPECT_CLAUSES,
    DONE,
    ERROR
}
