package org.cnfanalysis.dimacs;

import java.util.Arrays;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * PARSER DIMACS IN STREAMING - Macchina a stati alimentata una riga alla volta
 *
 * Consuma le righe fisiche di un file CNF nell'ordine di lettura, valida l'header
 * e consegna ogni clausola completata al {@link ClauseListener} configurato, senza
 * mai trattenere in memoria più della clausola corrente.
 *
 * STATI:
 * - EXPECT_HEADER: la prima riga significativa deve essere 'p cnf <vars> <clauses>'
 * - EXPECT_CLAUSES: accumulo letterali ed emissione clausole
 * - DONE: fine input raggiunta, controlli di coerenza superati
 * - ERROR: primo errore fatale, ripetuto a ogni chiamata successiva
 *
 * POLITICHE SELEZIONABILI:
 * - Validazione header disattivata: si parte da EXPECT_CLAUSES; il primo header
 *   ben formato viene registrato (e riportato nelle metriche) ma non impone alcun
 *   vincolo, gli altri header e quelli malformati sono ignorati
 * - Modalità multiriga: clausole su più righe e marcatore di fine '%'
 *
 * INVARIANTI:
 * - Una volta lasciato EXPECT_HEADER il parser non vi rientra
 * - Con validazione attiva ogni letterale referenzia una variabile in [1, dichiarate]
 * - Nessuno stato statico: istanze diverse possono lavorare in parallelo
 */
public final class DimacsParser {

    private static final Logger LOGGER = Logger.getLogger(DimacsParser.class.getName());

    private static final int INITIAL_CLAUSE_CAPACITY = 16;
    private static final String REDUNDANT_TERMINATOR = "0";

    //region CONFIGURAZIONE

    private final boolean headerValidation;
    private final boolean multiline;
    private final LineClassifier classifier;
    private final ClauseTokenizer tokenizer = new ClauseTokenizer();
    private final HeaderParser headerParser = new HeaderParser();
    private final ClauseListener listener;
    private final ClauseTokenizer.TokenSink tokenSink = this::acceptToken;

    //endregion

    //region STATO DI PARSING

    private ParserState state;
    private HeaderDeclaration header;
    private DimacsParseException failure;

    private long lineNumber = 0;
    private long observedClauses = 0;
    private int maxVariable = 0;
    private boolean endMarkerSeen = false;

    /** Clausola in costruzione, riutilizzata tra una clausola e l'altra */
    private int[] clause = new int[INITIAL_CLAUSE_CAPACITY];
    private int clauseLength = 0;

    //endregion

    /**
     * @param headerValidation true per richiedere e verificare l'header
     * @param multiline true per la modalità multiriga
     * @param commentPrefixes caratteri che aprono una riga di commento
     * @param listener destinatario delle clausole completate
     */
    public DimacsParser(boolean headerValidation, boolean multiline,
                        Set<Character> commentPrefixes, ClauseListener listener) {
        if (listener == null) {
            throw new IllegalArgumentException("ClauseListener non può essere null");
        }
        this.headerValidation = headerValidation;
        this.multiline = multiline;
        this.classifier = new LineClassifier(commentPrefixes);
        this.listener = listener;
        this.state = headerValidation ? ParserState.EXPECT_HEADER : ParserState.EXPECT_CLAUSES;
    }

    //region ALIMENTAZIONE RIGHE

    /**
     * Elabora la prossima riga fisica dell'input.
     *
     * @param line riga senza terminatore di linea
     * @throws DimacsParseException al primo errore fatale, ripetuto nelle chiamate successive
     * @throws IllegalStateException se l'input è già stato chiuso con {@link #finish()}
     */
    public void feedLine(String line) throws DimacsParseException {
        ensureOpen();
        lineNumber++;

        try {
            processLine(line);
        } catch (DimacsParseException e) {
            fail(e);
        }
    }

    private void processLine(String line) throws DimacsParseException {
        LineKind kind = classifier.classify(line);

        switch (kind) {
            case BLANK, COMMENT -> { /* scartate senza ulteriore elaborazione */ }
            case HEADER -> processHeaderLine(line);
            case CLAUSE_TERMINATOR_MARKER -> processTerminatorMarker();
            case CLAUSE_DATA -> processClauseLine(line);
        }
    }

    private void processHeaderLine(String line) throws DimacsParseException {
        if (!headerValidation) {
            recordUncheckedHeader(line);
            return;
        }
        if (state != ParserState.EXPECT_HEADER) {
            throw new DimacsParseException(ParseErrorKind.HEADER_OUT_OF_ORDER, lineNumber,
                    "Header DIMACS duplicato (già dichiarato alla riga " + header.lineNumber() + ")");
        }

        header = headerParser.parse(line, lineNumber);
        state = ParserState.EXPECT_CLAUSES;
    }

    private void recordUncheckedHeader(String line) {
        if (header != null) {
            LOGGER.fine("Riga header ignorata alla riga " + lineNumber + " (header già registrato)");
            return;
        }
        try {
            header = headerParser.parse(line, lineNumber);
        } catch (DimacsParseException e) {
            LOGGER.fine("Header non valido ignorato (validazione disattivata): " + e.getMessage());
        }
    }

    private void processTerminatorMarker() throws DimacsParseException {
        if (!multiline) {
            throw new DimacsParseException(ParseErrorKind.MALFORMED_CLAUSE_LINE, lineNumber,
                    "Marcatore di fine '%' ammesso solo in modalità multiriga");
        }
        requireHeaderBeforeClauses();

        if (!endMarkerSeen) {
            LOGGER.fine("Marcatore di fine input '%' alla riga " + lineNumber);
        }
        endMarkerSeen = true;
    }

    private void processClauseLine(String line) throws DimacsParseException {
        requireHeaderBeforeClauses();

        if (endMarkerSeen) {
            // Dopo '%' è tollerato solo uno 0 ridondante
            if (!line.strip().equals(REDUNDANT_TERMINATOR)) {
                throw new DimacsParseException(ParseErrorKind.MALFORMED_CLAUSE_LINE, lineNumber,
                        "Contenuto dopo il marcatore di fine '%'");
            }
            return;
        }

        if (multiline) {
            tokenizer.emitMultiline(line, lineNumber, tokenSink);
        } else {
            tokenizer.emitSingleLine(line, lineNumber, tokenSink);
        }
    }

    private void requireHeaderBeforeClauses() throws DimacsParseException {
        if (state == ParserState.EXPECT_HEADER) {
            throw new DimacsParseException(ParseErrorKind.HEADER_OUT_OF_ORDER, lineNumber,
                    "Header atteso prima delle clausole");
        }
    }

    //endregion

    //region ACCUMULO CLAUSOLE

    private void acceptToken(int token) throws DimacsParseException {
        if (token == 0) {
            completeClause();
            return;
        }

        int variable = Math.abs(token);
        if (headerValidation && variable > header.variables()) {
            throw new DimacsParseException(ParseErrorKind.VARIABLE_OUT_OF_RANGE, lineNumber,
                    "Letterale " + token + " fuori da [-" + header.variables() + ", " + header.variables()
                            + "] dichiarato nell'header");
        }
        if (variable > maxVariable) {
            maxVariable = variable;
        }

        if (clauseLength == clause.length) {
            clause = Arrays.copyOf(clause, clause.length * 2);
        }
        clause[clauseLength++] = token;
    }

    private void completeClause() {
        observedClauses++;

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Clausola " + observedClauses + " completata alla riga " + lineNumber
                    + ": " + clauseLength + " letterali");
        }

        listener.onClause(clause, clauseLength);
        clauseLength = 0;
    }

    //endregion

    //region FINE INPUT

    /**
     * Segnala la fine dell'input ed esegue i controlli di coerenza con l'header.
     * Le chiamate successive alla prima riuscita non hanno effetto.
     *
     * @throws DimacsParseException se l'input è incompleto o incoerente con l'header
     */
    public void finish() throws DimacsParseException {
        if (state == ParserState.ERROR) {
            throw failure;
        }
        if (state == ParserState.DONE) {
            return;
        }

        try {
            verifyEndOfInput();
        } catch (DimacsParseException e) {
            fail(e);
        }

        state = ParserState.DONE;
        LOGGER.fine("Fine input alla riga " + lineNumber + ": " + observedClauses
                + " clausole, variabile massima " + maxVariable);
    }

    private void verifyEndOfInput() throws DimacsParseException {
        if (state == ParserState.EXPECT_HEADER) {
            throw new DimacsParseException(ParseErrorKind.MALFORMED_HEADER, lineNumber,
                    "Header DIMACS mancante: atteso 'p cnf <variabili> <clausole>'");
        }
        if (clauseLength > 0) {
            throw new DimacsParseException(ParseErrorKind.UNTERMINATED_CLAUSE, lineNumber,
                    "Fine input con clausola non terminata da 0 (" + clauseLength + " letterali)");
        }
        if (!headerValidation) {
            return;
        }
        if (observedClauses != header.clauses()) {
            throw DimacsParseException.countMismatch(lineNumber, "clausole", header.clauses(), observedClauses);
        }
        if (maxVariable > header.variables()) {
            throw DimacsParseException.countMismatch(lineNumber, "variabili", header.variables(), maxVariable);
        }
    }

    //endregion

    //region GESTIONE ERRORI E STATO

    private void fail(DimacsParseException e) throws DimacsParseException {
        state = ParserState.ERROR;
        failure = e;
        LOGGER.fine("Parsing interrotto: " + e.getMessage());
        throw e;
    }

    private void ensureOpen() throws DimacsParseException {
        if (state == ParserState.ERROR) {
            throw failure;
        }
        if (state == ParserState.DONE) {
            throw new IllegalStateException("Input già chiuso: impossibile aggiungere righe dopo finish()");
        }
    }

    public ParserState getState() {
        return state;
    }

    /**
     * @return header letto, null se assente; con validazione disattivata è il primo
     *         header ben formato, registrato senza vincoli sui conteggi
     */
    public HeaderDeclaration getHeader() {
        return header;
    }

    public long getObservedClauses() {
        return observedClauses;
    }

    public int getMaxVariable() {
        return maxVariable;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    //endregion
}
