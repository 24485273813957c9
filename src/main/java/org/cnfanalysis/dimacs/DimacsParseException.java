package org.cnfanalysis.dimacs;

/**
 * ERRORE DI PARSING DIMACS - Errore tipizzato e fatale per la pipeline di un file
 *
 * Trasporta la tipologia dell'errore, il numero di riga di origine (0 se l'errore
 * è rilevato a fine input senza una riga precisa) e, per gli errori di conteggio,
 * i valori dichiarati e osservati. Il messaggio è pensato per essere mostrato
 * direttamente all'utente.
 */
public class DimacsParseException extends Exception {

    private static final long NO_VALUE = -1L;

    private final ParseErrorKind kind;
    private final long lineNumber;
    private final long claimed;
    private final long actual;

    public DimacsParseException(ParseErrorKind kind, long lineNumber, String message) {
        this(kind, lineNumber, message, NO_VALUE, NO_VALUE, null);
    }

    public DimacsParseException(ParseErrorKind kind, long lineNumber, String message, Throwable cause) {
        this(kind, lineNumber, message, NO_VALUE, NO_VALUE, cause);
    }

    private DimacsParseException(ParseErrorKind kind, long lineNumber, String message,
                                 long claimed, long actual, Throwable cause) {
        super(formatMessage(message, lineNumber), cause);
        this.kind = kind;
        this.lineNumber = lineNumber;
        this.claimed = claimed;
        this.actual = actual;
    }

    /**
     * Costruisce un errore di incoerenza tra header e contenuto.
     *
     * @param lineNumber ultima riga letta
     * @param subject oggetto del conteggio ("clausole" o "variabili")
     * @param claimed valore dichiarato nell'header
     * @param actual valore osservato nel file
     * @return eccezione di tipo {@link ParseErrorKind#HEADER_COUNT_MISMATCH}
     */
    public static DimacsParseException countMismatch(long lineNumber, String subject, long claimed, long actual) {
        String message = "Numero di " + subject + " dichiarato " + claimed + ", ma osservato " + actual;
        return new DimacsParseException(ParseErrorKind.HEADER_COUNT_MISMATCH, lineNumber, message,
                claimed, actual, null);
    }

    private static String formatMessage(String message, long lineNumber) {
        return lineNumber > 0 ? message + " alla riga " + lineNumber : message;
    }

    public ParseErrorKind getKind() {
        return kind;
    }

    public long getLineNumber() {
        return lineNumber;
    }

    /**
     * @return valore dichiarato nell'header, -1 se non applicabile
     */
    public long getClaimed() {
        return claimed;
    }

    /**
     * @return valore osservato nel file, -1 se non applicabile
     */
    public long getActual() {
        return actual;
    }
}
