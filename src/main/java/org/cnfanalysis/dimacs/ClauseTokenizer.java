package org.cnfanalysis.dimacs;

import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * TOKENIZZATORE CLAUSOLE - Conversione delle righe di clausole in interi con segno
 *
 * Trasforma una riga CLAUSE_DATA in una sequenza di letterali terminata da 0 e la
 * consegna a un {@link TokenSink}. Le due modalità supportate differiscono solo
 * nella validazione della forma della riga:
 *
 * MODALITÀ RIGA SINGOLA:
 * - La riga contiene esattamente una clausola: interi separati da spazi, ultimo token 0
 * - Uno 0 in posizione intermedia o l'assenza dello 0 finale rendono la riga malformata
 * - La riga "0" da sola rappresenta la clausola vuota
 *
 * MODALITÀ MULTIRIGA:
 * - I letterali si accumulano attraverso righe consecutive fino al primo 0
 * - Una riga può chiudere più clausole e lasciarne una aperta
 * - Ogni token è consegnato appena letto: una riga con l'intera formula non
 *   viene mai copiata in memoria
 *
 * La scansione dei token è manuale (nessuno split con espressioni regolari); un
 * segno '+' o '-' iniziale è ammesso. Solo la modalità riga singola usa il buffer
 * interno, grande quanto la clausola della riga.
 */
public final class ClauseTokenizer {

    private static final Logger LOGGER = Logger.getLogger(ClauseTokenizer.class.getName());

    private static final int INITIAL_BUFFER_SIZE = 64;

    /** Destinatario dei token prodotti, 0 compreso */
    @FunctionalInterface
    public interface TokenSink {
        void accept(int token) throws DimacsParseException;
    }

    private int[] buffer = new int[INITIAL_BUFFER_SIZE];
    private int size;

    //region MODALITÀ DI EMISSIONE

    /**
     * Valida ed emette una riga in modalità riga singola.
     *
     * @param line riga di tipo CLAUSE_DATA
     * @param lineNumber numero di riga per i messaggi di errore
     * @param sink destinatario dei token
     * @throws DimacsParseException MALFORMED_CLAUSE_LINE o NON_INTEGER_TOKEN
     */
    public void emitSingleLine(String line, long lineNumber, TokenSink sink) throws DimacsParseException {
        tokenize(line, lineNumber);

        if (size == 0 || buffer[size - 1] != 0) {
            throw new DimacsParseException(ParseErrorKind.MALFORMED_CLAUSE_LINE, lineNumber,
                    "La riga di clausola deve essere una sequenza di interi terminata da 0");
        }
        for (int i = 0; i < size - 1; i++) {
            if (buffer[i] == 0) {
                throw new DimacsParseException(ParseErrorKind.MALFORMED_CLAUSE_LINE, lineNumber,
                        "Letterale 0 in posizione " + (i + 1) + " prima della fine della clausola");
            }
        }

        emitBuffer(sink);
    }

    /**
     * Emette una riga in modalità multiriga, senza vincoli sulla posizione degli 0.
     *
     * @param line riga di tipo CLAUSE_DATA
     * @param lineNumber numero di riga per i messaggi di errore
     * @param sink destinatario dei token
     * @throws DimacsParseException NON_INTEGER_TOKEN
     */
    public void emitMultiline(String line, long lineNumber, TokenSink sink) throws DimacsParseException {
        int count = scan(line, lineNumber, sink);
        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Riga " + lineNumber + ": " + count + " token");
        }
    }

    private void emitBuffer(TokenSink sink) throws DimacsParseException {
        for (int i = 0; i < size; i++) {
            sink.accept(buffer[i]);
        }
    }

    //endregion

    //region SCANSIONE TOKEN

    /**
     * Scompone la riga in interi con segno, riempiendo il buffer interno.
     *
     * @return numero di token letti
     */
    int tokenize(String line, long lineNumber) throws DimacsParseException {
        size = 0;
        scan(line, lineNumber, this::append);

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("Riga " + lineNumber + ": " + size + " token");
        }
        return size;
    }

    /**
     * Consegna a {@code target} ogni token della riga, nell'ordine di lettura.
     *
     * @return numero di token consegnati
     */
    private static int scan(String line, long lineNumber, TokenSink target) throws DimacsParseException {
        int length = line.length();
        int count = 0;
        int i = 0;

        while (i < length) {
            while (i < length && Character.isWhitespace(line.charAt(i))) {
                i++;
            }
            if (i >= length) {
                break;
            }
            int start = i;
            while (i < length && !Character.isWhitespace(line.charAt(i))) {
                i++;
            }
            target.accept(parseToken(line, start, i, lineNumber));
            count++;
        }
        return count;
    }

    /**
     * Interpreta un token come intero con segno a 32 bit.
     * Il valore {@link Integer#MIN_VALUE} è rifiutato: il suo modulo non è una variabile valida.
     */
    private static int parseToken(String line, int start, int end, long lineNumber) throws DimacsParseException {
        int i = start;
        boolean negative = line.charAt(i) == '-';
        if (negative || line.charAt(i) == '+') {
            i++;
        }
        if (i >= end) {
            throw nonInteger(line, start, end, lineNumber);
        }

        long value = 0;
        for (; i < end; i++) {
            char ch = line.charAt(i);
            if (ch < '0' || ch > '9') {
                throw nonInteger(line, start, end, lineNumber);
            }
            value = value * 10 + (ch - '0');
            if (value > Integer.MAX_VALUE) {
                throw nonInteger(line, start, end, lineNumber);
            }
        }
        return negative ? (int) -value : (int) value;
    }

    private static DimacsParseException nonInteger(String line, int start, int end, long lineNumber) {
        return new DimacsParseException(ParseErrorKind.NON_INTEGER_TOKEN, lineNumber,
                "Token non intero '" + line.substring(start, end) + "'");
    }

    private void append(int token) {
        if (size == buffer.length) {
            buffer = Arrays.copyOf(buffer, buffer.length * 2);
        }
        buffer[size++] = token;
    }

    //endregion
}
