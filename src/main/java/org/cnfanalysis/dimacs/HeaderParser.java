package org.cnfanalysis.dimacs;

import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.misc.ParseCancellationException;
import org.cnfanalysis.antlr.DimacsHeaderBaseVisitor;
import org.cnfanalysis.antlr.DimacsHeaderLexer;
import org.cnfanalysis.antlr.DimacsHeaderParser;
import org.cnfanalysis.antlr.DimacsHeaderParser.CountContext;
import org.cnfanalysis.antlr.DimacsHeaderParser.HeaderContext;

import java.util.logging.Logger;

/**
 * PARSER HEADER DIMACS - Convertitore da albero sintattico ANTLR a {@link HeaderDeclaration}
 *
 * Analizza la riga di dichiarazione con la grammatica DimacsHeader e ne estrae i
 * conteggi dichiarati tramite visitor. L'header compare una sola volta per file,
 * quindi il costo della pipeline ANTLR è irrilevante rispetto alla scansione
 * delle clausole.
 *
 * FORMA ACCETTATA:
 * - Parola chiave 'p' seguita da 'cnf' (maiuscole o minuscole)
 * - Due interi non negativi
 * - Almeno uno spazio tra ogni coppia di token
 * - Nessun altro contenuto sulla riga
 *
 * Qualsiasi errore lessicale o sintattico viene convertito in un
 * {@link DimacsParseException} di tipo MALFORMED_HEADER.
 */
public class HeaderParser extends DimacsHeaderBaseVisitor<long[]> {

    private static final Logger LOGGER = Logger.getLogger(HeaderParser.class.getName());

    //region PUNTO DI INGRESSO

    /**
     * Analizza una riga di dichiarazione.
     *
     * @param line riga classificata come HEADER
     * @param lineNumber numero di riga per i messaggi di errore
     * @return dichiarazione con i conteggi validati
     * @throws DimacsParseException se la riga non rispetta la forma {@code p cnf <vars> <clauses>}
     */
    public HeaderDeclaration parse(String line, long lineNumber) throws DimacsParseException {
        long[] counts;
        try {
            DimacsHeaderLexer lexer = new DimacsHeaderLexer(CharStreams.fromString(line));
            DimacsHeaderParser parser = new DimacsHeaderParser(new CommonTokenStream(lexer));

            // Errori lessicali e sintattici interrompono subito il parsing
            lexer.removeErrorListeners();
            lexer.addErrorListener(FailFastErrorListener.INSTANCE);
            parser.removeErrorListeners();
            parser.addErrorListener(FailFastErrorListener.INSTANCE);

            counts = visit(parser.header());
        } catch (ParseCancellationException e) {
            throw new DimacsParseException(ParseErrorKind.MALFORMED_HEADER, lineNumber,
                    "Header non valido '" + line.strip() + "', atteso 'p cnf <variabili> <clausole>'", e);
        } catch (NumberFormatException e) {
            throw new DimacsParseException(ParseErrorKind.MALFORMED_HEADER, lineNumber,
                    "Conteggio dell'header fuori intervallo in '" + line.strip() + "'", e);
        }

        if (counts[0] > Integer.MAX_VALUE) {
            throw new DimacsParseException(ParseErrorKind.MALFORMED_HEADER, lineNumber,
                    "Numero di variabili dichiarato troppo grande: " + counts[0]);
        }

        HeaderDeclaration declaration = new HeaderDeclaration((int) counts[0], counts[1], lineNumber);
        LOGGER.fine("Header letto: " + declaration);
        return declaration;
    }

    //endregion

    //region VISITOR

    /**
     * Estrae la coppia (variabili, clausole) dalla regola {@code header}.
     */
    @Override
    public long[] visitHeader(HeaderContext ctx) {
        return new long[]{readCount(ctx.variables), readCount(ctx.clauses)};
    }

    private static long readCount(CountContext ctx) {
        return Long.parseLong(ctx.NUMBER().getText());
    }

    //endregion

    /**
     * Listener che trasforma il primo errore di riconoscimento in eccezione.
     */
    private static final class FailFastErrorListener extends BaseErrorListener {

        static final FailFastErrorListener INSTANCE = new FailFastErrorListener();

        @Override
        public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line,
                                int charPositionInLine, String msg, RecognitionException e) {
            throw new ParseCancellationException("colonna " + charPositionInLine + ": " + msg, e);
        }
    }
}
