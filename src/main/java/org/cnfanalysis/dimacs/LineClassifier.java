package org.cnfanalysis.dimacs;

import java.util.Set;

/**
 * CLASSIFICATORE RIGHE DIMACS - Categorizzazione pura di una singola riga fisica
 *
 * Determina il ruolo di ogni riga indipendentemente dallo stato del parser:
 * - BLANK: riga vuota o composta solo da spazi
 * - COMMENT: primo carattere significativo tra i prefissi di commento configurati
 * - HEADER: riga di dichiarazione che inizia con 'p'
 * - CLAUSE_TERMINATOR_MARKER: riga composta dal solo '%' (dialetto di alcuni generatori)
 * - CLAUSE_DATA: qualsiasi altra riga, interpretata come contenuto di clausole
 *
 * Il controllo dei commenti precede quello dell'header e del marcatore, quindi un
 * insieme di prefissi che include '%' trasforma il marcatore in un commento.
 */
public final class LineClassifier {

    /** Prefisso di commento convenzionale del formato DIMACS */
    public static final char DEFAULT_COMMENT_PREFIX = 'c';

    private static final char HEADER_PREFIX = 'p';
    private static final char TERMINATOR_MARKER = '%';

    private final Set<Character> commentPrefixes;

    public LineClassifier() {
        this(Set.of(DEFAULT_COMMENT_PREFIX));
    }

    /**
     * @param commentPrefixes caratteri che, in apertura di riga, indicano un commento
     */
    public LineClassifier(Set<Character> commentPrefixes) {
        if (commentPrefixes == null) {
            throw new IllegalArgumentException("L'insieme dei prefissi di commento non può essere null");
        }
        this.commentPrefixes = Set.copyOf(commentPrefixes);
    }

    /**
     * Classifica una riga fisica.
     *
     * @param line riga senza terminatore di linea
     * @return categoria della riga
     */
    public LineKind classify(String line) {
        int start = firstSignificantIndex(line);
        if (start < 0) {
            return LineKind.BLANK;
        }

        char first = line.charAt(start);
        if (commentPrefixes.contains(first)) {
            return LineKind.COMMENT;
        }
        if (first == HEADER_PREFIX) {
            return LineKind.HEADER;
        }
        if (first == TERMINATOR_MARKER && firstSignificantIndex(line, start + 1) < 0) {
            return LineKind.CLAUSE_TERMINATOR_MARKER;
        }
        return LineKind.CLAUSE_DATA;
    }

    public Set<Character> getCommentPrefixes() {
        return commentPrefixes;
    }

    private static int firstSignificantIndex(String line) {
        return firstSignificantIndex(line, 0);
    }

    private static int firstSignificantIndex(String line, int from) {
        for (int i = from; i < line.length(); i++) {
            if (!Character.isWhitespace(line.charAt(i))) {
                return i;
            }
        }
        return -1;
    }
}
