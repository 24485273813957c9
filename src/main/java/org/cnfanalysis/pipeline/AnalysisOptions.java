package org.cnfanalysis.pipeline;

import org.cnfanalysis.dimacs.LineClassifier;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * OPZIONI DI ANALISI - Politiche di dialetto e metriche opzionali per una pipeline
 *
 * Immutabile; si costruisce con {@link #builder()}. Valori predefiniti:
 * validazione header attiva, modalità a riga singola, commenti con 'c',
 * tracciamento esteso delle clausole disattivato.
 */
public final class AnalysisOptions {

    private final boolean headerValidation;
    private final boolean multiline;
    private final Set<Character> commentPrefixes;
    private final boolean extendedClauseTracking;

    private AnalysisOptions(Builder builder) {
        this.headerValidation = builder.headerValidation;
        this.multiline = builder.multiline;
        this.commentPrefixes = Collections.unmodifiableSet(new LinkedHashSet<>(builder.commentPrefixes));
        this.extendedClauseTracking = builder.extendedClauseTracking;
    }

    public static AnalysisOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean isHeaderValidation() {
        return headerValidation;
    }

    public boolean isMultiline() {
        return multiline;
    }

    public Set<Character> getCommentPrefixes() {
        return commentPrefixes;
    }

    public boolean isExtendedClauseTracking() {
        return extendedClauseTracking;
    }

    @Override
    public String toString() {
        return "AnalysisOptions{headerValidation=" + headerValidation
                + ", multiline=" + multiline
                + ", commentPrefixes=" + commentPrefixes
                + ", extendedClauseTracking=" + extendedClauseTracking + "}";
    }

    public static final class Builder {

        private boolean headerValidation = true;
        private boolean multiline = false;
        private Set<Character> commentPrefixes = Set.of(LineClassifier.DEFAULT_COMMENT_PREFIX);
        private boolean extendedClauseTracking = false;

        private Builder() {
        }

        public Builder headerValidation(boolean headerValidation) {
            this.headerValidation = headerValidation;
            return this;
        }

        public Builder multiline(boolean multiline) {
            this.multiline = multiline;
            return this;
        }

        /**
         * @throws IllegalArgumentException se l'insieme è null o vuoto
         */
        public Builder commentPrefixes(Set<Character> commentPrefixes) {
            if (commentPrefixes == null || commentPrefixes.isEmpty()) {
                throw new IllegalArgumentException("Serve almeno un prefisso di commento");
            }
            this.commentPrefixes = commentPrefixes;
            return this;
        }

        public Builder extendedClauseTracking(boolean extendedClauseTracking) {
            this.extendedClauseTracking = extendedClauseTracking;
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(this);
        }
    }
}
