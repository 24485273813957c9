package org.cnfanalysis.features;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Descrizione di una riga per ogni metrica prodotta, nell'ordine di assemblaggio.
 * Le famiglie di metriche (distribuzioni, fasce percentuali) sono descritte per prefisso.
 */
public final class MetricsDocumentation {

    private static final Map<String, String> DESCRIPTIONS = buildDescriptions();

    private MetricsDocumentation() {
    }

    private static Map<String, String> buildDescriptions() {
        Map<String, String> d = new LinkedHashMap<>();

        //region HEADER
        d.put("nbvars", "numero di variabili dichiarato nell'header (solo con header)");
        d.put("nbclauses", "numero di clausole dichiarato nell'header (solo con header)");
        //endregion

        //region CONTEGGI
        d.put("clauses_count", "numero di clausole lette");
        d.put("literals_count", "numero totale di letterali, ripetizioni incluse");
        d.put("positive_literals_count", "occorrenze di letterali positivi");
        d.put("negative_literals_count", "occorrenze di letterali negativi");
        d.put("positive_literals_ratio", "frazione di letterali positivi sul totale");
        d.put("positive_unit_clause_count", "clausole unitarie con letterale positivo");
        d.put("negative_unit_clause_count", "clausole unitarie con letterale negativo");
        d.put("two_literals_clause_count", "clausole con esattamente due letterali");
        d.put("definite_clauses_count", "clausole con esattamente un letterale positivo");
        d.put("goal_clauses_count", "clausole non vuote senza letterali positivi");
        d.put("tautological_clauses_count", "clausole che contengono una variabile con entrambe le polarità");
        d.put("tautological_literals_count", "variabili con entrambe le polarità nella stessa clausola, sommate sulle clausole");
        //endregion

        //region DISTRIBUZIONI PER CLAUSOLA
        d.put("clauses_length_*", "lunghezza delle clausole: count, sum, mean, sd, smallest, largest, median");
        d.put("positive_literals_in_clause_*", "letterali positivi per clausola: count, sum, mean, sd, smallest, largest");
        d.put("negative_literals_in_clause_*", "letterali negativi per clausola: count, sum, mean, sd, smallest, largest");
        d.put("clauses_length_uniform", "true se tutte le clausole hanno la stessa lunghezza");
        d.put("positive_negative_literals_in_clause_ratio_mean",
                "media della frazione di letterali positivi per clausola (0 = tutti negativi, 1 = tutti positivi), sulle clausole non vuote");
        d.put("positive_negative_literals_in_clause_ratio_sd", "deviazione standard della frazione di letterali positivi per clausola");
        d.put("positive_negative_literals_in_clause_ratio_entropy",
                "entropia -somma(r*log2(r)) sulle frazioni r di letterali positivi non nulle delle clausole");
        d.put("clause_variables_sd_mean", "media della deviazione standard degli indici di variabile per clausola");
        //endregion

        //region OCCORRENZE
        d.put("variables_used_count", "variabili distinte che compaiono in almeno una clausola");
        d.put("literals_used_count", "letterali distinti che compaiono in almeno una clausola");
        d.put("pure_literals_count", "letterali la cui negazione non compare mai");
        d.put("pure_positive_literals_count", "letterali puri positivi");
        d.put("pure_negative_literals_count", "letterali puri negativi");
        d.put("existential_literals_count", "letterali puri che compaiono una sola volta");
        d.put("existential_positive_literals_count", "letterali puri positivi che compaiono una sola volta");
        d.put("literals_occurence_one_count", "letterali che compaiono esattamente una volta");
        d.put("variables_largest", "indice di variabile massimo osservato");
        d.put("variables_smallest", "indice di variabile minimo osservato");
        d.put("variables_occurrence_*", "occorrenze per variabile: count, sum, mean, sd, smallest, largest, median, entropy");
        d.put("literals_occurrence_*", "occorrenze per letterale: count, sum, mean, sd, smallest, largest, median, entropy");
        d.put("variables_frequency_<da>_to_<a>", "variabili con occorrenze, rispetto al massimo, nella fascia percentuale indicata");
        d.put("literals_frequency_<da>_to_<a>", "letterali con occorrenze, rispetto al massimo, nella fascia percentuale indicata");
        //endregion

        //region GRAFI E BANALITÀ
        d.put("connected_variable_components_count", "componenti connesse del grafo delle variabili");
        d.put("connected_literal_components_count", "componenti connesse del grafo dei letterali");
        d.put("true_trivial", "true se la formula non ha clausole");
        d.put("false_trivial", "true se la formula contiene la clausola vuota");
        //endregion

        //region TRACCIAMENTO ESTESO
        d.put("clauses_unique_count", "clausole distinte come insiemi di letterali (solo con tracciamento esteso)");
        d.put("xor2_count", "coppie di clausole binarie {a, b} e {-a, -b} (solo con tracciamento esteso)");
        d.put("literals_unit_unique_count", "variabili distinte che compaiono in clausole unitarie (solo con tracciamento esteso)");
        d.put("literals_unit_unique_positive_count",
                "variabili presenti solo in clausole unitarie positive, omessa se 0 (solo con tracciamento esteso)");
        d.put("literals_unit_unique_negative_count",
                "variabili presenti solo in clausole unitarie negative, omessa se 0 (solo con tracciamento esteso)");
        d.put("literals_unit_unique_contradictory_variable",
                "ultima variabile trovata in clausole unitarie di entrambe le polarità, omessa se assente (solo con tracciamento esteso)");
        //endregion

        return Collections.unmodifiableMap(d);
    }

    /**
     * @return nome (o famiglia) di metrica → descrizione
     */
    public static Map<String, String> descriptions() {
        return DESCRIPTIONS;
    }

    /**
     * @return testo tabellare stampabile
     */
    public static String render() {
        int width = DESCRIPTIONS.keySet().stream().mapToInt(String::length).max().orElse(0);
        StringBuilder text = new StringBuilder();
        DESCRIPTIONS.forEach((name, description) ->
                text.append(String.format("%-" + width + "s  %s%n", name, description)));
        return text.toString();
    }
}
