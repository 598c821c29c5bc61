package io.xsql.engine.execution;

import io.xsql.engine.query.ast.SelectItem;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * TF-IDF over a corpus of candidate texts.
 *
 * tf = term count / token count of the document,
 * idf = ln((N + 1) / (df + 1)) + 1.
 */
final class TfIdf {

    static final Set<String> ENGLISH_STOPWORDS = Set.of(
            "a", "an", "and", "are", "as", "at", "be", "but", "by", "for", "from", "has", "have",
            "he", "her", "his", "i", "in", "is", "it", "its", "of", "on", "or", "she", "that",
            "the", "their", "they", "to", "was", "were", "with", "you");

    private final SelectItem.TfidfItem item;
    private final int topTerms;

    TfIdf(SelectItem.TfidfItem item, int defaultTopTerms) {
        this.item = item;
        this.topTerms = item.topTerms() != null ? item.topTerms() : defaultTopTerms;
    }

    /**
     * Lowercase runs of letters, digits and underscores.
     */
    static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '_') {
                current.append(Character.toLowerCase(c));
            } else if (current.length() > 0) {
                tokens.add(current.toString());
                current.setLength(0);
            }
        }
        if (current.length() > 0) {
            tokens.add(current.toString());
        }
        return tokens;
    }

    /**
     * One value per document: a term score map, or the summed score of the
     * query terms.
     */
    List<Value> score(List<String> documents) {
        List<Map<String, Integer>> termCounts = new ArrayList<>(documents.size());
        List<Integer> lengths = new ArrayList<>(documents.size());
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (String document : documents) {
            Map<String, Integer> counts = new LinkedHashMap<>();
            int length = 0;
            for (String token : tokenize(document)) {
                if (isStopword(token)) {
                    continue;
                }
                counts.merge(token, 1, Integer::sum);
                length++;
            }
            for (String term : counts.keySet()) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
            termCounts.add(counts);
            lengths.add(length);
        }

        int n = documents.size();
        List<Value> out = new ArrayList<>(n);
        for (int d = 0; d < n; d++) {
            Map<String, Integer> counts = termCounts.get(d);
            int length = lengths.get(d);
            if (item.scoresTerms()) {
                double total = 0;
                for (String term : item.terms()) {
                    String key = term.toLowerCase(Locale.ROOT);
                    Integer count = counts.get(key);
                    if (count != null && withinDfBounds(documentFrequency.get(key))) {
                        total += weight(count, length, documentFrequency.get(key), n);
                    }
                }
                out.add(Value.of(round(total)));
            } else {
                out.add(topTermsOf(counts, length, documentFrequency, n));
            }
        }
        return out;
    }

    private Value topTermsOf(Map<String, Integer> counts, int length, Map<String, Integer> df, int n) {
        List<Map.Entry<String, Double>> scored = new ArrayList<>();
        for (Map.Entry<String, Integer> e : counts.entrySet()) {
            int termDf = df.get(e.getKey());
            if (withinDfBounds(termDf)) {
                scored.add(Map.entry(e.getKey(), round(weight(e.getValue(), length, termDf, n))));
            }
        }
        scored.sort(Map.Entry.<String, Double>comparingByValue().reversed()
                .thenComparing(Map.Entry.<String, Double>comparingByKey(RowOrdering::compareCodePoints)));
        Map<String, Value> top = new LinkedHashMap<>();
        for (int i = 0; i < scored.size() && i < topTerms; i++) {
            top.put(scored.get(i).getKey(), Value.of(scored.get(i).getValue()));
        }
        return new Value.MapValue(top);
    }

    private boolean isStopword(String token) {
        return item.stopwords() == SelectItem.Stopwords.ENGLISH && ENGLISH_STOPWORDS.contains(token);
    }

    private boolean withinDfBounds(int df) {
        return df >= item.minDf() && (item.maxDf() <= 0 || df <= item.maxDf());
    }

    private static double weight(int count, int length, int df, int n) {
        double tf = (double) count / length;
        double idf = Math.log((n + 1.0) / (df + 1.0)) + 1.0;
        return tf * idf;
    }

    // six decimal places
    private static double round(double value) {
        return Math.round(value * 1_000_000d) / 1_000_000d;
    }
}
