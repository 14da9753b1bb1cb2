package com.compliance.guardian.engine.classifier;

import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Term-count features over a fixed vocabulary.
 */
public final class BagOfWordsVectorizer {

    private BagOfWordsVectorizer() {
    }

    /**
     * Build a vocabulary from tokenized documents, keeping the {@code maxFeatures}
     * terms with the highest document frequency (ties broken alphabetically).
     * Indices are assigned in alphabetical term order so the result is deterministic.
     */
    public static Map<String, Integer> buildVocabulary(List<List<String>> documents, int maxFeatures) {
        Map<String, Integer> documentFrequency = new HashMap<>();
        for (List<String> doc : documents) {
            for (String term : new HashSet<>(doc)) {
                documentFrequency.merge(term, 1, Integer::sum);
            }
        }

        List<String> terms = documentFrequency.entrySet().stream()
                .sorted(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(maxFeatures)
                .map(Map.Entry::getKey)
                .sorted()
                .toList();

        Map<String, Integer> vocabulary = new LinkedHashMap<>();
        for (int i = 0; i < terms.size(); i++) {
            vocabulary.put(terms.get(i), i);
        }
        return vocabulary;
    }

    /**
     * Sparse term counts (feature index to count). Out-of-vocabulary terms are ignored.
     */
    public static Map<Integer, Integer> countVector(List<String> tokens, Map<String, Integer> vocabulary) {
        Map<Integer, Integer> counts = new TreeMap<>();
        for (String token : tokens) {
            Integer index = vocabulary.get(token);
            if (index != null) {
                counts.merge(index, 1, Integer::sum);
            }
        }
        return counts;
    }
}
