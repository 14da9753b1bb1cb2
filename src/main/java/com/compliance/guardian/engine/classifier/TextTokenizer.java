package com.compliance.guardian.engine.classifier;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Splits email text into lower-case terms. Tokens shorter than two characters
 * and common English stop words are dropped.
 */
public final class TextTokenizer {

    private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{N}]+");

    private static final int MIN_TOKEN_LENGTH = 2;

    static final Set<String> STOP_WORDS = Set.of(
            "a", "about", "above", "after", "again", "all", "am", "an", "and", "any", "are", "as", "at",
            "be", "because", "been", "before", "being", "below", "between", "both", "but", "by",
            "can", "could", "did", "do", "does", "doing", "down", "during", "each", "few", "for", "from",
            "further", "had", "has", "have", "having", "he", "her", "here", "hers", "him", "his", "how",
            "if", "in", "into", "is", "it", "its", "itself", "just", "me", "more", "most", "my", "no",
            "nor", "not", "now", "of", "off", "on", "once", "only", "or", "other", "our", "ours", "out",
            "over", "own", "same", "she", "should", "so", "some", "such", "than", "that", "the", "their",
            "them", "then", "there", "these", "they", "this", "those", "through", "to", "too", "under",
            "until", "up", "very", "was", "we", "were", "what", "when", "where", "which", "while", "who",
            "whom", "why", "will", "with", "would", "you", "your", "yours");

    private TextTokenizer() {
    }

    public static List<String> tokenize(String text) {
        List<String> tokens = new ArrayList<>();
        if (text == null || text.isBlank()) return tokens;

        for (String raw : SEPARATOR.split(text.toLowerCase(Locale.ROOT))) {
            if (raw.length() < MIN_TOKEN_LENGTH) continue;
            if (STOP_WORDS.contains(raw)) continue;
            tokens.add(raw);
        }
        return tokens;
    }
}
