/**
 * Tokenizer.java
 * Naive Bayes Text Classifier
 *
 * Description:
 *  Turns raw document text into a bag of lower-cased word tokens.
 *   - splits on whitespace and punctuation (anything that is not a letter, mark or digit)
 *   - lower-cases every token so matching is case-insensitive
 *   - drops empty pieces left by consecutive separators
 *
 *  Token order is preserved, but the model only ever uses token counts.
 */

package org.utd.cs.naivebayes;

import java.util.*;
import java.util.regex.Pattern;

public final class Tokenizer {

    // one or more characters that are neither a letter, a combining mark nor a digit
    private static final Pattern SEPARATOR = Pattern.compile("[^\\p{L}\\p{M}\\p{Nd}]+");

    private Tokenizer() {}

    /**
     * Tokenizes text into lower-cased words.
     * @param text The raw text, may be null or empty.
     * @return The tokens in order of appearance, never null.
     */
    public static List<String> tokenize(String text) {
        List<String> toks = new ArrayList<>();
        if (text == null || text.isBlank()) return toks;

        for (String raw : SEPARATOR.split(text)) {
            if (raw.isEmpty()) continue;
            toks.add(raw.toLowerCase(Locale.ROOT));
        }
        return toks;
    }

    /** Utility: top-k by value for maps (for CLI printing). Ties are broken by key. */
    public static List<Map.Entry<String, Integer>> topK(Map<String, Integer> m, int k) {
        return m.entrySet().stream()
                .sorted((a, b) -> {
                    int c = Integer.compare(b.getValue(), a.getValue());
                    return c != 0 ? c : a.getKey().compareTo(b.getKey());
                })
                .limit(k)
                .toList();
    }
}
