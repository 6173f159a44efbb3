package org.utd.cs.naivebayes;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Raw counts gathered for one label while documents are being added.
 * Only {@link NaiveBayesModel} mutates it, and only before training.
 */
public class ClassStats {
    private final String label;
    private final Map<String, Integer> tokenCounts = new HashMap<>();
    private int documentCount;
    private long tokenTotal;

    public ClassStats(String label) {
        this.label = label;
    }

    void addToken(String token) {
        tokenCounts.merge(token, 1, Integer::sum);
        tokenTotal++;
    }

    void addDocument() {
        documentCount++;
    }

    // bulk variants used when restoring saved counts
    void addToken(String token, int count) {
        tokenCounts.merge(token, count, Integer::sum);
        tokenTotal += count;
    }

    void addDocuments(int count) {
        documentCount += count;
    }

    // Getters
    public String getLabel() {
        return label;
    }

    public int getDocumentCount() {
        return documentCount;
    }

    public long getTokenTotal() {
        return tokenTotal;
    }

    /** Occurrences of token in this label's documents, 0 if never seen here. */
    public int getCount(String token) {
        return tokenCounts.getOrDefault(token, 0);
    }

    public Map<String, Integer> getTokenCounts() {
        return Collections.unmodifiableMap(tokenCounts);
    }

    @Override
    public String toString() {
        return "ClassStats{" +
                "label='" + label + '\'' +
                ", documentCount=" + documentCount +
                ", tokenTotal=" + tokenTotal +
                ", distinctTokens=" + tokenCounts.size() +
                '}';
    }
}
