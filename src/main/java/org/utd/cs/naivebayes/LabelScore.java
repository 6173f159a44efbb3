package org.utd.cs.naivebayes;

/**
 * A label together with the log-space score a document received under it.
 */
public record LabelScore(String label, double logScore) {
}
