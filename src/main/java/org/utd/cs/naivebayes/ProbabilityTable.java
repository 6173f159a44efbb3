/**
 * ProbabilityTable.java
 * Naive Bayes Text Classifier
 *
 * Description: Trained, read-only probabilities for a single label.
 *
 * Holds the log-prior ln(D_c / D) and, for every token of the vocabulary,
 * the smoothed log-likelihood
 *
 *      log P(t | c) = ln( (n_tc + a) / (T_c + a * V) )
 *
 * where a is the smoothing constant (1.0 gives Laplace add-one smoothing).
 * Because a > 0 every entry is finite, so a token seen under one label only
 * never drives another label's score to negative infinity.
 */

package org.utd.cs.naivebayes;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.Set;

public final class ProbabilityTable {
    private final String label;
    private final double logPrior;
    private final Map<String, Double> logLikelihoods;

    ProbabilityTable(String label, double logPrior, Map<String, Double> logLikelihoods) {
        this.label = label;
        this.logPrior = logPrior;
        this.logLikelihoods = Collections.unmodifiableMap(logLikelihoods);
    }

    /**
     * Builds the table for one label from its frozen counts.
     * @param stats The label's accumulated counts.
     * @param vocabulary Every token seen in training, across all labels.
     * @param totalDocuments Documents added across all labels.
     * @param smoothing Additive smoothing constant, strictly positive.
     */
    static ProbabilityTable build(ClassStats stats, Set<String> vocabulary,
                                  int totalDocuments, double smoothing) {
        double logPrior = Math.log((double) stats.getDocumentCount() / (double) totalDocuments);
        double denominator = stats.getTokenTotal() + smoothing * vocabulary.size();

        Map<String, Double> table = new HashMap<>(vocabulary.size() * 2);
        for (String token : vocabulary) {
            double numerator = stats.getCount(token) + smoothing;
            table.put(token, Math.log(numerator / denominator));
        }
        return new ProbabilityTable(stats.getLabel(), logPrior, table);
    }

    public String getLabel() {
        return label;
    }

    public double getLogPrior() {
        return logPrior;
    }

    /** Log-likelihood of the token under this label; empty if the token is outside the vocabulary. */
    public OptionalDouble logLikelihood(String token) {
        Double p = logLikelihoods.get(token);
        return p == null ? OptionalDouble.empty() : OptionalDouble.of(p);
    }

    public Map<String, Double> getLogLikelihoods() {
        return logLikelihoods;
    }

    /**
     * Scores a tokenized document: log-prior plus the log-likelihood of each
     * token that is in the vocabulary. Out-of-vocabulary tokens are skipped.
     */
    public double score(Iterable<String> tokens) {
        double total = 0.0;
        for (String token : tokens) {
            Double p = logLikelihoods.get(token);
            if (p != null) {
                total += p;
            }
        }
        return logPrior + total;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProbabilityTable)) return false;
        ProbabilityTable that = (ProbabilityTable) o;
        return Double.compare(logPrior, that.logPrior) == 0
                && label.equals(that.label)
                && logLikelihoods.equals(that.logLikelihoods);
    }

    @Override
    public int hashCode() {
        return 31 * label.hashCode() + logLikelihoods.hashCode();
    }
}
