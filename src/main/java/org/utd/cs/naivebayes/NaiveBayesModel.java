/**
 * NaiveBayesModel.java
 * Naive Bayes Text Classifier
 *
 * Description: Multinomial naive Bayes over bags of word tokens.
 *
 * The model moves through two phases:
 *  1.  UNTRAINED: documents are added one at a time. Each document's tokens
 *      are counted into its label's ClassStats and into the shared vocabulary.
 *  2.  TRAINED: train() has frozen the counts into one ProbabilityTable per
 *      label. Documents can no longer be added; classify() scores a document
 *      under every label and returns the best one.
 *
 * All scoring happens in log-space so long documents do not underflow.
 * When several labels share the exact best score the lexicographically
 * smallest label wins; labels are kept in sorted order for that reason.
 */

package org.utd.cs.naivebayes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

public class NaiveBayesModel {
    private static final Logger logger = LoggerFactory.getLogger(NaiveBayesModel.class);

    public static final double DEFAULT_SMOOTHING = 1.0;

    public enum Phase {
        UNTRAINED, TRAINED
    }

    // label -> counts, sorted so iteration order is the tie-break order
    private final SortedMap<String, ClassStats> classes = new TreeMap<>();
    // token -> occurrences across all labels
    private final Map<String, Integer> vocabulary = new HashMap<>();
    private int totalDocuments = 0;
    private double smoothing = DEFAULT_SMOOTHING;

    private volatile Phase phase = Phase.UNTRAINED;
    private Map<String, ProbabilityTable> tables = Collections.emptyMap();

    public NaiveBayesModel() {}

    public NaiveBayesModel(double smoothing) {
        setSmoothing(smoothing);
    }

    // ---- ACCUMULATION ----

    /**
     * Tokenizes a document and counts it under the given label.
     * @param text The raw document text.
     * @param label The document's class.
     * @throws ModelStateException if the model is already trained.
     */
    public void addDocument(String text, String label) {
        addDocumentTokenized(Tokenizer.tokenize(text), label);
    }

    /**
     * Counts an already tokenized document under the given label.
     * A document without tokens still counts towards the label's prior.
     */
    public void addDocumentTokenized(List<String> tokens, String label) {
        requirePhase(Phase.UNTRAINED, "add documents");
        if (label == null) {
            throw new IllegalArgumentException("label must not be null");
        }

        ClassStats stats = classes.computeIfAbsent(label, ClassStats::new);
        for (String token : tokens) {
            stats.addToken(token);
            vocabulary.merge(token, 1, Integer::sum);
        }
        stats.addDocument();
        totalDocuments++;
    }

    /** Adds every (text, label) pair in order. */
    public void addDocuments(List<Map.Entry<String, String>> documents) {
        for (Map.Entry<String, String> doc : documents) {
            addDocument(doc.getKey(), doc.getValue());
        }
    }

    /**
     * Restores previously saved counts for one label without re-reading the
     * documents. Used by ModelStore.
     */
    void restoreClass(String label, int documents, Map<String, Integer> tokenCounts) {
        requirePhase(Phase.UNTRAINED, "restore counts");
        if (label == null) {
            throw new IllegalArgumentException("label must not be null");
        }
        if (documents < 1) {
            throw new IllegalArgumentException("document count must be positive for label " + label);
        }

        ClassStats stats = classes.computeIfAbsent(label, ClassStats::new);
        for (Map.Entry<String, Integer> e : tokenCounts.entrySet()) {
            if (e.getValue() <= 0) {
                throw new IllegalArgumentException("non-positive count for token '" + e.getKey() + "'");
            }
            stats.addToken(e.getKey(), e.getValue());
            vocabulary.merge(e.getKey(), e.getValue(), Integer::sum);
        }
        stats.addDocuments(documents);
        totalDocuments += documents;
    }

    // ---- TRAINING ----

    /**
     * Builds the probability tables from the current counts and moves the
     * model to TRAINED. Calling it again recomputes the same tables.
     * @throws ModelStateException if no document was ever added.
     */
    public void train() {
        if (totalDocuments == 0 || classes.isEmpty()) {
            throw new ModelStateException("Cannot train a model without documents");
        }

        Set<String> vocab = Collections.unmodifiableSet(vocabulary.keySet());
        Map<String, ProbabilityTable> built = new LinkedHashMap<>();
        for (ClassStats stats : classes.values()) {
            ProbabilityTable table = ProbabilityTable.build(stats, vocab, totalDocuments, smoothing);
            built.put(stats.getLabel(), table);
            logger.debug("Trained label '{}': docs={} tokens={} logPrior={}",
                    stats.getLabel(), stats.getDocumentCount(), stats.getTokenTotal(), table.getLogPrior());
        }
        this.tables = Collections.unmodifiableMap(built);
        this.phase = Phase.TRAINED;

        logger.info("Training complete: {} labels, {} documents, vocabulary size {}, smoothing {}",
                classes.size(), totalDocuments, vocabulary.size(), smoothing);
    }

    // ---- CLASSIFICATION ----

    /**
     * Returns the most probable label for the text.
     * An empty document falls back to the label with the highest prior.
     * @throws ModelStateException if the model has not been trained.
     */
    public String classify(String text) {
        return classifyTokenized(Tokenizer.tokenize(text));
    }

    public String classifyTokenized(List<String> tokens) {
        requirePhase(Phase.TRAINED, "classify");

        String best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        // tables iterate in label order, so a strict '>' keeps the smallest tied label
        for (ProbabilityTable table : tables.values()) {
            double score = table.score(tokens);
            logger.debug("score for {}: {}", table.getLabel(), score);
            if (best == null || score > bestScore) {
                best = table.getLabel();
                bestScore = score;
            }
        }
        return best;
    }

    /**
     * Log-scores of the text under every label, best first.
     * Equal scores are ordered by label.
     */
    public List<LabelScore> getDocumentScores(String text) {
        return getDocumentScoresTokenized(Tokenizer.tokenize(text));
    }

    public List<LabelScore> getDocumentScoresTokenized(List<String> tokens) {
        requirePhase(Phase.TRAINED, "score documents");

        List<LabelScore> scores = new ArrayList<>(tables.size());
        for (ProbabilityTable table : tables.values()) {
            scores.add(new LabelScore(table.getLabel(), table.score(tokens)));
        }
        scores.sort(Comparator.comparingDouble(LabelScore::logScore).reversed()
                .thenComparing(LabelScore::label));
        return scores;
    }

    // ---- CONFIG / ACCESSORS ----

    /**
     * Sets the additive smoothing constant. 1.0 is Laplace smoothing.
     * @throws IllegalArgumentException if the value is not a positive finite number.
     * @throws ModelStateException if the model is already trained.
     */
    public void setSmoothing(double smoothing) {
        if (!(smoothing > 0.0) || Double.isInfinite(smoothing)) {
            throw new IllegalArgumentException("smoothing must be a positive number, got " + smoothing);
        }
        requirePhase(Phase.UNTRAINED, "change smoothing");
        this.smoothing = smoothing;
    }

    public double getSmoothing() {
        return smoothing;
    }

    public Phase getPhase() {
        return phase;
    }

    public boolean isTrained() {
        return phase == Phase.TRAINED;
    }

    /** Known labels in sorted order; empty before the first document. */
    public List<String> getLabels() {
        return new ArrayList<>(classes.keySet());
    }

    public int getTotalDocuments() {
        return totalDocuments;
    }

    public int getVocabularySize() {
        return vocabulary.size();
    }

    public boolean inVocabulary(String token) {
        return vocabulary.containsKey(token);
    }

    /** Token -> occurrences across every label. */
    public Map<String, Integer> getVocabulary() {
        return Collections.unmodifiableMap(vocabulary);
    }

    public Optional<ClassStats> getClassStats(String label) {
        return Optional.ofNullable(classes.get(label));
    }

    /**
     * The trained table for a label.
     * @throws ModelStateException if the model has not been trained.
     */
    public Optional<ProbabilityTable> getProbabilityTable(String label) {
        requirePhase(Phase.TRAINED, "read probability tables");
        return Optional.ofNullable(tables.get(label));
    }

    private void requirePhase(Phase expected, String action) {
        if (phase != expected) {
            throw new ModelStateException("Cannot " + action + " while the model is " + phase
                    + " (requires " + expected + ")");
        }
    }
}
