/**
 * ClassifierCli.java
 * Naive Bayes Text Classifier
 *
 * Description:
 *  Command-line entry point for training and querying the classifier.
 *
 *  This class:
 *    - Trains a model from a labeled corpus folder (see CorpusLoader), or
 *      loads a previously saved model
 *    - Optionally saves the trained model as JSON
 *    - Classifies every remaining argument as a document and prints the
 *      winning label followed by the log-score of each label
 *
 *  Supported flags:
 *    --train=DIR        Corpus folder (one sub-folder per label)
 *    --model=FILE       Model file (default: classifier.model.path from classifier.properties)
 *    --save             Write the trained model to the model file
 *    --smoothing=X      Additive smoothing used when training (default: classifier.smoothing)
 *    --top=N            Print the N most frequent tokens of each label
 *
 *  TO USE:
 *
 *    mvn -q -DskipTests compile exec:java "-Dexec.args=--train=data/corpus --save"
 *    mvn -q -DskipTests exec:java "-Dexec.args=salami pancetta beef ribs"
 */

package org.utd.cs.naivebayes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public class ClassifierCli {
    private static final Logger logger = LoggerFactory.getLogger(ClassifierCli.class);

    private final ClassifierConfig config;
    private final PrintStream out;

    public ClassifierCli(ClassifierConfig config, PrintStream out) {
        this.config = config;
        this.out = out;
    }

    public static void main(String[] args) {
        int code = new ClassifierCli(ClassifierConfig.load(), System.out).run(args);
        System.exit(code);
    }

    /**
     * Runs the CLI.
     * @return 0 on success, 1 on a usage or I/O error.
     */
    public int run(String[] args) {
        String trainDir = null;
        File modelFile = config.getModelPath();
        boolean save = false;
        Double smoothing = null;
        int top = 0;
        List<String> texts = new ArrayList<>();

        try {
            for (String a : args) {
                if (a.startsWith("--train=")) {
                    trainDir = a.substring(8);
                } else if (a.startsWith("--model=")) {
                    modelFile = new File(a.substring(8));
                } else if (a.equals("--save")) {
                    save = true;
                } else if (a.startsWith("--smoothing=")) {
                    smoothing = Double.parseDouble(a.substring(12));
                } else if (a.startsWith("--top=")) {
                    top = Integer.parseInt(a.substring(6));
                } else if (a.startsWith("--")) {
                    throw new IllegalArgumentException("Unknown flag: " + a);
                } else {
                    texts.add(a);
                }
            }
        } catch (IllegalArgumentException e) {
            // NumberFormatException lands here too
            logger.error("Bad arguments: {}", e.getMessage());
            printUsage();
            return 1;
        }

        if (trainDir == null && texts.isEmpty()) {
            printUsage();
            return 1;
        }

        try {
            NaiveBayesModel model;
            if (trainDir != null) {
                model = smoothing == null ? config.newModel() : new NaiveBayesModel(smoothing);
                int added = CorpusLoader.loadInto(model, Path.of(trainDir));
                out.println("Loaded " + added + " documents from " + trainDir);
                model.train();
                out.println("Labels: " + model.getLabels() + " | Vocabulary: " + model.getVocabularySize());

                if (save) {
                    ModelStore.save(model, modelFile);
                    out.println("Saved model to " + modelFile);
                }
            } else {
                if (!modelFile.isFile()) {
                    logger.error("No model at {}; train one first with --train=DIR --save", modelFile);
                    return 1;
                }
                model = ModelStore.load(modelFile);
            }

            if (top > 0) {
                printTopTokens(model, top);
            }

            for (String text : texts) {
                out.println("\n--- " + text + " ---");
                out.println("label: " + model.classify(text));
                for (LabelScore s : model.getDocumentScores(text)) {
                    out.printf("  %s : %.6f%n", s.label(), s.logScore());
                }
            }
            return 0;
        } catch (IOException e) {
            logger.error("I/O failure: {}", e.getMessage(), e);
            return 1;
        } catch (IllegalArgumentException | ModelStateException e) {
            logger.error("Classifier failure: {}", e.getMessage());
            return 1;
        }
    }

    private void printTopTokens(NaiveBayesModel model, int k) {
        for (String label : model.getLabels()) {
            ClassStats stats = model.getClassStats(label).orElseThrow();
            out.println("\nTop " + k + " tokens for '" + label + "' (" + stats.getDocumentCount() + " docs):");
            for (Map.Entry<String, Integer> e : Tokenizer.topK(stats.getTokenCounts(), k)) {
                out.println("  " + e.getKey() + " : " + e.getValue());
            }
        }
    }

    private void printUsage() {
        out.println("Usage: ClassifierCli [--train=DIR] [--model=FILE] [--save] [--smoothing=X] [--top=N] [text ...]");
    }
}
