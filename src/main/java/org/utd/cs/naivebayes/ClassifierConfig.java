/**
 * ClassifierConfig.java
 * Naive Bayes Text Classifier
 *
 * Description:
 * Reads classifier settings from classifier.properties on the classpath.
 * A system property with the same key overrides the file, and a missing
 * file leaves the defaults in place.
 *
 *   classifier.smoothing   additive smoothing constant (default 1.0)
 *   classifier.model.path  where the CLI saves/loads the model (default data/model/classifier.json)
 */

package org.utd.cs.naivebayes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Properties;

public class ClassifierConfig {
    private static final Logger logger = LoggerFactory.getLogger(ClassifierConfig.class);

    public static final String RESOURCE = "classifier.properties";
    public static final String SMOOTHING_KEY = "classifier.smoothing";
    public static final String MODEL_PATH_KEY = "classifier.model.path";
    public static final String DEFAULT_MODEL_PATH = "data/model/classifier.json";

    private final double smoothing;
    private final File modelPath;

    public ClassifierConfig(double smoothing, File modelPath) {
        if (!(smoothing > 0.0) || Double.isInfinite(smoothing)) {
            throw new IllegalArgumentException(SMOOTHING_KEY + " must be a positive number, got " + smoothing);
        }
        this.smoothing = smoothing;
        this.modelPath = modelPath;
    }

    /** Loads classifier.properties from the classpath. */
    public static ClassifierConfig load() {
        return load(RESOURCE);
    }

    public static ClassifierConfig load(String resource) {
        Properties props = new Properties();
        try (InputStream in = ClassifierConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (in == null) {
                logger.info("No {} on classpath, using defaults.", resource);
            } else {
                props.load(in);
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read " + resource, e);
        }
        return fromProperties(props);
    }

    static ClassifierConfig fromProperties(Properties props) {
        String smoothingValue = lookup(props, SMOOTHING_KEY, String.valueOf(NaiveBayesModel.DEFAULT_SMOOTHING));
        String modelPathValue = lookup(props, MODEL_PATH_KEY, DEFAULT_MODEL_PATH);

        double smoothing;
        try {
            smoothing = Double.parseDouble(smoothingValue.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(SMOOTHING_KEY + " is not a number: " + smoothingValue, e);
        }

        ClassifierConfig config = new ClassifierConfig(smoothing, new File(modelPathValue.trim()));
        logger.debug("Loaded config: smoothing={} modelPath={}", config.smoothing, config.modelPath);
        return config;
    }

    private static String lookup(Properties props, String key, String fallback) {
        String sys = System.getProperty(key);
        if (sys != null && !sys.isBlank()) return sys;
        return props.getProperty(key, fallback);
    }

    /** A fresh, untrained model using the configured smoothing. */
    public NaiveBayesModel newModel() {
        return new NaiveBayesModel(smoothing);
    }

    public double getSmoothing() {
        return smoothing;
    }

    public File getModelPath() {
        return modelPath;
    }
}
