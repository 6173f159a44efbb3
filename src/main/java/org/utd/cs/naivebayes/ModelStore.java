/**
 * ModelStore.java
 * Naive Bayes Text Classifier
 *
 * Description:
 * Saves and loads a trained NaiveBayesModel as JSON.
 *
 * Only the raw counts are written (smoothing, and per label the document
 * count plus token counts). Loading replays those counts into a fresh model
 * and trains it, so the probability tables are always rebuilt from counts
 * and never read from disk.
 *
 *   {
 *     "smoothing": 1.0,
 *     "classes": [
 *       { "label": "meat", "documents": 2, "tokens": { "pork": 3, ... } },
 *       ...
 *     ]
 *   }
 */

package org.utd.cs.naivebayes;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.HashMap;
import java.util.Map;

public class ModelStore {
    private static final Logger logger = LoggerFactory.getLogger(ModelStore.class);

    private ModelStore() {}

    public static void save(NaiveBayesModel model, File file) throws IOException {
        logger.info("Saving model at {}", file);
        File parentDir = file.getParentFile();
        // Check if it exists and create it if it doesn't
        if (parentDir != null && !parentDir.exists()) {
            if (!parentDir.mkdirs()) {
                throw new IOException("Failed to create parent directories: " + parentDir.getAbsolutePath());
            }
        }
        Files.writeString(file.toPath(), toJson(model), StandardCharsets.UTF_8);
    }

    public static NaiveBayesModel load(File file) throws IOException {
        logger.info("Loading model from {}", file);
        String json = Files.readString(file.toPath(), StandardCharsets.UTF_8);
        try {
            return fromJson(json);
        } catch (JSONException | IllegalArgumentException | ModelStateException e) {
            throw new IOException("Malformed model file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Serializes the counts behind a trained model.
     * @throws ModelStateException if the model has not been trained.
     */
    public static String toJson(NaiveBayesModel model) {
        if (!model.isTrained()) {
            throw new ModelStateException("Only a trained model can be saved");
        }

        JSONObject obj = new JSONObject();
        obj.put("smoothing", model.getSmoothing());

        JSONArray classes = new JSONArray();
        for (String label : model.getLabels()) {
            ClassStats stats = model.getClassStats(label).orElseThrow();
            JSONObject c = new JSONObject();
            c.put("label", label);
            c.put("documents", stats.getDocumentCount());
            c.put("tokens", new JSONObject(stats.getTokenCounts()));
            classes.put(c);
        }
        obj.put("classes", classes);

        return obj.toString(2);
    }

    /**
     * Rebuilds and trains a model from {@link #toJson(NaiveBayesModel)} output.
     * @throws JSONException if the text is not a valid model document.
     */
    public static NaiveBayesModel fromJson(String json) {
        JSONObject obj = new JSONObject(json);

        NaiveBayesModel model = new NaiveBayesModel(obj.optDouble("smoothing", NaiveBayesModel.DEFAULT_SMOOTHING));

        JSONArray classes = obj.getJSONArray("classes");
        for (int i = 0; i < classes.length(); i++) {
            JSONObject c = classes.getJSONObject(i);
            JSONObject tokens = c.getJSONObject("tokens");

            Map<String, Integer> counts = new HashMap<>();
            for (String token : tokens.keySet()) {
                counts.put(token, wholeNumber(tokens, token));
            }
            model.restoreClass(c.getString("label"), wholeNumber(c, "documents"), counts);
        }

        model.train();
        return model;
    }

    // counts must be whole numbers; getInt would silently truncate 1.9 to 1
    private static int wholeNumber(JSONObject obj, String key) {
        BigDecimal value = obj.getBigDecimal(key);
        try {
            return value.intValueExact();
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("'" + key + "' must be a whole number, got " + value, e);
        }
    }
}
