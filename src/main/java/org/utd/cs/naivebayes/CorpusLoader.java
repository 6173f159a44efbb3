/**
 * CorpusLoader.java
 * Naive Bayes Text Classifier
 *
 * Description:
 * Reads a labeled training corpus laid out as one folder per label:
 *
 *   corpus/
 *     meat/    doc1.txt doc2.txt ...
 *     veggie/  doc1.txt ...
 *
 * Every .txt file is one document whose label is its parent folder's name.
 * Names starting with '.' are skipped.
 * Folders and files are visited in name order so loading is repeatable.
 */

package org.utd.cs.naivebayes;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

public class CorpusLoader {
    private static final Logger logger = LoggerFactory.getLogger(CorpusLoader.class);

    private CorpusLoader() {}

    /**
     * Loads every document under root.
     * @param root Folder whose sub-folders are labels.
     * @return (text, label) pairs.
     * @throws IOException if root is not a directory or a file cannot be read.
     */
    public static List<Map.Entry<String, String>> load(Path root) throws IOException {
        if (!Files.isDirectory(root)) {
            throw new NotDirectoryException(root.toString());
        }

        List<Map.Entry<String, String>> docs = new ArrayList<>();
        for (Path labelDir : listSorted(root, p -> Files.isDirectory(p) && !isHidden(p))) {
            String label = labelDir.getFileName().toString();
            List<Path> files = listSorted(labelDir,
                    p -> Files.isRegularFile(p) && !isHidden(p) && p.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".txt"));

            for (Path f : files) {
                String text = Files.readString(f, StandardCharsets.UTF_8);
                docs.add(Map.entry(text, label));
            }
            logger.info("Loaded {} documents for label '{}'", files.size(), label);
        }

        if (docs.isEmpty()) {
            logger.warn("No .txt documents found under {}", root.toAbsolutePath());
        }
        return docs;
    }

    /** Loads root and adds every document to the model. Returns the number added. */
    public static int loadInto(NaiveBayesModel model, Path root) throws IOException {
        List<Map.Entry<String, String>> docs = load(root);
        model.addDocuments(docs);
        return docs.size();
    }

    // .git, .DS_Store and the like are never labels or documents
    private static boolean isHidden(Path p) {
        return p.getFileName().toString().startsWith(".");
    }

    private static List<Path> listSorted(Path dir, Predicate<Path> filter) throws IOException {
        try (Stream<Path> s = Files.list(dir)) {
            return s.filter(filter)
                    .sorted(Comparator.comparing(p -> p.getFileName().toString()))
                    .collect(Collectors.toList());
        }
    }
}
