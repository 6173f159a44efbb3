package org.utd.cs.naivebayes;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CorpusLoaderTest {

    @TempDir
    Path tempDir;

    static void writeFoodCorpus(Path root) throws IOException {
        Path meat = Files.createDirectories(root.resolve("meat"));
        Path veggie = Files.createDirectories(root.resolve("veggie"));
        Files.writeString(meat.resolve("1.txt"), FoodExamples.MEAT_1, StandardCharsets.UTF_8);
        Files.writeString(meat.resolve("2.txt"), FoodExamples.MEAT_2, StandardCharsets.UTF_8);
        Files.writeString(veggie.resolve("1.txt"), FoodExamples.VEGGIE_1, StandardCharsets.UTF_8);
        Files.writeString(veggie.resolve("2.txt"), FoodExamples.VEGGIE_2, StandardCharsets.UTF_8);
    }

    @Test
    void loadsOneDocumentPerTextFileLabeledByFolder() throws IOException {
        writeFoodCorpus(tempDir);
        Files.writeString(tempDir.resolve("meat/notes.md"), "ignored", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("README.txt"), "not in a label folder", StandardCharsets.UTF_8);

        List<Map.Entry<String, String>> docs = CorpusLoader.load(tempDir);

        assertThat(docs).containsExactly(
                Map.entry(FoodExamples.MEAT_1, "meat"),
                Map.entry(FoodExamples.MEAT_2, "meat"),
                Map.entry(FoodExamples.VEGGIE_1, "veggie"),
                Map.entry(FoodExamples.VEGGIE_2, "veggie"));
    }

    @Test
    void hiddenFoldersAndFilesAreSkipped() throws IOException {
        writeFoodCorpus(tempDir);
        Path git = Files.createDirectories(tempDir.resolve(".git"));
        Files.writeString(git.resolve("HEAD.txt"), "ref: refs/heads/main", StandardCharsets.UTF_8);
        Files.writeString(tempDir.resolve("meat/.draft.txt"), "tofu", StandardCharsets.UTF_8);

        List<Map.Entry<String, String>> docs = CorpusLoader.load(tempDir);

        assertThat(docs).hasSize(4);
        assertThat(docs).extracting(Map.Entry::getValue).containsOnly("meat", "veggie");
    }

    @Test
    void loadIntoFeedsTheModel() throws IOException {
        writeFoodCorpus(tempDir);
        NaiveBayesModel nb = new NaiveBayesModel();

        assertThat(CorpusLoader.loadInto(nb, tempDir)).isEqualTo(4);
        nb.train();
        assertThat(nb.classify(FoodExamples.MEAT_QUERY)).isEqualTo("meat");
    }

    @Test
    void emptyCorpusGivesNoDocuments() throws IOException {
        assertThat(CorpusLoader.load(tempDir)).isEmpty();
    }

    @Test
    void missingRootIsRejected() {
        assertThatThrownBy(() -> CorpusLoader.load(tempDir.resolve("missing")))
                .isInstanceOf(NotDirectoryException.class);
    }
}
