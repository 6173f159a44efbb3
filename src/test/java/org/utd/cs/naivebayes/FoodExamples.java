package org.utd.cs.naivebayes;

import java.util.List;
import java.util.Map;

/**
 * Shared training fixture: two vegetable documents and two meat documents.
 */
final class FoodExamples {

    static final String VEGGIE_1 = "beetroot water spinach okra water chestnut ricebean pea catsear courgette summer purslane. water spinach arugula pea tatsoi aubergine spring onion bush tomato kale radicchio turnip chicory salsify pea sprouts fava bean. dandelion zucchini burdock yarrow chickpea dandelion sorrel courgette turnip greens tigernut soybean radish artichoke wattle seed endive groundnut broccoli arugula.";

    static final String MEAT_1 = "sirloin meatloaf ham hock sausage meatball tongue prosciutto picanha turkey ball tip pastrami. ribeye chicken sausage, ham hock landjaeger pork belly pancetta ball tip tenderloin leberkas shank shankle rump. cupim short ribs ground round biltong tenderloin ribeye drumstick landjaeger short loin doner chicken shoulder spare ribs fatback boudin. pork chop shank shoulder, t-bone beef ribs drumstick landjaeger meatball.";

    static final String VEGGIE_2 = "pea horseradish azuki bean lettuce avocado asparagus okra. kohlrabi radish okra azuki bean corn fava bean mustard tigernut jícama green bean celtuce collard greens avocado quandong fennel gumbo black-eyed pea. grape silver beet watercress potato tigernut corn groundnut. chickweed okra pea winter purslane coriander yarrow sweet pepper radish garlic brussels sprout groundnut summer purslane earthnut pea tomato spring onion azuki bean gourd. gumbo kakadu plum komatsuna black-eyed pea green bean zucchini gourd winter purslane silver beet rock melon radish asparagus spinach.";

    static final String MEAT_2 = "sirloin porchetta drumstick, pastrami bresaola landjaeger turducken kevin ham capicola corned beef. pork cow capicola, pancetta turkey tri-tip doner ball tip salami. fatback pastrami rump pancetta landjaeger. doner porchetta meatloaf short ribs cow chuck jerky pork chop landjaeger picanha tail.";

    static final String MEAT_QUERY = "salami pancetta beef ribs";

    static List<Map.Entry<String, String>> documents() {
        return List.of(
                Map.entry(VEGGIE_1, "veggie"),
                Map.entry(MEAT_1, "meat"),
                Map.entry(VEGGIE_2, "veggie"),
                Map.entry(MEAT_2, "meat"));
    }

    static NaiveBayesModel untrained() {
        NaiveBayesModel nb = new NaiveBayesModel();
        for (Map.Entry<String, String> doc : documents()) {
            nb.addDocument(doc.getKey(), doc.getValue());
        }
        return nb;
    }

    static NaiveBayesModel trained() {
        NaiveBayesModel nb = untrained();
        nb.train();
        return nb;
    }

    private FoodExamples() {}
}
