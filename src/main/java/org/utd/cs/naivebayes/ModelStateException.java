package org.utd.cs.naivebayes;

/**
 * Thrown when a model operation is called in the wrong lifecycle phase:
 * classifying before training, adding documents after training, or training
 * a model that has no documents.
 */
public class ModelStateException extends IllegalStateException {

    public ModelStateException(String message) {
        super(message);
    }
}
