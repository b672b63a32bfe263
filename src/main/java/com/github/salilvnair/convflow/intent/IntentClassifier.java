package com.github.salilvnair.convflow.intent;

import java.util.Map;

public interface IntentClassifier {
    /**
     * Classify the user text. Implementations may block; callers bound them by a timeout.
     */
    ClassifiedIntent classify(String userInput, Map<String, Object> context);
}
