package com.github.salilvnair.convflow.intent;

public record ClassifiedIntent(
        String intentName,
        double confidence
) {
    public boolean isResolved() {
        return intentName != null && !intentName.isBlank();
    }
}
