package ru.tigran.eventfeedbackanalyzer.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Overall sentiment of an event's feedback. Serialized by its label.
 */
public enum Sentiment {
    POSITIVE("Positive"),
    NEUTRAL("Neutral"),
    NEGATIVE("Negative");

    private final String label;

    Sentiment(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * Case-sensitive lookup by label: "Positive" matches, "positive" does not.
     */
    public static Optional<Sentiment> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(sentiment -> sentiment.label.equals(label))
                .findFirst();
    }
}
