package ru.tigran.eventfeedbackanalyzer.dto;

/**
 * Projection of a response sent to the AI: the rating and the comment, if any.
 */
public record FeedbackEntry(int rating, String comment) {

    public boolean hasComment() {
        return comment != null && !comment.isBlank();
    }
}
