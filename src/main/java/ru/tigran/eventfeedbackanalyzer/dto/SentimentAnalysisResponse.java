package ru.tigran.eventfeedbackanalyzer.dto;

import ru.tigran.eventfeedbackanalyzer.model.Sentiment;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Cached sentiment analysis of a form, as returned by both analyze and fetch.
 */
public record SentimentAnalysisResponse(
        UUID id,
        UUID formId,
        Sentiment overallSentiment,
        String positiveHighlights,
        String commonComplaints,
        String executiveSummary,
        LocalDateTime analyzedAt
) {
}
