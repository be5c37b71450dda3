package ru.tigran.eventfeedbackanalyzer.dto;

import ru.tigran.eventfeedbackanalyzer.model.Sentiment;

/**
 * Structured result parsed from the AI reply. All four fields are always filled.
 */
public record AnalysisResult(
        Sentiment overallSentiment,
        String positiveHighlights,
        String commonComplaints,
        String executiveSummary
) {
}
