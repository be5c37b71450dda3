package ru.tigran.eventfeedbackanalyzer.service;

import ru.tigran.eventfeedbackanalyzer.dto.FeedbackEntry;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

/**
 * Builder for the sentiment analysis prompt.
 *
 * The prompt is deterministic for a given ordered list of entries:
 * - total number of responses
 * - average rating with two decimals
 * - up to MAX_COMMENTS non-empty comments, numbered from 1 in input order
 *
 * The section headers requested at the end are the ones AnalysisResponseParser looks for,
 * so they must be changed together.
 *
 * Usage:
 * String prompt = FeedbackPromptBuilder.buildAnalysisPrompt(entries);
 */
public class FeedbackPromptBuilder {

    public static final int MAX_COMMENTS = 50;
    public static final String NO_COMMENTS_PLACEHOLDER = "(No written comments provided)";

    /**
     * Builds the analysis prompt.
     *
     * @param feedback non-empty list of rating/comment entries in submission order
     * @return prompt text
     */
    public static String buildAnalysisPrompt(List<FeedbackEntry> feedback) {
        if (feedback == null || feedback.isEmpty()) {
            throw new IllegalArgumentException("No feedback data provided");
        }

        int totalResponses = feedback.size();
        double averageRating = feedback.stream()
                .mapToInt(FeedbackEntry::rating)
                .average()
                .orElse(0.0);

        List<String> comments = feedback.stream()
                .filter(FeedbackEntry::hasComment)
                .map(FeedbackEntry::comment)
                .toList();

        return String.format(Locale.ROOT, """
                You are an expert event feedback analyzer. Analyze the following attendee feedback and provide insights.

                FEEDBACK DATA:
                - Total Responses: %d
                - Average Rating: %.2f/5.0

                ATTENDEE COMMENTS:
                %s

                Please provide your analysis in the following exact format:

                OVERALL_SENTIMENT: [Choose ONLY one: Positive, Neutral, or Negative]

                POSITIVE_HIGHLIGHTS:
                [List the main positive aspects mentioned by attendees. If none, write "None mentioned"]

                COMMON_COMPLAINTS:
                [List recurring issues or complaints. If none, write "None mentioned"]

                EXECUTIVE_SUMMARY:
                [Provide a concise 2-3 sentence summary of the overall feedback]

                Important:
                - Be specific and data-driven
                - Extract actual themes from the comments
                - Keep each section concise
                - Use the exact format headers shown above
                """, totalResponses, averageRating, formatComments(comments));
    }

    /**
     * Formats comments as a numbered list ("1. first", "2. second", ...).
     * Line breaks inside a comment are flattened so every comment stays on its own line.
     */
    static String formatComments(List<String> comments) {
        if (comments.isEmpty()) {
            return NO_COMMENTS_PLACEHOLDER;
        }

        List<String> limited = comments.subList(0, Math.min(comments.size(), MAX_COMMENTS));
        return IntStream.range(0, limited.size())
                .mapToObj(i -> (i + 1) + ". " + flatten(limited.get(i)))
                .collect(Collectors.joining("\n"));
    }

    private static String flatten(String comment) {
        return comment.replace("\r\n", " ")
                .replace('\n', ' ')
                .replace('\r', ' ');
    }
}
