package ru.tigran.eventfeedbackanalyzer.service;

import lombok.extern.slf4j.Slf4j;
import ru.tigran.eventfeedbackanalyzer.dto.AnalysisResult;
import ru.tigran.eventfeedbackanalyzer.model.Sentiment;

import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the free-text AI reply into an {@link AnalysisResult}.
 *
 * Expected reply layout (headers are matched case-insensitively, order as requested by
 * FeedbackPromptBuilder):
 * <pre>
 * OVERALL_SENTIMENT: Positive
 * POSITIVE_HIGHLIGHTS: ...
 * COMMON_COMPLAINTS: ...
 * EXECUTIVE_SUMMARY: ...
 * </pre>
 *
 * A section runs from the end of its header to the start of the next header found in the
 * reply, or to the end of the text. Missing or garbled sections never fail the parse:
 * sentiment falls back to Neutral and text sections fall back to fixed placeholders.
 */
@Slf4j
public class AnalysisResponseParser {

    public static final int MAX_FIELD_LENGTH = 1000;
    public static final String DEFAULT_HIGHLIGHTS = "No specific highlights mentioned";
    public static final String DEFAULT_COMPLAINTS = "No specific complaints mentioned";
    public static final String DEFAULT_SUMMARY = "Analysis completed successfully";

    private static final Pattern HEADER_PATTERN = Pattern.compile(
            "(OVERALL_SENTIMENT|POSITIVE_HIGHLIGHTS|COMMON_COMPLAINTS|EXECUTIVE_SUMMARY):",
            Pattern.CASE_INSENSITIVE
    );

    private enum Section {
        OVERALL_SENTIMENT, POSITIVE_HIGHLIGHTS, COMMON_COMPLAINTS, EXECUTIVE_SUMMARY
    }

    /**
     * Parses the AI reply. Never returns a partially filled result.
     *
     * @param reply raw text returned by the model (may be null or empty)
     * @return parsed result with defaults applied
     */
    public static AnalysisResult parse(String reply) {
        Map<Section, String> sections = extractSections(reply == null ? "" : reply);

        return new AnalysisResult(
                parseSentiment(sections.get(Section.OVERALL_SENTIMENT)),
                textOrDefault(sections.get(Section.POSITIVE_HIGHLIGHTS), DEFAULT_HIGHLIGHTS),
                textOrDefault(sections.get(Section.COMMON_COMPLAINTS), DEFAULT_COMPLAINTS),
                textOrDefault(sections.get(Section.EXECUTIVE_SUMMARY), DEFAULT_SUMMARY)
        );
    }

    /**
     * Splits the reply on known headers. Only the first occurrence of each header is kept.
     */
    private static Map<Section, String> extractSections(String text) {
        Map<Section, String> sections = new EnumMap<>(Section.class);
        Matcher matcher = HEADER_PATTERN.matcher(text);

        Section current = null;
        int contentStart = -1;
        while (matcher.find()) {
            if (current != null) {
                sections.putIfAbsent(current, text.substring(contentStart, matcher.start()));
            }
            current = Section.valueOf(matcher.group(1).toUpperCase(Locale.ROOT));
            contentStart = matcher.end();
        }
        if (current != null) {
            sections.putIfAbsent(current, text.substring(contentStart));
        }

        return sections;
    }

    /**
     * Takes the first word of the sentiment section. Leading whitespace and markdown
     * emphasis ('*') are skipped. Anything other than an exact label gives Neutral.
     */
    private static Sentiment parseSentiment(String section) {
        if (section == null) {
            log.warn("OVERALL_SENTIMENT section missing in AI reply, defaulting to {}", Sentiment.NEUTRAL.getLabel());
            return Sentiment.NEUTRAL;
        }

        int start = 0;
        while (start < section.length()
                && (Character.isWhitespace(section.charAt(start)) || section.charAt(start) == '*')) {
            start++;
        }
        int end = start;
        while (end < section.length()
                && (Character.isLetterOrDigit(section.charAt(end)) || section.charAt(end) == '_')) {
            end++;
        }
        String token = section.substring(start, end);

        return Sentiment.fromLabel(token).orElseGet(() -> {
            log.warn("Unrecognized sentiment '{}' in AI reply, defaulting to {}", token, Sentiment.NEUTRAL.getLabel());
            return Sentiment.NEUTRAL;
        });
    }

    private static String textOrDefault(String section, String defaultValue) {
        String value = section == null ? "" : section.strip();
        if (value.isEmpty()) {
            value = defaultValue;
        }
        return truncate(value);
    }

    /**
     * Cuts to MAX_FIELD_LENGTH chars without splitting a surrogate pair.
     */
    static String truncate(String value) {
        if (value.length() <= MAX_FIELD_LENGTH) {
            return value;
        }
        int end = MAX_FIELD_LENGTH;
        if (Character.isHighSurrogate(value.charAt(end - 1))) {
            end--;
        }
        return value.substring(0, end);
    }
}
