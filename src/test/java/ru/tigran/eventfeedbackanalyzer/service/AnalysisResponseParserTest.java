package ru.tigran.eventfeedbackanalyzer.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.eventfeedbackanalyzer.dto.AnalysisResult;
import ru.tigran.eventfeedbackanalyzer.model.Sentiment;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("AnalysisResponseParser unit тесты")
class AnalysisResponseParserTest {

    @Test
    @DisplayName("parse - корректный ответ со всеми секциями")
    void parseWellFormedReply() {
        String reply = """
                OVERALL_SENTIMENT: Positive

                POSITIVE_HIGHLIGHTS:
                Great speakers and good venue.

                COMMON_COMPLAINTS:
                Food ran out early.

                EXECUTIVE_SUMMARY:
                Attendees loved the talks. Catering needs more capacity.
                """;

        AnalysisResult result = AnalysisResponseParser.parse(reply);

        assertEquals(Sentiment.POSITIVE, result.overallSentiment());
        assertEquals("Great speakers and good venue.", result.positiveHighlights());
        assertEquals("Food ran out early.", result.commonComplaints());
        assertEquals("Attendees loved the talks. Catering needs more capacity.", result.executiveSummary());
    }

    @Test
    @DisplayName("parse - заголовки в нижнем регистре распознаются")
    void parseLowercaseHeaders() {
        String reply = "overall_sentiment: Negative\n"
                + "positive_highlights: Nice badges\n"
                + "common_complaints: Too long\n"
                + "executive_summary: Mostly unhappy.";

        AnalysisResult result = AnalysisResponseParser.parse(reply);

        assertEquals(Sentiment.NEGATIVE, result.overallSentiment());
        assertEquals("Nice badges", result.positiveHighlights());
        assertEquals("Too long", result.commonComplaints());
        assertEquals("Mostly unhappy.", result.executiveSummary());
    }

    @Test
    @DisplayName("parse - метка тональности с markdown выделением")
    void parseSentimentWithEmphasis() {
        AnalysisResult result = AnalysisResponseParser.parse("OVERALL_SENTIMENT: **Negative**");

        assertEquals(Sentiment.NEGATIVE, result.overallSentiment());
    }

    @Test
    @DisplayName("parse - неизвестная или другая по регистру метка даёт Neutral")
    void parseUnknownSentimentDefaultsToNeutral() {
        assertEquals(Sentiment.NEUTRAL, AnalysisResponseParser.parse("OVERALL_SENTIMENT: Mixed").overallSentiment());
        assertEquals(Sentiment.NEUTRAL, AnalysisResponseParser.parse("OVERALL_SENTIMENT: positive").overallSentiment());
        assertEquals(Sentiment.NEUTRAL, AnalysisResponseParser.parse("OVERALL_SENTIMENT:").overallSentiment());
    }

    @Test
    @DisplayName("parse - пустой ответ даёт значения по умолчанию")
    void parseEmptyReplyUsesDefaults() {
        AnalysisResult result = AnalysisResponseParser.parse("");

        assertEquals(Sentiment.NEUTRAL, result.overallSentiment());
        assertEquals(AnalysisResponseParser.DEFAULT_HIGHLIGHTS, result.positiveHighlights());
        assertEquals(AnalysisResponseParser.DEFAULT_COMPLAINTS, result.commonComplaints());
        assertEquals(AnalysisResponseParser.DEFAULT_SUMMARY, result.executiveSummary());
    }

    @Test
    @DisplayName("parse - null ответ обрабатывается как пустой")
    void parseNullReply() {
        AnalysisResult result = AnalysisResponseParser.parse(null);

        assertEquals(Sentiment.NEUTRAL, result.overallSentiment());
        assertEquals(AnalysisResponseParser.DEFAULT_SUMMARY, result.executiveSummary());
    }

    @Test
    @DisplayName("parse - отсутствующие и пустые секции заменяются заглушками")
    void parseMissingSections() {
        String reply = "OVERALL_SENTIMENT: Positive\nPOSITIVE_HIGHLIGHTS:   \nEXECUTIVE_SUMMARY: Fine event.";

        AnalysisResult result = AnalysisResponseParser.parse(reply);

        assertEquals(Sentiment.POSITIVE, result.overallSentiment());
        assertEquals(AnalysisResponseParser.DEFAULT_HIGHLIGHTS, result.positiveHighlights());
        assertEquals(AnalysisResponseParser.DEFAULT_COMPLAINTS, result.commonComplaints());
        assertEquals("Fine event.", result.executiveSummary());
    }

    @Test
    @DisplayName("parse - текст без заголовков не ломает разбор")
    void parseTextWithoutHeaders() {
        AnalysisResult result = AnalysisResponseParser.parse("I cannot help with that request.");

        assertEquals(Sentiment.NEUTRAL, result.overallSentiment());
        assertEquals(AnalysisResponseParser.DEFAULT_HIGHLIGHTS, result.positiveHighlights());
    }

    @Test
    @DisplayName("parse - длинные секции обрезаются до 1000 символов")
    void parseTruncatesLongSections() {
        String longText = "x".repeat(1500);
        String reply = "OVERALL_SENTIMENT: Neutral\nPOSITIVE_HIGHLIGHTS: " + longText
                + "\nCOMMON_COMPLAINTS: " + longText
                + "\nEXECUTIVE_SUMMARY: " + longText;

        AnalysisResult result = AnalysisResponseParser.parse(reply);

        assertEquals(AnalysisResponseParser.MAX_FIELD_LENGTH, result.positiveHighlights().length());
        assertEquals(AnalysisResponseParser.MAX_FIELD_LENGTH, result.commonComplaints().length());
        assertEquals(AnalysisResponseParser.MAX_FIELD_LENGTH, result.executiveSummary().length());
    }

    @Test
    @DisplayName("parse - повторный заголовок не перезаписывает первую секцию")
    void parseKeepsFirstOccurrence() {
        String reply = "EXECUTIVE_SUMMARY: First summary.\nEXECUTIVE_SUMMARY: Second summary.";

        AnalysisResult result = AnalysisResponseParser.parse(reply);

        assertEquals("First summary.", result.executiveSummary());
    }

    @Test
    @DisplayName("parse - обрезка не разрывает суррогатную пару на границе 1000 символов")
    void parseTruncationKeepsSurrogatePairsWhole() {
        String reply = "POSITIVE_HIGHLIGHTS: " + "a".repeat(999) + "\uD83D\uDE00 tail";

        String highlights = AnalysisResponseParser.parse(reply).positiveHighlights();

        assertEquals(999, highlights.length());
        assertFalse(Character.isHighSurrogate(highlights.charAt(highlights.length() - 1)));
    }

    @Test
    @DisplayName("truncate - эмодзи целиком внутри лимита сохраняется")
    void truncateKeepsPairInsideLimit() {
        String value = "a".repeat(998) + "\uD83D\uDE00" + "bbb";

        String truncated = AnalysisResponseParser.truncate(value);

        assertEquals(1000, truncated.length());
        assertTrue(truncated.endsWith("\uD83D\uDE00"));
    }
}
