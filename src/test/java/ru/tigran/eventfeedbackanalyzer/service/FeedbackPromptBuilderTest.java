package ru.tigran.eventfeedbackanalyzer.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import ru.tigran.eventfeedbackanalyzer.dto.FeedbackEntry;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("FeedbackPromptBuilder unit тесты")
class FeedbackPromptBuilderTest {

    @Test
    @DisplayName("buildAnalysisPrompt - количество ответов, средний рейтинг и комментарии")
    void buildPromptWithStatisticsAndComments() {
        List<FeedbackEntry> entries = List.of(
                new FeedbackEntry(5, "Excellent talks"),
                new FeedbackEntry(4, "Good venue")
        );

        String prompt = FeedbackPromptBuilder.buildAnalysisPrompt(entries);

        assertTrue(prompt.contains("Total Responses: 2"));
        assertTrue(prompt.contains("Average Rating: 4.50/5.0"));
        assertTrue(prompt.contains("1. Excellent talks"));
        assertTrue(prompt.contains("2. Good venue"));
        assertTrue(prompt.contains("OVERALL_SENTIMENT:"));
        assertTrue(prompt.contains("POSITIVE_HIGHLIGHTS:"));
        assertTrue(prompt.contains("COMMON_COMPLAINTS:"));
        assertTrue(prompt.contains("EXECUTIVE_SUMMARY:"));
    }

    @Test
    @DisplayName("buildAnalysisPrompt - одинаковый вход даёт одинаковый промпт")
    void buildPromptIsDeterministic() {
        List<FeedbackEntry> entries = List.of(new FeedbackEntry(3, "Ok"), new FeedbackEntry(2, null));

        assertEquals(
                FeedbackPromptBuilder.buildAnalysisPrompt(entries),
                FeedbackPromptBuilder.buildAnalysisPrompt(List.copyOf(entries))
        );
    }

    @Test
    @DisplayName("buildAnalysisPrompt - без комментариев используется заглушка")
    void buildPromptWithoutComments() {
        List<FeedbackEntry> entries = List.of(new FeedbackEntry(1, null), new FeedbackEntry(2, "   "));

        String prompt = FeedbackPromptBuilder.buildAnalysisPrompt(entries);

        assertTrue(prompt.contains(FeedbackPromptBuilder.NO_COMMENTS_PLACEHOLDER));
        assertTrue(prompt.contains("Average Rating: 1.50/5.0"));
    }

    @Test
    @DisplayName("buildAnalysisPrompt - в промпт попадают не более 50 комментариев")
    void buildPromptLimitsComments() {
        List<FeedbackEntry> entries = new ArrayList<>();
        for (int i = 1; i <= 60; i++) {
            entries.add(new FeedbackEntry(4, "comment-" + i));
        }

        String prompt = FeedbackPromptBuilder.buildAnalysisPrompt(entries);

        assertTrue(prompt.contains("Total Responses: 60"));
        assertTrue(prompt.contains("50. comment-50"));
        assertFalse(prompt.contains("comment-51"));
    }

    @Test
    @DisplayName("formatComments - переносы строк внутри комментария заменяются пробелами")
    void formatCommentsFlattensLineBreaks() {
        String formatted = FeedbackPromptBuilder.formatComments(List.of("first line\nsecond line", "other"));

        assertEquals("1. first line second line\n2. other", formatted);
    }

    @Test
    @DisplayName("buildAnalysisPrompt - пустой список отклоняется")
    void buildPromptRejectsEmptyList() {
        assertThrows(IllegalArgumentException.class,
                () -> FeedbackPromptBuilder.buildAnalysisPrompt(List.of()));
    }
}
