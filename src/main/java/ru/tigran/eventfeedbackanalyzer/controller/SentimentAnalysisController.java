package ru.tigran.eventfeedbackanalyzer.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.tigran.eventfeedbackanalyzer.dto.SentimentAnalysisResponse;
import ru.tigran.eventfeedbackanalyzer.service.SentimentAnalysisService;

import java.util.UUID;

/**
 * REST API для AI анализа отзывов формы.
 * Анализ выполняется один раз; повторные запросы возвращают сохранённый результат.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/forms/{formId}")
@Tag(name = "Sentiment Analysis", description = "AI анализ тональности отзывов")
public class SentimentAnalysisController {

    private final SentimentAnalysisService sentimentAnalysisService;

    public SentimentAnalysisController(SentimentAnalysisService sentimentAnalysisService) {
        this.sentimentAnalysisService = sentimentAnalysisService;
    }

    @PostMapping("/analyze")
    @Operation(
            summary = "Запустить анализ",
            description = "Анализирует все отзывы формы через Gemini. " +
                    "Если анализ уже есть, возвращает его без повторного вызова AI."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Анализ выполнен или возвращён сохранённый",
                    content = @Content(schema = @Schema(implementation = SentimentAnalysisResponse.class))
            ),
            @ApiResponse(responseCode = "404", description = "Форма не найдена"),
            @ApiResponse(responseCode = "422", description = "У формы нет отзывов"),
            @ApiResponse(responseCode = "503", description = "AI сервис недоступен")
    })
    public ResponseEntity<SentimentAnalysisResponse> analyzeForm(@PathVariable UUID formId) {
        log.info("POST /api/v1/forms/{}/analyze", formId);
        return ResponseEntity.ok(sentimentAnalysisService.analyzeForm(formId));
    }

    @GetMapping("/analysis")
    @Operation(summary = "Получить сохранённый анализ", description = "Никогда не вызывает AI.")
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Анализ найден",
                    content = @Content(schema = @Schema(implementation = SentimentAnalysisResponse.class))
            ),
            @ApiResponse(responseCode = "404", description = "Форма не найдена или анализ ещё не выполнялся")
    })
    public ResponseEntity<SentimentAnalysisResponse> getAnalysis(@PathVariable UUID formId) {
        log.info("GET /api/v1/forms/{}/analysis", formId);
        return ResponseEntity.ok(sentimentAnalysisService.getAnalysis(formId));
    }
}
