package ru.tigran.eventfeedbackanalyzer.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import ru.tigran.eventfeedbackanalyzer.dto.FeedbackFormRequest;
import ru.tigran.eventfeedbackanalyzer.dto.FeedbackFormResponse;
import ru.tigran.eventfeedbackanalyzer.dto.FeedbackFormUpdateRequest;
import ru.tigran.eventfeedbackanalyzer.dto.FeedbackResponseDTO;
import ru.tigran.eventfeedbackanalyzer.dto.FeedbackSubmissionRequest;
import ru.tigran.eventfeedbackanalyzer.service.FeedbackFormService;
import ru.tigran.eventfeedbackanalyzer.service.FeedbackResponseService;

import java.util.List;
import java.util.UUID;

/**
 * REST API для форм обратной связи и отзывов участников.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/forms")
@Tag(name = "Feedback Forms", description = "Управление формами обратной связи и приём отзывов")
public class FeedbackFormController {

    private final FeedbackFormService feedbackFormService;
    private final FeedbackResponseService feedbackResponseService;

    public FeedbackFormController(
            FeedbackFormService feedbackFormService,
            FeedbackResponseService feedbackResponseService
    ) {
        this.feedbackFormService = feedbackFormService;
        this.feedbackResponseService = feedbackResponseService;
    }

    /**
     * Создать форму обратной связи.
     *
     * @param request название, дата и описание мероприятия
     * @return FeedbackFormResponse с ID созданной формы
     */
    @PostMapping
    @Operation(
            summary = "Создать форму",
            description = "Создаёт форму обратной связи для мероприятия."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "201",
                    description = "Форма успешно создана",
                    content = @Content(schema = @Schema(implementation = FeedbackFormResponse.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Пустое название мероприятия или слишком длинные поля"
            )
    })
    public ResponseEntity<FeedbackFormResponse> createForm(@Valid @RequestBody FeedbackFormRequest request) {
        log.info("POST /api/v1/forms - event name: {}", request.eventName());

        FeedbackFormResponse response = feedbackFormService.createForm(request);

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{formId}")
    @Operation(summary = "Получить форму по ID")
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Форма успешно получена",
                    content = @Content(schema = @Schema(implementation = FeedbackFormResponse.class))
            ),
            @ApiResponse(responseCode = "404", description = "Форма не найдена")
    })
    public ResponseEntity<FeedbackFormResponse> getForm(@PathVariable UUID formId) {
        log.info("GET /api/v1/forms/{}", formId);
        return ResponseEntity.ok(feedbackFormService.getForm(formId));
    }

    /**
     * Обновить форму. Изменяются только переданные поля.
     *
     * @param formId ID формы
     * @param request новые значения
     * @return обновлённый FeedbackFormResponse
     */
    @PutMapping("/{formId}")
    @Operation(
            summary = "Обновить форму",
            description = "Частичное обновление: поля, не переданные в запросе, остаются без изменений."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "200",
                    description = "Форма успешно обновлена",
                    content = @Content(schema = @Schema(implementation = FeedbackFormResponse.class))
            ),
            @ApiResponse(responseCode = "400", description = "Неверные параметры запроса"),
            @ApiResponse(responseCode = "404", description = "Форма не найдена")
    })
    public ResponseEntity<FeedbackFormResponse> updateForm(
            @PathVariable UUID formId,
            @Valid @RequestBody FeedbackFormUpdateRequest request
    ) {
        log.info("PUT /api/v1/forms/{}", formId);
        return ResponseEntity.ok(feedbackFormService.updateForm(formId, request));
    }

    /**
     * Удалить форму вместе со всеми отзывами и анализом.
     *
     * @param formId ID формы
     * @return 204 No Content
     */
    @DeleteMapping("/{formId}")
    @Operation(
            summary = "Удалить форму",
            description = "Удаляет форму, все её отзывы и сохранённый анализ."
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "204", description = "Форма успешно удалена"),
            @ApiResponse(responseCode = "404", description = "Форма не найдена")
    })
    public ResponseEntity<Void> deleteForm(@PathVariable UUID formId) {
        log.info("DELETE /api/v1/forms/{}", formId);

        feedbackFormService.deleteForm(formId);

        return ResponseEntity.noContent().build();
    }

    /**
     * Отправить отзыв участника.
     *
     * @param formId ID формы
     * @param request рейтинг 1-5, необязательные комментарий и имя
     * @return FeedbackResponseDTO сохранённого отзыва
     */
    @PostMapping("/{formId}/responses")
    @Operation(
            summary = "Отправить отзыв",
            description = "Сохраняет отзыв участника. Рейтинг обязателен и должен быть от 1 до 5."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "201",
                    description = "Отзыв сохранён",
                    content = @Content(schema = @Schema(implementation = FeedbackResponseDTO.class))
            ),
            @ApiResponse(responseCode = "400", description = "Рейтинг вне диапазона 1-5 или отсутствует"),
            @ApiResponse(responseCode = "404", description = "Форма не найдена")
    })
    public ResponseEntity<FeedbackResponseDTO> submitResponse(
            @PathVariable UUID formId,
            @Valid @RequestBody FeedbackSubmissionRequest request
    ) {
        log.info("POST /api/v1/forms/{}/responses - rating: {}", formId, request.rating());

        FeedbackResponseDTO response = feedbackResponseService.submitResponse(formId, request);

        return ResponseEntity.status(HttpStatus.CREATED).body(response);
    }

    @GetMapping("/{formId}/responses")
    @Operation(summary = "Получить отзывы формы", description = "Отзывы возвращаются в порядке отправки.")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Список отзывов успешно получен"),
            @ApiResponse(responseCode = "404", description = "Форма не найдена")
    })
    public ResponseEntity<List<FeedbackResponseDTO>> getResponses(@PathVariable UUID formId) {
        log.info("GET /api/v1/forms/{}/responses", formId);
        return ResponseEntity.ok(feedbackResponseService.getResponses(formId));
    }
}
