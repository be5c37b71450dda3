package ru.tigran.eventfeedbackanalyzer.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.eventfeedbackanalyzer.config.CacheConfig;
import ru.tigran.eventfeedbackanalyzer.dto.FeedbackFormRequest;
import ru.tigran.eventfeedbackanalyzer.dto.FeedbackFormResponse;
import ru.tigran.eventfeedbackanalyzer.dto.FeedbackFormUpdateRequest;
import ru.tigran.eventfeedbackanalyzer.exception.ErrorCode;
import ru.tigran.eventfeedbackanalyzer.exception.ResourceNotFoundException;
import ru.tigran.eventfeedbackanalyzer.exception.ValidationException;
import ru.tigran.eventfeedbackanalyzer.model.FeedbackForm;
import ru.tigran.eventfeedbackanalyzer.repository.FeedbackFormRepository;
import ru.tigran.eventfeedbackanalyzer.repository.FeedbackResponseRepository;
import ru.tigran.eventfeedbackanalyzer.repository.SentimentAnalysisRepository;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Сервис для управления формами обратной связи.
 * Выполняет CRUD операции; удаление формы каскадно удаляет отзывы и анализ.
 */
@Slf4j
@Service
public class FeedbackFormService {

    private final FeedbackFormRepository feedbackFormRepository;
    private final FeedbackResponseRepository feedbackResponseRepository;
    private final SentimentAnalysisRepository sentimentAnalysisRepository;

    public FeedbackFormService(
            FeedbackFormRepository feedbackFormRepository,
            FeedbackResponseRepository feedbackResponseRepository,
            SentimentAnalysisRepository sentimentAnalysisRepository
    ) {
        this.feedbackFormRepository = feedbackFormRepository;
        this.feedbackResponseRepository = feedbackResponseRepository;
        this.sentimentAnalysisRepository = sentimentAnalysisRepository;
    }

    /**
     * Создаёт новую форму обратной связи для мероприятия.
     *
     * @param request данные формы
     * @return FeedbackFormResponse с ID созданной формы
     */
    @Transactional
    public FeedbackFormResponse createForm(FeedbackFormRequest request) {
        log.info("Creating feedback form for event: {}", request.eventName());

        FeedbackForm form = new FeedbackForm();
        form.setEventName(request.eventName());
        form.setEventDate(request.eventDate());
        form.setDescription(request.description());

        FeedbackForm saved = feedbackFormRepository.save(form);
        log.info("Feedback form created with id: {}", saved.getId());

        return mapToResponse(saved);
    }

    /**
     * Получает форму по ID.
     *
     * @param formId ID формы
     * @return FeedbackFormResponse
     */
    @Transactional(readOnly = true)
    public FeedbackFormResponse getForm(UUID formId) {
        log.debug("Getting feedback form {}", formId);
        return mapToResponse(findFormOrThrow(formId));
    }

    /**
     * Частично обновляет форму: изменяются только переданные (не null) поля.
     * updatedAt обновляется при каждом вызове.
     *
     * @param formId ID формы
     * @param request новые значения полей
     * @return FeedbackFormResponse с обновлёнными данными
     */
    @Transactional
    public FeedbackFormResponse updateForm(UUID formId, FeedbackFormUpdateRequest request) {
        log.info("Updating feedback form {}", formId);

        FeedbackForm form = findFormOrThrow(formId);

        if (request.eventName() != null) {
            if (request.eventName().isBlank()) {
                throw new ValidationException(
                        "Event name must not be blank",
                        ErrorCode.VALIDATION_ERROR.getCode()
                );
            }
            form.setEventName(request.eventName());
        }
        if (request.eventDate() != null) {
            form.setEventDate(request.eventDate());
        }
        if (request.description() != null) {
            form.setDescription(request.description());
        }
        form.setUpdatedAt(LocalDateTime.now());

        FeedbackForm saved = feedbackFormRepository.saveAndFlush(form);
        log.info("Feedback form {} updated successfully", formId);

        return mapToResponse(saved);
    }

    /**
     * Удаляет форму вместе со всеми отзывами и анализом в одной транзакции.
     *
     * @param formId ID формы
     */
    @Transactional
    @CacheEvict(value = CacheConfig.ANALYSIS_CACHE, key = "#formId.toString()")
    public void deleteForm(UUID formId) {
        log.info("Deleting feedback form {}", formId);

        if (!feedbackFormRepository.existsById(formId)) {
            throw formNotFound(formId);
        }

        int analyses = sentimentAnalysisRepository.deleteByFormId(formId);
        int responses = feedbackResponseRepository.deleteByFormId(formId);
        feedbackFormRepository.deleteById(formId);

        log.info("Feedback form {} deleted with {} responses and {} analysis", formId, responses, analyses);
    }

    private FeedbackForm findFormOrThrow(UUID formId) {
        return feedbackFormRepository.findById(formId)
                .orElseThrow(() -> formNotFound(formId));
    }

    private ResourceNotFoundException formNotFound(UUID formId) {
        return new ResourceNotFoundException(
                "Feedback form with id " + formId + " not found",
                ErrorCode.FORM_NOT_FOUND.getCode()
        );
    }

    /**
     * Маппинг FeedbackForm entity → FeedbackFormResponse DTO.
     */
    private FeedbackFormResponse mapToResponse(FeedbackForm form) {
        return new FeedbackFormResponse(
                form.getId(),
                form.getEventName(),
                form.getEventDate(),
                form.getDescription(),
                form.getCreatedAt(),
                form.getUpdatedAt()
        );
    }
}
