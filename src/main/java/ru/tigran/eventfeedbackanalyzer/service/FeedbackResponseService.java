package ru.tigran.eventfeedbackanalyzer.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.eventfeedbackanalyzer.dto.FeedbackResponseDTO;
import ru.tigran.eventfeedbackanalyzer.dto.FeedbackSubmissionRequest;
import ru.tigran.eventfeedbackanalyzer.exception.ErrorCode;
import ru.tigran.eventfeedbackanalyzer.exception.ResourceNotFoundException;
import ru.tigran.eventfeedbackanalyzer.exception.ValidationException;
import ru.tigran.eventfeedbackanalyzer.model.FeedbackForm;
import ru.tigran.eventfeedbackanalyzer.model.FeedbackResponse;
import ru.tigran.eventfeedbackanalyzer.repository.FeedbackFormRepository;
import ru.tigran.eventfeedbackanalyzer.repository.FeedbackResponseRepository;

import java.util.List;
import java.util.UUID;

/**
 * Сервис для приёма отзывов участников.
 * Отзывы только добавляются: изменения и удаления по отдельности нет.
 */
@Slf4j
@Service
public class FeedbackResponseService {

    private static final int MIN_RATING = 1;
    private static final int MAX_RATING = 5;

    private final FeedbackFormRepository feedbackFormRepository;
    private final FeedbackResponseRepository feedbackResponseRepository;

    public FeedbackResponseService(
            FeedbackFormRepository feedbackFormRepository,
            FeedbackResponseRepository feedbackResponseRepository
    ) {
        this.feedbackFormRepository = feedbackFormRepository;
        this.feedbackResponseRepository = feedbackResponseRepository;
    }

    /**
     * Сохраняет отзыв участника для формы.
     *
     * @param formId ID формы
     * @param request рейтинг, комментарий и имя участника
     * @return FeedbackResponseDTO сохранённого отзыва
     */
    @Transactional
    public FeedbackResponseDTO submitResponse(UUID formId, FeedbackSubmissionRequest request) {
        log.info("Submitting feedback response for form {} with rating {}", formId, request.rating());

        validateRating(request.rating());

        FeedbackForm form = feedbackFormRepository.findById(formId)
                .orElseThrow(() -> formNotFound(formId));

        FeedbackResponse response = new FeedbackResponse();
        response.setForm(form);
        response.setAttendeeName(request.attendeeName());
        response.setRating(request.rating());
        response.setComment(normalizeComment(request.comment()));

        FeedbackResponse saved = feedbackResponseRepository.save(response);
        log.info("Feedback response {} stored for form {}", saved.getId(), formId);

        return mapToResponse(saved, formId);
    }

    /**
     * Возвращает все отзывы формы в порядке отправки (старые первыми).
     *
     * @param formId ID формы
     * @return список FeedbackResponseDTO
     */
    @Transactional(readOnly = true)
    public List<FeedbackResponseDTO> getResponses(UUID formId) {
        log.debug("Getting feedback responses for form {}", formId);

        if (!feedbackFormRepository.existsById(formId)) {
            throw formNotFound(formId);
        }

        return feedbackResponseRepository.findByFormIdOrderBySubmittedAtAscIdAsc(formId).stream()
                .map(response -> mapToResponse(response, formId))
                .toList();
    }

    private void validateRating(Integer rating) {
        if (rating == null || rating < MIN_RATING || rating > MAX_RATING) {
            throw new ValidationException(
                    "Rating must be between " + MIN_RATING + " and " + MAX_RATING + ", got " + rating,
                    ErrorCode.INVALID_RATING.getCode()
            );
        }
    }

    /**
     * Комментарий из одних пробельных символов считается отсутствующим.
     */
    static String normalizeComment(String comment) {
        if (comment == null || comment.isBlank()) {
            return null;
        }
        return comment;
    }

    private ResourceNotFoundException formNotFound(UUID formId) {
        return new ResourceNotFoundException(
                "Feedback form with id " + formId + " not found",
                ErrorCode.FORM_NOT_FOUND.getCode()
        );
    }

    private FeedbackResponseDTO mapToResponse(FeedbackResponse response, UUID formId) {
        return new FeedbackResponseDTO(
                response.getId(),
                formId,
                response.getAttendeeName(),
                response.getRating(),
                response.getComment(),
                response.getSubmittedAt()
        );
    }
}
