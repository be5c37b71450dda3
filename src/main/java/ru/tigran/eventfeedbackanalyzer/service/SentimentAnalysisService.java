package ru.tigran.eventfeedbackanalyzer.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import ru.tigran.eventfeedbackanalyzer.config.CacheConfig;
import ru.tigran.eventfeedbackanalyzer.dto.AnalysisResult;
import ru.tigran.eventfeedbackanalyzer.dto.FeedbackEntry;
import ru.tigran.eventfeedbackanalyzer.dto.SentimentAnalysisResponse;
import ru.tigran.eventfeedbackanalyzer.exception.ErrorCode;
import ru.tigran.eventfeedbackanalyzer.exception.NoResponsesException;
import ru.tigran.eventfeedbackanalyzer.exception.ResourceNotFoundException;
import ru.tigran.eventfeedbackanalyzer.exception.StorageException;
import ru.tigran.eventfeedbackanalyzer.model.FeedbackForm;
import ru.tigran.eventfeedbackanalyzer.model.FeedbackResponse;
import ru.tigran.eventfeedbackanalyzer.model.SentimentAnalysis;
import ru.tigran.eventfeedbackanalyzer.repository.FeedbackFormRepository;
import ru.tigran.eventfeedbackanalyzer.repository.FeedbackResponseRepository;
import ru.tigran.eventfeedbackanalyzer.repository.SentimentAnalysisRepository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Runs and serves the sentiment analysis of a form.
 *
 * The analysis is computed at most once per form and stored; every later request returns
 * the stored row without calling Gemini. analyzeForm is not transactional: each repository
 * call runs in its own transaction and the Gemini call runs outside of any.
 */
@Slf4j
@Service
public class SentimentAnalysisService {

    private final FeedbackFormRepository feedbackFormRepository;
    private final FeedbackResponseRepository feedbackResponseRepository;
    private final SentimentAnalysisRepository sentimentAnalysisRepository;
    private final AIGatewayService aiGatewayService;
    private final Counter cacheHitCounter;
    private final Counter aiCallCounter;
    private final Counter raceResolvedCounter;
    private final Timer analysisTimer;

    public SentimentAnalysisService(
            FeedbackFormRepository feedbackFormRepository,
            FeedbackResponseRepository feedbackResponseRepository,
            SentimentAnalysisRepository sentimentAnalysisRepository,
            AIGatewayService aiGatewayService,
            MeterRegistry meterRegistry
    ) {
        this.feedbackFormRepository = feedbackFormRepository;
        this.feedbackResponseRepository = feedbackResponseRepository;
        this.sentimentAnalysisRepository = sentimentAnalysisRepository;
        this.aiGatewayService = aiGatewayService;
        this.cacheHitCounter = Counter.builder("feedback.analysis.cache.hit")
                .description("Analysis requests served from the stored analysis")
                .register(meterRegistry);
        this.aiCallCounter = Counter.builder("feedback.analysis.ai.calls")
                .description("Analysis requests that called the AI service")
                .register(meterRegistry);
        this.raceResolvedCounter = Counter.builder("feedback.analysis.race.resolved")
                .description("Concurrent analysis inserts resolved by re-fetching the stored analysis")
                .register(meterRegistry);
        this.analysisTimer = Timer.builder("feedback.analysis.time")
                .description("Time to serve an analysis request")
                .register(meterRegistry);
    }

    /**
     * Returns the analysis of a form, running it first if the form has none yet.
     *
     * @param formId form ID
     * @return stored analysis
     * @throws ResourceNotFoundException FORM_NOT_FOUND if the form does not exist
     * @throws NoResponsesException if the form has no responses
     * @throws ru.tigran.eventfeedbackanalyzer.exception.AIGatewayException if the Gemini call fails
     */
    public SentimentAnalysisResponse analyzeForm(UUID formId) {
        return analysisTimer.record(() -> executeAnalyzeForm(formId));
    }

    private SentimentAnalysisResponse executeAnalyzeForm(UUID formId) {
        log.info("Analysis requested for form {}", formId);

        FeedbackForm form = feedbackFormRepository.findById(formId)
                .orElseThrow(() -> formNotFound(formId));

        Optional<SentimentAnalysis> existing = sentimentAnalysisRepository.findByFormId(formId);
        if (existing.isPresent()) {
            cacheHitCounter.increment();
            log.info("Returning stored analysis for form {}", formId);
            return mapToResponse(existing.get(), formId);
        }

        List<FeedbackResponse> responses = feedbackResponseRepository.findByFormIdOrderBySubmittedAtAscIdAsc(formId);
        if (responses.isEmpty()) {
            throw new NoResponsesException(
                    "Cannot analyze form " + formId + ": No feedback responses submitted yet",
                    ErrorCode.NO_RESPONSES.getCode()
            );
        }

        List<FeedbackEntry> entries = responses.stream()
                .map(response -> new FeedbackEntry(response.getRating(), response.getComment()))
                .toList();

        aiCallCounter.increment();
        AnalysisResult result = aiGatewayService.analyzeFeedback(entries);

        SentimentAnalysis analysis = new SentimentAnalysis();
        analysis.setForm(form);
        analysis.setOverallSentiment(result.overallSentiment());
        analysis.setPositiveHighlights(result.positiveHighlights());
        analysis.setCommonComplaints(result.commonComplaints());
        analysis.setExecutiveSummary(result.executiveSummary());

        try {
            SentimentAnalysis saved = sentimentAnalysisRepository.saveAndFlush(analysis);
            log.info("Stored analysis {} for form {} (sentiment={})",
                    saved.getId(), formId, saved.getOverallSentiment().getLabel());
            return mapToResponse(saved, formId);
        } catch (DataIntegrityViolationException e) {
            return resolveConcurrentInsert(formId, e);
        }
    }

    /**
     * The insert lost against another request for the same form (unique form_id) or the form
     * was deleted meanwhile (foreign key). The stored analysis wins; if there is none the form is gone.
     */
    private SentimentAnalysisResponse resolveConcurrentInsert(UUID formId, DataIntegrityViolationException e) {
        Optional<SentimentAnalysis> winner = sentimentAnalysisRepository.findByFormId(formId);
        if (winner.isPresent()) {
            raceResolvedCounter.increment();
            log.info("Analysis for form {} was stored by a concurrent request, returning it", formId);
            return mapToResponse(winner.get(), formId);
        }

        if (!feedbackFormRepository.existsById(formId)) {
            log.warn("Form {} was deleted while its analysis was running", formId);
            throw formNotFound(formId);
        }

        throw new StorageException(
                "Failed to store analysis for form " + formId,
                ErrorCode.STORAGE_ERROR.getCode(),
                e
        );
    }

    /**
     * Returns the stored analysis of a form. Never calls Gemini.
     *
     * @param formId form ID
     * @return stored analysis
     * @throws ResourceNotFoundException FORM_NOT_FOUND or ANALYSIS_NOT_FOUND
     */
    @Transactional(readOnly = true)
    @Cacheable(value = CacheConfig.ANALYSIS_CACHE, key = "#formId.toString()")
    public SentimentAnalysisResponse getAnalysis(UUID formId) {
        log.debug("Fetching analysis for form {}", formId);

        if (!feedbackFormRepository.existsById(formId)) {
            throw formNotFound(formId);
        }

        SentimentAnalysis analysis = sentimentAnalysisRepository.findByFormId(formId)
                .orElseThrow(() -> new ResourceNotFoundException(
                        "No analysis found for form " + formId + ". Please run analysis first.",
                        ErrorCode.ANALYSIS_NOT_FOUND.getCode()
                ));

        return mapToResponse(analysis, formId);
    }

    private ResourceNotFoundException formNotFound(UUID formId) {
        return new ResourceNotFoundException(
                "Feedback form with id " + formId + " not found",
                ErrorCode.FORM_NOT_FOUND.getCode()
        );
    }

    private SentimentAnalysisResponse mapToResponse(SentimentAnalysis analysis, UUID formId) {
        return new SentimentAnalysisResponse(
                analysis.getId(),
                formId,
                analysis.getOverallSentiment(),
                analysis.getPositiveHighlights(),
                analysis.getCommonComplaints(),
                analysis.getExecutiveSummary(),
                analysis.getAnalyzedAt()
        );
    }
}
