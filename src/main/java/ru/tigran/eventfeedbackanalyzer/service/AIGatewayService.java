package ru.tigran.eventfeedbackanalyzer.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import ru.tigran.eventfeedbackanalyzer.dto.AnalysisResult;
import ru.tigran.eventfeedbackanalyzer.dto.FeedbackEntry;
import ru.tigran.eventfeedbackanalyzer.exception.AIGatewayException;
import ru.tigran.eventfeedbackanalyzer.exception.ErrorCode;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Gateway to the Google Gemini API.
 *
 * Turns an ordered list of rating/comment entries into one structured sentiment record:
 * builds the prompt with FeedbackPromptBuilder, calls generateContent once and parses the reply
 * with AnalysisResponseParser. Calls go through the "aiProvider" circuit breaker and are never
 * retried; any failure surfaces as AIGatewayException with AI_SERVICE_UNAVAILABLE.
 */
@Slf4j
@Service
public class AIGatewayService {

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final CircuitBreaker circuitBreaker;
    private final String apiKey;
    private final String baseUrl;
    private final String model;
    private final double temperature;
    private final int maxOutputTokens;

    // Maximum response size (1 MB) to prevent memory exhaustion
    private static final long MAX_RESPONSE_SIZE_BYTES = 1024 * 1024;

    public AIGatewayService(
            RestClient restClient,
            ObjectMapper objectMapper,
            CircuitBreaker aiProviderCircuitBreaker,
            @Value("${app.gemini.api-key}") String apiKey,
            @Value("${app.gemini.base-url:https://generativelanguage.googleapis.com/v1beta}") String baseUrl,
            @Value("${app.gemini.model:gemini-2.5-flash}") String model,
            @Value("${app.gemini.temperature:0.7}") double temperature,
            @Value("${app.gemini.max-output-tokens:1000}") int maxOutputTokens
    ) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.circuitBreaker = aiProviderCircuitBreaker;
        this.apiKey = apiKey;
        this.baseUrl = baseUrl;
        this.model = model;
        this.temperature = temperature;
        this.maxOutputTokens = maxOutputTokens;
    }

    /**
     * Analyzes attendee feedback.
     *
     * @param feedback non-empty list of entries in submission order
     * @return parsed analysis, always complete
     * @throws IllegalArgumentException if feedback is empty
     * @throws AIGatewayException if the Gemini call fails
     */
    public AnalysisResult analyzeFeedback(List<FeedbackEntry> feedback) {
        if (feedback == null || feedback.isEmpty()) {
            throw new IllegalArgumentException("No feedback data provided");
        }
        log.info("Analyzing {} feedback entries with model {}", feedback.size(), model);

        String prompt = FeedbackPromptBuilder.buildAnalysisPrompt(feedback);
        String reply = callGemini(prompt);

        AnalysisResult result = AnalysisResponseParser.parse(reply);
        log.info("Analysis parsed: sentiment={}", result.overallSentiment().getLabel());
        return result;
    }

    /**
     * Returns the configured model name, reported by the aiProvider health indicator.
     */
    public String getConfiguredModel() {
        return model;
    }

    private String callGemini(String prompt) {
        try {
            return circuitBreaker.executeSupplier(() -> doCallGemini(prompt));
        } catch (CallNotPermittedException e) {
            log.warn("Circuit breaker '{}' is open, Gemini call rejected", circuitBreaker.getName());
            throw new AIGatewayException(
                    "AI service temporarily unavailable (circuit breaker open)",
                    ErrorCode.AI_SERVICE_UNAVAILABLE.getCode(),
                    e
            );
        }
    }

    private String doCallGemini(String prompt) {
        try {
            String requestBody = buildRequestBody(prompt);

            String response = restClient.post()
                    .uri(baseUrl + "/models/{model}:generateContent", model)
                    .header("x-goog-api-key", apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(requestBody)
                    .retrieve()
                    .onStatus(HttpStatusCode::isError, (request, errorResponse) -> {
                        int statusCode = errorResponse.getStatusCode().value();
                        log.error("Gemini API error: {} {}", statusCode, errorResponse.getStatusText());
                        throw new AIGatewayException(
                                "Gemini API error: " + statusCode,
                                ErrorCode.AI_SERVICE_UNAVAILABLE.getCode()
                        );
                    })
                    .body(String.class);

            String content = extractCandidateText(response);

            log.debug("Gemini prompt (first 500 chars): {}",
                    prompt.length() > 500 ? prompt.substring(0, 500) + "..." : prompt);
            log.debug("Gemini reply (first 800 chars): {}",
                    content.length() > 800 ? content.substring(0, 800) + "..." : content);

            return content;
        } catch (AIGatewayException e) {
            throw e;
        } catch (Exception e) {
            log.error("Error calling Gemini API", e);
            throw new AIGatewayException(
                    "Failed to analyze feedback: " + e.getMessage(),
                    ErrorCode.AI_SERVICE_UNAVAILABLE.getCode(),
                    e
            );
        }
    }

    /**
     * Builds the generateContent request body with a single user turn and the
     * configured generation parameters.
     */
    private String buildRequestBody(String prompt) {
        try {
            var rootNode = objectMapper.createObjectNode();

            var content = rootNode.putArray("contents").addObject();
            content.put("role", "user");
            content.putArray("parts").addObject().put("text", prompt);

            var generationConfig = rootNode.putObject("generationConfig");
            generationConfig.put("temperature", temperature);
            generationConfig.put("maxOutputTokens", maxOutputTokens);

            return objectMapper.writeValueAsString(rootNode);
        } catch (Exception e) {
            throw new AIGatewayException(
                    "Failed to build request body",
                    ErrorCode.AI_SERVICE_UNAVAILABLE.getCode(),
                    e
            );
        }
    }

    /**
     * Extracts the text of the first candidate from a generateContent response.
     * Multiple text parts are concatenated.
     */
    private String extractCandidateText(String response) {
        validateResponseSize(response);

        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode parts = root.at("/candidates/0/content/parts");

            if (!parts.isArray() || parts.isEmpty()) {
                String finishReason = root.at("/candidates/0/finishReason").asText("NONE");
                String blockReason = root.at("/promptFeedback/blockReason").asText("NONE");
                log.error("No candidate text in Gemini response (finishReason={}, blockReason={})",
                        finishReason, blockReason);
                throw new AIGatewayException(
                        "Missing content in Gemini response",
                        ErrorCode.AI_SERVICE_UNAVAILABLE.getCode()
                );
            }

            StringBuilder text = new StringBuilder();
            for (JsonNode part : parts) {
                text.append(part.path("text").asText(""));
            }
            return text.toString();
        } catch (AIGatewayException e) {
            throw e;
        } catch (Exception e) {
            throw new AIGatewayException(
                    "Failed to parse Gemini response: " + e.getMessage(),
                    ErrorCode.AI_SERVICE_UNAVAILABLE.getCode(),
                    e
            );
        }
    }

    private void validateResponseSize(String responseBody) {
        if (responseBody == null) {
            throw new AIGatewayException(
                    "Empty response from Gemini API",
                    ErrorCode.AI_SERVICE_UNAVAILABLE.getCode()
            );
        }

        int sizeBytes = responseBody.getBytes(StandardCharsets.UTF_8).length;
        if (sizeBytes > MAX_RESPONSE_SIZE_BYTES) {
            String errorMsg = String.format(
                    "Gemini response exceeds maximum allowed size. Response size: %d bytes, max allowed: %d bytes",
                    sizeBytes,
                    MAX_RESPONSE_SIZE_BYTES
            );
            log.error(errorMsg);
            throw new AIGatewayException(errorMsg, ErrorCode.AI_SERVICE_UNAVAILABLE.getCode());
        }
    }
}
