package ru.tigran.eventfeedbackanalyzer.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import ru.tigran.eventfeedbackanalyzer.service.AIGatewayService;

import java.time.Duration;

/**
 * Health check для Gemini API
 */
@Slf4j
@Configuration
public class HealthCheckConfig {

    /**
     * Пингует список моделей Gemini с настроенным ключом.
     * Состояние Redis и БД проверяет сам Spring Boot.
     */
    @Bean
    public HealthIndicator aiProviderHealthIndicator(
            WebClient webClient,
            @Value("${app.gemini.base-url:https://generativelanguage.googleapis.com/v1beta}") String baseUrl,
            @Value("${app.gemini.api-key:}") String apiKey,
            AIGatewayService aiGatewayService
    ) {
        String model = String.valueOf(aiGatewayService.getConfiguredModel());
        return () -> {
            try {
                webClient.get()
                        .uri(baseUrl + "/models")
                        .header("x-goog-api-key", apiKey)
                        .retrieve()
                        .bodyToMono(String.class)
                        .timeout(Duration.ofSeconds(5))
                        .block();

                log.debug("Gemini health check: OK");
                return Health.up()
                        .withDetail("model", model)
                        .build();
            } catch (Exception e) {
                log.warn("Gemini health check failed: {}", e.getMessage());
                return Health.down()
                        .withDetail("model", model)
                        .withDetail("error", e.getMessage())
                        .build();
            }
        };
    }
}
