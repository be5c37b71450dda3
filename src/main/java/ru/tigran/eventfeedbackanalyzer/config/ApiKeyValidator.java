package ru.tigran.eventfeedbackanalyzer.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

/**
 * Прерывает запуск приложения, если ключ Gemini не задан.
 */
@Slf4j
@Component
public class ApiKeyValidator implements ApplicationRunner {

    static final String ENV_VAR_NAME = "GEMINI_API_KEY";

    @Value("${app.gemini.api-key:}")
    private String geminiApiKey;

    @Override
    public void run(ApplicationArguments args) {
        log.info("Validating Gemini API key configuration");
        validateApiKey(geminiApiKey);
        log.info("API key validation completed successfully");
    }

    void validateApiKey(String apiKey) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException(
                String.format(
                    "%s environment variable is not set! Please configure it before starting the application. " +
                    "Example: export %s=your-gemini-api-key",
                    ENV_VAR_NAME, ENV_VAR_NAME
                )
            );
        }

        if (apiKey.contains("YOUR_") || apiKey.contains("PLACEHOLDER")) {
            throw new IllegalStateException(
                String.format(
                    "%s contains placeholder value! Please set a real API key in environment variables.",
                    ENV_VAR_NAME
                )
            );
        }

        log.debug("API key validation passed for {}", ENV_VAR_NAME);
    }
}
