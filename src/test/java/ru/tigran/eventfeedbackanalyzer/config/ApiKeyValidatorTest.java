package ru.tigran.eventfeedbackanalyzer.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ApiKeyValidator unit тесты")
class ApiKeyValidatorTest {

    private final ApiKeyValidator validator = new ApiKeyValidator();

    @Test
    @DisplayName("validateApiKey - отсутствующий ключ прерывает запуск")
    void missingKeyFails() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> validator.validateApiKey(""));
        assertTrue(e.getMessage().contains("GEMINI_API_KEY"));

        assertThrows(IllegalStateException.class, () -> validator.validateApiKey(null));
        assertThrows(IllegalStateException.class, () -> validator.validateApiKey("   "));
    }

    @Test
    @DisplayName("validateApiKey - ключ-заглушка прерывает запуск")
    void placeholderKeyFails() {
        assertThrows(IllegalStateException.class, () -> validator.validateApiKey("YOUR_GEMINI_KEY"));
        assertThrows(IllegalStateException.class, () -> validator.validateApiKey("PLACEHOLDER"));
    }

    @Test
    @DisplayName("validateApiKey - настоящий ключ принимается")
    void realKeyPasses() {
        assertDoesNotThrow(() -> validator.validateApiKey("AIzaSyTestKey123"));
    }
}
