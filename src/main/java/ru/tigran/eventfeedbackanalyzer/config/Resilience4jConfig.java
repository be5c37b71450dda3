package ru.tigran.eventfeedbackanalyzer.config;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import ru.tigran.eventfeedbackanalyzer.exception.AIGatewayException;

import java.time.Duration;

/**
 * Конфигурация Resilience4j для вызовов Gemini.
 * Повторных попыток нет: каждый запрос анализа вызывает Gemini не более одного раза.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    /**
     * Открывается, когда половина из последних 10 вызовов завершилась ошибкой (минимум 5 вызовов).
     * Остаётся открытым 30 секунд, затем переходит в HALF_OPEN.
     */
    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry() {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(
            CircuitBreakerConfig.custom()
                .failureRateThreshold(50.0f)
                .slowCallRateThreshold(80.0f)
                .slowCallDurationThreshold(Duration.ofSeconds(25))
                .permittedNumberOfCallsInHalfOpenState(2)
                .minimumNumberOfCalls(5)
                .slidingWindowSize(10)
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .automaticTransitionFromOpenToHalfOpenEnabled(true)
                .waitDurationInOpenState(Duration.ofSeconds(30))
                .recordExceptions(AIGatewayException.class)
                .ignoreExceptions(IllegalArgumentException.class)
                .build()
        );

        registry.getEventPublisher()
                .onEntryAdded(event -> log.info("CircuitBreaker created: {}", event.getAddedEntry().getName()));

        return registry;
    }

    @Bean
    public CircuitBreaker aiProviderCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreaker circuitBreaker = registry.circuitBreaker("aiProvider");

        circuitBreaker.getEventPublisher()
                .onStateTransition(event -> log.warn("CircuitBreaker state changed: {} -> {}",
                    event.getStateTransition().getFromState(),
                    event.getStateTransition().getToState()))
                .onError(event -> log.error("CircuitBreaker recorded error: {}", event.getThrowable().getMessage()));

        return circuitBreaker;
    }
}
