package ru.tigran.eventfeedbackanalyzer.config;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

import java.io.IOException;

/**
 * CORS для фронтенда формы отзывов и логирование запросов к API.
 */
@Slf4j
@Configuration
public class WebConfig implements WebMvcConfigurer {

    static final String API_PATH_PREFIX = "/api/";
    private static final long SLOW_REQUEST_MS = 1000;

    @Value("${cors.allowed-origins:http://localhost:3000,http://localhost:5173}")
    private String allowedOrigins;

    /**
     * Фронтенд работает без авторизации, поэтому cookies не разрешены.
     */
    @Override
    public void addCorsMappings(CorsRegistry registry) {
        registry.addMapping(API_PATH_PREFIX + "**")
                .allowedOrigins(allowedOrigins.split(","))
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("Content-Type")
                .allowCredentials(false)
                .maxAge(3600);
    }

    /**
     * Логирует только запросы к /api/. Анализ формы ждёт ответа Gemini, поэтому
     * медленные запросы выделяются отдельно.
     */
    @Bean
    public OncePerRequestFilter apiRequestLoggingFilter() {
        return new OncePerRequestFilter() {
            @Override
            protected boolean shouldNotFilter(HttpServletRequest request) {
                return !request.getRequestURI().startsWith(API_PATH_PREFIX);
            }

            @Override
            protected void doFilterInternal(
                    HttpServletRequest request,
                    HttpServletResponse response,
                    FilterChain filterChain
            ) throws ServletException, IOException {
                long startTime = System.currentTimeMillis();

                try {
                    filterChain.doFilter(request, response);
                } finally {
                    long duration = System.currentTimeMillis() - startTime;
                    int status = response.getStatus();
                    String method = request.getMethod();
                    String uri = request.getRequestURI();

                    if (status >= 500) {
                        log.error("{} {} -> {} in {}ms", method, uri, status, duration);
                    } else if (status >= 400) {
                        log.warn("{} {} -> {} in {}ms", method, uri, status, duration);
                    } else if (duration > SLOW_REQUEST_MS) {
                        log.info("{} {} -> {} in {}ms (slow)", method, uri, status, duration);
                    } else {
                        log.debug("{} {} -> {} in {}ms", method, uri, status, duration);
                    }
                }
            }
        };
    }
}
