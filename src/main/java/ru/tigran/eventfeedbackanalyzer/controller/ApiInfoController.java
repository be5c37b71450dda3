package ru.tigran.eventfeedbackanalyzer.controller;

import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Контроллер для информации об API и эндпоинтах
 */
@RestController
@RequestMapping("/api")
@Tag(name = "API Info", description = "Информация об API и доступных эндпоинтах")
public class ApiInfoController {

    @GetMapping("/endpoints")
    public ResponseEntity<ApiEndpointsResponse> getEndpoints() {
        return ResponseEntity.ok(new ApiEndpointsResponse(
                "Event Feedback Analyzer API",
                "Сбор отзывов участников мероприятий и AI анализ тональности",
                "1.0.0",
                List.of(
                    new EndpointGroup(
                            "Формы",
                            "Управление формами обратной связи",
                            List.of(
                                    new ApiEndpoint("POST", "/api/v1/forms", "Создать форму"),
                                    new ApiEndpoint("GET", "/api/v1/forms/{formId}", "Получить форму по ID"),
                                    new ApiEndpoint("PUT", "/api/v1/forms/{formId}", "Обновить форму"),
                                    new ApiEndpoint("DELETE", "/api/v1/forms/{formId}", "Удалить форму с отзывами и анализом")
                            )
                    ),
                    new EndpointGroup(
                            "Отзывы",
                            "Приём отзывов участников",
                            List.of(
                                    new ApiEndpoint("POST", "/api/v1/forms/{formId}/responses", "Отправить отзыв"),
                                    new ApiEndpoint("GET", "/api/v1/forms/{formId}/responses", "Получить отзывы формы")
                            )
                    ),
                    new EndpointGroup(
                            "Анализ",
                            "AI анализ тональности отзывов",
                            List.of(
                                    new ApiEndpoint("POST", "/api/v1/forms/{formId}/analyze", "Запустить анализ (один раз на форму)"),
                                    new ApiEndpoint("GET", "/api/v1/forms/{formId}/analysis", "Получить сохранённый анализ")
                            )
                    ),
                    new EndpointGroup(
                            "Документация",
                            "Доступ к документации API",
                            List.of(
                                    new ApiEndpoint("GET", "/swagger-ui.html", "Интерактивная документация Swagger UI"),
                                    new ApiEndpoint("GET", "/v3/api-docs", "OpenAPI документация в JSON формате"),
                                    new ApiEndpoint("GET", "/api/endpoints", "Получить список всех эндпоинтов")
                            )
                    )
                )
        ));
    }

    @Getter
    @RequiredArgsConstructor
    public static class ApiEndpointsResponse {
        private final String title;
        private final String description;
        private final String version;
        private final List<EndpointGroup> groups;
    }

    @Getter
    @RequiredArgsConstructor
    public static class EndpointGroup {
        private final String name;
        private final String description;
        private final List<ApiEndpoint> endpoints;
    }

    @Getter
    @RequiredArgsConstructor
    public static class ApiEndpoint {
        private final String method;
        private final String path;
        private final String description;
    }
}
