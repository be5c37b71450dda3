package ru.tigran.eventfeedbackanalyzer.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI 3.0 configuration for Swagger UI documentation.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI customOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("Event Feedback Analyzer API")
                        .description("REST API для сбора отзывов участников мероприятий " +
                                "и AI анализа тональности. Анализ формы выполняется один раз и сохраняется.")
                        .version("1.0.0")
                        .contact(new Contact()
                                .name("Tigran")
                                .url("https://github.com/TIGERVENENO")
                        )
                );
    }
}
