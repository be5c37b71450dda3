package ru.tigran.eventfeedbackanalyzer.config;

import org.springframework.context.annotation.Configuration;
import org.springframework.data.jpa.repository.config.EnableJpaAuditing;

/**
 * Включает аудит сущностей: createdAt, updatedAt заполняются автоматически.
 */
@Configuration
@EnableJpaAuditing
public class AuditingConfig {
}
