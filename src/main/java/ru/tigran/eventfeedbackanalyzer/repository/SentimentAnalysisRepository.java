package ru.tigran.eventfeedbackanalyzer.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.tigran.eventfeedbackanalyzer.model.SentimentAnalysis;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface SentimentAnalysisRepository extends JpaRepository<SentimentAnalysis, UUID> {
    Optional<SentimentAnalysis> findByFormId(UUID formId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM SentimentAnalysis a WHERE a.form.id = :formId")
    int deleteByFormId(@Param("formId") UUID formId);
}
