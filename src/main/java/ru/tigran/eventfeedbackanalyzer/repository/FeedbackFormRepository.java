package ru.tigran.eventfeedbackanalyzer.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import ru.tigran.eventfeedbackanalyzer.model.FeedbackForm;

import java.util.UUID;

@Repository
public interface FeedbackFormRepository extends JpaRepository<FeedbackForm, UUID> {
}
