package ru.tigran.eventfeedbackanalyzer.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import ru.tigran.eventfeedbackanalyzer.model.FeedbackResponse;

import java.util.List;
import java.util.UUID;

@Repository
public interface FeedbackResponseRepository extends JpaRepository<FeedbackResponse, UUID> {
    /**
     * Responses of a form, oldest first. Prompt construction depends on this order.
     */
    List<FeedbackResponse> findByFormIdOrderBySubmittedAtAscIdAsc(UUID formId);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM FeedbackResponse r WHERE r.form.id = :formId")
    int deleteByFormId(@Param("formId") UUID formId);
}
