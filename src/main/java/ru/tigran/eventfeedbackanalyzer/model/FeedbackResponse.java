package ru.tigran.eventfeedbackanalyzer.model;

import jakarta.persistence.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.Check;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * One attendee submission. Append-only: there is no update path, rows go away only
 * together with their form.
 */
@Entity
@Table(name = "feedback_responses", indexes = {
    @Index(name = "idx_feedback_response_form_submitted", columnList = "form_id, submitted_at")
})
@Check(constraints = "rating >= 1 AND rating <= 5")
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
@ToString(exclude = "form")
public class FeedbackResponse {
    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "form_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private FeedbackForm form;

    @Column(name = "attendee_name", length = 255)
    private String attendeeName;

    @Column(nullable = false)
    private Integer rating;

    @Column(columnDefinition = "TEXT")
    private String comment;

    @Column(name = "submitted_at", nullable = false, updatable = false)
    private LocalDateTime submittedAt;

    @PrePersist
    protected void onCreate() {
        if (submittedAt == null) {
            submittedAt = LocalDateTime.now();
        }
    }
}
