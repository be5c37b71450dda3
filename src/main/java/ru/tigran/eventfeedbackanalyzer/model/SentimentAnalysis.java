package ru.tigran.eventfeedbackanalyzer.model;

import jakarta.persistence.*;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import lombok.ToString;
import org.hibernate.annotations.OnDelete;
import org.hibernate.annotations.OnDeleteAction;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * AI-generated sentiment summary of a form. At most one per form: the unique constraint on
 * form_id is what SentimentAnalysisService relies on when two analyses race.
 */
@Entity
@Table(name = "sentiment_analysis", uniqueConstraints = {
    @UniqueConstraint(name = SentimentAnalysis.FORM_UNIQUE_CONSTRAINT, columnNames = "form_id")
})
@Getter
@Setter
@NoArgsConstructor
@EqualsAndHashCode(of = "id")
@ToString(exclude = "form")
public class SentimentAnalysis {
    public static final String FORM_UNIQUE_CONSTRAINT = "uk_sentiment_analysis_form";

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @OneToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "form_id", nullable = false, updatable = false)
    @OnDelete(action = OnDeleteAction.CASCADE)
    private FeedbackForm form;

    @Enumerated(EnumType.STRING)
    @Column(name = "overall_sentiment", nullable = false, length = 50, updatable = false)
    private Sentiment overallSentiment;

    @Column(name = "positive_highlights", columnDefinition = "TEXT", updatable = false)
    private String positiveHighlights;

    @Column(name = "common_complaints", columnDefinition = "TEXT", updatable = false)
    private String commonComplaints;

    @Column(name = "executive_summary", columnDefinition = "TEXT", nullable = false, updatable = false)
    private String executiveSummary;

    @Column(name = "analyzed_at", nullable = false, updatable = false)
    private LocalDateTime analyzedAt;

    @PrePersist
    protected void onCreate() {
        if (analyzedAt == null) {
            analyzedAt = LocalDateTime.now();
        }
    }
}
