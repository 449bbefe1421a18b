package uk.gegc.questionnaire.features.question.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Table(name = "questions")
public class Question {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "paper_id", nullable = false)
    private UUID paperId;

    @Column(name = "title", nullable = false, length = 1000)
    private String title;

    @Column(name = "question_order", nullable = false)
    private Integer questionOrder;

    @Column(name = "question_type", nullable = false, length = 50)
    private String questionType;

    /**
     * Display condition as stored JSON, {@code null} when the question is always shown.
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "display_condition", columnDefinition = "json")
    private String displayCondition;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false, nullable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;
}
