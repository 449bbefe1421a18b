package uk.gegc.questionnaire.features.condition.domain.model;

import java.util.Objects;

/**
 * Read-only view of a question handed to the dependency validator for one analysis pass.
 *
 * @param id               opaque question identifier
 * @param title            display title, used in diagnostics and diagrams
 * @param paperId          paper the question belongs to
 * @param displayCondition condition controlling visibility, {@code null} when always shown
 */
public record QuestionSnapshot(String id, String title, String paperId, DisplayCondition displayCondition) {

    public QuestionSnapshot {
        Objects.requireNonNull(id, "id must not be null");
        title = title == null ? "" : title;
    }

    public boolean hasCondition() {
        return displayCondition != null;
    }

    public QuestionSnapshot withDisplayCondition(DisplayCondition condition) {
        return new QuestionSnapshot(id, title, paperId, condition);
    }
}
