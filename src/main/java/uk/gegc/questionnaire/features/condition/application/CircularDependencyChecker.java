package uk.gegc.questionnaire.features.condition.application;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import uk.gegc.questionnaire.features.condition.config.ConditionLogicProperties;
import uk.gegc.questionnaire.features.condition.domain.graph.DependencyValidator;
import uk.gegc.questionnaire.features.condition.domain.model.DisplayCondition;
import uk.gegc.questionnaire.features.condition.domain.model.QuestionSnapshot;
import uk.gegc.questionnaire.features.condition.infra.mapping.QuestionSnapshotMapper;
import uk.gegc.questionnaire.features.question.domain.repository.QuestionRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Checks a single proposed display condition for cycles before it is saved.
 *
 * <p>The paper's committed questions are loaded, the proposed condition is overlaid
 * in memory (a placeholder question is appended when the id is not part of the paper
 * yet) and the overlay is handed to a fresh {@link DependencyValidator}. Nothing is
 * written back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CircularDependencyChecker {

    static final String NEW_QUESTION_TITLE = "New question";

    private final QuestionRepository questionRepository;
    private final QuestionSnapshotMapper snapshotMapper;
    private final ConditionLogicProperties properties;

    public CircularDependencyCheck check(String questionId, DisplayCondition condition, UUID paperId) {
        if (condition == null) {
            return CircularDependencyCheck.none();
        }

        List<QuestionSnapshot> snapshot = new ArrayList<>(
                snapshotMapper.toSnapshots(questionRepository.findAllByPaperIdOrderByQuestionOrderAsc(paperId)));

        boolean replaced = false;
        for (int i = 0; i < snapshot.size(); i++) {
            if (snapshot.get(i).id().equals(questionId)) {
                snapshot.set(i, snapshot.get(i).withDisplayCondition(condition));
                replaced = true;
                break;
            }
        }
        if (!replaced) {
            snapshot.add(new QuestionSnapshot(questionId, NEW_QUESTION_TITLE, paperId.toString(), condition));
        }

        List<String> cycle = new DependencyValidator(snapshot, properties.getMaxConditionDepth())
                .detectCircularDependency(questionId);
        if (cycle.isEmpty()) {
            return CircularDependencyCheck.none();
        }
        log.debug("Proposed condition for question {} closes cycle {}", questionId, cycle);
        return CircularDependencyCheck.cycle(cycle);
    }
}
