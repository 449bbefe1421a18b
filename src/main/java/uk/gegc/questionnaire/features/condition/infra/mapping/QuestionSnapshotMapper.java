package uk.gegc.questionnaire.features.condition.infra.mapping;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.questionnaire.features.condition.domain.model.QuestionSnapshot;
import uk.gegc.questionnaire.features.question.domain.model.Question;

import java.util.List;

@Component
@RequiredArgsConstructor
public class QuestionSnapshotMapper {

    private final DisplayConditionJsonMapper conditionMapper;

    public QuestionSnapshot toSnapshot(Question question) {
        return new QuestionSnapshot(
                question.getId().toString(),
                question.getTitle(),
                question.getPaperId().toString(),
                conditionMapper.fromStoredJson(question.getDisplayCondition())
        );
    }

    public List<QuestionSnapshot> toSnapshots(List<Question> questions) {
        return questions.stream().map(this::toSnapshot).toList();
    }
}
