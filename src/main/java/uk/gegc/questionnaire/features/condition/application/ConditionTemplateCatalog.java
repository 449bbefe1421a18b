package uk.gegc.questionnaire.features.condition.application;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionTemplateDto;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionTemplatesResponse;
import uk.gegc.questionnaire.features.condition.domain.model.ComplexCondition;
import uk.gegc.questionnaire.features.condition.domain.model.DisplayCondition;
import uk.gegc.questionnaire.features.condition.domain.model.SimpleCondition;
import uk.gegc.questionnaire.features.condition.infra.mapping.DisplayConditionJsonMapper;

import java.util.List;

/**
 * Ready-made display condition patterns offered to questionnaire authors.
 * Templates are built from the condition model so they always have the stored shape.
 */
@Component
@RequiredArgsConstructor
public class ConditionTemplateCatalog {

    private final DisplayConditionJsonMapper conditionMapper;

    public ConditionTemplatesResponse templates() {
        List<ConditionTemplateDto> common = List.of(
                template("Basic filter",
                        "Show the question for one answer to an earlier question",
                        on("${QUESTION_ID}", "${OPTION_KEY}"),
                        on("q1", "A")),
                template("All of (AND)",
                        "Show the question only when every condition holds",
                        ComplexCondition.and(on("${QUESTION_ID_1}", "${OPTION_KEY_1}"), on("${QUESTION_ID_2}", "${OPTION_KEY_2}")),
                        ComplexCondition.and(on("q1", "A"), on("q2", "B"))),
                template("Any of (OR)",
                        "Show the question when at least one condition holds",
                        ComplexCondition.or(on("${QUESTION_ID_1}", "${OPTION_KEY_1}"), on("${QUESTION_ID_2}", "${OPTION_KEY_2}")),
                        ComplexCondition.or(on("q1", "A"), on("q3", "C")))
        );

        List<ConditionTemplateDto> psychological = List.of(
                template("Anxiety screening",
                        "Follow-up questions after elevated GAD-7 answers",
                        null,
                        ComplexCondition.and(on("anxiety_1", "C"), on("anxiety_2", "D"))),
                template("Depression follow-up",
                        "Graded PHQ-9 screening, either high answer opens the next block",
                        null,
                        ComplexCondition.or(on("depression_base", "C"), on("depression_base", "D")))
        );

        return new ConditionTemplatesResponse(common, psychological);
    }

    private ConditionTemplateDto template(String name, String description,
                                          DisplayCondition template, DisplayCondition example) {
        return new ConditionTemplateDto(
                name,
                description,
                template == null ? null : conditionMapper.toJson(template),
                conditionMapper.toJson(example)
        );
    }

    private static SimpleCondition on(String questionId, String option) {
        return new SimpleCondition(questionId, option);
    }
}
