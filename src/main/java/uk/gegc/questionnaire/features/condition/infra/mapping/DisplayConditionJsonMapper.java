package uk.gegc.questionnaire.features.condition.infra.mapping;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.questionnaire.features.condition.config.ConditionLogicProperties;
import uk.gegc.questionnaire.features.condition.domain.exception.InvalidConditionException;
import uk.gegc.questionnaire.features.condition.domain.model.ComplexCondition;
import uk.gegc.questionnaire.features.condition.domain.model.DisplayCondition;
import uk.gegc.questionnaire.features.condition.domain.model.SimpleCondition;

import java.util.ArrayList;
import java.util.List;

/**
 * Reads and writes display conditions in their stored JSON shape:
 * <pre>
 * {"question_id": "...", "selected_option": "..."}
 * {"operator": "AND", "conditions": [ ... ]}
 * </pre>
 * Only the shape is checked here; references, operators and list sizes are left to
 * the dependency validator so they surface as validation messages.
 */
@Component
@RequiredArgsConstructor
public class DisplayConditionJsonMapper {

    static final String QUESTION_ID = "question_id";
    static final String SELECTED_OPTION = "selected_option";
    static final String OPERATOR = "operator";
    static final String CONDITIONS = "conditions";

    private final ObjectMapper objectMapper;
    private final ConditionLogicProperties properties;

    /**
     * @return the condition, or {@code null} for a missing or JSON null node
     */
    public DisplayCondition fromJson(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        return readNode(node, 0);
    }

    public DisplayCondition fromStoredJson(String json) {
        if (!StringUtils.hasText(json)) {
            return null;
        }
        try {
            return fromJson(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            throw new InvalidConditionException("Stored display condition is not valid JSON", e);
        }
    }

    public JsonNode toJson(DisplayCondition condition) {
        if (condition == null) {
            return objectMapper.nullNode();
        }
        return condition.match(
                simple -> {
                    ObjectNode node = objectMapper.createObjectNode();
                    node.put(QUESTION_ID, simple.questionId());
                    node.put(SELECTED_OPTION, simple.selectedOption());
                    return node;
                },
                complex -> {
                    ObjectNode node = objectMapper.createObjectNode();
                    node.put(OPERATOR, complex.operator());
                    ArrayNode children = node.putArray(CONDITIONS);
                    complex.conditions().forEach(sub -> children.add(toJson(sub)));
                    return node;
                }
        );
    }

    public String toStoredJson(DisplayCondition condition) {
        if (condition == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(toJson(condition));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize display condition", e);
        }
    }

    private DisplayCondition readNode(JsonNode node, int depth) {
        if (depth > properties.getMaxConditionDepth()) {
            throw new InvalidConditionException(
                    "Display condition is nested deeper than " + properties.getMaxConditionDepth() + " levels");
        }
        if (!node.isObject()) {
            throw new InvalidConditionException("Display condition must be a JSON object");
        }
        if (node.has(QUESTION_ID)) {
            return readSimple(node);
        }
        if (node.has(OPERATOR)) {
            return readComplex(node, depth);
        }
        throw new InvalidConditionException(
                "Invalid condition format: expected '" + QUESTION_ID + "' or '" + OPERATOR + "'");
    }

    private SimpleCondition readSimple(JsonNode node) {
        JsonNode questionId = node.get(QUESTION_ID);
        if (!questionId.isTextual() || questionId.asText().isBlank()) {
            throw new InvalidConditionException("'" + QUESTION_ID + "' must be a non-empty string");
        }
        JsonNode option = node.get(SELECTED_OPTION);
        String selectedOption = option == null || option.isNull() ? null : option.asText();
        return new SimpleCondition(questionId.asText(), selectedOption);
    }

    private ComplexCondition readComplex(JsonNode node, int depth) {
        JsonNode operator = node.get(OPERATOR);
        String operatorValue = operator.isNull() ? null : operator.asText();

        JsonNode conditions = node.get(CONDITIONS);
        if (conditions == null || conditions.isNull()) {
            return new ComplexCondition(operatorValue, List.of());
        }
        if (!conditions.isArray()) {
            throw new InvalidConditionException("'" + CONDITIONS + "' must be an array");
        }
        List<DisplayCondition> children = new ArrayList<>();
        for (JsonNode child : conditions) {
            children.add(readNode(child, depth + 1));
        }
        return new ComplexCondition(operatorValue, children);
    }
}
