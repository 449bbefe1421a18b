package uk.gegc.questionnaire.features.condition.application;

import com.fasterxml.jackson.databind.JsonNode;
import uk.gegc.questionnaire.features.condition.api.dto.BatchConditionRequest;
import uk.gegc.questionnaire.features.condition.api.dto.BatchConditionResponse;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionLogicExport;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionLogicImportRequest;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionLogicImportResponse;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionTemplatesResponse;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionValidationResponse;
import uk.gegc.questionnaire.features.condition.api.dto.EdgeCheckResponse;
import uk.gegc.questionnaire.features.condition.api.dto.PaperDependencyResponse;
import uk.gegc.questionnaire.features.condition.domain.graph.DependencyReport;

import java.util.UUID;

public interface ConditionLogicService {

    PaperDependencyResponse getPaperDependencies(UUID paperId);

    DependencyReport getDependencyReport(UUID paperId);

    String renderDiagram(UUID paperId, DiagramFormat format);

    EdgeCheckResponse checkEdge(UUID paperId, UUID fromQuestionId, UUID toQuestionId);

    ConditionValidationResponse validateCondition(UUID questionId, JsonNode condition);

    ConditionValidationResponse updateCondition(UUID questionId, JsonNode condition);

    BatchConditionResponse batchUpdateConditions(BatchConditionRequest request);

    ConditionLogicExport exportConditionLogic(UUID paperId);

    ConditionLogicImportResponse importConditionLogic(UUID paperId, ConditionLogicImportRequest request);

    ConditionTemplatesResponse getConditionTemplates();
}
