package uk.gegc.questionnaire.features.condition.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import uk.gegc.questionnaire.features.condition.api.dto.BatchConditionRequest;
import uk.gegc.questionnaire.features.condition.api.dto.BatchConditionResponse;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionLogicExport;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionLogicImportRequest;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionLogicImportResponse;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionSettingRequest;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionTemplatesResponse;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionValidationResponse;
import uk.gegc.questionnaire.features.condition.api.dto.EdgeCheckResponse;
import uk.gegc.questionnaire.features.condition.api.dto.PaperDependencyResponse;
import uk.gegc.questionnaire.features.condition.api.dto.QuestionDependencyDto;
import uk.gegc.questionnaire.features.condition.application.CircularDependencyChecker;
import uk.gegc.questionnaire.features.condition.application.ConditionRecommendationAdvisor;
import uk.gegc.questionnaire.features.condition.application.ConditionTemplateCatalog;
import uk.gegc.questionnaire.features.condition.application.DiagramFormat;
import uk.gegc.questionnaire.features.condition.config.ConditionLogicProperties;
import uk.gegc.questionnaire.features.condition.domain.exception.InvalidConditionException;
import uk.gegc.questionnaire.features.condition.domain.graph.DependencyReport;
import uk.gegc.questionnaire.features.condition.infra.mapping.DisplayConditionJsonMapper;
import uk.gegc.questionnaire.features.condition.infra.mapping.QuestionSnapshotMapper;
import uk.gegc.questionnaire.features.paper.domain.model.Paper;
import uk.gegc.questionnaire.features.paper.domain.repository.PaperRepository;
import uk.gegc.questionnaire.features.question.domain.model.Question;
import uk.gegc.questionnaire.features.question.domain.repository.QuestionRepository;
import uk.gegc.questionnaire.shared.exception.ResourceNotFoundException;
import uk.gegc.questionnaire.shared.exception.ValidationException;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyIterable;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ConditionLogicServiceImpl")
class ConditionLogicServiceImplTest {

    @Mock
    private PaperRepository paperRepository;

    @Mock
    private QuestionRepository questionRepository;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private ConditionLogicProperties properties;
    private ConditionLogicServiceImpl service;

    private final UUID paperId = UUID.randomUUID();
    private Question q1;
    private Question q2;
    private Question q3;

    @BeforeEach
    void setUp() {
        properties = new ConditionLogicProperties();
        DisplayConditionJsonMapper conditionMapper = new DisplayConditionJsonMapper(objectMapper, properties);
        QuestionSnapshotMapper snapshotMapper = new QuestionSnapshotMapper(conditionMapper);
        service = new ConditionLogicServiceImpl(
                paperRepository,
                questionRepository,
                snapshotMapper,
                conditionMapper,
                new CircularDependencyChecker(questionRepository, snapshotMapper, properties),
                new ConditionRecommendationAdvisor(),
                new ConditionTemplateCatalog(conditionMapper),
                properties
        );

        q1 = question(1, "Do you own a pet?", null);
        q2 = question(2, "What kind of pet?", dependsOn(q1.getId()));
        q3 = question(3, "How old is it?", dependsOn(q2.getId()));
    }

    private Question question(int order, String title, String storedCondition) {
        Question question = new Question();
        question.setId(UUID.randomUUID());
        question.setPaperId(paperId);
        question.setTitle(title);
        question.setQuestionOrder(order);
        question.setQuestionType("SINGLE_CHOICE");
        question.setDisplayCondition(storedCondition);
        return question;
    }

    private static String dependsOn(UUID id) {
        return "{\"question_id\":\"" + id + "\",\"selected_option\":\"yes\"}";
    }

    private JsonNode conditionOn(UUID id) throws Exception {
        return objectMapper.readTree(dependsOn(id));
    }

    private void paperExists() {
        Paper paper = new Paper();
        paper.setId(paperId);
        paper.setTitle("Pet survey");
        when(paperRepository.findById(paperId)).thenReturn(Optional.of(paper));
    }

    private void paperHolds(Question... questions) {
        when(questionRepository.findAllByPaperIdOrderByQuestionOrderAsc(paperId)).thenReturn(List.of(questions));
    }

    @Nested
    @DisplayName("paper analysis")
    class PaperAnalysis {

        @Test
        @DisplayName("fails for an unknown paper")
        void unknownPaper_throws() {
            when(paperRepository.findById(paperId)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.getPaperDependencies(paperId))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessageContaining(paperId.toString());
        }

        @Test
        @DisplayName("describes every question with its dependencies and dependents")
        void chain_details() {
            paperExists();
            paperHolds(q1, q2, q3);

            PaperDependencyResponse response = service.getPaperDependencies(paperId);

            assertThat(response.paperInfo().title()).isEqualTo("Pet survey");
            assertThat(response.paperInfo().totalQuestions()).isEqualTo(3);
            assertThat(response.circularDependencies()).isEmpty();

            QuestionDependencyDto first = response.questions().get(0);
            assertThat(first.hasCondition()).isFalse();
            assertThat(first.displayCondition().isNull()).isTrue();
            assertThat(first.dependentQuestions()).containsExactly(q2.getId().toString());

            QuestionDependencyDto third = response.questions().get(2);
            assertThat(third.dependencies().directDependencies()).containsExactly(q2.getId().toString());
            assertThat(third.dependencies().indirectDependencies()).containsExactly(q1.getId().toString());
            assertThat(third.displayCondition().get("question_id").asText()).isEqualTo(q2.getId().toString());

            assertThat(response.statistics().questionsWithConditions()).isEqualTo(2);
            assertThat(response.statistics().totalDependencies()).isEqualTo(2);
            assertThat(response.statistics().circularDependencies()).isZero();
            assertThat(response.statistics().complexConditions()).isZero();
        }

        @Test
        @DisplayName("reports stored cycles")
        void storedCycle_reported() {
            q1.setDisplayCondition(dependsOn(q3.getId()));
            paperExists();
            paperHolds(q1, q2, q3);

            DependencyReport report = service.getDependencyReport(paperId);

            assertThat(report.circularDependencies()).hasSize(1);
            assertThat(report.recommendations().get(0)).startsWith("Found 1 circular dependencies");
        }

        @Test
        @DisplayName("renders the requested diagram format")
        void diagram_format() {
            paperExists();
            paperHolds(q1, q2);

            assertThat(service.renderDiagram(paperId, DiagramFormat.DOT)).startsWith("digraph DependencyGraph {");
            assertThat(service.renderDiagram(paperId, DiagramFormat.MERMAID)).startsWith("graph TD");
        }

        @Test
        @DisplayName("checks a speculative edge")
        void edgeCheck() {
            paperExists();
            paperHolds(q1, q2, q3);

            EdgeCheckResponse closing = service.checkEdge(paperId, q1.getId(), q3.getId());
            EdgeCheckResponse shortcut = service.checkEdge(paperId, q3.getId(), q1.getId());

            assertThat(closing.wouldCreateCycle()).isTrue();
            assertThat(closing.mutualDependency()).isFalse();
            assertThat(shortcut.wouldCreateCycle()).isFalse();
        }

        @Test
        @DisplayName("edge check fails for a question outside the paper")
        void edgeCheck_unknownQuestion() {
            paperExists();
            paperHolds(q1);

            assertThatThrownBy(() -> service.checkEdge(paperId, q1.getId(), UUID.randomUUID()))
                    .isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Nested
    @DisplayName("single condition")
    class SingleCondition {

        @Test
        @DisplayName("validates an acyclic condition")
        void validate_valid() throws Exception {
            when(questionRepository.findById(q3.getId())).thenReturn(Optional.of(q3));
            paperHolds(q1, q2, q3);

            ConditionValidationResponse response = service.validateCondition(q3.getId(), conditionOn(q1.getId()));

            assertThat(response.validationResult().valid()).isTrue();
            assertThat(response.circularDependencyCheck().hasCircularDependency()).isFalse();
            assertThat(response.questionInfo().title()).isEqualTo("How old is it?");
            assertThat(response.recommendations()).contains("Condition passed validation and is safe to use");
        }

        @Test
        @DisplayName("rejects a condition that closes a cycle")
        void validate_cycle() throws Exception {
            when(questionRepository.findById(q1.getId())).thenReturn(Optional.of(q1));
            paperHolds(q1, q2, q3);

            ConditionValidationResponse response = service.validateCondition(q1.getId(), conditionOn(q3.getId()));

            assertThat(response.validationResult().valid()).isFalse();
            assertThat(response.validationResult().errors())
                    .hasSize(1)
                    .allMatch(e -> e.startsWith("Would create a circular dependency: Do you own a pet?"));
            assertThat(response.circularDependencyCheck().hasCircularDependency()).isTrue();
            assertThat(response.circularDependencyCheck().errorMessage()).startsWith("Circular dependency detected: ");
            assertThat(response.circularDependencyCheck().cyclePath()).hasSize(4);
        }

        @Test
        @DisplayName("fails for an unknown question")
        void validate_unknownQuestion() {
            UUID missing = UUID.randomUUID();
            when(questionRepository.findById(missing)).thenReturn(Optional.empty());

            assertThatThrownBy(() -> service.validateCondition(missing, null))
                    .isInstanceOf(ResourceNotFoundException.class);
        }

        @Test
        @DisplayName("propagates malformed conditions")
        void validate_malformed() throws Exception {
            when(questionRepository.findById(q3.getId())).thenReturn(Optional.of(q3));

            assertThatThrownBy(() -> service.validateCondition(q3.getId(), objectMapper.readTree("\"text\"")))
                    .isInstanceOf(InvalidConditionException.class);
        }

        @Test
        @DisplayName("saves a valid condition in stored form")
        void update_saves() throws Exception {
            when(questionRepository.findById(q3.getId())).thenReturn(Optional.of(q3));
            paperHolds(q1, q2, q3);

            service.updateCondition(q3.getId(), conditionOn(q1.getId()));

            verify(questionRepository).save(q3);
            assertThat(objectMapper.readTree(q3.getDisplayCondition()).get("question_id").asText())
                    .isEqualTo(q1.getId().toString());
        }

        @Test
        @DisplayName("clears the condition when null is given")
        void update_clears() {
            when(questionRepository.findById(q3.getId())).thenReturn(Optional.of(q3));

            service.updateCondition(q3.getId(), null);

            verify(questionRepository).save(q3);
            assertThat(q3.getDisplayCondition()).isNull();
        }

        @Test
        @DisplayName("refuses to save an invalid condition")
        void update_rejected() throws Exception {
            when(questionRepository.findById(q1.getId())).thenReturn(Optional.of(q1));
            paperHolds(q1, q2, q3);

            assertThatThrownBy(() -> service.updateCondition(q1.getId(), conditionOn(q3.getId())))
                    .isInstanceOf(ValidationException.class)
                    .satisfies(ex -> assertThat(((ValidationException) ex).getErrors()).isNotEmpty());

            verify(questionRepository, never()).save(any());
            assertThat(q1.getDisplayCondition()).isNull();
        }
    }

    @Nested
    @DisplayName("batch update")
    class Batch {

        @Test
        @DisplayName("saves all valid changes together")
        @SuppressWarnings("unchecked")
        void batch_saves() throws Exception {
            Question q4 = question(4, "Does it have a name?", null);
            when(questionRepository.findAllById(anyIterable())).thenReturn(List.of(q3, q4));
            paperHolds(q1, q2, q3, q4);

            BatchConditionResponse response = service.batchUpdateConditions(new BatchConditionRequest(List.of(
                    new ConditionSettingRequest(q3.getId(), conditionOn(q1.getId())),
                    new ConditionSettingRequest(q4.getId(), conditionOn(q3.getId()))
            )));

            assertThat(response.updatedCount()).isEqualTo(2);
            assertThat(response.validationResults()).allMatch(entry -> entry.validationResult().valid());

            ArgumentCaptor<List<Question>> saved = ArgumentCaptor.forClass(List.class);
            verify(questionRepository).saveAll(saved.capture());
            assertThat(saved.getValue()).containsExactly(q3, q4);
            assertThat(q4.getDisplayCondition()).contains(q3.getId().toString());
        }

        @Test
        @DisplayName("rejects edits that only form a cycle together")
        void batch_jointCycle() throws Exception {
            Question a = question(1, "Alpha", null);
            Question b = question(2, "Beta", null);
            when(questionRepository.findAllById(anyIterable())).thenReturn(List.of(a, b));
            paperHolds(a, b);

            BatchConditionRequest request = new BatchConditionRequest(List.of(
                    new ConditionSettingRequest(a.getId(), conditionOn(b.getId())),
                    new ConditionSettingRequest(b.getId(), conditionOn(a.getId()))
            ));

            assertThatThrownBy(() -> service.batchUpdateConditions(request))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Alpha: ");

            verify(questionRepository, never()).saveAll(anyIterable());
            assertThat(a.getDisplayCondition()).isNull();
            assertThat(b.getDisplayCondition()).isNull();
        }

        @Test
        @DisplayName("rejects batches over the configured limit")
        void batch_overLimit() throws Exception {
            properties.setBatchLimit(1);
            BatchConditionRequest request = new BatchConditionRequest(List.of(
                    new ConditionSettingRequest(q1.getId(), null),
                    new ConditionSettingRequest(q2.getId(), null)
            ));

            assertThatThrownBy(() -> service.batchUpdateConditions(request))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("at most 1");
        }

        @Test
        @DisplayName("rejects the same question twice")
        void batch_duplicate() {
            BatchConditionRequest request = new BatchConditionRequest(List.of(
                    new ConditionSettingRequest(q1.getId(), null),
                    new ConditionSettingRequest(q1.getId(), null)
            ));

            assertThatThrownBy(() -> service.batchUpdateConditions(request))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("fails when a question does not exist")
        void batch_unknownQuestion() {
            UUID missing = UUID.randomUUID();
            when(questionRepository.findAllById(anyIterable())).thenReturn(List.of(q1));

            BatchConditionRequest request = new BatchConditionRequest(List.of(
                    new ConditionSettingRequest(q1.getId(), null),
                    new ConditionSettingRequest(missing, null)
            ));

            assertThatThrownBy(() -> service.batchUpdateConditions(request))
                    .isInstanceOf(ResourceNotFoundException.class)
                    .hasMessageContaining(missing.toString());
        }

        @Test
        @DisplayName("rejects an empty batch")
        void batch_empty() {
            assertThatThrownBy(() -> service.batchUpdateConditions(new BatchConditionRequest(new ArrayList<>())))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("export and import")
    class ExportImport {

        private ConditionLogicImportRequest importing(String mode, ConditionSettingRequest... entries) {
            return new ConditionLogicImportRequest(new ConditionLogicImportRequest.Config(List.of(entries)), mode);
        }

        @Test
        @DisplayName("exports only questions with a condition, with their effort score")
        void export_conditionalQuestions() {
            q3.setDisplayCondition("{\"operator\":\"OR\",\"conditions\":["
                    + dependsOn(q1.getId()) + "," + dependsOn(q2.getId()) + "]}");
            paperExists();
            paperHolds(q1, q2, q3);

            ConditionLogicExport export = service.exportConditionLogic(paperId);

            assertThat(export.paperInfo().title()).isEqualTo("Pet survey");
            assertThat(export.paperInfo().exportedAt()).isNotNull();
            assertThat(export.conditionLogic()).extracting(ConditionLogicExport.Entry::questionId)
                    .containsExactly(q2.getId(), q3.getId());
            assertThat(export.conditionLogic().get(1).displayCondition().get("operator").asText()).isEqualTo("OR");
            assertThat(export.statistics().totalConditionalQuestions()).isEqualTo(2);
            assertThat(export.statistics().logicComplexity()).isEqualTo(1 + 4);
        }

        @Test
        @DisplayName("merge import changes only the imported questions")
        @SuppressWarnings("unchecked")
        void import_merge() throws Exception {
            paperExists();
            paperHolds(q1, q2, q3);

            ConditionLogicImportResponse response = service.importConditionLogic(paperId,
                    importing("merge", new ConditionSettingRequest(q3.getId(), conditionOn(q1.getId()))));

            assertThat(response.importMode()).isEqualTo("merge");
            assertThat(response.updatedCount()).isEqualTo(1);
            assertThat(response.clearedCount()).isZero();
            assertThat(response.totalConditions()).isEqualTo(1);

            ArgumentCaptor<List<Question>> saved = ArgumentCaptor.forClass(List.class);
            verify(questionRepository).saveAll(saved.capture());
            assertThat(saved.getValue()).containsExactly(q3);
            assertThat(q2.getDisplayCondition()).contains(q1.getId().toString());
            assertThat(q3.getDisplayCondition()).contains(q1.getId().toString());
        }

        @Test
        @DisplayName("replace import clears conditions left out of the import")
        @SuppressWarnings("unchecked")
        void import_replace() throws Exception {
            paperExists();
            paperHolds(q1, q2, q3);

            ConditionLogicImportResponse response = service.importConditionLogic(paperId,
                    importing("replace", new ConditionSettingRequest(q3.getId(), conditionOn(q1.getId()))));

            assertThat(response.importMode()).isEqualTo("replace");
            assertThat(response.updatedCount()).isEqualTo(1);
            assertThat(response.clearedCount()).isEqualTo(1);

            ArgumentCaptor<List<Question>> saved = ArgumentCaptor.forClass(List.class);
            verify(questionRepository).saveAll(saved.capture());
            assertThat(saved.getValue()).containsExactly(q2, q3);
            assertThat(q2.getDisplayCondition()).isNull();
        }

        @Test
        @DisplayName("validates against the paper as it will be after the import")
        void import_validatesAgainstResult() throws Exception {
            paperExists();
            paperHolds(q1, q2, q3);
            ConditionSettingRequest closing = new ConditionSettingRequest(q1.getId(), conditionOn(q3.getId()));

            assertThatThrownBy(() -> service.importConditionLogic(paperId, importing("merge", closing)))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Do you own a pet?: Would create a circular dependency");
            verify(questionRepository, never()).saveAll(anyIterable());

            ConditionLogicImportResponse replaced = service.importConditionLogic(paperId, importing("replace", closing));

            assertThat(replaced.clearedCount()).isEqualTo(2);
            assertThat(q1.getDisplayCondition()).contains(q3.getId().toString());
            assertThat(q3.getDisplayCondition()).isNull();
        }

        @Test
        @DisplayName("rejects questions outside the paper")
        void import_unknownQuestion() {
            UUID missing = UUID.randomUUID();
            paperExists();
            paperHolds(q1);

            assertThatThrownBy(() -> service.importConditionLogic(paperId,
                    importing(null, new ConditionSettingRequest(missing, null))))
                    .isInstanceOf(ValidationException.class)
                    .hasMessageContaining("Question does not exist in paper: " + missing);
            verify(questionRepository, never()).saveAll(anyIterable());
        }

        @Test
        @DisplayName("rejects the same question twice")
        void import_duplicate() {
            paperExists();

            assertThatThrownBy(() -> service.importConditionLogic(paperId, importing("merge",
                    new ConditionSettingRequest(q1.getId(), null),
                    new ConditionSettingRequest(q1.getId(), null))))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("more than once");
        }

        @Test
        @DisplayName("rejects an unknown import mode")
        void import_unknownMode() {
            paperExists();

            assertThatThrownBy(() -> service.importConditionLogic(paperId, importing("append")))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("Unsupported import mode 'append'");
        }

        @Test
        @DisplayName("lists condition templates")
        void templates() {
            ConditionTemplatesResponse templates = service.getConditionTemplates();

            assertThat(templates.commonPatterns()).hasSize(3);
            assertThat(templates.commonPatterns().get(1).template().get("operator").asText()).isEqualTo("AND");
            assertThat(templates.psychologicalPatterns()).hasSize(2)
                    .allMatch(t -> t.template() == null && t.example() != null);
        }
    }
}
