package uk.gegc.questionnaire.features.condition.application.impl;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.questionnaire.features.condition.api.dto.BatchConditionRequest;
import uk.gegc.questionnaire.features.condition.api.dto.BatchConditionResponse;
import uk.gegc.questionnaire.features.condition.api.dto.BatchValidationEntry;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionLogicExport;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionLogicImportRequest;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionLogicImportResponse;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionSettingRequest;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionTemplatesResponse;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionValidationResponse;
import uk.gegc.questionnaire.features.condition.api.dto.EdgeCheckResponse;
import uk.gegc.questionnaire.features.condition.api.dto.PaperDependencyResponse;
import uk.gegc.questionnaire.features.condition.api.dto.PaperDependencyStatisticsDto;
import uk.gegc.questionnaire.features.condition.api.dto.PaperInfoDto;
import uk.gegc.questionnaire.features.condition.api.dto.QuestionDependencyDto;
import uk.gegc.questionnaire.features.condition.api.dto.QuestionInfoDto;
import uk.gegc.questionnaire.features.condition.application.CircularDependencyCheck;
import uk.gegc.questionnaire.features.condition.application.CircularDependencyChecker;
import uk.gegc.questionnaire.features.condition.application.ConditionLogicService;
import uk.gegc.questionnaire.features.condition.application.ConditionRecommendationAdvisor;
import uk.gegc.questionnaire.features.condition.application.ConditionTemplateCatalog;
import uk.gegc.questionnaire.features.condition.application.DiagramFormat;
import uk.gegc.questionnaire.features.condition.application.ImportMode;
import uk.gegc.questionnaire.features.condition.config.ConditionLogicProperties;
import uk.gegc.questionnaire.features.condition.domain.graph.CircularDependency;
import uk.gegc.questionnaire.features.condition.domain.graph.ConditionMetrics;
import uk.gegc.questionnaire.features.condition.domain.graph.ConditionRuleValidator;
import uk.gegc.questionnaire.features.condition.domain.graph.ConditionValidationResult;
import uk.gegc.questionnaire.features.condition.domain.graph.DependencyGraphData;
import uk.gegc.questionnaire.features.condition.domain.graph.DependencyReport;
import uk.gegc.questionnaire.features.condition.domain.graph.DependencyValidator;
import uk.gegc.questionnaire.features.condition.domain.model.ConditionKind;
import uk.gegc.questionnaire.features.condition.domain.model.DisplayCondition;
import uk.gegc.questionnaire.features.condition.domain.model.QuestionSnapshot;
import uk.gegc.questionnaire.features.condition.infra.mapping.DisplayConditionJsonMapper;
import uk.gegc.questionnaire.features.condition.infra.mapping.QuestionSnapshotMapper;
import uk.gegc.questionnaire.features.paper.domain.model.Paper;
import uk.gegc.questionnaire.features.paper.domain.repository.PaperRepository;
import uk.gegc.questionnaire.features.question.domain.model.Question;
import uk.gegc.questionnaire.features.question.domain.repository.QuestionRepository;
import uk.gegc.questionnaire.shared.exception.ResourceNotFoundException;
import uk.gegc.questionnaire.shared.exception.ValidationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

@Service
@Transactional
@RequiredArgsConstructor
@Slf4j
public class ConditionLogicServiceImpl implements ConditionLogicService {

    private final PaperRepository paperRepository;
    private final QuestionRepository questionRepository;
    private final QuestionSnapshotMapper snapshotMapper;
    private final DisplayConditionJsonMapper conditionMapper;
    private final CircularDependencyChecker circularDependencyChecker;
    private final ConditionRecommendationAdvisor recommendationAdvisor;
    private final ConditionTemplateCatalog templateCatalog;
    private final ConditionLogicProperties properties;

    @Override
    @Transactional(readOnly = true)
    public PaperDependencyResponse getPaperDependencies(UUID paperId) {
        Paper paper = loadPaper(paperId);
        List<Question> questions = questionRepository.findAllByPaperIdOrderByQuestionOrderAsc(paperId);
        List<QuestionSnapshot> snapshots = snapshotMapper.toSnapshots(questions);
        DependencyValidator validator = newValidator(snapshots);

        DependencyGraphData graph = validator.getDependencyGraphData();
        List<CircularDependency> cycles = validator.detectAllCircularDependencies();

        List<QuestionDependencyDto> details = new ArrayList<>();
        for (int i = 0; i < questions.size(); i++) {
            Question question = questions.get(i);
            QuestionSnapshot snapshot = snapshots.get(i);
            details.add(new QuestionDependencyDto(
                    question.getId(),
                    question.getTitle(),
                    question.getQuestionOrder(),
                    question.getQuestionType(),
                    snapshot.hasCondition(),
                    conditionMapper.toJson(snapshot.displayCondition()),
                    validator.getQuestionDependencies(snapshot.id()),
                    graph.nodes().get(i).incomingDependencies()
            ));
        }

        int complexConditions = (int) graph.nodes().stream()
                .filter(node -> node.conditionType() == ConditionKind.COMPLEX)
                .count();
        PaperDependencyStatisticsDto statistics = new PaperDependencyStatisticsDto(
                graph.statistics().questionsWithConditions(),
                graph.statistics().totalDependencies(),
                cycles.size(),
                complexConditions
        );

        log.debug("Paper {} has {} questions, {} dependencies and {} cycles",
                paperId, questions.size(), statistics.totalDependencies(), cycles.size());

        return new PaperDependencyResponse(
                new PaperInfoDto(paper.getId(), paper.getTitle(), questions.size()),
                graph,
                cycles,
                details,
                statistics
        );
    }

    @Override
    @Transactional(readOnly = true)
    public DependencyReport getDependencyReport(UUID paperId) {
        loadPaper(paperId);
        return newValidator(loadSnapshots(paperId)).getDependencyReport();
    }

    @Override
    @Transactional(readOnly = true)
    public String renderDiagram(UUID paperId, DiagramFormat format) {
        loadPaper(paperId);
        DependencyValidator validator = newValidator(loadSnapshots(paperId));
        return format == DiagramFormat.DOT
                ? validator.generateDotDiagram()
                : validator.generateMermaidDiagram();
    }

    @Override
    @Transactional(readOnly = true)
    public EdgeCheckResponse checkEdge(UUID paperId, UUID fromQuestionId, UUID toQuestionId) {
        loadPaper(paperId);
        DependencyValidator validator = newValidator(loadSnapshots(paperId));
        for (UUID id : List.of(fromQuestionId, toQuestionId)) {
            if (!validator.getDependencyGraph().containsQuestion(id.toString())) {
                throw new ResourceNotFoundException("Question " + id + " not found in paper " + paperId);
            }
        }
        String from = fromQuestionId.toString();
        String to = toQuestionId.toString();
        return new EdgeCheckResponse(
                fromQuestionId,
                toQuestionId,
                validator.wouldCreateCycle(from, to),
                validator.hasMutualDependency(from, to)
        );
    }

    @Override
    @Transactional(readOnly = true)
    public ConditionValidationResponse validateCondition(UUID questionId, JsonNode conditionJson) {
        Question question = loadQuestion(questionId);
        DisplayCondition condition = conditionMapper.fromJson(conditionJson);
        return validate(question, condition);
    }

    @Override
    public ConditionValidationResponse updateCondition(UUID questionId, JsonNode conditionJson) {
        Question question = loadQuestion(questionId);
        DisplayCondition condition = conditionMapper.fromJson(conditionJson);

        ConditionValidationResponse response = validate(question, condition);
        ConditionValidationResult result = response.validationResult();
        if (!result.valid()) {
            log.warn("Rejected display condition for question {}: {}", questionId, result.errors());
            throw new ValidationException(
                    "Display condition rejected: " + String.join("; ", result.errors()), result.errors());
        }

        question.setDisplayCondition(conditionMapper.toStoredJson(condition));
        questionRepository.save(question);
        log.info("Updated display condition for question {}", questionId);
        return response;
    }

    @Override
    public BatchConditionResponse batchUpdateConditions(BatchConditionRequest request) {
        List<ConditionSettingRequest> settings = request.conditionSettings();
        if (settings == null || settings.isEmpty()) {
            throw new IllegalArgumentException("Condition settings must not be empty");
        }
        if (settings.size() > properties.getBatchLimit()) {
            throw new IllegalArgumentException("A batch may update at most " + properties.getBatchLimit()
                    + " questions, got " + settings.size());
        }

        Set<UUID> seen = new HashSet<>();
        for (ConditionSettingRequest setting : settings) {
            if (!seen.add(setting.questionId())) {
                throw new IllegalArgumentException("Question " + setting.questionId() + " appears more than once in the batch");
            }
        }

        Map<UUID, Question> questions = questionRepository.findAllById(seen).stream()
                .collect(Collectors.toMap(Question::getId, Function.identity()));
        List<UUID> missing = settings.stream()
                .map(ConditionSettingRequest::questionId)
                .filter(id -> !questions.containsKey(id))
                .toList();
        if (!missing.isEmpty()) {
            throw new ResourceNotFoundException("Questions not found: " + missing);
        }

        Map<String, DisplayCondition> proposed = new LinkedHashMap<>();
        for (ConditionSettingRequest setting : settings) {
            proposed.put(setting.questionId().toString(), conditionMapper.fromJson(setting.displayCondition()));
        }

        Map<UUID, DependencyValidator> validatorsByPaper = new HashMap<>();
        List<BatchValidationEntry> results = new ArrayList<>();
        List<String> failures = new ArrayList<>();
        for (ConditionSettingRequest setting : settings) {
            Question question = questions.get(setting.questionId());
            DependencyValidator validator = validatorsByPaper.computeIfAbsent(question.getPaperId(),
                    paperId -> newValidator(overlay(loadSnapshots(paperId), proposed)));

            String id = setting.questionId().toString();
            ConditionValidationResult result = validator.validateQuestionCondition(id, proposed.get(id));
            results.add(new BatchValidationEntry(question.getId(), question.getTitle(), result));
            if (!result.valid()) {
                failures.add(question.getTitle() + ": " + String.join(", ", result.errors()));
            }
        }

        if (!failures.isEmpty()) {
            log.warn("Rejected batch of {} display conditions, {} invalid", settings.size(), failures.size());
            throw new ValidationException("Condition validation failed: " + String.join("; ", failures), failures);
        }

        List<Question> updated = new ArrayList<>();
        for (ConditionSettingRequest setting : settings) {
            Question question = questions.get(setting.questionId());
            question.setDisplayCondition(conditionMapper.toStoredJson(proposed.get(setting.questionId().toString())));
            updated.add(question);
        }
        questionRepository.saveAll(updated);
        log.info("Updated display conditions for {} questions", updated.size());

        return new BatchConditionResponse(updated.size(), results);
    }

    @Override
    @Transactional(readOnly = true)
    public ConditionLogicExport exportConditionLogic(UUID paperId) {
        Paper paper = loadPaper(paperId);
        List<Question> questions = questionRepository.findAllByPaperIdOrderByQuestionOrderAsc(paperId);
        List<QuestionSnapshot> snapshots = snapshotMapper.toSnapshots(questions);

        List<ConditionLogicExport.Entry> entries = new ArrayList<>();
        int logicComplexity = 0;
        for (int i = 0; i < questions.size(); i++) {
            DisplayCondition condition = snapshots.get(i).displayCondition();
            if (condition == null) {
                continue;
            }
            Question question = questions.get(i);
            entries.add(new ConditionLogicExport.Entry(
                    question.getId(),
                    question.getQuestionOrder(),
                    question.getTitle(),
                    conditionMapper.toJson(condition)
            ));
            logicComplexity += ConditionMetrics.logicComplexity(condition);
        }

        log.info("Exported {} display conditions of paper {}", entries.size(), paperId);
        return new ConditionLogicExport(
                new ConditionLogicExport.PaperInfo(paper.getId(), paper.getTitle(), Instant.now()),
                entries,
                new ConditionLogicExport.Statistics(entries.size(), logicComplexity)
        );
    }

    @Override
    public ConditionLogicImportResponse importConditionLogic(UUID paperId, ConditionLogicImportRequest request) {
        loadPaper(paperId);
        ImportMode mode = ImportMode.parse(request.importMode());
        List<ConditionSettingRequest> entries = request.conditionConfig().conditionLogic();

        Set<UUID> seen = new HashSet<>();
        for (ConditionSettingRequest entry : entries) {
            if (!seen.add(entry.questionId())) {
                throw new IllegalArgumentException("Question " + entry.questionId() + " appears more than once in the import");
            }
        }

        List<Question> questions = questionRepository.findAllByPaperIdOrderByQuestionOrderAsc(paperId);
        Map<UUID, Question> byId = questions.stream()
                .collect(Collectors.toMap(Question::getId, Function.identity()));
        List<String> failures = new ArrayList<>();
        for (ConditionSettingRequest entry : entries) {
            if (!byId.containsKey(entry.questionId())) {
                failures.add("Question does not exist in paper: " + entry.questionId());
            }
        }
        if (!failures.isEmpty()) {
            throw new ValidationException("Import validation failed: " + String.join("; ", failures), failures);
        }

        // replace mode starts from an empty paper, the import is then laid over it
        Map<String, DisplayCondition> proposed = new LinkedHashMap<>();
        if (mode == ImportMode.REPLACE) {
            questions.forEach(q -> proposed.put(q.getId().toString(), null));
        }
        for (ConditionSettingRequest entry : entries) {
            proposed.put(entry.questionId().toString(), conditionMapper.fromJson(entry.displayCondition()));
        }

        DependencyValidator validator = newValidator(overlay(snapshotMapper.toSnapshots(questions), proposed));
        int totalConditions = 0;
        for (ConditionSettingRequest entry : entries) {
            DisplayCondition condition = proposed.get(entry.questionId().toString());
            if (condition == null) {
                continue;
            }
            totalConditions++;
            ConditionValidationResult result = validator.validateQuestionCondition(entry.questionId().toString(), condition);
            if (!result.valid()) {
                failures.add(byId.get(entry.questionId()).getTitle() + ": " + String.join(", ", result.errors()));
            }
        }
        if (!failures.isEmpty()) {
            log.warn("Rejected condition import for paper {}, {} invalid entries", paperId, failures.size());
            throw new ValidationException("Import validation failed: " + String.join("; ", failures), failures);
        }

        List<Question> changed = new ArrayList<>();
        int clearedCount = 0;
        for (Question question : questions) {
            if (!proposed.containsKey(question.getId().toString())) {
                continue;
            }
            boolean imported = seen.contains(question.getId());
            if (!imported && question.getDisplayCondition() == null) {
                continue;
            }
            if (!imported) {
                clearedCount++;
            }
            question.setDisplayCondition(conditionMapper.toStoredJson(proposed.get(question.getId().toString())));
            changed.add(question);
        }
        questionRepository.saveAll(changed);
        log.info("Imported {} display conditions into paper {} ({} mode, {} cleared)",
                entries.size(), paperId, mode.value(), clearedCount);

        return new ConditionLogicImportResponse(mode.value(), entries.size(), clearedCount, totalConditions);
    }

    @Override
    @Transactional(readOnly = true)
    public ConditionTemplatesResponse getConditionTemplates() {
        return templateCatalog.templates();
    }

    private ConditionValidationResponse validate(Question question, DisplayCondition condition) {
        String id = question.getId().toString();
        CircularDependencyCheck check = circularDependencyChecker.check(id, condition, question.getPaperId());
        ConditionValidationResult validation =
                newValidator(loadSnapshots(question.getPaperId())).validateQuestionCondition(id, condition);

        // the quick check only adds its message when the full validation missed the cycle
        ConditionValidationResult merged = validation;
        boolean cycleReported = validation.errors().stream()
                .anyMatch(e -> e.startsWith(ConditionRuleValidator.CIRCULAR_DEPENDENCY_ERROR));
        if (check.hasCircularDependency() && !cycleReported) {
            List<String> errors = new ArrayList<>(validation.errors());
            errors.add(check.errorMessage());
            merged = ConditionValidationResult.of(errors, validation.warnings());
        }

        return new ConditionValidationResponse(
                new QuestionInfoDto(question.getId(), question.getTitle(), question.getPaperId()),
                conditionMapper.toJson(condition),
                merged,
                check,
                recommendationAdvisor.recommend(condition, merged)
        );
    }

    private static List<QuestionSnapshot> overlay(List<QuestionSnapshot> snapshots, Map<String, DisplayCondition> proposed) {
        return snapshots.stream()
                .map(s -> proposed.containsKey(s.id()) ? s.withDisplayCondition(proposed.get(s.id())) : s)
                .toList();
    }

    private DependencyValidator newValidator(List<QuestionSnapshot> snapshots) {
        return new DependencyValidator(snapshots, properties.getMaxConditionDepth());
    }

    private List<QuestionSnapshot> loadSnapshots(UUID paperId) {
        return snapshotMapper.toSnapshots(questionRepository.findAllByPaperIdOrderByQuestionOrderAsc(paperId));
    }

    private Paper loadPaper(UUID paperId) {
        return paperRepository.findById(paperId)
                .orElseThrow(() -> new ResourceNotFoundException("Paper " + paperId + " not found"));
    }

    private Question loadQuestion(UUID questionId) {
        return questionRepository.findById(questionId)
                .orElseThrow(() -> new ResourceNotFoundException("Question " + questionId + " not found"));
    }
}
