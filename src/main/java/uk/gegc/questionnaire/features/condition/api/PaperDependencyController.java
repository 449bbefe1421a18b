package uk.gegc.questionnaire.features.condition.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.enums.ParameterIn;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.questionnaire.features.condition.api.dto.EdgeCheckResponse;
import uk.gegc.questionnaire.features.condition.api.dto.PaperDependencyResponse;
import uk.gegc.questionnaire.features.condition.application.ConditionLogicService;
import uk.gegc.questionnaire.features.condition.application.DiagramFormat;
import uk.gegc.questionnaire.features.condition.domain.graph.DependencyReport;

import java.util.UUID;

@Tag(
        name = "Condition Dependencies",
        description = "Analysis of display condition dependencies within a paper"
)
@RestController
@RequestMapping("/api/v1/papers/{paperId}/questions/dependencies")
@RequiredArgsConstructor
public class PaperDependencyController {

    private final ConditionLogicService conditionLogicService;

    @Operation(
            summary = "Get paper dependencies",
            description = "Dependency graph, circular dependencies and per-question dependency details of a paper"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Dependencies returned"),
            @ApiResponse(responseCode = "404", description = "Paper not found")
    })
    @GetMapping
    public ResponseEntity<PaperDependencyResponse> getDependencies(
            @Parameter(description = "UUID of the paper", required = true)
            @PathVariable UUID paperId
    ) {
        return ResponseEntity.ok(conditionLogicService.getPaperDependencies(paperId));
    }

    @Operation(
            summary = "Get dependency report",
            description = "Summary counts, complexity analysis and recommendations for a paper"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Report returned"),
            @ApiResponse(responseCode = "404", description = "Paper not found")
    })
    @GetMapping("/report")
    public ResponseEntity<DependencyReport> getReport(@PathVariable UUID paperId) {
        return ResponseEntity.ok(conditionLogicService.getDependencyReport(paperId));
    }

    @Operation(
            summary = "Render dependency diagram",
            description = "Mermaid flowchart or Graphviz DOT text of the dependency graph"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Diagram returned"),
            @ApiResponse(responseCode = "400", description = "Unsupported format"),
            @ApiResponse(responseCode = "404", description = "Paper not found")
    })
    @GetMapping(value = "/diagram", produces = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> getDiagram(
            @PathVariable UUID paperId,
            @Parameter(in = ParameterIn.QUERY, description = "mermaid or dot", example = "mermaid")
            @RequestParam(defaultValue = "mermaid") String format
    ) {
        String diagram = conditionLogicService.renderDiagram(paperId, DiagramFormat.parse(format));
        return ResponseEntity.ok().contentType(MediaType.TEXT_PLAIN).body(diagram);
    }

    @Operation(
            summary = "Check a dependency edge",
            description = "Whether making one question depend on another would create a cycle"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Check result returned"),
            @ApiResponse(responseCode = "404", description = "Paper or question not found")
    })
    @GetMapping("/edge-check")
    public ResponseEntity<EdgeCheckResponse> checkEdge(
            @PathVariable UUID paperId,
            @Parameter(in = ParameterIn.QUERY, description = "Question that would gain the dependency", required = true)
            @RequestParam UUID from,
            @Parameter(in = ParameterIn.QUERY, description = "Question it would depend on", required = true)
            @RequestParam UUID to
    ) {
        return ResponseEntity.ok(conditionLogicService.checkEdge(paperId, from, to));
    }
}
