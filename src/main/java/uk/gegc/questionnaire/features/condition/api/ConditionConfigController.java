package uk.gegc.questionnaire.features.condition.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionLogicExport;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionLogicImportRequest;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionLogicImportResponse;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionTemplatesResponse;
import uk.gegc.questionnaire.features.condition.application.ConditionLogicService;

import java.util.UUID;

@Tag(
        name = "Condition Logic Configuration",
        description = "Templates, export and import of display condition logic"
)
@RestController
@RequestMapping("/api/v1/papers")
@RequiredArgsConstructor
public class ConditionConfigController {

    private final ConditionLogicService conditionLogicService;

    @Operation(
            summary = "Get condition templates",
            description = "Common AND/OR patterns and screening patterns to start a display condition from"
    )
    @ApiResponse(responseCode = "200", description = "Templates returned")
    @GetMapping("/condition-templates")
    public ResponseEntity<ConditionTemplatesResponse> getTemplates() {
        return ResponseEntity.ok(conditionLogicService.getConditionTemplates());
    }

    @Operation(
            summary = "Export condition logic",
            description = "Downloads every display condition of a paper as a JSON attachment"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Export returned"),
            @ApiResponse(responseCode = "404", description = "Paper not found")
    })
    @GetMapping("/{paperId}/conditions/export")
    public ResponseEntity<ConditionLogicExport> exportConditions(
            @Parameter(description = "UUID of the paper", required = true)
            @PathVariable UUID paperId
    ) {
        ConditionLogicExport export = conditionLogicService.exportConditionLogic(paperId);
        String filename = export.paperInfo().title().replaceAll("[\"\\\\\r\n]", "_") + "_conditions.json";
        return ResponseEntity.ok()
                .contentType(MediaType.APPLICATION_JSON)
                .header("Content-Disposition", "attachment; filename=\"" + filename + "\"")
                .body(export);
    }

    @Operation(
            summary = "Import condition logic",
            description = "Validates every imported condition against the paper and saves them together; " +
                    "replace mode also clears conditions left out of the import"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Conditions imported"),
            @ApiResponse(responseCode = "400", description = "Malformed import or a condition failed validation"),
            @ApiResponse(responseCode = "404", description = "Paper not found")
    })
    @PostMapping("/{paperId}/conditions/import")
    public ResponseEntity<ConditionLogicImportResponse> importConditions(
            @PathVariable UUID paperId,
            @Valid @RequestBody ConditionLogicImportRequest request
    ) {
        return ResponseEntity.ok(conditionLogicService.importConditionLogic(paperId, request));
    }
}
