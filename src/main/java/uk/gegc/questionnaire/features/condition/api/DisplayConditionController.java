package uk.gegc.questionnaire.features.condition.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.questionnaire.features.condition.api.dto.BatchConditionRequest;
import uk.gegc.questionnaire.features.condition.api.dto.BatchConditionResponse;
import uk.gegc.questionnaire.features.condition.api.dto.ConditionValidationResponse;
import uk.gegc.questionnaire.features.condition.api.dto.DisplayConditionRequest;
import uk.gegc.questionnaire.features.condition.application.ConditionLogicService;

import java.util.UUID;

@Tag(
        name = "Display Conditions",
        description = "Validate and save question display conditions"
)
@RestController
@RequestMapping("/api/v1/questions")
@RequiredArgsConstructor
public class DisplayConditionController {

    private final ConditionLogicService conditionLogicService;

    @Operation(
            summary = "Validate a display condition",
            description = "Checks references, structure and cycles without saving"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Validation result returned"),
            @ApiResponse(responseCode = "400", description = "Malformed condition"),
            @ApiResponse(responseCode = "404", description = "Question not found")
    })
    @io.swagger.v3.oas.annotations.parameters.RequestBody(
            description = "Condition to validate",
            required = true,
            content = @Content(schema = @Schema(implementation = DisplayConditionRequest.class))
    )
    @PostMapping("/{questionId}/display-condition/validate")
    public ResponseEntity<ConditionValidationResponse> validateCondition(
            @Parameter(description = "UUID of the question", required = true)
            @PathVariable UUID questionId,
            @RequestBody DisplayConditionRequest request
    ) {
        return ResponseEntity.ok(conditionLogicService.validateCondition(questionId, request.displayCondition()));
    }

    @Operation(
            summary = "Save a display condition",
            description = "Validates and stores the condition, a null condition clears it"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Condition saved"),
            @ApiResponse(responseCode = "400", description = "Condition rejected"),
            @ApiResponse(responseCode = "404", description = "Question not found")
    })
    @PutMapping("/{questionId}/display-condition")
    public ResponseEntity<ConditionValidationResponse> updateCondition(
            @Parameter(description = "UUID of the question", required = true)
            @PathVariable UUID questionId,
            @RequestBody DisplayConditionRequest request
    ) {
        return ResponseEntity.ok(conditionLogicService.updateCondition(questionId, request.displayCondition()));
    }

    @Operation(
            summary = "Save display conditions in batch",
            description = "Validates all changes together and saves them in one transaction, or none of them"
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Conditions saved"),
            @ApiResponse(responseCode = "400", description = "Validation error"),
            @ApiResponse(responseCode = "404", description = "Question not found")
    })
    @PostMapping("/display-conditions/batch")
    public ResponseEntity<BatchConditionResponse> batchUpdate(
            @RequestBody @Valid BatchConditionRequest request
    ) {
        return ResponseEntity.ok(conditionLogicService.batchUpdateConditions(request));
    }
}
