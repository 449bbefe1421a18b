package uk.gegc.questionnaire.features.condition.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(name = "EdgeCheckResponse", description = "Effect of adding one dependency edge")
public record EdgeCheckResponse(
        UUID from,
        UUID to,

        @Schema(description = "Whether making 'from' depend on 'to' would close a cycle")
        boolean wouldCreateCycle,

        @Schema(description = "Whether the two questions already reach each other")
        boolean mutualDependency
) {
}
