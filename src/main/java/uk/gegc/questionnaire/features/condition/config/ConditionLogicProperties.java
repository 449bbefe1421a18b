package uk.gegc.questionnaire.features.condition.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import uk.gegc.questionnaire.features.condition.domain.graph.DependencyLimits;

/**
 * Configuration properties for display-condition validation
 */
@Component
@ConfigurationProperties(prefix = "questionnaire.condition-logic")
@Data
public class ConditionLogicProperties {

    /**
     * Maximum number of condition settings accepted by one batch update
     */
    private int batchLimit = 100;

    /**
     * Maximum complex-inside-complex depth accepted when reading or validating a condition
     */
    private int maxConditionDepth = DependencyLimits.DEFAULT_MAX_CONDITION_DEPTH;
}
