package uk.gegc.questionnaire.shared.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups, one per area of the questionnaire builder.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public OpenAPI questionnaireOpenApi() {
        return new OpenAPI().info(new Info()
                .title("Questionnaire Builder API")
                .description("Display condition validation and dependency analysis")
                .version("v1"));
    }

    @Bean
    public GroupedOpenApi dependenciesGroup() {
        return GroupedOpenApi.builder()
                .group("dependencies")
                .displayName("Condition Dependencies")
                .pathsToMatch("/api/v1/papers/**")
                .build();
    }

    @Bean
    public GroupedOpenApi displayConditionsGroup() {
        return GroupedOpenApi.builder()
                .group("display-conditions")
                .displayName("Display Conditions")
                .pathsToMatch("/api/v1/questions/**")
                .build();
    }
}
