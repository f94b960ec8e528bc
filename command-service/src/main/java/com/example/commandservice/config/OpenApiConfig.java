package com.example.commandservice.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityRequirement;
import io.swagger.v3.oas.models.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAPI document of the command API, split into a commands group and an audit group.
 */
@Configuration
public class OpenApiConfig {

    private static final String BEARER_SCHEME = "bearerAuth";

    @Bean
    public OpenAPI plannerCommandOpenApi() {
        return new OpenAPI()
                .info(new Info()
                        .title("Planner Command Service API")
                        .version("1.0.0")
                        .description("""
                            Structured create/read/update/delete commands for the study planner.

                            ## Authentication
                            `Authorization: Bearer <token>` on every endpoint but health and docs.
                            The token subject is the owner every command is scoped to.

                            ## Idempotency
                            A mutating command may carry `idempotency_key`. Resending the key returns the
                            first result with `cached: true` and writes nothing.

                            ## Transactions
                            `transaction_id` groups the commands of one intent in the audit log, for
                            reconstruction only: commands are not rolled back together.
                            """))
                .addSecurityItem(new SecurityRequirement().addList(BEARER_SCHEME))
                .components(new Components()
                        .addSecuritySchemes(BEARER_SCHEME, new SecurityScheme()
                                .type(SecurityScheme.Type.HTTP)
                                .scheme("bearer")
                                .bearerFormat("JWT")));
    }

    @Bean
    public GroupedOpenApi commandsApi() {
        return GroupedOpenApi.builder()
                .group("commands")
                .pathsToMatch("/api/commands/**")
                .build();
    }

    @Bean
    public GroupedOpenApi auditApi() {
        return GroupedOpenApi.builder()
                .group("audit")
                .pathsToMatch("/api/audit/**")
                .build();
    }
}
