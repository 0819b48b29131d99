package com.example.negotiation.config;

import io.swagger.v3.oas.annotations.OpenAPIDefinition;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeIn;
import io.swagger.v3.oas.annotations.enums.SecuritySchemeType;
import io.swagger.v3.oas.annotations.info.Info;
import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.security.SecurityScheme;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * The caller is identified by the gateway through {@code X-User-Id}; it is documented as an API key so the
 * Swagger UI can send it.
 */
@Configuration
@OpenAPIDefinition(
        info = @Info(
                title = "Marketplace Negotiation API",
                version = "1.0",
                description = "Buyer and seller conversations per product, offers and read tracking."),
        security = @SecurityRequirement(name = OpenApiConfig.GATEWAY_USER_SCHEME))
@SecurityScheme(
        name = OpenApiConfig.GATEWAY_USER_SCHEME,
        type = SecuritySchemeType.APIKEY,
        in = SecuritySchemeIn.HEADER,
        paramName = "X-User-Id")
public class OpenApiConfig {

    static final String GATEWAY_USER_SCHEME = "gatewayUser";

    @Bean
    public GroupedOpenApi conversationsApi() {
        return GroupedOpenApi.builder()
                .group("conversations")
                .pathsToMatch("/api/conversations", "/api/conversations/**")
                .build();
    }
}
