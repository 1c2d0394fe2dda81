package com.sommerph.didvault.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI didVaultOpenAPI() {
        return new OpenAPI()
                .info(new Info()
                        .title("DID Vault API")
                        .version("1.0.0")
                        .description("API for DID challenge authentication, verifiable credential issuance, presentation verification and revocation."));
    }

    @Bean
    public GroupedOpenApi authGroup() {
        return GroupedOpenApi.builder()
                .group("auth")
                .pathsToMatch("/api/auth/**")
                .build();
    }

    @Bean
    public GroupedOpenApi credentialGroup() {
        return GroupedOpenApi.builder()
                .group("credentials")
                .pathsToMatch("/api/credentials/**")
                .build();
    }

    @Bean
    public GroupedOpenApi verificationGroup() {
        return GroupedOpenApi.builder()
                .group("verification")
                .pathsToMatch("/api/presentations/**", "/api/revocations/**")
                .build();
    }

}
