package com.eyelevel.pdfcompressor.config;

import io.swagger.v3.oas.models.Components;
import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.security.SecurityScheme;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.info.BuildProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Profile;

import java.util.Optional;

@Configuration
@Profile("!prod")
@RequiredArgsConstructor
public class OpenApiConfig {

    private final Optional<BuildProperties> buildProperties;

    @Bean
    public OpenAPI customOpenAPI() {
        String version = buildProperties.map(BuildProperties::getVersion).orElse("<NOT_FOUND>");
        String appName = buildProperties.map(BuildProperties::getName).orElse("PDF Compressor API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                Compresses PDF documents with Ghostscript.
                                
                                * **Profiles:** `low`, `medium` (default) and `high` map to fixed Ghostscript presets.
                                * **Jobs:** every accepted submission is recorded as a job that can be looked up later.
                                * **Dispatch:** jobs run inline, on a local worker pool, or through an SQS queue.
                                
                                When API keys are configured, every `/api` call must carry the `X-API-Key` header.
                                """))
                .components(new Components().addSecuritySchemes("apiKey", new SecurityScheme()
                        .type(SecurityScheme.Type.APIKEY)
                        .in(SecurityScheme.In.HEADER)
                        .name("X-API-Key")));
    }
}
