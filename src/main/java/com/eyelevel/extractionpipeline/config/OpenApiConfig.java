package com.eyelevel.extractionpipeline.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Contact;
import io.swagger.v3.oas.models.info.Info;
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
        String appName = buildProperties.map(BuildProperties::getName).orElse("Extraction Pipeline API");

        return new OpenAPI()
                .info(new Info().title(appName)
                        .version(version)
                        .description("""
                                This API coordinates asynchronous document extraction and the export of its results.

                                Key features include:
                                * **Job Queue:** Extraction jobs are queued in Redis and dispatched to exactly one worker.
                                * **Worker Pool:** Workers can be scaled up or down at runtime and stop gracefully.
                                * **Sessions:** Extracted records are kept per uploaded file and can be reviewed and amended.
                                * **Exports:** Session records are written to CSV (optionally gzip or zip compressed) and
                                  delivered through expiring, count-limited download tokens.

                                **Note:** Worker scaling and cleanup endpoints are administrative and should be used with caution.
                                """)
                        .contact(new Contact()
                                .name("EyeLevel.ai Support")
                                .url("https://www.eyelevel.ai")));
    }
}
