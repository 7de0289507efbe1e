package com.eyelevel.extractionpipeline;

import com.eyelevel.extractionpipeline.config.PipelineConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Extraction Pipeline Spring Boot application.
 * <p>
 * This class bootstraps the application context and enables key Spring features:
 * <ul>
 *     <li>{@link SpringBootApplication}: auto-configuration, component scanning and property support.</li>
 *     <li>{@link EnableConfigurationProperties}: binds the "app.pipeline" properties to {@link PipelineConfig}.</li>
 *     <li>{@link EnableScheduling}: drives the export expiry sweep and the session retention sweep.</li>
 *     <li>{@link EnableAsync}: enables Spring's asynchronous method execution capabilities.</li>
 *     <li>{@link EnableRetry}: retries idempotent job store writes after transient Redis errors.</li>
 * </ul>
 */
@Slf4j
@EnableAsync
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(value = PipelineConfig.class)
@EnableRetry
public class ExtractionPipelineApplication {

    /**
     * Launches the application and logs key environment information upon startup.
     *
     * @param args Command-line arguments passed to the application.
     */
    public static void main(final String[] args) {
        log.info("🚀 Starting ExtractionPipelineApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(ExtractionPipelineApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "ExtractionPipeline"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Job store:  {}", env.getProperty("app.pipeline.queue.store", "redis"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
