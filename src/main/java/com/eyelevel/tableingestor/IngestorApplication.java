package com.eyelevel.tableingestor;

import com.eyelevel.tableingestor.config.IngestionConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.data.jpa.repository.config.EnableJpaRepositories;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the Table Ingestor Spring Boot application.
 * <p>
 * Besides auto-configuration it enables:
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: binds "app.ingestion" properties to {@link IngestionConfig}.</li>
 *     <li>{@link EnableScheduling}: the optional bucket polling trigger.</li>
 *     <li>{@link EnableRetry}: retry support for transient store failures.</li>
 * </ul>
 */
@Slf4j
@EnableRetry
@EnableScheduling
@SpringBootApplication
@EnableJpaRepositories(basePackages = "com.eyelevel.tableingestor.repository")
@EnableConfigurationProperties(value = IngestionConfig.class)
public class IngestorApplication {

    public static void main(final String[] args) {
        log.info("Starting IngestorApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(IngestorApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "TableIngestor"));
        log.info("  - Local:      http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Profile(s): {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
