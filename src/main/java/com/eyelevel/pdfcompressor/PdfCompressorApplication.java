package com.eyelevel.pdfcompressor;

import com.eyelevel.pdfcompressor.config.PdfCompressorConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.core.env.Environment;
import org.springframework.retry.annotation.EnableRetry;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * The main entry point for the PDF Compressor Spring Boot application.
 * <p>
 * Besides the usual auto-configuration this enables:
 * <ul>
 *     <li>{@link EnableConfigurationProperties}: binds the "app" properties to {@link PdfCompressorConfig}.</li>
 *     <li>{@link EnableScheduling}: runs the stale job recovery sweep.</li>
 *     <li>{@link EnableRetry}: retries queue publishes in SQS dispatch mode.</li>
 * </ul>
 */
@Slf4j
@EnableScheduling
@SpringBootApplication
@EnableConfigurationProperties(value = PdfCompressorConfig.class)
@EnableRetry
public class PdfCompressorApplication {

    public static void main(final String[] args) {
        log.info("Starting PdfCompressorApplication...");

        final ConfigurableApplicationContext context = SpringApplication.run(PdfCompressorApplication.class, args);
        final Environment env = context.getEnvironment();

        log.info("------------------------------------------------------------------");
        log.info("Application '{}' is now running!", env.getProperty("spring.application.name", "PdfCompressor"));
        log.info("  - Local:         http://localhost:{}", env.getProperty("server.port", "8080"));
        log.info("  - Dispatch mode: {}", env.getProperty("app.dispatch.mode", "inline"));
        log.info("  - Profile(s):    {}", String.join(", ", env.getActiveProfiles().length > 0
                ? env.getActiveProfiles()
                : new String[]{"default"}));
        log.info("------------------------------------------------------------------");
    }
}
