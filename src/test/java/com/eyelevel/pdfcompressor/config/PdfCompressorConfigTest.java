package com.eyelevel.pdfcompressor.config;

import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.assertj.core.api.Assertions.assertThat;

class PdfCompressorConfigTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(BindOnly.class);

    @Configuration
    @EnableConfigurationProperties(PdfCompressorConfig.class)
    static class BindOnly {
    }

    @Test
    void defaultsAreValid() {
        contextRunner.run(context -> {
            assertThat(context).hasNotFailed();
            assertThat(context.getBean(PdfCompressorConfig.class).getScheduler().getStaleJobMinutes()).isEqualTo(30);
        });
    }

    @Test
    void staleWindowMustOutlastGhostscriptTimeout() {
        contextRunner.withPropertyValues("app.ghostscript.timeout-minutes=5", "app.scheduler.stale-job-minutes=5")
                     .run(context -> assertThat(context).hasFailed()
                                                        .getFailure()
                                                        .hasStackTraceContaining("stale-job-minutes must be greater"));
    }

    @Test
    void zeroStaleWindowIsRejected() {
        contextRunner.withPropertyValues("app.scheduler.stale-job-minutes=0")
                     .run(context -> assertThat(context).hasFailed());
    }
}
