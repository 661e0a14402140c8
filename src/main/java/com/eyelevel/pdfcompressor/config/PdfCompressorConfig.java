package com.eyelevel.pdfcompressor.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

/**
 * Binds application properties under the "app" prefix to a strongly-typed configuration object.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "app")
public class PdfCompressorConfig {

    @Valid
    private Storage storage = new Storage();
    @Valid
    private Ghostscript ghostscript = new Ghostscript();
    @Valid
    private RateLimit rateLimit = new RateLimit();
    @Valid
    private Security security = new Security();
    @Valid
    private Dispatch dispatch = new Dispatch();
    @Valid
    private Scheduler scheduler = new Scheduler();
    private Build build = new Build();

    /**
     * A job may legitimately run for the whole Ghostscript timeout, so the stale window has to be longer.
     */
    @AssertTrue(message = "app.scheduler.stale-job-minutes must be greater than app.ghostscript.timeout-minutes")
    public boolean isStaleWindowLongerThanToolTimeout() {
        return scheduler.getStaleJobMinutes() > ghostscript.getTimeoutMinutes();
    }

    @Data
    public static class RetryConfig {
        @PositiveOrZero
        private int attempts = 3;
        @PositiveOrZero
        private long delayMs = 500;
    }

    @Data
    public static class Storage {
        @NotBlank
        private String uploadDir = "uploads";
        @NotBlank
        private String compressedDir = "compressed";
    }

    @Data
    public static class Ghostscript {
        /**
         * Explicit executable path or name. When blank the executable is discovered on PATH.
         */
        private String command;
        @Positive
        private long timeoutMinutes = 5;
    }

    @Data
    public static class RateLimit {
        private boolean enabled = true;
        @NotBlank
        private String keyPrefix = "pdf-compress";
        @NotBlank
        private String compress = "10 per minute";
    }

    @Data
    public static class Security {
        private List<@Valid ApiKey> apiKeys = new ArrayList<>();

        @Data
        public static class ApiKey {
            @NotBlank
            private String key;
            private String email;
            private String name;
            private boolean elevated;
        }
    }

    @Data
    public static class Dispatch {
        @NotNull
        private DispatchMode mode = DispatchMode.INLINE;
        @NotBlank
        private String queueName = "pdf-compression-jobs";
        @Valid
        private RetryConfig retry = new RetryConfig();
        @Valid
        private Listener listener = new Listener();
        @Valid
        private Executor executor = new Executor();

        @Data
        public static class Listener {
            @Min(1)
            private int maxConcurrentMessages = 4;
            @Min(1)
            private int maxMessagesPerPoll = 4;
            @Min(1)
            private int pollTimeoutSeconds = 10;
        }

        @Data
        public static class Executor {
            @Min(1)
            private int corePoolSize = 2;
            @Min(1)
            private int maxPoolSize = 4;
            @PositiveOrZero
            private int queueCapacity = 50;
        }
    }

    @Data
    public static class Scheduler {
        @NotBlank
        private String staleJobCron = "0 */5 * * * *";
        @Positive
        private long staleJobMinutes = 30;
    }

    @Data
    public static class Build {
        private String version = "1.0.0";
        private String commit;
        private String time;
    }
}
