package com.eyelevel.pdfcompressor.service.compression;

import com.eyelevel.pdfcompressor.config.PdfCompressorConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.io.File;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Finds the Ghostscript executable: the configured command first, then the usual names on {@code PATH},
 * then the standard Windows install locations.
 */
@Slf4j
@Component
public class GhostscriptLocator {

    private static final List<String> CANDIDATE_NAMES = List.of("gs", "gswin64c", "gswin32c");
    private static final List<String> WINDOWS_EXECUTABLES = List.of("gswin64c.exe", "gswin32c.exe", "gs.exe");
    private static final List<String> PROGRAM_FILES_VARIABLES = List.of("ProgramFiles", "ProgramFiles(x86)", "ProgramW6432");

    private final PdfCompressorConfig config;
    private final Function<String, String> environment;

    @Autowired
    public GhostscriptLocator(final PdfCompressorConfig config) {
        this(config, System::getenv);
    }

    GhostscriptLocator(final PdfCompressorConfig config, final Function<String, String> environment) {
        this.config = config;
        this.environment = environment;
    }

    /**
     * @return the executable to launch, or empty when Ghostscript is not available
     */
    public Optional<String> resolve() {
        final String configured = config.getGhostscript().getCommand();
        if (StringUtils.hasText(configured)) {
            return Optional.of(configured.trim());
        }
        final Optional<String> onPath = findOnPath();
        if (onPath.isPresent()) {
            return onPath;
        }
        return findInProgramFiles();
    }

    public boolean isAvailable() {
        return resolve().isPresent();
    }

    private Optional<String> findOnPath() {
        final String path = environment.apply("PATH");
        if (!StringUtils.hasText(path)) {
            return Optional.empty();
        }
        final boolean windows = isWindows();
        for (final String name : CANDIDATE_NAMES) {
            for (final String directory : path.split(File.pathSeparator)) {
                if (!StringUtils.hasText(directory)) {
                    continue;
                }
                final Path candidate = Paths.get(directory, windows ? name + ".exe" : name);
                if (Files.isRegularFile(candidate) && Files.isExecutable(candidate)) {
                    return Optional.of(candidate.toString());
                }
            }
        }
        return Optional.empty();
    }

    private Optional<String> findInProgramFiles() {
        for (final String variable : PROGRAM_FILES_VARIABLES) {
            final String root = environment.apply(variable);
            if (!StringUtils.hasText(root)) {
                continue;
            }
            final Path gsRoot = Paths.get(root, "gs");
            if (!Files.isDirectory(gsRoot)) {
                continue;
            }
            for (final Path versionDir : versionDirectories(gsRoot)) {
                for (final String executable : WINDOWS_EXECUTABLES) {
                    final Path candidate = versionDir.resolve("bin").resolve(executable);
                    if (Files.isRegularFile(candidate)) {
                        return Optional.of(candidate.toString());
                    }
                }
            }
        }
        return Optional.empty();
    }

    private List<Path> versionDirectories(final Path gsRoot) {
        final List<Path> directories = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(gsRoot, "gs*")) {
            stream.forEach(directories::add);
        } catch (IOException e) {
            log.warn("Could not scan Ghostscript install directory {}: {}", gsRoot, e.getMessage());
        }
        directories.sort(Comparator.comparing(Path::toString).reversed());
        return directories;
    }

    private static boolean isWindows() {
        return System.getProperty("os.name", "").toLowerCase().startsWith("windows");
    }
}
