package com.eyelevel.pdfcompressor.service.workspace;

import com.eyelevel.pdfcompressor.config.PdfCompressorConfig;
import com.eyelevel.pdfcompressor.exception.StorageException;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.filefilter.AgeFileFilter;
import org.apache.commons.io.filefilter.FileFilterUtils;
import org.apache.commons.io.filefilter.IOFileFilter;
import org.springframework.stereotype.Component;

import java.io.File;
import java.io.FileFilter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.UUID;

/**
 * Allocates collision-free workspaces under the configured upload and compressed directories.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class JobWorkspaceFactory {

    private final PdfCompressorConfig config;

    private Path uploadDir;
    private Path compressedDir;

    @PostConstruct
    void createDirectories() {
        uploadDir = Paths.get(config.getStorage().getUploadDir()).toAbsolutePath().normalize();
        compressedDir = Paths.get(config.getStorage().getCompressedDir()).toAbsolutePath().normalize();
        try {
            Files.createDirectories(uploadDir);
            Files.createDirectories(compressedDir);
        } catch (IOException e) {
            throw new StorageException("Could not create storage directories " + uploadDir + " and " + compressedDir, e);
        }
        log.info("Job workspaces: uploads in {}, compressed output in {}.", uploadDir, compressedDir);
    }

    /**
     * Allocates fresh {@code <uuid>.pdf} paths. Nothing is written until {@link JobWorkspace#storeUpload} is called.
     */
    public JobWorkspace allocate(final String contextInfo) {
        final String name = UUID.randomUUID().toString().replace("-", "") + ".pdf";
        return new JobWorkspace(contextInfo, uploadDir.resolve(name), compressedDir.resolve(name));
    }

    /**
     * Takes ownership of paths allocated by another process, e.g. when a queue worker picks up a job.
     */
    public JobWorkspace attach(final String contextInfo, final Path inputPath, final Path outputPath) {
        return new JobWorkspace(contextInfo, inputPath, outputPath);
    }

    /**
     * Deletes workspace files not modified since {@code threshold}. Used after stale jobs are failed, since an
     * abandoned job's paths are known only to the process that died.
     *
     * @return the number of files removed
     */
    public int purgeOlderThan(final Instant threshold) {
        final IOFileFilter leftovers = FileFilterUtils.and(FileFilterUtils.fileFileFilter(),
                                                           FileFilterUtils.suffixFileFilter(".pdf"),
                                                           new AgeFileFilter(threshold.toEpochMilli()));
        return purge(uploadDir, leftovers) + purge(compressedDir, leftovers);
    }

    private int purge(final Path dir, final IOFileFilter filter) {
        final File[] files = dir.toFile().listFiles((FileFilter) filter);
        if (files == null) {
            return 0;
        }
        int deleted = 0;
        for (final File file : files) {
            try {
                if (Files.deleteIfExists(file.toPath())) {
                    deleted++;
                }
            } catch (IOException e) {
                log.warn("Could not delete abandoned workspace file {}: {}", file, e.getMessage());
            }
        }
        return deleted;
    }
}
