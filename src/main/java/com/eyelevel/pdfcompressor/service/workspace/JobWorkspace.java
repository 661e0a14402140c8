package com.eyelevel.pdfcompressor.service.workspace;

import com.eyelevel.pdfcompressor.exception.StorageException;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.InputStreamSource;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Scoped ownership of one job's input and output files.
 * <p>
 * {@link #close()} deletes both files the first time it is called and does nothing afterwards. Whoever holds
 * the workspace last is responsible for closing it: the request thread for inline jobs, the worker otherwise.
 */
@Slf4j
@Getter
public class JobWorkspace implements AutoCloseable {

    private final String contextInfo;
    private final Path inputPath;
    private final Path outputPath;
    private final AtomicBoolean closed = new AtomicBoolean(false);

    JobWorkspace(final String contextInfo, final Path inputPath, final Path outputPath) {
        this.contextInfo = contextInfo;
        this.inputPath = inputPath;
        this.outputPath = outputPath;
    }

    /**
     * Streams the upload to the input path.
     *
     * @return number of bytes written
     * @throws StorageException if the upload cannot be written
     */
    public long storeUpload(final InputStreamSource upload) {
        try (InputStream in = upload.getInputStream()) {
            final long written = Files.copy(in, inputPath, StandardCopyOption.REPLACE_EXISTING);
            log.debug("[{}] Stored {} bytes at {}.", contextInfo, written, inputPath);
            return written;
        } catch (IOException e) {
            log.error("[{}] Failed to store upload at {}.", contextInfo, inputPath, e);
            throw new StorageException("Failed to save the uploaded file.", e);
        }
    }

    /**
     * @throws StorageException if the compressed output cannot be read
     */
    public byte[] readOutput() {
        try {
            return Files.readAllBytes(outputPath);
        } catch (IOException e) {
            throw new StorageException("Failed to read the compressed file.", e);
        }
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        delete(inputPath);
        delete(outputPath);
    }

    private void delete(final Path path) {
        try {
            if (Files.deleteIfExists(path)) {
                log.debug("[{}] Removed temporary file {}.", contextInfo, path);
            }
        } catch (IOException e) {
            log.warn("[{}] Failed to remove temporary file {}: {}", contextInfo, path, e.getMessage());
        }
    }
}
