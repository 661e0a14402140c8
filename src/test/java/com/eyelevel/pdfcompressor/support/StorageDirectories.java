package com.eyelevel.pdfcompressor.support;

import com.eyelevel.pdfcompressor.config.PdfCompressorConfig;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;

public final class StorageDirectories {

    private StorageDirectories() {
    }

    /**
     * Number of files currently left in the upload and compressed directories.
     */
    public static long leftoverFiles(final PdfCompressorConfig config) {
        return count(Paths.get(config.getStorage().getUploadDir())) + count(Paths.get(config.getStorage().getCompressedDir()));
    }

    private static long count(final Path directory) {
        if (!Files.isDirectory(directory)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(directory)) {
            return files.count();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
