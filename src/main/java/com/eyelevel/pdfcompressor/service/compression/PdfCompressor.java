package com.eyelevel.pdfcompressor.service.compression;

import com.eyelevel.pdfcompressor.exception.ExternalToolException;
import com.eyelevel.pdfcompressor.exception.ToolNotFoundException;
import com.eyelevel.pdfcompressor.model.CompressionProfile;

import java.nio.file.Path;

/**
 * Strategy interface for compressing a PDF document. Implementations never touch job state.
 */
public interface PdfCompressor {

    /**
     * Compresses {@code input} into {@code output}.
     *
     * @param contextInfo a string for logging, usually the job id
     * @throws ToolNotFoundException if the compression tool cannot be launched
     * @throws ExternalToolException if the tool ran but failed or timed out
     */
    CompressionResult compress(Path input, Path output, CompressionProfile profile, boolean preserveImages,
                               String contextInfo) throws ToolNotFoundException, ExternalToolException;
}
