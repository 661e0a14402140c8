package com.eyelevel.pdfcompressor.service.compression;

import com.eyelevel.pdfcompressor.model.CompressionProfile;
import org.apache.commons.io.FilenameUtils;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Builds the Ghostscript argument vector. Argument order is fixed. Input and output paths always use forward
 * slashes; the executable is passed exactly as resolved.
 */
public final class GhostscriptCommandBuilder {

    private static final List<String> PRESERVE_IMAGE_FLAGS = List.of(
            "-dDownsampleColorImages=false",
            "-dDownsampleGrayImages=false",
            "-dDownsampleMonoImages=false");

    private GhostscriptCommandBuilder() {
    }

    public static List<String> build(final String executable, final Path input, final Path output,
                                     final CompressionProfile profile, final boolean preserveImages) {
        final List<String> command = new ArrayList<>(List.of(
                executable,
                "-sDEVICE=pdfwrite",
                "-dCompatibilityLevel=1.4",
                "-dPDFSETTINGS=" + profile.getPreset(),
                "-dNOPAUSE",
                "-dQUIET",
                "-dBATCH",
                "-sOutputFile=" + normalize(output.toString())));
        if (preserveImages) {
            command.addAll(PRESERVE_IMAGE_FLAGS);
        }
        command.add(normalize(input.toString()));
        return command;
    }

    static String normalize(final String path) {
        return FilenameUtils.separatorsToUnix(path);
    }
}
