package com.eyelevel.pdfcompressor.service.compression;

import com.eyelevel.pdfcompressor.common.processexec.ProcessExecutor;
import com.eyelevel.pdfcompressor.common.processexec.ProcessExecutor.ProcessResult;
import com.eyelevel.pdfcompressor.common.processexec.ProcessLaunchException;
import com.eyelevel.pdfcompressor.common.processexec.ProcessTimeoutException;
import com.eyelevel.pdfcompressor.config.PdfCompressorConfig;
import com.eyelevel.pdfcompressor.exception.ExternalToolException;
import com.eyelevel.pdfcompressor.exception.ToolNotFoundException;
import com.eyelevel.pdfcompressor.model.CompressionProfile;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class GhostscriptCompressor implements PdfCompressor {

    private static final String PROCESS_NAME = "gs";

    private final PdfCompressorConfig config;
    private final ProcessExecutor processExecutor;
    private final GhostscriptLocator ghostscriptLocator;

    @Override
    public CompressionResult compress(final Path input, final Path output, final CompressionProfile profile,
                                      final boolean preserveImages, final String contextInfo) {
        final String executable = ghostscriptLocator.resolve()
                                                    .orElseThrow(() -> new ToolNotFoundException(
                                                            "Ghostscript executable could not be located."));
        final long timeout = config.getGhostscript().getTimeoutMinutes();
        final List<String> command = GhostscriptCommandBuilder.build(executable, input, output, profile, preserveImages);
        log.info("[{}] Compressing with Ghostscript (profile {}, preset {}, keep images {}, timeout {}m).",
                 contextInfo, profile.getValue(), profile.getPreset(), preserveImages, timeout);
        log.debug("[{}] Ghostscript command: {}", contextInfo, command);

        final ProcessResult result;
        try {
            result = processExecutor.execute(command, contextInfo, timeout, PROCESS_NAME);
        } catch (ProcessLaunchException e) {
            log.error("[{}] Ghostscript could not be launched from '{}'.", contextInfo, executable, e);
            throw new ToolNotFoundException("Ghostscript could not be launched: " + executable, e);
        } catch (ProcessTimeoutException e) {
            log.error("[{}] {}", contextInfo, e.getMessage());
            throw new ExternalToolException("Ghostscript timed out.", e.getMessage(), e);
        } catch (IOException e) {
            throw new ExternalToolException("Ghostscript execution failed.", e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ExternalToolException("Ghostscript execution was interrupted.", e.toString(), e);
        }

        if (result.exitCode() != 0) {
            log.error("[{}] Ghostscript exited with code {}: {}", contextInfo, result.exitCode(), result.stderr());
            throw new ExternalToolException("Ghostscript exited with code " + result.exitCode() + ".",
                                            diagnostic(result));
        }
        if (!Files.isRegularFile(output)) {
            log.error("[{}] Ghostscript reported success but produced no output file.", contextInfo);
            throw new ExternalToolException("Ghostscript produced no output file.", diagnostic(result));
        }

        try {
            final CompressionResult compression = new CompressionResult(Files.size(input), Files.size(output));
            log.info("[{}] Ghostscript finished: {} -> {} bytes (ratio {}).", contextInfo, compression.bytesIn(),
                     compression.bytesOut(), compression.ratio());
            return compression;
        } catch (IOException e) {
            throw new ExternalToolException("Compressed output could not be measured.", e.getMessage(), e);
        }
    }

    private static String diagnostic(final ProcessResult result) {
        return result.stderr().isEmpty() ? result.stdout() : result.stderr();
    }
}
