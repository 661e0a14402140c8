package com.eyelevel.pdfcompressor.support;

import com.eyelevel.pdfcompressor.common.processexec.ProcessExecutor;
import com.eyelevel.pdfcompressor.common.processexec.ProcessExecutor.ProcessResult;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doReturn;

/**
 * Stands in for the Ghostscript binary. A mocked {@link ProcessExecutor} either writes a fixed, smaller PDF to the
 * {@code -sOutputFile=} target, or fails with a given exit code.
 */
public final class GhostscriptStub {

    public static final byte[] COMPRESSED = "%PDF-1.4\n% compressed by stub\n%%EOF\n".getBytes(StandardCharsets.US_ASCII);

    private static final String OUTPUT_FLAG = "-sOutputFile=";

    private GhostscriptStub() {
    }

    public static void succeed(final ProcessExecutor executor) throws Exception {
        doAnswer(invocation -> {
            final List<String> command = invocation.getArgument(0);
            Files.write(outputOf(command), COMPRESSED);
            return new ProcessResult(0, "", "");
        }).when(executor).execute(anyList(), anyString(), anyLong(), anyString());
    }

    public static void fail(final ProcessExecutor executor, final int exitCode, final String stderr) throws Exception {
        doReturn(new ProcessResult(exitCode, "", stderr))
                .when(executor).execute(anyList(), anyString(), anyLong(), anyString());
    }

    public static Path outputOf(final List<String> command) {
        return command.stream()
                      .filter(argument -> argument.startsWith(OUTPUT_FLAG))
                      .map(argument -> Paths.get(argument.substring(OUTPUT_FLAG.length())))
                      .findFirst()
                      .orElseThrow(() -> new AssertionError("No output file in " + command));
    }

    /**
     * A small but valid-looking PDF, comfortably larger than {@link #COMPRESSED}.
     */
    public static byte[] samplePdf() {
        final StringBuilder body = new StringBuilder("%PDF-1.7\n");
        for (int i = 0; i < 64; i++) {
            body.append("% filler line ").append(i).append(" to give the document some weight\n");
        }
        body.append("%%EOF\n");
        return body.toString().getBytes(StandardCharsets.US_ASCII);
    }
}
