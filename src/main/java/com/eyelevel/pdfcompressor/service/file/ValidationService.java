package com.eyelevel.pdfcompressor.service.file;

import com.eyelevel.pdfcompressor.exception.apiclient.BadRequestException;
import com.eyelevel.pdfcompressor.exception.apiclient.ServiceUnavailableException;
import com.eyelevel.pdfcompressor.exception.apiclient.UnsupportedMediaTypeException;
import com.eyelevel.pdfcompressor.model.CompressionProfile;
import com.eyelevel.pdfcompressor.service.compression.GhostscriptLocator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.io.FilenameUtils;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Locale;
import java.util.Set;

/**
 * Request-level checks that run before any job exists. Every failure is an {@code ApiException}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ValidationService {

    private static final byte[] PDF_MAGIC = "%PDF-".getBytes(StandardCharsets.US_ASCII);
    private static final Set<String> TRUTHY = Set.of("1", "true", "yes", "on");

    private final GhostscriptLocator ghostscriptLocator;

    public MultipartFile requireFile(final MultipartFile file) {
        if (file == null || !StringUtils.hasText(file.getOriginalFilename())) {
            throw new BadRequestException("missing_file", "No file part in the request.");
        }
        return file;
    }

    /**
     * @param value the raw {@code profile} field; {@code null} selects the default
     */
    public CompressionProfile requireProfile(final String value) {
        if (value == null) {
            return CompressionProfile.MEDIUM;
        }
        return CompressionProfile.fromValue(value)
                                 .orElseThrow(() -> new BadRequestException("invalid_profile",
                                                                            "Profile must be one of: low, medium, high."));
    }

    /**
     * Accepts the upload only when the extension, the declared content type and the leading bytes all say PDF.
     */
    public void requirePdf(final MultipartFile file) {
        final String name = FilenameUtils.getName(file.getOriginalFilename());
        final String extension = FilenameUtils.getExtension(name).toLowerCase(Locale.ROOT);
        final String contentType = file.getContentType() == null ? "" : file.getContentType().toLowerCase(Locale.ROOT);
        if (!"pdf".equals(extension) || !contentType.contains("pdf") || !startsWithPdfHeader(file)) {
            log.warn("Rejected non-PDF upload '{}' (content type '{}').", name, contentType);
            throw new UnsupportedMediaTypeException("unsupported_media_type",
                                                    "Only PDF documents are supported for compression.");
        }
    }

    public void requireGhostscript() {
        if (!ghostscriptLocator.isAvailable()) {
            throw new ServiceUnavailableException("ghostscript_unavailable",
                    "Ghostscript is not available on the server. Please install it and ensure it can be executed.");
        }
    }

    public boolean isTruthyFlag(final String value) {
        return value != null && TRUTHY.contains(value.trim().toLowerCase(Locale.ROOT));
    }

    private boolean startsWithPdfHeader(final MultipartFile file) {
        try (InputStream in = file.getInputStream()) {
            final byte[] head = in.readNBytes(PDF_MAGIC.length);
            return Arrays.equals(head, PDF_MAGIC);
        } catch (IOException e) {
            log.warn("Could not read the header of upload '{}': {}", file.getOriginalFilename(), e.getMessage());
            return false;
        }
    }
}
