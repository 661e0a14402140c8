package com.eyelevel.pdfcompressor.web;

import org.apache.commons.io.FilenameUtils;
import org.springframework.util.StringUtils;

import java.text.Normalizer;

/**
 * Builds the attachment name offered for a compressed download.
 */
public final class DownloadNames {

    static final String DEFAULT_BASE_NAME = "document";
    private static final String SUFFIX = "-compressed.pdf";

    private DownloadNames() {
    }

    /**
     * {@code "Quarterly Report.pdf"} becomes {@code "Quarterly_Report-compressed.pdf"}; names that sanitize to
     * nothing fall back to {@code "document-compressed.pdf"}.
     */
    public static String compressedName(final String originalFilename) {
        final String base = FilenameUtils.getBaseName(sanitize(originalFilename));
        return (StringUtils.hasText(base) ? base : DEFAULT_BASE_NAME) + SUFFIX;
    }

    static String sanitize(final String filename) {
        if (filename == null) {
            return "";
        }
        final String ascii = Normalizer.normalize(filename, Normalizer.Form.NFKD).replaceAll("[^\\p{ASCII}]", "");
        final String flattened = ascii.replace('/', ' ').replace('\\', ' ').trim().replaceAll("\\s+", "_");
        return flattened.replaceAll("[^A-Za-z0-9_.-]", "").replaceAll("^[._]+|[._]+$", "");
    }
}
