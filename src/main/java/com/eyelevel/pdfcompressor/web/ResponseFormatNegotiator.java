package com.eyelevel.pdfcompressor.web;

import org.springframework.http.InvalidMediaTypeException;
import org.springframework.http.MediaType;
import org.springframework.util.StringUtils;

import java.util.List;

/**
 * Decides whether an inline compression answers with the PDF itself or a JSON summary.
 * <p>
 * JSON is chosen only when the {@code Accept} header admits it and it beats {@code application/pdf}: on equal
 * quality the more specific entry wins, and on a full tie the PDF wins. A missing or unparsable header means PDF.
 */
public final class ResponseFormatNegotiator {

    private static final List<MediaType> SERVER_TYPES = List.of(MediaType.APPLICATION_PDF, MediaType.APPLICATION_JSON);

    private ResponseFormatNegotiator() {
    }

    public static boolean prefersJson(final String acceptHeader) {
        if (!StringUtils.hasText(acceptHeader)) {
            return false;
        }
        final List<MediaType> accepted;
        try {
            accepted = MediaType.parseMediaTypes(acceptHeader);
        } catch (InvalidMediaTypeException e) {
            return false;
        }
        if (qualityOf(MediaType.APPLICATION_JSON, accepted) <= 0) {
            return false;
        }

        MediaType best = MediaType.APPLICATION_PDF;
        double bestQuality = -1;
        int bestSpecificity = -1;
        for (final MediaType server : SERVER_TYPES) {
            for (final MediaType client : accepted) {
                final double quality = client.getQualityValue();
                final int specificity = specificity(client);
                if (quality <= 0 || quality < bestQuality) {
                    continue;
                }
                if ((quality > bestQuality || specificity > bestSpecificity) && client.includes(server)) {
                    best = server;
                    bestQuality = quality;
                    bestSpecificity = specificity;
                }
            }
        }
        return MediaType.APPLICATION_JSON.equals(best);
    }

    private static double qualityOf(final MediaType type, final List<MediaType> accepted) {
        double quality = 0;
        for (final MediaType client : accepted) {
            if (client.includes(type)) {
                quality = Math.max(quality, client.getQualityValue());
            }
        }
        return quality;
    }

    private static int specificity(final MediaType type) {
        if (type.isWildcardType()) {
            return 0;
        }
        return type.isWildcardSubtype() ? 1 : 2;
    }
}
