package com.eyelevel.pdfcompressor.model;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Compression intensity requested by the caller, mapped to a fixed Ghostscript {@code -dPDFSETTINGS} preset.
 */
@Getter
@RequiredArgsConstructor
public enum CompressionProfile {
    LOW("/printer"),
    MEDIUM("/ebook"),
    HIGH("/screen");

    private final String preset;

    public static Optional<CompressionProfile> fromValue(final String value) {
        if (value == null) {
            return Optional.empty();
        }
        final String normalized = value.trim().toUpperCase(Locale.ROOT);
        return Arrays.stream(values()).filter(profile -> profile.name().equals(normalized)).findFirst();
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
