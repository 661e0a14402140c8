package com.eyelevel.pdfcompressor.service.compression;

/**
 * Sizes reported by a successful compression run.
 */
public record CompressionResult(long bytesIn, long bytesOut) {

    /**
     * {@code bytesOut / bytesIn} rounded to four decimals, or {@code 0.0} for an empty input.
     */
    public double ratio() {
        if (bytesIn <= 0) {
            return 0.0;
        }
        return Math.round(((double) bytesOut / bytesIn) * 10_000d) / 10_000d;
    }
}
