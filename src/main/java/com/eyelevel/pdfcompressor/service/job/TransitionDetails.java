package com.eyelevel.pdfcompressor.service.job;

/**
 * Extra data recorded alongside a status change.
 *
 * @param errorMessage        recorded only on a transition to FAILED
 * @param compressedSizeBytes recorded only on a transition to COMPLETED, where it is required
 */
public record TransitionDetails(String errorMessage, Long compressedSizeBytes) {

    public static TransitionDetails none() {
        return new TransitionDetails(null, null);
    }

    public static TransitionDetails completed(final long compressedSizeBytes) {
        return new TransitionDetails(null, compressedSizeBytes);
    }

    public static TransitionDetails failed(final String errorMessage) {
        return new TransitionDetails(errorMessage, null);
    }
}
