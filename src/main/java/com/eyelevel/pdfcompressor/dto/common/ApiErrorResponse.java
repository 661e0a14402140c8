package com.eyelevel.pdfcompressor.dto.common;

import lombok.Builder;
import lombok.Getter;

/**
 * The uniform error body: {@code {"ok": false, "error": "<code>", "detail": "<message>"}}.
 */
@Getter
@Builder
public class ApiErrorResponse {

    @Builder.Default
    private final boolean ok = false;

    /**
     * Stable, machine-readable error code.
     */
    private final String error;

    /**
     * Human-readable explanation. Never contains raw tool output.
     */
    private final String detail;

    public static ApiErrorResponse of(final String error, final String detail) {
        return ApiErrorResponse.builder().error(error).detail(detail).build();
    }
}
