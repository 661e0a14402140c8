package com.eyelevel.pdfcompressor.web.gate;

import com.eyelevel.pdfcompressor.exception.apiclient.ApiException;

/**
 * Outcome of a single {@link RequestGate}. A denial carries the error reported to the caller.
 */
public record GateDecision(boolean allowed, ApiException denial) {

    private static final GateDecision ALLOW = new GateDecision(true, null);

    public static GateDecision allow() {
        return ALLOW;
    }

    public static GateDecision deny(final ApiException denial) {
        return new GateDecision(false, denial);
    }
}
