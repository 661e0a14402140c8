package com.eyelevel.pdfcompressor.web.gate;

import jakarta.servlet.http.HttpServletRequest;

/**
 * One check in front of an API handler. Gates run in registration order and the first denial wins.
 */
public interface RequestGate {

    GateDecision check(HttpServletRequest request);
}
