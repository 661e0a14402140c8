package com.eyelevel.pdfcompressor.web.gate;

import com.eyelevel.pdfcompressor.exception.apiclient.UnauthorizedException;
import com.eyelevel.pdfcompressor.service.identity.CallerCredential;
import com.eyelevel.pdfcompressor.service.identity.IdentityResolver;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Authenticates the {@code X-API-Key} header and exposes the credential to handlers as a request attribute.
 */
@Component
@RequiredArgsConstructor
public class ApiKeyGate implements RequestGate {

    public static final String HEADER = "X-API-Key";
    public static final String CALLER_ATTRIBUTE = "com.eyelevel.pdfcompressor.web.gate.ApiKeyGate.caller";

    private final IdentityResolver identityResolver;

    @Override
    public GateDecision check(final HttpServletRequest request) {
        try {
            final CallerCredential caller = identityResolver.authenticate(request.getHeader(HEADER));
            request.setAttribute(CALLER_ATTRIBUTE, caller);
            return GateDecision.allow();
        } catch (UnauthorizedException e) {
            return GateDecision.deny(e);
        }
    }
}
