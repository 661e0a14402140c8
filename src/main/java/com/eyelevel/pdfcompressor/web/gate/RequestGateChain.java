package com.eyelevel.pdfcompressor.web.gate;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.NonNull;
import org.springframework.web.servlet.HandlerInterceptor;

import java.util.List;

/**
 * Runs an ordered list of gates before the handler. A denial is thrown so that the global exception handler
 * renders it like any other API error.
 */
public class RequestGateChain implements HandlerInterceptor {

    private final List<RequestGate> gates;

    public RequestGateChain(final List<RequestGate> gates) {
        this.gates = List.copyOf(gates);
    }

    @Override
    public boolean preHandle(@NonNull final HttpServletRequest request, @NonNull final HttpServletResponse response,
                             @NonNull final Object handler) {
        for (final RequestGate gate : gates) {
            final GateDecision decision = gate.check(request);
            if (!decision.allowed()) {
                throw decision.denial();
            }
        }
        return true;
    }
}
