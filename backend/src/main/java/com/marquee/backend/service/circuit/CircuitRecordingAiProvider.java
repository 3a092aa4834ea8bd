package com.marquee.backend.service.circuit;

import com.marquee.backend.service.ai.AiGenerationRequest;
import com.marquee.backend.service.ai.AiGenerationResponse;
import com.marquee.backend.service.ai.AiProvider;

/**
 * Reports the outcome of every call on the wrapped provider to its circuit, so each half-open probe counts.
 */
public class CircuitRecordingAiProvider implements AiProvider {

    private final AiProvider delegate;
    private final CircuitBreakerService circuitBreakerService;
    private final String circuitId;

    public CircuitRecordingAiProvider(AiProvider delegate, CircuitBreakerService circuitBreakerService) {
        this.delegate = delegate;
        this.circuitBreakerService = circuitBreakerService;
        this.circuitId = CircuitRegistry.providerCircuitId(delegate.getName());
    }

    @Override
    public String getName() {
        return delegate.getName();
    }

    @Override
    public boolean isConfigured() {
        return delegate.isConfigured();
    }

    @Override
    public AiGenerationResponse generate(AiGenerationRequest request) {
        AiGenerationResponse response;
        try {
            response = delegate.generate(request);
        } catch (RuntimeException e) {
            circuitBreakerService.recordProviderFailure(circuitId, e);
            throw e;
        }
        circuitBreakerService.recordProviderSuccess(circuitId);
        return response;
    }

    public String getCircuitId() {
        return circuitId;
    }
}
