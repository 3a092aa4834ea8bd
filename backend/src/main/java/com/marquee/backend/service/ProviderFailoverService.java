package com.marquee.backend.service;

import com.marquee.backend.exception.AiProviderException;
import com.marquee.backend.model.GeneratedContent;
import com.marquee.backend.model.GenerationContext;
import com.marquee.backend.service.ai.AiProvider;
import com.marquee.backend.service.content.GeneratorFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One attempt against the preferred provider and, for retryable failures only, exactly one against the alternate.
 * Stateless and strictly sequential; circuit bookkeeping happens in the provider decorators, not here.
 */
@Slf4j
@Service
public class ProviderFailoverService {

    public GeneratedContent run(GeneratorFactory factory, GenerationContext context,
                                AiProvider preferred, AiProvider alternate) {
        try {
            GeneratedContent content = factory.create(preferred).generate(context);
            return content.withMetadata(Map.of("provider", preferred.getName(), "failedOver", false));
        } catch (RuntimeException primaryError) {
            if (!isRetryable(primaryError)) {
                log.warn("Provider call failed, not retryable provider={} error={}",
                        preferred.getName(), primaryError.toString());
                throw primaryError;
            }
            if (alternate == null) {
                log.warn("Provider call failed, no alternate provider={} error={}",
                        preferred.getName(), primaryError.toString());
                throw primaryError;
            }
            log.warn("Provider call failed, failing over from={} to={} error={}",
                    preferred.getName(), alternate.getName(), primaryError.toString());
            GeneratedContent content = factory.create(alternate).generate(context);
            Map<String, Object> failover = new LinkedHashMap<>();
            failover.put("provider", alternate.getName());
            failover.put("failedOver", true);
            failover.put("primaryProvider", preferred.getName());
            failover.put("primaryError", primaryError.getMessage());
            return content.withMetadata(failover);
        }
    }

    public static boolean isRetryable(Throwable error) {
        return error instanceof AiProviderException providerError && providerError.isRetryable();
    }
}
