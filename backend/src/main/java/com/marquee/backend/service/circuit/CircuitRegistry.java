package com.marquee.backend.service.circuit;

import com.marquee.backend.model.CircuitState;
import com.marquee.backend.model.CircuitType;

import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

/**
 * The fixed set of circuits created at startup.
 */
public final class CircuitRegistry {

    public static final String MASTER = "MASTER";
    public static final String SLEEP_MODE = "SLEEP_MODE";
    public static final String PROVIDER_OPENAI = "PROVIDER_OPENAI";
    public static final String PROVIDER_ANTHROPIC = "PROVIDER_ANTHROPIC";

    public static final int DEFAULT_FAILURE_THRESHOLD = 5;

    public static final List<CircuitDefinition> MANUAL_CIRCUITS = List.of(
            new CircuitDefinition(MASTER, CircuitType.MANUAL, CircuitState.ON,
                    "Global kill switch; OFF blocks all display updates", DEFAULT_FAILURE_THRESHOLD),
            new CircuitDefinition(SLEEP_MODE, CircuitType.MANUAL, CircuitState.OFF,
                    "Quiet hours; ON blocks display updates", DEFAULT_FAILURE_THRESHOLD)
    );

    public static final List<CircuitDefinition> PROVIDER_CIRCUITS = List.of(
            new CircuitDefinition(PROVIDER_OPENAI, CircuitType.PROVIDER, CircuitState.ON,
                    "OpenAI provider availability", DEFAULT_FAILURE_THRESHOLD),
            new CircuitDefinition(PROVIDER_ANTHROPIC, CircuitType.PROVIDER, CircuitState.ON,
                    "Anthropic provider availability", DEFAULT_FAILURE_THRESHOLD)
    );

    private CircuitRegistry() {
    }

    public static List<CircuitDefinition> all() {
        return Stream.concat(MANUAL_CIRCUITS.stream(), PROVIDER_CIRCUITS.stream()).toList();
    }

    /**
     * Circuit id guarding a provider, e.g. {@code openai -> PROVIDER_OPENAI}.
     */
    public static String providerCircuitId(String providerName) {
        return "PROVIDER_" + providerName.toUpperCase(Locale.ROOT);
    }
}
