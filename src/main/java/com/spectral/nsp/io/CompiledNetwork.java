package com.spectral.nsp.io;

import com.spectral.nsp.api.BaseSelector;
import com.spectral.nsp.engine.DynamicsEngine;
import com.spectral.nsp.engine.Network;
import com.spectral.nsp.engine.StabilityAnalyzer;
import com.spectral.nsp.engine.StabilityConfig;

/**
 * Result of compiling a {@link NetworkDefinition}.
 *
 * @param name            Name from the definition, may be null.
 * @param network         The original network.
 * @param base            Configured base set, or null if none was given.
 * @param stabilityConfig Stability settings, defaults filled in.
 */
public record CompiledNetwork(String name, Network network, BaseSelector base, StabilityConfig stabilityConfig) {

    public boolean hasBase() {
        return base != null;
    }

    /**
     * The network specialized around the configured base set.
     *
     * @throws IllegalStateException if the definition had no base set.
     */
    public Network specialized() {
        if (base == null) {
            throw new IllegalStateException("Network definition '" + name + "' declares no base set");
        }
        return network.specialize(base);
    }

    public StabilityAnalyzer analyzer(Network target) {
        return new StabilityAnalyzer(target, stabilityConfig);
    }

    public DynamicsEngine dynamics(Network target) {
        return new DynamicsEngine(target);
    }
}
