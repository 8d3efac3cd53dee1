package com.spectral.nsp;

import com.spectral.nsp.engine.Network;
import com.spectral.nsp.io.CompiledNetwork;
import com.spectral.nsp.io.JsonNetworkLoader;
import com.spectral.nsp.io.NetworkCompiler;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;

/**
 * SpecNet: network specialization, dynamics and spectral stability.
 *
 * <h2>Workflow</h2>
 * <ol>
 * <li>Build a {@link Network} (adjacency plus optional functional matrix), or
 * load one from a JSON definition.</li>
 * <li>{@link Network#specialize} it around a base set. The result is a new,
 * larger network whose copies all resolve to the original functions.</li>
 * <li>Simulate either network with
 * {@link com.spectral.nsp.engine.DynamicsEngine}.</li>
 * <li>Estimate local stability with
 * {@link com.spectral.nsp.engine.StabilityAnalyzer}.</li>
 * </ol>
 *
 * Networks are immutable and all computation is synchronous and in-memory.
 */
public final class SpecNet {
    private static final Logger log = LogManager.getLogger(SpecNet.class);

    private SpecNet() {
        // Prevent instantiation of utility class
    }

    /**
     * Entry point: a builder for an original network.
     */
    public static Network.Builder builder() {
        return Network.builder();
    }

    /**
     * Loads and compiles a JSON network definition.
     *
     * @param jsonPath Path to the definition.
     * @throws UncheckedIOException if the file cannot be read.
     */
    public static CompiledNetwork load(Path jsonPath) {
        try {
            CompiledNetwork compiled = new NetworkCompiler().compile(JsonNetworkLoader.parseFile(jsonPath));
            log.info("Loaded network '{}' from {}: {}", compiled.name(), jsonPath, compiled.network());
            return compiled;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load network definition from " + jsonPath, e);
        }
    }

    /**
     * Compiles a JSON network definition held in a string.
     */
    public static CompiledNetwork parse(String json) {
        return new NetworkCompiler().compile(JsonNetworkLoader.parse(json));
    }
}
