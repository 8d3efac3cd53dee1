package com.spectral.nsp.io;

import com.spectral.nsp.api.BaseSelector;
import com.spectral.nsp.api.NetworkValidationException;
import com.spectral.nsp.engine.LabelRegistry;
import com.spectral.nsp.engine.Network;
import com.spectral.nsp.engine.StabilityConfig;
import com.spectral.nsp.fn.FunctionRegistry;
import com.spectral.nsp.fn.NodeFunction;
import com.spectral.nsp.fn.NodeFunctions;

import java.util.List;

/**
 * Compiles a {@link NetworkDefinition} into a {@link Network}.
 *
 * When the definition lists any functions, the network gets a full functional
 * matrix and every cell not listed is the zero function. Without functions the
 * dynamics are linear.
 */
public final class NetworkCompiler {
    private final FunctionRegistry functions;

    public NetworkCompiler() {
        this(new FunctionRegistry());
    }

    public NetworkCompiler(FunctionRegistry functions) {
        this.functions = functions;
    }

    public FunctionRegistry functions() {
        return functions;
    }

    public CompiledNetwork compile(NetworkDefinition def) {
        NetworkDefinition.NetworkInfo info = def.getNetwork();
        if (info == null) {
            throw new NetworkValidationException("Missing 'network' key");
        }
        List<String> nodes = info.getNodes();
        if (nodes == null) {
            throw new NetworkValidationException("Network '" + info.getName() + "' declares no nodes");
        }

        Network.Builder builder = Network.builder().nodes(nodes);

        if (info.getEdges() != null) {
            for (NetworkDefinition.EdgeDef e : info.getEdges()) {
                if (e.getFrom() == null || e.getTo() == null) {
                    throw new NetworkValidationException("Edge needs both 'from' and 'to': " + e);
                }
                builder.edge(e.getFrom(), e.getTo(), e.getWeight());
            }
        }

        if (info.getFunctions() != null && !info.getFunctions().isEmpty()) {
            builder.functions(functionalMatrix(nodes, info.getFunctions()));
        }

        BaseSelector base = info.getBase() != null ? BaseSelector.of(info.getBase()) : null;

        return new CompiledNetwork(info.getName(), builder.build(), base, stabilityConfig(info.getStability()));
    }

    private NodeFunction[][] functionalMatrix(List<String> nodes, List<NetworkDefinition.FunctionDef> defs) {
        LabelRegistry registry = LabelRegistry.of(nodes);
        int n = registry.size();
        NodeFunction[][] matrix = new NodeFunction[n][n];
        for (NetworkDefinition.FunctionDef fd : defs) {
            if (fd.getTarget() == null || fd.getSource() == null) {
                throw new NetworkValidationException("Function needs both 'target' and 'source': " + fd);
            }
            int i = registry.index(fd.getTarget());
            int j = registry.index(fd.getSource());
            if (matrix[i][j] != null) {
                throw new NetworkValidationException("Function for " + fd.getSource() + " -> " + fd.getTarget()
                        + " defined twice");
            }
            matrix[i][j] = functions.create(fd.getType(), fd.getProperties());
        }
        for (NodeFunction[] row : matrix) {
            for (int j = 0; j < n; j++) {
                if (row[j] == null) {
                    row[j] = NodeFunctions.zero();
                }
            }
        }
        return matrix;
    }

    static StabilityConfig stabilityConfig(NetworkDefinition.StabilityDef sd) {
        StabilityConfig d = StabilityConfig.DEFAULT;
        if (sd == null) {
            return d;
        }
        return new StabilityConfig(
                sd.getLower() != null ? sd.getLower() : d.lower(),
                sd.getUpper() != null ? sd.getUpper() : d.upper(),
                sd.getSamples() != null ? sd.getSamples() : d.samples(),
                sd.getThreshold() != null ? sd.getThreshold() : d.threshold());
    }
}
