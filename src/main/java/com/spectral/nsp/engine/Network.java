package com.spectral.nsp.engine;

import com.spectral.nsp.api.BaseSelector;
import com.spectral.nsp.api.NetworkValidationException;
import com.spectral.nsp.fn.NodeFunction;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * An immutable directed, weighted network.
 *
 * <h2>Conventions</h2>
 * <ul>
 * <li>Entry (i, j) of the adjacency is the weight of the edge from node j to
 * node i (row = target, column = source).</li>
 * <li>The diagonal is expected to be zero. Self-dynamics belong to the
 * functional matrix.</li>
 * <li>Labels are unique and aligned with rows/columns through a
 * {@link LabelRegistry}.</li>
 * <li>The functional matrix and origin mapping live in a shared
 * {@link FunctionalSystem} sized to the original network, not to this
 * one.</li>
 * </ul>
 *
 * Every transformation ({@link #permute(int[])}, {@link #specialize}) returns a
 * new instance and leaves this one untouched. The adjacency is stored as an EJML
 * {@link DMatrixSparseCSC}; that layout is an implementation detail and is
 * only handed out as a copy.
 */
public final class Network {
    private final DMatrixSparseCSC adjacency;
    private final LabelRegistry registry;
    private final FunctionalSystem system;

    Network(DMatrixSparseCSC adjacency, LabelRegistry registry, FunctionalSystem system) {
        if (adjacency.numRows != adjacency.numCols) {
            throw new NetworkValidationException("Matrix not square: " + adjacency.numRows + "x" + adjacency.numCols);
        }
        if (registry.size() != adjacency.numRows) {
            throw new NetworkValidationException("labels must be a string list of length " + adjacency.numRows);
        }
        this.adjacency = adjacency;
        this.registry = registry;
        this.system = system;
    }

    /** Original network with default labels and linear dynamics. */
    public static Network of(double[][] adjacency) {
        return builder().adjacency(adjacency).build();
    }

    public static Builder builder() {
        return new Builder();
    }

    // ── Structure ──────────────────────────────────────────────

    public int nodeCount() {
        return adjacency.numRows;
    }

    /** Number of nonzero adjacency entries. */
    public int edgeCount() {
        return SparseBlocks.nonZeroCount(adjacency);
    }

    public double weight(int target, int source) {
        return adjacency.get(target, source);
    }

    /** Weight of the edge {@code from -> to}, by label. */
    public double weight(String from, String to) {
        return adjacency.get(registry.index(to), registry.index(from));
    }

    /** Copy of the sparse adjacency. */
    public DMatrixSparseCSC adjacency() {
        return adjacency.copy();
    }

    public double[][] toDense() {
        return SparseBlocks.toDense(adjacency);
    }

    /**
     * Copy of the sub-block with rows [row0, row1) and columns [col0, col1).
     */
    public DMatrixSparseCSC subBlock(int row0, int row1, int col0, int col1) {
        return SparseBlocks.extract(adjacency, row0, row1, col0, col1);
    }

    // Internal access for engine classes; never exposed.
    DMatrixSparseCSC matrix() {
        return adjacency;
    }

    // ── Labels ──────────────────────────────────────────────

    public LabelRegistry registry() {
        return registry;
    }

    public List<String> labels() {
        return registry.labels();
    }

    public String label(int index) {
        return registry.label(index);
    }

    public int index(String label) {
        return registry.index(label);
    }

    /** Label of node i with any copy suffix removed. */
    public String canonicalLabel(int index) {
        return LabelRegistry.canonical(registry.label(index));
    }

    // ── Functional system ──────────────────────────────────────

    public FunctionalSystem functionalSystem() {
        return system;
    }

    public boolean hasFunctions() {
        return !system.isLinear();
    }

    /**
     * Index into the original functional matrix for node i: its label is
     * stripped of any copy suffix and resolved through origin.
     *
     * @throws com.spectral.nsp.api.OriginLookupException if the canonical label
     *                                                     has no origin entry.
     */
    public int original(int index) {
        return system.resolve(registry.label(index));
    }

    // ── Transformations ──────────────────────────────────────────

    /**
     * Reorders rows and columns: node i of the result is node {@code order[i]}
     * of this network. Labels travel with their nodes; the functional system
     * is shared.
     *
     * @throws NetworkValidationException if order is not a permutation of
     *                                    {@code 0..n-1}.
     */
    public Network permute(int[] order) {
        int n = nodeCount();
        if (order == null || order.length != n) {
            throw new NetworkValidationException("Permutation must have length " + n);
        }
        boolean[] seen = new boolean[n];
        for (int v : order) {
            if (v < 0 || v >= n || seen[v]) {
                throw new NetworkValidationException("Not a permutation of 0.." + (n - 1) + ": "
                        + Arrays.toString(order));
            }
            seen[v] = true;
        }
        return new Network(SparseBlocks.permute(adjacency, order), registry.permute(order), system);
    }

    /**
     * Specializes this network around the given base set.
     *
     * @see Specializer
     */
    public Network specialize(BaseSelector base) {
        return Specializer.specialize(this, base);
    }

    public Network specializeByLabel(String... base) {
        return specialize(BaseSelector.byLabel(base));
    }

    public Network specializeByIndex(int... base) {
        return specialize(BaseSelector.byIndex(base));
    }

    @Override
    public String toString() {
        return "Network{n=" + nodeCount() + ", edges=" + edgeCount() + ", labels=" + labels()
                + (hasFunctions() ? ", nonlinear" : ", linear") + "}";
    }

    /**
     * Builder for original networks, or for networks that join an existing
     * {@link FunctionalSystem}.
     *
     * Either set a full adjacency ({@link #adjacency(double[][])}) or declare
     * {@link #nodes(List)} and add edges one by one with
     * {@link #edge(String, String, double)}; parallel edges sum their weights.
     */
    public static final class Builder {
        private DMatrixSparseCSC adjacency;
        private double[][] denseAdjacency;
        private List<String> labels;
        private final List<PendingEdge> edges = new ArrayList<>();
        private NodeFunction[][] functions;
        private Map<String, Integer> origin;
        private FunctionalSystem system;

        private record PendingEdge(String from, String to, double weight) {
        }

        private Builder() {
        }

        public Builder adjacency(double[][] adjacency) {
            this.denseAdjacency = adjacency;
            this.adjacency = null;
            return this;
        }

        public Builder adjacency(DMatrixSparseCSC adjacency) {
            this.adjacency = adjacency;
            this.denseAdjacency = null;
            return this;
        }

        public Builder labels(List<String> labels) {
            this.labels = labels;
            return this;
        }

        public Builder labels(String... labels) {
            return labels(Arrays.asList(labels));
        }

        /** Same as {@link #labels(List)}; reads better with {@link #edge}. */
        public Builder nodes(List<String> labels) {
            return labels(labels);
        }

        public Builder nodes(String... labels) {
            return labels(labels);
        }

        /** Adds weight to the edge {@code from -> to}. */
        public Builder edge(String from, String to, double weight) {
            edges.add(new PendingEdge(from, to, weight));
            return this;
        }

        public Builder functions(NodeFunction[][] functions) {
            this.functions = functions;
            return this;
        }

        public Builder origin(Map<String, Integer> origin) {
            this.origin = origin;
            return this;
        }

        /** Shares an existing functional system instead of creating one. */
        public Builder system(FunctionalSystem system) {
            this.system = system;
            return this;
        }

        public Network build() {
            DMatrixSparseCSC a = resolveAdjacency();
            int n = a.numRows;
            LabelRegistry registry = labels != null ? LabelRegistry.of(labels, n) : LabelRegistry.defaults(n);
            return new Network(a, registry, resolveSystem(registry));
        }

        private DMatrixSparseCSC resolveAdjacency() {
            if (denseAdjacency != null || adjacency != null) {
                if (!edges.isEmpty()) {
                    throw new NetworkValidationException("Set either a full adjacency or individual edges, not both");
                }
                if (denseAdjacency != null) {
                    return SparseBlocks.fromDense(denseAdjacency);
                }
                if (adjacency.numRows != adjacency.numCols) {
                    throw new NetworkValidationException("Matrix not square: " + adjacency.numRows + "x"
                            + adjacency.numCols);
                }
                return adjacency.copy();
            }
            if (labels == null) {
                throw new NetworkValidationException("Either an adjacency or the node labels must be given");
            }

            LabelRegistry registry = LabelRegistry.of(labels);
            Map<Long, Double> summed = new LinkedHashMap<>();
            int n = registry.size();
            for (PendingEdge e : edges) {
                int to = registry.index(e.to());
                int from = registry.index(e.from());
                summed.merge((long) to * n + from, e.weight(), Double::sum);
            }
            DMatrixSparseTriplet t = new DMatrixSparseTriplet(n, n, summed.size());
            for (var entry : summed.entrySet()) {
                if (entry.getValue() != 0.0) {
                    long key = entry.getKey();
                    t.addItem((int) (key / n), (int) (key % n), entry.getValue());
                }
            }
            return SparseBlocks.toCsc(t);
        }

        private FunctionalSystem resolveSystem(LabelRegistry registry) {
            FunctionalSystem fs;
            if (system != null) {
                if (functions != null || origin != null) {
                    throw new NetworkValidationException("A shared functional system replaces functions and origin");
                }
                fs = system;
            } else if (origin != null) {
                fs = functions != null ? FunctionalSystem.of(functions, origin) : FunctionalSystem.linear(origin);
            } else {
                // This network is itself the original one.
                for (String label : registry.labels()) {
                    if (label.indexOf(LabelRegistry.COPY_SEPARATOR) >= 0) {
                        throw new NetworkValidationException("Label '" + label + "' of an original network must not contain '"
                                + LabelRegistry.COPY_SEPARATOR + "'");
                    }
                }
                if (functions != null && functions.length != registry.size()) {
                    throw new NetworkValidationException("Functional matrix is " + functions.length + "x"
                            + functions.length + " but the network has " + registry.size() + " nodes");
                }
                fs = functions != null ? FunctionalSystem.of(functions, registry.indexer())
                        : FunctionalSystem.linear(registry.indexer());
            }
            for (String label : registry.labels()) {
                if (!fs.canResolve(label)) {
                    throw new NetworkValidationException("Label '" + label + "' does not resolve through origin");
                }
            }
            return fs;
        }
    }
}
