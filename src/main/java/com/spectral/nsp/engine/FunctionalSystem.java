package com.spectral.nsp.engine;

import com.spectral.nsp.api.NetworkValidationException;
import com.spectral.nsp.api.OriginLookupException;
import com.spectral.nsp.fn.NodeFunction;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Immutable description of the original, unexpanded system: its functional
 * matrix (absent for linear dynamics) and the origin mapping from canonical
 * labels to rows/columns of that matrix.
 *
 * One instance is created with the original network and then shared by
 * reference with every network derived from it. Specialization grows the
 * networks, never this handle.
 */
public final class FunctionalSystem {
    private final NodeFunction[][] functions;
    private final Map<String, Integer> origin;
    private final int originalSize;

    private FunctionalSystem(NodeFunction[][] functions, Map<String, Integer> origin, int originalSize) {
        this.functions = functions;
        this.origin = origin;
        this.originalSize = originalSize;
    }

    /**
     * A system without a functional matrix; dynamics are adjacency products.
     */
    public static FunctionalSystem linear(Map<String, Integer> origin) {
        Map<String, Integer> copy = copyOrigin(origin);
        int size = copy.size();
        checkOriginRange(copy, size);
        return new FunctionalSystem(null, copy, size);
    }

    /**
     * @param functions n0 x n0 matrix, no null cells. Copied.
     * @param origin    canonical label -> index into functions.
     */
    public static FunctionalSystem of(NodeFunction[][] functions, Map<String, Integer> origin) {
        if (functions == null) {
            throw new NetworkValidationException("Functional matrix must not be null");
        }
        int n0 = functions.length;
        NodeFunction[][] copy = new NodeFunction[n0][];
        for (int i = 0; i < n0; i++) {
            if (functions[i] == null || functions[i].length != n0) {
                throw new NetworkValidationException("Functional matrix must be square, row " + i + " has "
                        + (functions[i] == null ? "no" : functions[i].length) + " entries for " + n0 + " rows");
            }
            copy[i] = functions[i].clone();
            for (int j = 0; j < n0; j++) {
                if (copy[i][j] == null) {
                    throw new NetworkValidationException("Functional matrix cell (" + i + "," + j + ") is null");
                }
            }
        }
        Map<String, Integer> originCopy = copyOrigin(origin);
        checkOriginRange(originCopy, n0);
        return new FunctionalSystem(copy, originCopy, n0);
    }

    private static Map<String, Integer> copyOrigin(Map<String, Integer> origin) {
        if (origin == null) {
            throw new NetworkValidationException("Origin mapping must not be null");
        }
        return Collections.unmodifiableMap(new HashMap<>(origin));
    }

    private static void checkOriginRange(Map<String, Integer> origin, int size) {
        for (var e : origin.entrySet()) {
            Integer v = e.getValue();
            if (v == null || v < 0 || v >= size) {
                throw new NetworkValidationException("Origin index " + v + " of label '" + e.getKey()
                        + "' outside 0.." + (size - 1));
            }
        }
    }

    public boolean isLinear() {
        return functions == null;
    }

    /** n0, the node count of the original system. */
    public int originalSize() {
        return originalSize;
    }

    public Map<String, Integer> origin() {
        return origin;
    }

    /**
     * Function in cell (oi, oj) of the original matrix.
     *
     * @throws IllegalStateException if the system is linear.
     */
    public NodeFunction function(int oi, int oj) {
        if (functions == null) {
            throw new IllegalStateException("Linear system has no functional matrix");
        }
        return functions[oi][oj];
    }

    public boolean canResolve(String label) {
        return origin.containsKey(LabelRegistry.canonical(label));
    }

    /**
     * Original index of a (possibly specialized) label.
     *
     * @throws OriginLookupException if the canonical label is not in origin.
     */
    public int resolve(String label) {
        String canonical = LabelRegistry.canonical(label);
        Integer idx = origin.get(canonical);
        if (idx == null) {
            throw new OriginLookupException(label, canonical);
        }
        return idx;
    }
}
