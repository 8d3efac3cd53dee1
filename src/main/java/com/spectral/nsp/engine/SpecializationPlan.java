package com.spectral.nsp.engine;

import java.util.List;

/**
 * Everything the specializer derived from a network and a base set before
 * assembling the result.
 *
 * @param permuted    The input network with the base block moved first.
 * @param baseIndices Base nodes as indices of the input network, in the order
 *                    given.
 * @param specIndices Remaining nodes as indices of the input network, in
 *                    their original relative order.
 * @param numIn       Summed weight of the edges from the base into the
 *                    specialized set.
 * @param numOut      Summed weight of the edges from the specialized set into
 *                    the base.
 * @param numCopies   floor(numIn * numOut), the number of replicas of the
 *                    specialized block.
 * @param inEdges     Nonzero entries of the into-spec block, row-major.
 * @param outEdges    Nonzero entries of the out-of-spec block, row-major.
 */
public record SpecializationPlan(
        Network permuted,
        List<Integer> baseIndices,
        List<Integer> specIndices,
        double numIn,
        double numOut,
        int numCopies,
        List<BoundaryEdge> inEdges,
        List<BoundaryEdge> outEdges) {

    public SpecializationPlan {
        baseIndices = List.copyOf(baseIndices);
        specIndices = List.copyOf(specIndices);
        inEdges = List.copyOf(inEdges);
        outEdges = List.copyOf(outEdges);
    }

    public int baseSize() {
        return baseIndices.size();
    }

    public int specSize() {
        return specIndices.size();
    }

    /** Node count of the specialized network. */
    public int resultSize() {
        return baseSize() + numCopies * specSize();
    }

    /** First row/column of copy {@code c} (0-based) in the result. */
    public int copyOffset(int c) {
        return baseSize() + c * specSize();
    }
}
