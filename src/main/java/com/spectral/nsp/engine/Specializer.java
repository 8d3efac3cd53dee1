package com.spectral.nsp.engine;

import com.spectral.nsp.api.BaseSelector;
import com.spectral.nsp.api.NetworkValidationException;

import lombok.extern.log4j.Log4j2;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;

import java.util.ArrayList;
import java.util.List;

/**
 * Network specialization around a base set, after "Spectral and Dynamic
 * Consequences of Network Specialization" (arXiv:1908.04435).
 *
 * <h2>Algorithm</h2>
 * <ol>
 * <li>Resolve the base set B to indices; the rest forms the specialized set
 * S, kept in its original relative order.</li>
 * <li>Permute rows and columns by {@code B ++ S} so that the adjacency splits
 * into four blocks: B x B, S x S, S x B (into S) and B x S (out of S).</li>
 * <li>numIn and numOut are the summed weights of the two cross blocks;
 * {@code numCopies = floor(numIn * numOut)}.</li>
 * <li>The result is block diagonal: the B x B block followed by numCopies
 * verbatim copies of the S x S block.</li>
 * <li>Rewiring: inbound edges (outer loop) are paired with outbound edges
 * (inner loop), both enumerated row-major. Pairing c gives copy c exactly
 * that one inbound and that one outbound connection; all other cross entries
 * of the copy stay zero.</li>
 * <li>Copy c (1-based) of node s is labelled {@code s + "." + c}. The
 * functional system is shared unchanged.</li>
 * </ol>
 *
 * The replication count comes from summed weights while pairing runs over edge
 * occurrences. If {@code numCopies != |inEdges| x |outEdges|} the plan fails
 * instead of producing a mis-shaped matrix.
 *
 * Rewiring costs O(|inEdges| x |outEdges|), bounded by the boundary, not by the
 * size of the network.
 */
@Log4j2
public final class Specializer {

    private Specializer() {
    }

    /**
     * Specializes {@code network} around {@code base}.
     *
     * @return A new, larger network sharing the input's functional system.
     * @throws NetworkValidationException for unknown, duplicate or too many
     *                                    base identifiers, or when the weight
     *                                    product does not match the number of
     *                                    boundary-edge pairings.
     */
    public static Network specialize(Network network, BaseSelector base) {
        return execute(plan(network, base));
    }

    /**
     * Runs steps 1-3 of the algorithm and counts the boundary without
     * assembling the result.
     */
    public static SpecializationPlan plan(Network network, BaseSelector base) {
        if (base == null) {
            throw new NetworkValidationException("Base selector must not be null");
        }
        final int n = network.nodeCount();
        if (base.size() > n) {
            throw new NetworkValidationException("base list is too long: " + base.size() + " > " + n);
        }

        List<Integer> baseIdx = resolve(network, base);

        boolean[] inBase = new boolean[n];
        for (int b : baseIdx) {
            if (inBase[b]) {
                throw new NetworkValidationException("Node '" + network.label(b) + "' appears twice in the base set");
            }
            inBase[b] = true;
        }
        List<Integer> specIdx = new ArrayList<>(n - baseIdx.size());
        for (int i = 0; i < n; i++) {
            if (!inBase[i]) {
                specIdx.add(i);
            }
        }

        int[] order = new int[n];
        int p = 0;
        for (int b : baseIdx) {
            order[p++] = b;
        }
        for (int s : specIdx) {
            order[p++] = s;
        }
        Network permuted = network.permute(order);

        final int b = baseIdx.size();
        DMatrixSparseCSC intoSpec = permuted.subBlock(b, n, 0, b);
        DMatrixSparseCSC outOfSpec = permuted.subBlock(0, b, b, n);

        double numIn = SparseBlocks.sum(intoSpec);
        double numOut = SparseBlocks.sum(outOfSpec);
        double product = Math.floor(numIn * numOut);
        List<BoundaryEdge> inEdges = SparseBlocks.nonZerosRowMajor(intoSpec);
        List<BoundaryEdge> outEdges = SparseBlocks.nonZerosRowMajor(outOfSpec);

        long pairings = (long) inEdges.size() * outEdges.size();
        if (product != pairings) {
            throw new NetworkValidationException("Replication count floor(" + numIn + " * " + numOut + ") = "
                    + product + " does not match " + inEdges.size() + " inbound x " + outEdges.size()
                    + " outbound boundary edges = " + pairings + " pairings");
        }
        long resultSize = b + pairings * specIdx.size();
        if (resultSize > Integer.MAX_VALUE) {
            throw new NetworkValidationException("Specialized network would have " + resultSize + " nodes");
        }

        log.info("Specialization plan: base={}, spec={}, numIn={}, numOut={}, copies={}, resultSize={}",
                b, specIdx.size(), numIn, numOut, pairings, resultSize);

        return new SpecializationPlan(permuted, baseIdx, specIdx, numIn, numOut, (int) pairings, inEdges, outEdges);
    }

    /**
     * Assembles the specialized network described by a plan.
     */
    public static Network execute(SpecializationPlan plan) {
        final Network permuted = plan.permuted();
        final int n = permuted.nodeCount();
        final int b = plan.baseSize();
        final int s = plan.specSize();
        final int copies = plan.numCopies();
        final int size = plan.resultSize();

        DMatrixSparseCSC baseBlock = permuted.subBlock(0, b, 0, b);
        DMatrixSparseCSC specBlock = permuted.subBlock(b, n, b, n);

        DMatrixSparseTriplet t = new DMatrixSparseTriplet(size, size,
                tripletCapacity(baseBlock.nz_length, specBlock.nz_length, copies));

        // Block diagonal: base block, then the specialized block once per copy.
        addBlock(t, baseBlock, 0);
        for (int c = 0; c < copies; c++) {
            addBlock(t, specBlock, plan.copyOffset(c));
        }

        // Each (inbound, outbound) pairing owns exactly one copy.
        int c = 0;
        for (BoundaryEdge in : plan.inEdges()) {
            for (BoundaryEdge out : plan.outEdges()) {
                int offset = plan.copyOffset(c);
                t.addItem(offset + in.row(), in.col(), in.weight());
                t.addItem(out.row(), offset + out.col(), out.weight());
                if (log.isDebugEnabled()) {
                    log.debug("Copy {}: in {} -> {}.{}, out {}.{} -> {}", c + 1,
                            permuted.label(in.col()), permuted.label(b + in.row()), c + 1,
                            permuted.label(b + out.col()), c + 1, permuted.label(out.row()));
                }
                c++;
            }
        }

        List<String> labels = new ArrayList<>(size);
        for (int i = 0; i < b; i++) {
            labels.add(permuted.label(i));
        }
        for (int copy = 1; copy <= copies; copy++) {
            for (int j = 0; j < s; j++) {
                labels.add(permuted.label(b + j) + LabelRegistry.COPY_SEPARATOR + copy);
            }
        }

        return new Network(SparseBlocks.toCsc(t), LabelRegistry.of(labels, size), permuted.functionalSystem());
    }

    /**
     * Nonzeros of the result: the base block, plus per copy the specialized
     * block and its two boundary edges.
     *
     * @throws NetworkValidationException if the count does not fit an int.
     */
    static int tripletCapacity(int baseNonZeros, int specNonZeros, int copies) {
        long nnz = baseNonZeros + (long) copies * (specNonZeros + 2L);
        if (nnz > Integer.MAX_VALUE) {
            throw new NetworkValidationException("Specialized network would have " + nnz + " nonzero entries");
        }
        return (int) nnz;
    }

    private static void addBlock(DMatrixSparseTriplet t, DMatrixSparseCSC block, int offset) {
        for (int col = 0; col < block.numCols; col++) {
            for (int k = block.col_idx[col]; k < block.col_idx[col + 1]; k++) {
                t.addItem(offset + block.nz_rows[k], offset + col, block.nz_values[k]);
            }
        }
    }

    private static List<Integer> resolve(Network network, BaseSelector base) {
        List<Integer> out = new ArrayList<>(base.size());
        if (base instanceof BaseSelector.ByLabel byLabel) {
            for (String label : byLabel.labels()) {
                out.add(network.index(label));
            }
        } else if (base instanceof BaseSelector.ByIndex byIndex) {
            int n = network.nodeCount();
            for (int i : byIndex.indices()) {
                if (i < 0 || i >= n) {
                    throw new NetworkValidationException("Unknown node index " + i + " (network has " + n + " nodes)");
                }
                out.add(i);
            }
        }
        return out;
    }
}
