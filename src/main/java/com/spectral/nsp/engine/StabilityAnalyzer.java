package com.spectral.nsp.engine;

import com.spectral.nsp.fn.Differentiator;
import com.spectral.nsp.fn.NodeFunction;

import lombok.extern.log4j.Log4j2;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.EigenDecomposition_F64;

/**
 * Local stability estimate from the spectral radius of a Jacobian bound.
 *
 * <p>
 * With a functional matrix, {@code Df[i][j]} is the largest absolute
 * derivative of {@code F[oi,oj]} over the sampled domain. Copies of one
 * original node share their functions, so suprema are computed once per
 * original cell. Without a functional matrix the dynamics are {@code x -> Ax}
 * and the bound is {@code |A[i][j]|}.
 *
 * <p>
 * A radius below 1 typically implies local stability. The matrix is computed
 * on first use and kept, since the network cannot change.
 */
@Log4j2
public final class StabilityAnalyzer {
    private final Network network;
    private final StabilityConfig config;
    private final Differentiator differentiator;

    private double[][] stabilityMatrix;

    public StabilityAnalyzer(Network network) {
        this(network, StabilityConfig.DEFAULT, Differentiator.elementwise());
    }

    public StabilityAnalyzer(Network network, StabilityConfig config) {
        this(network, config, Differentiator.elementwise());
    }

    public StabilityAnalyzer(Network network, StabilityConfig config, Differentiator differentiator) {
        this.network = network;
        this.config = config;
        this.differentiator = differentiator;
    }

    public StabilityConfig config() {
        return config;
    }

    /**
     * @return A fresh n x n copy of the stability matrix.
     */
    public double[][] stabilityMatrix() {
        if (stabilityMatrix == null) {
            stabilityMatrix = network.hasFunctions() ? functionalBound() : linearBound();
        }
        double[][] out = new double[stabilityMatrix.length][];
        for (int i = 0; i < out.length; i++) {
            out[i] = stabilityMatrix[i].clone();
        }
        return out;
    }

    /**
     * Largest eigenvalue modulus of the stability matrix; 0 for an empty
     * network.
     *
     * @throws IllegalStateException if the eigen decomposition fails.
     */
    public double spectralRadius() {
        double[][] df = stabilityMatrix();
        int n = df.length;
        if (n == 0) {
            return 0.0;
        }

        EigenDecomposition_F64<DMatrixRMaj> eig = DecompositionFactory_DDRM.eig(n, false);
        if (!eig.decompose(new DMatrixRMaj(df))) {
            throw new IllegalStateException("Eigen decomposition of the " + n + "x" + n + " stability matrix failed");
        }

        double radius = 0.0;
        for (int k = 0; k < eig.getNumberOfEigenvalues(); k++) {
            radius = Math.max(radius, eig.getEigenvalue(k).getMagnitude());
        }
        return radius;
    }

    public StabilityVerdict verdict() {
        double radius = spectralRadius();
        StabilityVerdict verdict = StabilityVerdict.of(radius, config.threshold());
        log.info("Spectral radius {} on {} nodes: {}", radius, network.nodeCount(),
                verdict.stable() ? "stable" : "not shown stable");
        return verdict;
    }

    private double[][] functionalBound() {
        final int n = network.nodeCount();
        final FunctionalSystem system = network.functionalSystem();
        final int n0 = system.originalSize();
        final double[] points = config.samplePoints();

        int[] o = new int[n];
        for (int i = 0; i < n; i++) {
            o[i] = network.original(i);
        }

        // sup |F'| per original cell
        double[][] sup = new double[n0][n0];
        boolean[][] known = new boolean[n0][n0];

        double[][] df = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = 0; j < n; j++) {
                int oi = o[i], oj = o[j];
                if (!known[oi][oj]) {
                    sup[oi][oj] = maxAbs(differentiator.differentiate(system.function(oi, oj), points));
                    known[oi][oj] = true;
                }
                df[i][j] = sup[oi][oj];
            }
        }
        log.debug("Stability matrix for {} nodes from {} original cells over [{}, {}] x {}",
                n, n0 * n0, config.lower(), config.upper(), config.samples());
        return df;
    }

    private double[][] linearBound() {
        double[][] df = SparseBlocks.toDense(network.matrix());
        for (double[] row : df) {
            for (int j = 0; j < row.length; j++) {
                row[j] = Math.abs(row[j]);
            }
        }
        return df;
    }

    private static double maxAbs(double[] values) {
        double max = 0.0;
        for (double v : values) {
            double a = Math.abs(v);
            if (a > max || Double.isNaN(a)) {
                max = a;
            }
        }
        return max;
    }

    /** Exposed for callers that want the derivative bound of a single function. */
    public double supremum(NodeFunction function) {
        return maxAbs(differentiator.differentiate(function, config.samplePoints()));
    }
}
