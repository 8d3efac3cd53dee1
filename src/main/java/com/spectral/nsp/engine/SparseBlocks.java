package com.spectral.nsp.engine;

import com.spectral.nsp.api.NetworkValidationException;

import org.ejml.data.DMatrixSparseCSC;
import org.ejml.data.DMatrixSparseTriplet;
import org.ejml.ops.DConvertMatrixStruct;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Block bookkeeping on EJML compressed-sparse-column matrices.
 *
 * All results are assembled through a {@link DMatrixSparseTriplet} and
 * converted once, so callers never pay for incremental CSC insertion. Stored
 * zeros are dropped on the way.
 */
final class SparseBlocks {

    private static final Comparator<BoundaryEdge> ROW_MAJOR = Comparator.comparingInt(BoundaryEdge::row)
            .thenComparingInt(BoundaryEdge::col);

    private SparseBlocks() {
    }

    static DMatrixSparseCSC fromDense(double[][] dense) {
        if (dense == null) {
            throw new NetworkValidationException("Adjacency must not be null");
        }
        int n = dense.length;
        DMatrixSparseTriplet t = new DMatrixSparseTriplet(n, n, n * 4);
        for (int i = 0; i < n; i++) {
            if (dense[i] == null || dense[i].length != n) {
                throw new NetworkValidationException("Matrix not square: row " + i + " has "
                        + (dense[i] == null ? 0 : dense[i].length) + " columns, expected " + n);
            }
            for (int j = 0; j < n; j++) {
                if (dense[i][j] != 0.0) {
                    t.addItem(i, j, dense[i][j]);
                }
            }
        }
        return toCsc(t);
    }

    static DMatrixSparseCSC toCsc(DMatrixSparseTriplet triplet) {
        DMatrixSparseCSC csc = DConvertMatrixStruct.convert(triplet, (DMatrixSparseCSC) null);
        csc.sortIndices(null);
        return csc;
    }

    /** Sub-block rows [row0,row1), columns [col0,col1). */
    static DMatrixSparseCSC extract(DMatrixSparseCSC src, int row0, int row1, int col0, int col1) {
        if (row0 < 0 || row1 < row0 || row1 > src.numRows || col0 < 0 || col1 < col0 || col1 > src.numCols) {
            throw new IndexOutOfBoundsException("Block [" + row0 + "," + row1 + ")x[" + col0 + "," + col1
                    + ") outside " + src.numRows + "x" + src.numCols);
        }
        DMatrixSparseTriplet t = new DMatrixSparseTriplet(row1 - row0, col1 - col0, 0);
        for (int c = col0; c < col1; c++) {
            for (int k = src.col_idx[c]; k < src.col_idx[c + 1]; k++) {
                int r = src.nz_rows[k];
                double v = src.nz_values[k];
                if (r >= row0 && r < row1 && v != 0.0) {
                    t.addItem(r - row0, c - col0, v);
                }
            }
        }
        return toCsc(t);
    }

    /**
     * Symmetric permutation: result(i, j) = src(order[i], order[j]).
     */
    static DMatrixSparseCSC permute(DMatrixSparseCSC src, int[] order) {
        int n = order.length;
        int[] inverse = new int[n];
        for (int i = 0; i < n; i++) {
            inverse[order[i]] = i;
        }
        DMatrixSparseTriplet t = new DMatrixSparseTriplet(n, n, src.nz_length);
        for (int c = 0; c < src.numCols; c++) {
            for (int k = src.col_idx[c]; k < src.col_idx[c + 1]; k++) {
                double v = src.nz_values[k];
                if (v != 0.0) {
                    t.addItem(inverse[src.nz_rows[k]], inverse[c], v);
                }
            }
        }
        return toCsc(t);
    }

    static double sum(DMatrixSparseCSC m) {
        double total = 0.0;
        for (int k = 0; k < m.nz_length; k++) {
            total += m.nz_values[k];
        }
        return total;
    }

    /** Nonzero entries ordered by row, then column. */
    static List<BoundaryEdge> nonZerosRowMajor(DMatrixSparseCSC m) {
        List<BoundaryEdge> out = new ArrayList<>(m.nz_length);
        for (int c = 0; c < m.numCols; c++) {
            for (int k = m.col_idx[c]; k < m.col_idx[c + 1]; k++) {
                if (m.nz_values[k] != 0.0) {
                    out.add(new BoundaryEdge(m.nz_rows[k], c, m.nz_values[k]));
                }
            }
        }
        out.sort(ROW_MAJOR);
        return out;
    }

    static int nonZeroCount(DMatrixSparseCSC m) {
        int count = 0;
        for (int k = 0; k < m.nz_length; k++) {
            if (m.nz_values[k] != 0.0) {
                count++;
            }
        }
        return count;
    }

    static double[][] toDense(DMatrixSparseCSC m) {
        double[][] out = new double[m.numRows][m.numCols];
        for (int c = 0; c < m.numCols; c++) {
            for (int k = m.col_idx[c]; k < m.col_idx[c + 1]; k++) {
                out[m.nz_rows[k]][c] += m.nz_values[k];
            }
        }
        return out;
    }
}
