package com.spectral.nsp.engine;

/**
 * A nonzero entry of one of the cross blocks of a specialization.
 *
 * For an inbound edge, {@code row} is relative to the specialized block and
 * {@code col} is a base column. For an outbound edge, {@code row} is a base row
 * and {@code col} is relative to the specialized block.
 */
public record BoundaryEdge(int row, int col, double weight) {
}
