package com.spectral.nsp.util;

import com.spectral.nsp.engine.Network;

import org.ejml.data.DMatrixSparseCSC;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Diagnostic text renderings of a network.
 *
 * <p>
 * <b>Usage:</b> debugging sessions and log messages. Builds strings and walks
 * the whole adjacency; keep it away from simulation loops.
 */
public final class NetworkExplain {
    private final Network network;
    private final DMatrixSparseCSC adjacency;

    public NetworkExplain(Network network) {
        this.network = network;
        this.adjacency = network.adjacency();
    }

    /**
     * Dumps one node: index, canonical label, origin index and its in/out edges.
     */
    public String explainNode(String label) {
        int idx = network.index(label);
        StringBuilder sb = new StringBuilder(256);
        sb.append("Node: ").append(label).append('\n')
                .append("  Index: ").append(idx).append('\n')
                .append("  Canonical: ").append(network.canonicalLabel(idx)).append('\n')
                .append("  Original index: ").append(network.original(idx)).append('\n');

        List<String> in = new ArrayList<>();
        for (int k = 0; k < adjacency.numCols; k++) {
            double w = adjacency.get(idx, k);
            if (w != 0.0) {
                in.add(network.label(k) + " (" + format(w) + ")");
            }
        }
        List<String> out = new ArrayList<>();
        for (int k = adjacency.col_idx[idx]; k < adjacency.col_idx[idx + 1]; k++) {
            if (adjacency.nz_values[k] != 0.0) {
                out.add(network.label(adjacency.nz_rows[k]) + " (" + format(adjacency.nz_values[k]) + ")");
            }
        }
        sb.append("  Inputs (").append(in.size()).append("): ").append(String.join(", ", in)).append('\n');
        sb.append("  Outputs (").append(out.size()).append("): ").append(String.join(", ", out)).append('\n');
        return sb.toString();
    }

    /**
     * Dumps every node with its outgoing edges.
     */
    public String dumpTopology() {
        StringBuilder sb = new StringBuilder(1024);
        sb.append("Network (").append(network.nodeCount()).append(" nodes, ")
                .append(network.edgeCount()).append(" edges, ")
                .append(network.hasFunctions() ? "nonlinear" : "linear").append("):\n");
        for (int j = 0; j < network.nodeCount(); j++) {
            sb.append("  [").append(j).append("] ").append(network.label(j));
            int start = adjacency.col_idx[j], end = adjacency.col_idx[j + 1];
            boolean first = true;
            for (int k = start; k < end; k++) {
                if (adjacency.nz_values[k] == 0.0) {
                    continue;
                }
                sb.append(first ? " -> " : ", ");
                sb.append(network.label(adjacency.nz_rows[k])).append('(').append(format(adjacency.nz_values[k]))
                        .append(')');
                first = false;
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    /**
     * Mermaid flowchart of the network, edges labelled with their weights.
     * Copies of the same original node share a class so they can be styled
     * together.
     */
    public String toMermaid() {
        StringBuilder sb = new StringBuilder(4096);
        sb.append("graph LR;\n");
        for (int i = 0; i < network.nodeCount(); i++) {
            sb.append("  ").append(id(i)).append("[\"").append(network.label(i)).append("\"]");
            sb.append(":::").append(sanitize("origin_" + network.canonicalLabel(i))).append(";\n");
        }
        for (int j = 0; j < adjacency.numCols; j++) {
            for (int k = adjacency.col_idx[j]; k < adjacency.col_idx[j + 1]; k++) {
                double w = adjacency.nz_values[k];
                if (w == 0.0) {
                    continue;
                }
                sb.append("  ").append(id(j)).append(" -- \"").append(format(w)).append("\" --> ")
                        .append(id(adjacency.nz_rows[k])).append(";\n");
            }
        }
        return sb.toString();
    }

    private String id(int index) {
        return "n" + index + "_" + sanitize(network.label(index));
    }

    private static String sanitize(String name) {
        return name.replaceAll("[^a-zA-Z0-9_]", "_");
    }

    private static String format(double w) {
        return w == Math.rint(w) && Math.abs(w) < 1e15 ? Long.toString((long) w) : String.format(Locale.ROOT, "%.4f", w);
    }
}
