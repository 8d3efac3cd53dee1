package com.spectral.nsp.engine;

import com.spectral.nsp.api.NetworkValidationException;

import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Bidirectional mapping between node labels and node indices.
 *
 * The labeler is an array (index -> label) and the indexer a hash map
 * (label -> index); both are fixed at construction and always mutually
 * inverse: {@code index(label(i)) == i} for every i. Reordering never mutates
 * a registry, it rebuilds one.
 *
 * Specialized copies carry labels of the form {@code base.copy[.copy...]};
 * {@link #canonical(String)} strips everything from the first separator to
 * recover the label of the original node.
 */
public final class LabelRegistry {

    /** Separator between a canonical label and its copy numbers. */
    public static final char COPY_SEPARATOR = '.';

    private final String[] labeler;
    private final Map<String, Integer> indexer;

    private LabelRegistry(String[] labeler, Map<String, Integer> indexer) {
        this.labeler = labeler;
        this.indexer = indexer;
    }

    /** Labels "0", "1", ..., "n-1". */
    public static LabelRegistry defaults(int n) {
        if (n < 0) {
            throw new NetworkValidationException("Node count must not be negative: " + n);
        }
        String[] labels = new String[n];
        for (int i = 0; i < n; i++) {
            labels[i] = Integer.toString(i);
        }
        return build(labels);
    }

    /**
     * @throws NetworkValidationException if labels is null, has the wrong
     *                                    length, or holds null or duplicate
     *                                    entries.
     */
    public static LabelRegistry of(List<String> labels, int n) {
        if (labels == null || labels.size() != n) {
            throw new NetworkValidationException("labels must be a string list of length " + n
                    + (labels == null ? " (got null)" : " (got " + labels.size() + ")"));
        }
        return of(labels);
    }

    /**
     * Registry sized to the given labels.
     */
    public static LabelRegistry of(List<String> labels) {
        if (labels == null) {
            throw new NetworkValidationException("labels must not be null");
        }
        String[] arr = new String[labels.size()];
        for (int i = 0; i < arr.length; i++) {
            String label = labels.get(i);
            if (label == null) {
                throw new NetworkValidationException("Label at index " + i + " is null");
            }
            arr[i] = label;
        }
        return build(arr);
    }

    /**
     * Rebuilds a registry from an index -> label mapping. The keys must be
     * exactly {@code 0..n-1}.
     */
    public static LabelRegistry fromLabeler(Map<Integer, String> labeler) {
        int n = labeler.size();
        String[] arr = new String[n];
        for (var e : labeler.entrySet()) {
            int i = e.getKey();
            if (i < 0 || i >= n) {
                throw new NetworkValidationException("Labeler index " + i + " outside 0.." + (n - 1));
            }
            if (e.getValue() == null) {
                throw new NetworkValidationException("Label at index " + i + " is null");
            }
            arr[i] = e.getValue();
        }
        return build(arr);
    }

    /**
     * Rebuilds a registry from a label -> index mapping. The values must be
     * exactly {@code 0..n-1}.
     */
    public static LabelRegistry fromIndexer(Map<String, Integer> indexer) {
        int n = indexer.size();
        String[] arr = new String[n];
        for (var e : indexer.entrySet()) {
            Integer i = e.getValue();
            if (i == null || i < 0 || i >= n) {
                throw new NetworkValidationException("Indexer value " + i + " outside 0.." + (n - 1));
            }
            if (arr[i] != null) {
                throw new NetworkValidationException("Index " + i + " assigned to both '" + arr[i]
                        + "' and '" + e.getKey() + "'");
            }
            arr[i] = e.getKey();
        }
        return build(arr);
    }

    private static LabelRegistry build(String[] labels) {
        Map<String, Integer> idx = new HashMap<>(labels.length * 2);
        for (int i = 0; i < labels.length; i++) {
            Integer prev = idx.put(labels[i], i);
            if (prev != null) {
                throw new NetworkValidationException("Duplicate label '" + labels[i] + "' at indices "
                        + prev + " and " + i);
            }
        }
        return new LabelRegistry(labels, idx);
    }

    /**
     * Registry whose position i holds the label currently at {@code order[i]}.
     * The caller guarantees that order is a permutation of {@code 0..n-1}.
     */
    public LabelRegistry permute(int[] order) {
        String[] next = new String[labeler.length];
        for (int i = 0; i < order.length; i++) {
            next[i] = labeler[order[i]];
        }
        return build(next);
    }

    public int size() {
        return labeler.length;
    }

    public String label(int index) {
        if (index < 0 || index >= labeler.length) {
            throw new IndexOutOfBoundsException("Node index " + index + " outside 0.." + (labeler.length - 1));
        }
        return labeler[index];
    }

    /**
     * @throws NetworkValidationException for an unknown label.
     */
    public int index(String label) {
        Integer idx = indexer.get(label);
        if (idx == null) {
            throw new NetworkValidationException("Unknown node label: " + label);
        }
        return idx;
    }

    public boolean contains(String label) {
        return indexer.containsKey(label);
    }

    public List<String> labels() {
        return Collections.unmodifiableList(Arrays.asList(labeler));
    }

    /** Read-only label -> index view. */
    public Map<String, Integer> indexer() {
        return Collections.unmodifiableMap(indexer);
    }

    /** Fresh index -> label map. */
    public Map<Integer, String> labeler() {
        Map<Integer, String> out = new HashMap<>(labeler.length * 2);
        for (int i = 0; i < labeler.length; i++) {
            out.put(i, labeler[i]);
        }
        return out;
    }

    /**
     * Prefix of the label before the first {@link #COPY_SEPARATOR}, or the label
     * itself when it has none.
     */
    public static String canonical(String label) {
        int cut = label.indexOf(COPY_SEPARATOR);
        return cut == -1 ? label : label.substring(0, cut);
    }

    @Override
    public String toString() {
        return "LabelRegistry" + Arrays.toString(labeler);
    }
}
