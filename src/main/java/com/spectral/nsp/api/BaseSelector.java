package com.spectral.nsp.api;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Identifies the base set of a specialization, either by node label or by
 * node index. The two forms never mix.
 *
 * <p>
 * Use {@link #byLabel(String...)} or {@link #byIndex(int...)} from code. The
 * untyped {@link #of(List)} exists for inputs that arrive without a static
 * type, such as the {@code base} list of a JSON network definition.
 */
public sealed interface BaseSelector permits BaseSelector.ByLabel, BaseSelector.ByIndex {

    /** Number of identifiers in the selection, duplicates included. */
    int size();

    /** Base set given as node labels. */
    record ByLabel(List<String> labels) implements BaseSelector {
        public ByLabel {
            if (labels == null) {
                throw new NetworkValidationException("Base label list must not be null");
            }
            for (String label : labels) {
                if (label == null) {
                    throw new NetworkValidationException("Base label list contains null");
                }
            }
            labels = List.copyOf(labels);
        }

        @Override
        public int size() {
            return labels.size();
        }
    }

    /** Base set given as node indices. */
    record ByIndex(List<Integer> indices) implements BaseSelector {
        public ByIndex {
            if (indices == null) {
                throw new NetworkValidationException("Base index list must not be null");
            }
            for (Integer index : indices) {
                if (index == null) {
                    throw new NetworkValidationException("Base index list contains null");
                }
            }
            indices = List.copyOf(indices);
        }

        @Override
        public int size() {
            return indices.size();
        }
    }

    static BaseSelector byLabel(String... labels) {
        return new ByLabel(Arrays.asList(labels));
    }

    static BaseSelector byLabel(List<String> labels) {
        return new ByLabel(labels);
    }

    static BaseSelector byIndex(int... indices) {
        List<Integer> list = new ArrayList<>(indices.length);
        for (int i : indices) {
            list.add(i);
        }
        return new ByIndex(list);
    }

    static BaseSelector byIndex(List<Integer> indices) {
        return new ByIndex(indices);
    }

    /**
     * Builds a selector from an untyped identifier list. All elements must be
     * strings, or all must be integral numbers.
     *
     * @throws NetworkValidationException if the list mixes kinds or holds
     *                                    anything else.
     */
    static BaseSelector of(List<?> identifiers) {
        if (identifiers == null) {
            throw new NetworkValidationException("Base identifier list must not be null");
        }
        if (identifiers.isEmpty()) {
            return new ByIndex(Collections.emptyList());
        }

        Object first = identifiers.get(0);
        if (first instanceof String) {
            List<String> labels = new ArrayList<>(identifiers.size());
            for (Object id : identifiers) {
                if (!(id instanceof String s)) {
                    throw mixed(id);
                }
                labels.add(s);
            }
            return new ByLabel(labels);
        }
        if (isIntegral(first)) {
            List<Integer> indices = new ArrayList<>(identifiers.size());
            for (Object id : identifiers) {
                if (!isIntegral(id)) {
                    throw mixed(id);
                }
                long v = ((Number) id).longValue();
                if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE) {
                    throw new NetworkValidationException("Base index out of range: " + v);
                }
                indices.add((int) v);
            }
            return new ByIndex(indices);
        }
        throw new NetworkValidationException(
                "Base set must be either a list of labels or a list of indices, got " + describe(first));
    }

    private static boolean isIntegral(Object o) {
        return o instanceof Integer || o instanceof Long || o instanceof Short || o instanceof Byte;
    }

    private static NetworkValidationException mixed(Object offending) {
        return new NetworkValidationException(
                "Base set mixes labels and indices (offending element: " + describe(offending) + ")");
    }

    private static String describe(Object o) {
        return o == null ? "null" : o.getClass().getSimpleName() + " " + o;
    }
}
