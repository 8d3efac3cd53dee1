package com.spectral.nsp.engine;

import com.spectral.nsp.api.NetworkValidationException;
import org.junit.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class LabelRegistryTest {

    @Test
    public void testDefaultsAreDecimalIndices() {
        LabelRegistry r = LabelRegistry.defaults(3);
        assertEquals(List.of("0", "1", "2"), r.labels());
        assertEquals(2, r.index("2"));
    }

    @Test
    public void testLabelerAndIndexerAreInverse() {
        LabelRegistry r = LabelRegistry.of(List.of("x", "y", "z"));
        for (int i = 0; i < r.size(); i++) {
            assertEquals(i, r.index(r.label(i)));
        }
        assertEquals(r.labels(), LabelRegistry.fromIndexer(r.indexer()).labels());
        assertEquals(r.labels(), LabelRegistry.fromLabeler(r.labeler()).labels());
    }

    @Test(expected = NetworkValidationException.class)
    public void testDuplicateLabelRejected() {
        LabelRegistry.of(List.of("x", "y", "x"));
    }

    @Test(expected = NetworkValidationException.class)
    public void testWrongLengthRejected() {
        LabelRegistry.of(List.of("x", "y"), 3);
    }

    @Test(expected = NetworkValidationException.class)
    public void testUnknownLabel() {
        LabelRegistry.of(List.of("x")).index("y");
    }

    @Test(expected = NetworkValidationException.class)
    public void testIndexerWithCollidingIndices() {
        Map<String, Integer> indexer = new HashMap<>();
        indexer.put("x", 0);
        indexer.put("y", 0);
        LabelRegistry.fromIndexer(indexer);
    }

    @Test
    public void testPermuteMovesLabels() {
        LabelRegistry r = LabelRegistry.of(List.of("x", "y", "z")).permute(new int[] { 2, 0, 1 });
        assertEquals(List.of("z", "x", "y"), r.labels());
        assertEquals(0, r.index("z"));
    }

    @Test
    public void testCanonicalStripsFromFirstSeparator() {
        assertEquals("c", LabelRegistry.canonical("c"));
        assertEquals("c", LabelRegistry.canonical("c.1"));
        assertEquals("c", LabelRegistry.canonical("c.1.3"));
    }
}
