package com.spectral.nsp.api;

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.*;

public class BaseSelectorTest {

    @Test
    public void testStringsBecomeLabelSelector() {
        BaseSelector sel = BaseSelector.of(List.of("a", "b"));
        assertTrue(sel instanceof BaseSelector.ByLabel);
        assertEquals(List.of("a", "b"), ((BaseSelector.ByLabel) sel).labels());
        assertEquals(2, sel.size());
    }

    @Test
    public void testIntegersBecomeIndexSelector() {
        BaseSelector sel = BaseSelector.of(List.of(2, 0L));
        assertTrue(sel instanceof BaseSelector.ByIndex);
        assertEquals(List.of(2, 0), ((BaseSelector.ByIndex) sel).indices());
    }

    @Test
    public void testEmptyListIsAnEmptySelection() {
        assertEquals(0, BaseSelector.of(Collections.emptyList()).size());
    }

    @Test(expected = NetworkValidationException.class)
    public void testMixedKindsRejected() {
        BaseSelector.of(Arrays.asList("a", 1));
    }

    @Test(expected = NetworkValidationException.class)
    public void testFractionalIndexRejected() {
        BaseSelector.of(List.of(1.5));
    }

    @Test(expected = NetworkValidationException.class)
    public void testNullLabelRejected() {
        BaseSelector.byLabel("a", null);
    }

    @Test
    public void testSelectorIsDetachedFromCallerList() {
        List<Integer> indices = new ArrayList<>(List.of(0, 1));
        BaseSelector sel = BaseSelector.byIndex(indices);
        indices.add(2);
        assertEquals(2, sel.size());
    }
}
