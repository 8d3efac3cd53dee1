package com.spectral.nsp.fn;

import org.junit.Test;

import static org.junit.Assert.*;

public class NodeFunctionsTest {

    private static final double[] POINTS = { -3.0, -0.7, 0.0, 0.4, 2.5 };

    @Test
    public void testValues() {
        assertEquals(0.0, NodeFunctions.zero().apply(12.0), 0.0);
        assertEquals(3.0, NodeFunctions.constant(3.0).apply(-1.0), 0.0);
        assertEquals(-1.0, NodeFunctions.linear(0.5).apply(-2.0), 0.0);
        assertEquals(2.0, NodeFunctions.affine(0.5, 3.0).apply(-2.0), 0.0);
        assertEquals(2 * Math.tanh(0.5), NodeFunctions.tanh(2.0, 0.5).apply(1.0), 1e-15);
        assertEquals(0.5, NodeFunctions.sigmoid(4.0).apply(0.0), 0.0);
        assertEquals(0.0, NodeFunctions.sin(3.0, 2.0).apply(0.0), 0.0);
    }

    @Test
    public void testClosedFormDerivativesMatchCentralDifference() {
        NodeFunction[] fns = {
                NodeFunctions.affine(-1.5, 2.0),
                NodeFunctions.tanh(2.0, 0.5),
                NodeFunctions.sigmoid(3.0),
                NodeFunctions.sin(0.5, 2.0) };
        Differentiator numeric = Differentiator.centralDifference(1e-6);
        for (NodeFunction fn : fns) {
            assertArrayEquals(fn.toString(), numeric.differentiate(fn, POINTS),
                    Differentiator.elementwise().differentiate(fn, POINTS), 1e-6);
        }
    }

    @Test
    public void testDefaultDerivativeForLambdas() {
        NodeFunction cube = x -> x * x * x;
        assertEquals(12.0, cube.derivative(2.0), 1e-6);
        assertEquals(0.0, cube.derivative(0.0), 1e-9);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testCentralDifferenceNeedsPositiveStep() {
        Differentiator.centralDifference(0.0);
    }
}
