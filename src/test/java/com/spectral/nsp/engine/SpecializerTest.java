package com.spectral.nsp.engine;

import com.spectral.nsp.api.BaseSelector;
import com.spectral.nsp.api.NetworkValidationException;
import com.spectral.nsp.fn.NodeFunction;
import com.spectral.nsp.fn.NodeFunctions;
import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.*;

public class SpecializerTest {

    // a <-> b hubs with the chain a -> c -> d -> b
    private static Network hubChain(double in, double out) {
        return Network.builder()
                .nodes("a", "b", "c", "d")
                .edge("a", "b", 1.0)
                .edge("b", "a", 1.0)
                .edge("a", "c", in)
                .edge("c", "d", 1.0)
                .edge("d", "b", out)
                .build();
    }

    // a feeds both c and d, d feeds back into a, c -> d inside the specialized set
    private static Network fanIn() {
        return Network.builder()
                .nodes("a", "c", "d")
                .edge("a", "c", 1.0)
                .edge("a", "d", 1.0)
                .edge("d", "a", 1.0)
                .edge("c", "d", 4.0)
                .build();
    }

    @Test
    public void testNoEdgesIntoSpecializedSetMeansNoCopies() {
        // edges 1 -> 0 (weight 2) and 2 -> 0 (weight 1)
        Network net = Network.of(new double[][] {
                { 0, 2, 1 },
                { 0, 0, 0 },
                { 0, 0, 0 } });

        SpecializationPlan plan = Specializer.plan(net, BaseSelector.byIndex(0));
        assertEquals(0.0, plan.numIn(), 0.0);
        assertEquals(3.0, plan.numOut(), 0.0);
        assertEquals(0, plan.numCopies());

        Network result = Specializer.execute(plan);
        assertEquals(1, result.nodeCount());
        assertEquals(List.of("0"), result.labels());
        assertEquals(0.0, result.weight(0, 0), 0.0);
    }

    @Test
    public void testNoEdgesOutOfSpecializedSetMeansNoCopies() {
        // edges 0 -> 1 and 1 -> 2, nothing returns to 0
        Network net = Network.of(new double[][] {
                { 0, 0, 0 },
                { 1, 0, 0 },
                { 0, 1, 0 } });

        SpecializationPlan plan = Specializer.plan(net, BaseSelector.byIndex(0));
        assertEquals(1.0, plan.numIn(), 0.0);
        assertEquals(0.0, plan.numOut(), 0.0);
        assertEquals(0, plan.numCopies());
        assertTrue(plan.outEdges().isEmpty());

        Network result = Specializer.execute(plan);
        assertEquals(1, result.nodeCount());
        assertEquals(List.of("0"), result.labels());
        assertEquals(0.0, result.weight(0, 0), 0.0);
    }

    @Test
    public void testSingleInboundAndOutboundGiveOneCopy() {
        Network net = hubChain(2.0, 0.5);
        SpecializationPlan plan = Specializer.plan(net, BaseSelector.byLabel("a", "b"));
        assertEquals(2.0, plan.numIn(), 0.0);
        assertEquals(0.5, plan.numOut(), 0.0);
        assertEquals(1, plan.numCopies());

        Network result = Specializer.execute(plan);
        assertEquals(List.of("a", "b", "c.1", "d.1"), result.labels());
        // boundary weights carried over unchanged
        assertEquals(2.0, result.weight("a", "c.1"), 0.0);
        assertEquals(0.5, result.weight("d.1", "b"), 0.0);
        // base and specialized blocks as in the input
        assertEquals(1.0, result.weight("a", "b"), 0.0);
        assertEquals(1.0, result.weight("b", "a"), 0.0);
        assertEquals(1.0, result.weight("c.1", "d.1"), 0.0);
        assertEquals(5, result.edgeCount());
    }

    @Test
    public void testPairingsAssignOneCopyEach() {
        Network result = fanIn().specializeByLabel("a");

        assertEquals(List.of("a", "c.1", "d.1", "c.2", "d.2"), result.labels());
        // size = |B| + numCopies * |S|
        assertEquals(1 + 2 * 2, result.nodeCount());

        // copy 1 gets the first inbound edge (into c), copy 2 the second (into d)
        assertEquals(1.0, result.weight("a", "c.1"), 0.0);
        assertEquals(0.0, result.weight("a", "d.1"), 0.0);
        assertEquals(0.0, result.weight("a", "c.2"), 0.0);
        assertEquals(1.0, result.weight("a", "d.2"), 0.0);

        // both copies return through d
        assertEquals(1.0, result.weight("d.1", "a"), 0.0);
        assertEquals(1.0, result.weight("d.2", "a"), 0.0);

        // the specialized block is replicated verbatim
        assertEquals(4.0, result.weight("c.1", "d.1"), 0.0);
        assertEquals(4.0, result.weight("c.2", "d.2"), 0.0);
        assertEquals(0.0, result.weight("c.1", "d.2"), 0.0);

        assertEquals(6, result.edgeCount());
    }

    @Test
    public void testBaseOrderDrivesPermutation() {
        Network net = hubChain(1.0, 1.0);
        SpecializationPlan plan = Specializer.plan(net, BaseSelector.byIndex(1, 0));
        assertEquals(List.of(1, 0), plan.baseIndices());
        assertEquals(List.of(2, 3), plan.specIndices());
        assertEquals(List.of("b", "a", "c", "d"), plan.permuted().labels());
        assertEquals(List.of("b", "a", "c.1", "d.1"), Specializer.execute(plan).labels());
    }

    @Test
    public void testFullBaseKeepsNetwork() {
        Network net = hubChain(1.0, 1.0);
        Network result = net.specializeByLabel("d", "c", "b", "a");
        assertEquals(List.of("d", "c", "b", "a"), result.labels());
        assertEquals(net.edgeCount(), result.edgeCount());
        for (String from : net.labels()) {
            for (String to : net.labels()) {
                assertEquals(net.weight(from, to), result.weight(from, to), 0.0);
            }
        }
    }

    @Test
    public void testEmptyBaseGivesEmptyNetwork() {
        Network result = hubChain(1.0, 1.0).specializeByIndex();
        assertEquals(0, result.nodeCount());
    }

    @Test
    public void testSpecializedNetworkSharesFunctionalSystem() {
        NodeFunction[][] f = new NodeFunction[3][3];
        for (NodeFunction[] row : f) {
            Arrays.fill(row, NodeFunctions.linear(1.0));
        }
        Network net = Network.builder()
                .nodes("a", "c", "d")
                .edge("a", "c", 1.0)
                .edge("a", "d", 1.0)
                .edge("d", "a", 1.0)
                .functions(f)
                .build();
        Network result = net.specializeByLabel("a");
        assertSame(net.functionalSystem(), result.functionalSystem());
        assertEquals(3, result.functionalSystem().originalSize());
        assertEquals(1, result.original(result.index("c.2")));
        assertEquals(2, result.original(result.index("d.1")));
    }

    @Test
    public void testRespecializationResolvesToOriginal() {
        Network once = hubChain(1.0, 1.0).specializeByLabel("a", "b");
        Network twice = once.specializeByLabel("a", "b");
        assertEquals(List.of("a", "b", "c.1.1", "d.1.1"), twice.labels());
        assertEquals(2, twice.original(twice.index("c.1.1")));
        assertEquals(3, twice.original(twice.index("d.1.1")));
        assertEquals("c", twice.canonicalLabel(2));
    }

    @Test
    public void testInputNetworkUnchanged() {
        Network net = fanIn();
        net.specializeByLabel("a");
        assertEquals(List.of("a", "c", "d"), net.labels());
        assertEquals(4, net.edgeCount());
    }

    @Test(expected = NetworkValidationException.class)
    public void testWeightProductMismatchFailsFast() {
        // numIn = 2 from a single edge, so floor(2 * 1) != 1 x 1 pairings
        Network net = Network.builder()
                .nodes("a", "b", "c")
                .edge("a", "b", 2.0)
                .edge("b", "a", 1.0)
                .build();
        net.specializeByLabel("a");
    }

    @Test
    public void testTripletCapacityCountsBoundaryEdgesPerCopy() {
        assertEquals(3 + 4 * (5 + 2), Specializer.tripletCapacity(3, 5, 4));
        assertEquals(0, Specializer.tripletCapacity(0, 7, 0));
    }

    @Test(expected = NetworkValidationException.class)
    public void testTripletCapacityOverflowRejected() {
        // node count still fits an int, the nonzero count does not
        Specializer.tripletCapacity(10, 100_000, 50_000);
    }

    @Test(expected = NetworkValidationException.class)
    public void testUnknownLabel() {
        fanIn().specializeByLabel("zz");
    }

    @Test(expected = NetworkValidationException.class)
    public void testIndexOutOfRange() {
        fanIn().specializeByIndex(3);
    }

    @Test(expected = NetworkValidationException.class)
    public void testDuplicateBaseEntry() {
        fanIn().specializeByLabel("a", "a");
    }

    @Test(expected = NetworkValidationException.class)
    public void testBaseLongerThanNetwork() {
        fanIn().specializeByIndex(0, 1, 2, 0);
    }

    @Test(expected = NetworkValidationException.class)
    public void testNullSelector() {
        fanIn().specialize(null);
    }
}
