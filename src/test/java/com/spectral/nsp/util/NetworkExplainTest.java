package com.spectral.nsp.util;

import com.spectral.nsp.engine.Network;
import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.*;

public class NetworkExplainTest {

    private Network specialized;

    @Before
    public void setUp() {
        specialized = Network.builder()
                .nodes("a", "c", "d")
                .edge("a", "c", 1.0)
                .edge("a", "d", 1.0)
                .edge("d", "a", 1.0)
                .edge("c", "d", 0.25)
                .build()
                .specializeByLabel("a");
    }

    @Test
    public void testExplainCopyNode() {
        String text = new NetworkExplain(specialized).explainNode("d.2");
        assertTrue(text, text.contains("Node: d.2"));
        assertTrue(text, text.contains("Canonical: d"));
        assertTrue(text, text.contains("Original index: 2"));
        assertTrue(text, text.contains("Inputs (2): a (1), c.2 (0.2500)"));
        assertTrue(text, text.contains("Outputs (1): a (1)"));
    }

    @Test
    public void testDumpTopologyListsEveryNode() {
        String dump = new NetworkExplain(specialized).dumpTopology();
        assertTrue(dump, dump.startsWith("Network (5 nodes, 6 edges, linear)"));
        assertTrue(dump, dump.contains("[0] a -> c.1(1), d.2(1)"));
        assertTrue(dump, dump.contains("[3] c.2 -> d.2(0.2500)"));
    }

    @Test
    public void testMermaidSanitizesCopyLabels() {
        String mermaid = new NetworkExplain(specialized).toMermaid();
        assertTrue(mermaid.startsWith("graph LR;"));
        assertTrue(mermaid, mermaid.contains("n1_c_1[\"c.1\"]:::origin_c;"));
        assertTrue(mermaid, mermaid.contains("n0_a -- \"1\" --> n1_c_1;"));
        assertTrue(mermaid, mermaid.contains("n2_d_1 -- \"1\" --> n0_a;"));
    }
}
