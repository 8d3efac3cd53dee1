package com.spectral.nsp.io;

import com.spectral.nsp.api.NetworkValidationException;
import org.junit.Test;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

import static org.junit.Assert.*;

public class JsonNetworkLoaderTest {

    @Test
    public void testParseResource() throws IOException {
        NetworkDefinition def;
        try (InputStream in = getClass().getResourceAsStream("/networks/hub_chain.json")) {
            assertNotNull(in);
            def = JsonNetworkLoader.parse(in);
        }
        NetworkDefinition.NetworkInfo info = def.getNetwork();
        assertEquals("hub_chain", info.getName());
        assertEquals(List.of("a", "b", "c", "d"), info.getNodes());
        assertEquals(5, info.getEdges().size());
        // weight defaults to 1
        assertEquals(1.0, info.getEdges().get(2).getWeight(), 0.0);
        assertEquals(List.of("a", "b"), info.getBase());
        assertEquals(Integer.valueOf(1001), info.getStability().getSamples());
        assertNull(info.getStability().getLower());
    }

    @Test
    public void testUnknownKeysIgnored() {
        NetworkDefinition def = JsonNetworkLoader.parse("{\"version\": 2, \"network\": {\"nodes\": [], \"owner\": \"x\"}}");
        assertTrue(def.getNetwork().getNodes().isEmpty());
    }

    @Test
    public void testJsonRoundTripKeepsDefinition() {
        NetworkDefinition def = JsonNetworkLoader.parse("{\"network\": {\"name\": \"n\", \"nodes\": [\"x\"],"
                + " \"base\": [0]}}");
        assertEquals(def, JsonNetworkLoader.parse(JsonNetworkLoader.toJson(def)));
    }

    @Test(expected = NetworkValidationException.class)
    public void testMissingNetworkKey() {
        JsonNetworkLoader.parse("{}");
    }

    @Test(expected = NetworkValidationException.class)
    public void testMalformedJson() {
        JsonNetworkLoader.parse("{\"network\": {\"nodes\": [");
    }
}
