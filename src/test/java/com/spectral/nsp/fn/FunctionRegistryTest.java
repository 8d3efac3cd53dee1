package com.spectral.nsp.fn;

import com.spectral.nsp.api.NetworkValidationException;
import org.junit.Test;

import java.util.Collections;
import java.util.Map;

import static org.junit.Assert.*;

public class FunctionRegistryTest {

    private final FunctionRegistry registry = new FunctionRegistry();

    @Test
    public void testBuiltInTypesRegistered() {
        for (FunctionType type : FunctionType.values()) {
            assertTrue(type.key(), registry.isRegistered(type.key()));
        }
        assertTrue(registry.isRegistered("TANH"));
    }

    @Test
    public void testPropertiesAndDefaults() {
        NodeFunction tanh = registry.create("tanh", Map.of("scale", 2.0));
        assertEquals(2 * Math.tanh(1.0), tanh.apply(1.0), 1e-15);

        NodeFunction affine = registry.create("affine", Map.of("intercept", "1.5"));
        assertEquals(3.5, affine.apply(2.0), 0.0);

        assertEquals(4.0, registry.create("linear", null).apply(4.0), 0.0);
        assertEquals(0.0, registry.create("zero", Collections.emptyMap()).apply(4.0), 0.0);
    }

    @Test
    public void testCustomType() {
        registry.register("Cubic", props -> x -> x * x * x);
        assertTrue(registry.isRegistered("cubic"));
        assertEquals(8.0, registry.create("cubic", null).apply(2.0), 0.0);
    }

    @Test(expected = NetworkValidationException.class)
    public void testUnknownType() {
        registry.create("relu", null);
    }

    @Test(expected = NetworkValidationException.class)
    public void testNonNumericProperty() {
        registry.create("linear", Map.of("slope", "steep"));
    }
}
