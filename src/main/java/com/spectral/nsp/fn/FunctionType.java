package com.spectral.nsp.fn;

import java.util.Locale;

/**
 * Built-in function types accepted in network definitions.
 */
public enum FunctionType {
    ZERO(props -> NodeFunctions.zero()),
    CONSTANT(props -> NodeFunctions.constant(FunctionRegistry.getDouble(props, "value", 0.0))),
    LINEAR(props -> NodeFunctions.linear(FunctionRegistry.getDouble(props, "slope", 1.0))),
    AFFINE(props -> NodeFunctions.affine(FunctionRegistry.getDouble(props, "slope", 1.0),
            FunctionRegistry.getDouble(props, "intercept", 0.0))),
    TANH(props -> NodeFunctions.tanh(FunctionRegistry.getDouble(props, "scale", 1.0),
            FunctionRegistry.getDouble(props, "gain", 1.0))),
    SIGMOID(props -> NodeFunctions.sigmoid(FunctionRegistry.getDouble(props, "gain", 1.0))),
    SIN(props -> NodeFunctions.sin(FunctionRegistry.getDouble(props, "amplitude", 1.0),
            FunctionRegistry.getDouble(props, "frequency", 1.0)));

    private final FunctionRegistry.FunctionFactory factory;

    FunctionType(FunctionRegistry.FunctionFactory factory) {
        this.factory = factory;
    }

    public FunctionRegistry.FunctionFactory getFactory() {
        return factory;
    }

    /** Registry key for this type. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
