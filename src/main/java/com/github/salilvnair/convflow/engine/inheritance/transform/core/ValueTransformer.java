package com.github.salilvnair.convflow.engine.inheritance.transform.core;

/**
 * Named conversion applied to an inherited value before it is combined
 * into the target slot.
 */
public interface ValueTransformer {

    String name();

    Object transform(Object value);
}
