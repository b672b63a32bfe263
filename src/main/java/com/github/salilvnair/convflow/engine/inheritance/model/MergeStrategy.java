package com.github.salilvnair.convflow.engine.inheritance.model;

public enum MergeStrategy {
    /** Replace whatever the target holds. */
    OVERRIDE,
    /** Union lists, shallow-merge maps, otherwise replace. */
    MERGE,
    /** Fill the target only while it is empty. */
    SUPPLEMENT,
    /** Replace, gated by the rule condition. */
    CONDITIONAL
}
