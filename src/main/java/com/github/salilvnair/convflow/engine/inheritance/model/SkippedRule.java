package com.github.salilvnair.convflow.engine.inheritance.model;

public record SkippedRule(String ruleId, String reason) {

    public static final String ALREADY_HAS_VALUE = "already has value";
    public static final String CONDITION_FALSE = "condition false";
    public static final String SOURCE_UNAVAILABLE = "source unavailable";
    public static final String TTL_EXPIRED = "TTL expired";
    public static final String SOURCE_EMPTY = "source empty";
}
