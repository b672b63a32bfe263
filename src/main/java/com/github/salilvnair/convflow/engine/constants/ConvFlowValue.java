package com.github.salilvnair.convflow.engine.constants;

public final class ConvFlowValue {

    private ConvFlowValue() {
    }

    public static final String ANY = "*";
    public static final String ANY_ALIAS = "ANY";
    public static final String PREVIOUS = "previous";
    public static final String UNKNOWN = "unknown";

    // reserved targets of the special-case transfers
    public static final String TIMEOUT = "timeout";
    public static final String ERROR_RECOVERY = "error-recovery";
    public static final String SESSION_END = "session-end";
}
