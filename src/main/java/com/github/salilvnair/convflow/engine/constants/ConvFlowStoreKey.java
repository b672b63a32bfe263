package com.github.salilvnair.convflow.engine.constants;

public final class ConvFlowStoreKey {

    private ConvFlowStoreKey() {
    }

    public static final String SEPARATOR = ":";
    public static final String INTENT_STACK = "intent_stack:stack:";
    public static final String LAST_ACTIVITY = "intent_transfer:last_activity:";
    public static final String TRANSFER_HISTORY = "intent_transfer:history:";
    public static final String INHERITANCE = "inheritance:";

    public static String intentStack(String sessionId) {
        return INTENT_STACK + sessionId;
    }

    public static String lastActivity(String sessionId) {
        return LAST_ACTIVITY + sessionId;
    }

    public static String transferHistory(String sessionId) {
        return TRANSFER_HISTORY + sessionId;
    }

    public static String inheritanceUserPrefix(String userId) {
        return INHERITANCE + userId + SEPARATOR;
    }
}
