package com.github.salilvnair.convflow.engine.constants;

public final class ConvFlowContextKey {

    private ConvFlowContextKey() {
    }

    public static final String ERROR_COUNT = "error_count";
    public static final String MISSING_SLOTS = "missing_slots";
    public static final String COMPLETION_PROGRESS = "completion_progress";
    public static final String SEMANTIC_SIMILARITY = "semantic_similarity";

    // fingerprint fields of the inheritance cache
    public static final String CURRENT_VALUES = "current_values";
    public static final String USER_PROFILE_TIMESTAMP = "user_profile_timestamp";
    public static final String SESSION_CONTEXT_KEYS = "session_context_keys";
    public static final String CONVERSATION_CONTEXT_KEYS = "conversation_context_keys";
}
