package com.github.salilvnair.convflow.engine.inheritance.source;

import com.github.salilvnair.convflow.engine.inheritance.model.SourceValue;

import java.util.Map;

public interface SlotHistoryProvider {

    /**
     * Most recent value per slot over the user's last {@code limit} conversations.
     */
    Map<String, SourceValue> recentSlotValues(String userId, int limit);
}
