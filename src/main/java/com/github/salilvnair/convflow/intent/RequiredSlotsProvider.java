package com.github.salilvnair.convflow.intent;

import java.util.List;

public interface RequiredSlotsProvider {
    List<String> requiredSlots(String intentName);
}
