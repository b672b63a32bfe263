package com.github.salilvnair.convflow.engine.inheritance.model;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

@Value
@Builder(toBuilder = true)
public class InheritanceRequest {

    String userId;
    String sessionId;
    String intentName;

    @Builder.Default
    List<String> requiredSlots = List.of();

    @Builder.Default
    Map<String, Object> currentValues = Map.of();

    /** Values from the running conversation, added on top of the slot history. */
    @Builder.Default
    Map<String, Object> conversationContext = Map.of();

    @Builder.Default
    Map<String, Object> dependencyValues = Map.of();

    @Builder.Default
    Map<String, Object> defaultValues = Map.of();

    @Builder.Default
    boolean useCache = true;
}
