package com.github.salilvnair.convflow.engine.context;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class TurnRequest {
    private String sessionId;
    private String userId;
    private String userText;
    @Builder.Default
    private Map<String, Object> context = new HashMap<>();
}
