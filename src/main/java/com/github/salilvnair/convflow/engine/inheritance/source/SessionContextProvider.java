package com.github.salilvnair.convflow.engine.inheritance.source;

import java.util.Map;

public interface SessionContextProvider {
    Map<String, Object> currentContext(String sessionId);
}
