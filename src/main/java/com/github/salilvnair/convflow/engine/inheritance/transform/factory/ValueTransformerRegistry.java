package com.github.salilvnair.convflow.engine.inheritance.transform.factory;

import com.github.salilvnair.convflow.engine.inheritance.transform.core.ValueTransformer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Slf4j
@Component
public class ValueTransformerRegistry {

    private final Map<String, ValueTransformer> transformers = new ConcurrentHashMap<>();

    public ValueTransformerRegistry(List<ValueTransformer> transformers) {
        transformers.forEach(this::register);
    }

    public void register(ValueTransformer transformer) {
        transformers.put(transformer.name().toLowerCase(), transformer);
    }

    public Optional<ValueTransformer> get(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(transformers.get(name.toLowerCase()));
    }

    /**
     * An unknown name or a failing transformer leaves the value as it was.
     */
    public Object apply(String name, Object value) {
        if (name == null || name.isBlank()) {
            return value;
        }
        Optional<ValueTransformer> transformer = get(name);
        if (transformer.isEmpty()) {
            log.warn("Unknown value transformer name={}, keeping raw value", name);
            return value;
        }
        try {
            return transformer.get().transform(value);
        } catch (RuntimeException e) {
            log.warn("Value transformer failed name={} value={} msg={}", name, value, e.getMessage());
            return value;
        }
    }
}
