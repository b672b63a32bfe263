package com.github.salilvnair.convflow.engine.inheritance.transform.provider;

import com.github.salilvnair.convflow.engine.inheritance.transform.core.ValueTransformer;
import org.springframework.stereotype.Component;

import java.util.Locale;

@Component
public class LowercaseTransformer implements ValueTransformer {

    @Override
    public String name() {
        return "to_lowercase";
    }

    @Override
    public Object transform(Object value) {
        return String.valueOf(value).toLowerCase(Locale.ROOT);
    }
}
