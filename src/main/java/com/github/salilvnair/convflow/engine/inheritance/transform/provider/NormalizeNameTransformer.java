package com.github.salilvnair.convflow.engine.inheritance.transform.provider;

import com.github.salilvnair.convflow.engine.inheritance.transform.core.ValueTransformer;
import org.springframework.stereotype.Component;

/**
 * Trims and title-cases: a letter following a non-letter is upper-cased,
 * every other letter lower-cased.
 */
@Component
public class NormalizeNameTransformer implements ValueTransformer {

    @Override
    public String name() {
        return "normalize_name";
    }

    @Override
    public Object transform(Object value) {
        String name = String.valueOf(value).trim();
        StringBuilder normalized = new StringBuilder(name.length());
        boolean previousIsLetter = false;
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isLetter(c)) {
                normalized.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousIsLetter = true;
            } else {
                normalized.append(c);
                previousIsLetter = false;
            }
        }
        return normalized.toString();
    }
}
