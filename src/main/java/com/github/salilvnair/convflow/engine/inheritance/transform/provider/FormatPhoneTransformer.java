package com.github.salilvnair.convflow.engine.inheritance.transform.provider;

import com.github.salilvnair.convflow.engine.inheritance.transform.core.ValueTransformer;
import org.springframework.stereotype.Component;

/**
 * Keeps digits only; eleven digits are grouped 3-4-4.
 */
@Component
public class FormatPhoneTransformer implements ValueTransformer {

    @Override
    public String name() {
        return "format_phone";
    }

    @Override
    public Object transform(Object value) {
        String digits = String.valueOf(value).replaceAll("\\D", "");
        if (digits.length() == 11) {
            return digits.substring(0, 3) + "-" + digits.substring(3, 7) + "-" + digits.substring(7);
        }
        return digits;
    }
}
