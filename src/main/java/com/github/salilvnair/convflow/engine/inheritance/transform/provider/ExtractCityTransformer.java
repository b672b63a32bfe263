package com.github.salilvnair.convflow.engine.inheritance.transform.provider;

import com.github.salilvnair.convflow.engine.inheritance.transform.core.ValueTransformer;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
public class ExtractCityTransformer implements ValueTransformer {

    private static final List<String> ADMIN_SUFFIXES = List.of("市", "区", "县", "镇");

    private static final Map<String, String> SHORT_NAMES = Map.of(
            "北京", "北京市",
            "上海", "上海市",
            "广州", "广州市",
            "深圳", "深圳市",
            "杭州", "杭州市",
            "南京", "南京市"
    );

    @Override
    public String name() {
        return "extract_city";
    }

    @Override
    public Object transform(Object value) {
        String city = String.valueOf(value).trim();
        if (ADMIN_SUFFIXES.stream().anyMatch(city::endsWith)) {
            return city;
        }
        return SHORT_NAMES.getOrDefault(city, city);
    }
}
