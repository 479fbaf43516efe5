package com.voltquery.service.scenario;

import lombok.Value;

import java.util.Map;

/**
 * Named parameter set for one scenario branch.
 */
@Value
public class ScenarioVariant {
    String name;
    Map<String, Object> params;

    public static ScenarioVariant of(String name, Map<String, Object> params) {
        return new ScenarioVariant(name, Map.copyOf(params));
    }

    public double doubleParam(String key, double defaultValue) {
        Object value = params.get(key);
        return value instanceof Number number ? number.doubleValue() : defaultValue;
    }

    public int intParam(String key, int defaultValue) {
        Object value = params.get(key);
        return value instanceof Number number ? number.intValue() : defaultValue;
    }

    public boolean booleanParam(String key) {
        return Boolean.TRUE.equals(params.get(key));
    }
}
