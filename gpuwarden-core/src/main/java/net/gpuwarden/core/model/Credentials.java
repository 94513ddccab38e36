package net.gpuwarden.core.model;

import java.util.Map;

/** 불투명 자격 증명. toString 에 값은 노출하지 않는다. */
public record Credentials(String accountRef, Map<String, String> values) {
    public Credentials {
        values = values == null ? Map.of() : Map.copyOf(values);
    }

    public String get(String key) { return values.get(key); }

    @Override
    public String toString() {
        return "Credentials{accountRef='" + accountRef + "', keys=" + values.keySet() + '}';
    }
}
