package com.regvm.vm.host;

import com.regvm.vm.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Host object backed by an insertion-ordered map.
 * Keys are the string form of the key value, so {@code Int(1)} and {@code "1"} address the same slot.
 */
public class MapHostObject implements HostObject {

    private final Map<String, Value> properties = new LinkedHashMap<>();

    public MapHostObject() {
    }

    public MapHostObject(Map<String, Value> properties) {
        this.properties.putAll(properties);
    }

    @Override
    public Value getProperty(Value key) {
        return properties.getOrDefault(key.toStr(), Value.VOID);
    }

    public MapHostObject put(String name, Value value) {
        properties.put(name, value);
        return this;
    }

    public Map<String, Value> getProperties() {
        return Collections.unmodifiableMap(properties);
    }

    @Override
    public String toString() {
        return "object" + properties.keySet();
    }
}
