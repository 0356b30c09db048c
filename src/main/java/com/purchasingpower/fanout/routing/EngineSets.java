package com.purchasingpower.fanout.routing;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Per-layer engine code sets accumulated from routed operators.
 */
public final class EngineSets {

    private final Map<EngineLayer, Set<String>> layers = new EnumMap<>(EngineLayer.class);

    public EngineSets() {
        for (EngineLayer layer : EngineLayer.values()) {
            layers.put(layer, new LinkedHashSet<>());
        }
    }

    void addAll(EngineLayer layer, Set<String> codes) {
        layers.get(layer).addAll(codes);
    }

    public Set<String> get(EngineLayer layer) {
        return Collections.unmodifiableSet(layers.get(layer));
    }

    public Set<String> getL1() {
        return get(EngineLayer.L1);
    }

    public Set<String> getL2() {
        return get(EngineLayer.L2);
    }

    public Set<String> getL3() {
        return get(EngineLayer.L3);
    }

    /**
     * Union of all layers, L1 codes first.
     */
    @JsonIgnore
    public Set<String> union() {
        Set<String> all = new LinkedHashSet<>();
        layers.values().forEach(all::addAll);
        return all;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return layers.values().stream().allMatch(Set::isEmpty);
    }
}
