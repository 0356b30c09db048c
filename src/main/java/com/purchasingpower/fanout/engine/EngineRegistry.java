package com.purchasingpower.fanout.engine;

import com.google.common.base.Preconditions;
import lombok.extern.slf4j.Slf4j;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Read-only lookup of engine adapters by source code. Built once at startup.
 */
@Slf4j
public class EngineRegistry {

    private final Map<String, EngineDescriptor> engines;

    public EngineRegistry(List<EngineAdapter> adapters) {
        Map<String, EngineDescriptor> byCode = new LinkedHashMap<>();
        for (EngineAdapter adapter : adapters) {
            String code = adapter.code();
            Preconditions.checkArgument(!byCode.containsKey(code), "Duplicate engine code: %s", code);
            byCode.put(code, EngineDescriptor.builder()
                    .code(code)
                    .name(EngineCatalog.name(code))
                    .maxResults(EngineCatalog.cap(code))
                    .adapter(adapter)
                    .build());
        }
        this.engines = Collections.unmodifiableMap(byCode);
        log.info("Engine registry ready: {}", engines.keySet());
    }

    public Optional<EngineDescriptor> find(String code) {
        return Optional.ofNullable(engines.get(code));
    }

    public boolean isRegistered(String code) {
        return engines.containsKey(code);
    }

    public Set<String> codes() {
        return engines.keySet();
    }
}
