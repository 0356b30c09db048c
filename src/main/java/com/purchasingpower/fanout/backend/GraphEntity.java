package com.purchasingpower.fanout.backend;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * A node for the knowledge graph together with its outgoing relations.
 */
@Value
@Builder
public class GraphEntity {

    String id;
    String type;
    String name;
    String zone;

    @Singular
    Map<String, Object> properties;

    @Singular
    List<Relation> relations;

    public record Relation(String type, String targetId) {
    }
}
