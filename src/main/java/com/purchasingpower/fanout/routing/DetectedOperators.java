package com.purchasingpower.fanout.routing;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * Operators detected in a query grouped by family and, for LOCATION, by dimension.
 * Iteration order follows grammar table order so routes come out deterministically.
 */
public final class DetectedOperators {

    private final Map<OperatorFamily, Map<String, DetectedOperator>> byFamily;

    DetectedOperators(List<DetectedOperator> operators) {
        Map<OperatorFamily, Map<String, DetectedOperator>> grouped = new EnumMap<>(OperatorFamily.class);
        for (DetectedOperator operator : operators) {
            grouped.computeIfAbsent(operator.getFamily(), f -> new LinkedHashMap<>())
                    .put(operator.qualifiedName(), operator);
        }
        this.byFamily = grouped;
    }

    public static DetectedOperators none() {
        return new DetectedOperators(List.of());
    }

    public List<DetectedOperator> getSubject() {
        return family(OperatorFamily.SUBJECT);
    }

    public List<DetectedOperator> getObject() {
        return family(OperatorFamily.OBJECT);
    }

    /**
     * LOCATION operators keyed by dimension ({@code temporal}, {@code geographic}, ...).
     */
    public Map<String, List<DetectedOperator>> getLocation() {
        Map<String, List<DetectedOperator>> result = new LinkedHashMap<>();
        for (DetectedOperator operator : family(OperatorFamily.LOCATION)) {
            result.computeIfAbsent(operator.getDimension().key(), k -> new ArrayList<>()).add(operator);
        }
        return result;
    }

    @JsonIgnore
    public List<DetectedOperator> all() {
        List<DetectedOperator> all = new ArrayList<>();
        for (OperatorFamily family : OperatorFamily.values()) {
            all.addAll(family(family));
        }
        return all;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return byFamily.values().stream().allMatch(Map::isEmpty);
    }

    /**
     * Looks up an operator by its dotted name, e.g. {@code LOCATION.format.filetype}.
     */
    public Optional<DetectedOperator> find(String qualifiedName) {
        return byFamily.values().stream()
                .map(m -> m.get(qualifiedName))
                .filter(o -> o != null)
                .findFirst();
    }

    public boolean has(String qualifiedName) {
        return find(qualifiedName).isPresent();
    }

    public boolean anyMatch(Predicate<DetectedOperator> predicate) {
        return all().stream().anyMatch(predicate);
    }

    private List<DetectedOperator> family(OperatorFamily family) {
        Map<String, DetectedOperator> ops = byFamily.get(family);
        return ops == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(ops.values()));
    }

    @Override
    public String toString() {
        return all().stream().map(DetectedOperator::qualifiedName).toList().toString();
    }
}
