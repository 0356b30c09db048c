package com.purchasingpower.fanout.routing;

import com.google.common.base.Preconditions;
import com.google.common.collect.AbstractIterator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;

/**
 * Classifies search DSL tokens into the SUBJECT / OBJECT / LOCATION taxonomy and turns them
 * into engine layers and module routes.
 *
 * <p>Detection is driven entirely by {@link OperatorGrammar}; engine choice by
 * {@link OperatorEngineMatrix}. The router itself is stateless and thread-safe.
 *
 * @since 1.0.0
 */
@Slf4j
@Component
public class QueryOperatorRouter {

    private static final String SUBJECT_PREFIX = "ii.SUBJECT.ENTITY.";
    private static final String OBJECT_PREFIX = "iii.OBJECT.OPERATORS.";
    private static final String LOCATION_PREFIX = "iv.LOCATION.a.KNOWN_UNKNOWN.";

    /**
     * Runs every grammar row against the query. Rows sharing an operator name merge their values.
     */
    public DetectedOperators detectOperators(String query) {
        Preconditions.checkNotNull(query, "Query cannot be null");

        Map<String, DetectedOperator.DetectedOperatorBuilder> found = new LinkedHashMap<>();
        Map<String, Set<String>> values = new LinkedHashMap<>();

        for (OperatorGrammar row : OperatorGrammar.values()) {
            Matcher matcher = row.pattern().matcher(query);
            while (matcher.find()) {
                String key = row.qualifiedName();
                found.computeIfAbsent(key, k -> DetectedOperator.builder()
                        .family(row.family())
                        .dimension(row.dimension())
                        .name(row.operatorName()));
                Set<String> collected = values.computeIfAbsent(key, k -> new LinkedHashSet<>());
                if (!row.isFlag()) {
                    String value = matcher.group(row.valueGroup());
                    if (value != null && !value.isBlank()) {
                        collected.add(value);
                    }
                }
            }
        }

        List<DetectedOperator> operators = new ArrayList<>();
        found.forEach((key, builder) -> operators.add(builder.values(values.get(key)).build()));
        return new DetectedOperators(operators);
    }

    /**
     * Unions the matrix layers of every detected operator.
     */
    public EngineSets getEnginesForOperators(DetectedOperators detected) {
        EngineSets engines = new EngineSets();
        for (DetectedOperator operator : detected.all()) {
            String key = operator.qualifiedName();
            if (!OperatorEngineMatrix.contains(key)) {
                log.debug("No engine mapping for operator {}", key);
                continue;
            }
            for (EngineLayer layer : EngineLayer.values()) {
                engines.addAll(layer, OperatorEngineMatrix.engines(key, layer));
            }
        }
        return engines;
    }

    /**
     * One route per detected operator, in grammar order.
     */
    public List<ModuleRoute> routeToModules(String query, DetectedOperators detected) {
        List<ModuleRoute> routes = new ArrayList<>();
        for (DetectedOperator operator : detected.all()) {
            routes.add(ModuleRoute.builder()
                    .modulePath(modulePath(operator))
                    .operator(operator.getName())
                    .values(operator.getValues())
                    .family(operator.getFamily())
                    .dimension(operator.getDimension())
                    .build());
        }
        return routes;
    }

    public RoutingDecision routeQuery(String query) {
        DetectedOperators detected = detectOperators(query);
        EngineSets engines = getEnginesForOperators(detected);
        List<ModuleRoute> routes = routeToModules(query, detected);

        RoutingDecision decision = RoutingDecision.builder()
                .query(query)
                .detected(detected)
                .engines(engines)
                .routes(List.copyOf(routes))
                .timestamp(Instant.now())
                .build();

        if (decision.isHasRouting()) {
            log.info("Query routed to {} modules, L1 engines {}", routes.size(), engines.getL1());
            routes.forEach(r -> log.debug("  -> {} ({})", r.getModulePath(), r.getOperator()));
        } else {
            log.debug("No operators detected in '{}'", query);
        }
        return decision;
    }

    /**
     * Lazily walks the routes of a decision. The returned iterator is single-use.
     * With no routes it yields exactly one {@link RouteExecutionEvent.Type#DEFAULT} event.
     */
    public Iterator<RouteExecutionEvent> executeRoutes(RoutingDecision routing) {
        Preconditions.checkNotNull(routing, "Routing decision cannot be null");
        List<ModuleRoute> routes = routing.getRoutes();

        if (routes.isEmpty()) {
            return new AbstractIterator<>() {
                private boolean emitted;

                @Override
                protected RouteExecutionEvent computeNext() {
                    if (emitted) {
                        return endOfData();
                    }
                    emitted = true;
                    return RouteExecutionEvent.builder()
                            .type(RouteExecutionEvent.Type.DEFAULT)
                            .query(routing.getQuery())
                            .message("No specific routing, using default search")
                            .build();
                }
            };
        }

        Iterator<ModuleRoute> source = routes.iterator();
        return new AbstractIterator<>() {
            @Override
            protected RouteExecutionEvent computeNext() {
                if (!source.hasNext()) {
                    return endOfData();
                }
                ModuleRoute route = source.next();
                log.debug("Executing route: {}", route.getModulePath());
                return RouteExecutionEvent.builder()
                        .type(RouteExecutionEvent.Type.ROUTE_EXECUTION)
                        .query(routing.getQuery())
                        .route(route)
                        .message("Route ready for " + route.getOperator())
                        .build();
            }
        };
    }

    private String modulePath(DetectedOperator operator) {
        return switch (operator.getFamily()) {
            case SUBJECT -> SUBJECT_PREFIX + operator.getName();
            case OBJECT -> OBJECT_PREFIX + operator.getName();
            case LOCATION -> locationPath(operator);
        };
    }

    private String locationPath(DetectedOperator operator) {
        LocationDimension dimension = operator.getDimension();
        if (dimension == LocationDimension.FORMAT) {
            return LOCATION_PREFIX + "FORMAT.filetypes";
        }
        if ("language".equals(operator.getName())) {
            return LOCATION_PREFIX + "GEOGRAPHIC.LANGUAGE.language";
        }
        return LOCATION_PREFIX + dimension.name() + "." + operator.getName();
    }
}
