package com.purchasingpower.fanout.orchestrator;

import com.purchasingpower.fanout.recall.SearchType;
import com.purchasingpower.fanout.routing.DetectedOperator;
import com.purchasingpower.fanout.routing.DetectedOperators;
import com.purchasingpower.fanout.routing.LocationDimension;
import com.purchasingpower.fanout.routing.OperatorFamily;

import java.util.function.Predicate;

/**
 * Derives the planner's search type from detected operators. The first matching rule wins.
 */
public final class SearchTypeResolver {

    private SearchTypeResolver() {
    }

    public static SearchType resolve(DetectedOperators detected) {
        if (detected == null || detected.isEmpty()) {
            return SearchType.GENERAL;
        }
        if (detected.anyMatch(dimension(LocationDimension.FORMAT))) {
            return SearchType.FILETYPE;
        }
        if (detected.anyMatch(named(OperatorFamily.OBJECT, "proximity"))) {
            return SearchType.PROXIMITY;
        }
        if (detected.anyMatch(named(OperatorFamily.LOCATION, "language"))
                || detected.anyMatch(named(OperatorFamily.OBJECT, "translation"))) {
            return SearchType.LANGUAGE;
        }
        if (detected.anyMatch(named(OperatorFamily.LOCATION, "site"))
                || detected.anyMatch(named(OperatorFamily.LOCATION, "address"))
                || detected.anyMatch(dimension(LocationDimension.ADDRESS))) {
            return SearchType.LOCATION;
        }
        if (detected.anyMatch(named(OperatorFamily.SUBJECT, "company"))) {
            return SearchType.CORPORATE;
        }
        if (detected.anyMatch(dimension(LocationDimension.TEMPORAL))) {
            return SearchType.DATE;
        }
        return SearchType.GENERAL;
    }

    private static Predicate<DetectedOperator> dimension(LocationDimension dimension) {
        return op -> op.getFamily() == OperatorFamily.LOCATION && op.getDimension() == dimension;
    }

    private static Predicate<DetectedOperator> named(OperatorFamily family, String name) {
        return op -> op.getFamily() == family && name.equals(op.getName());
    }
}
