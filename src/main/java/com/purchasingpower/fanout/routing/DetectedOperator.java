package com.purchasingpower.fanout.routing;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One operator found in a query, together with every value its grammar rows extracted.
 * Flag operators carry an empty value list.
 */
@Value
@Builder
public class DetectedOperator {

    OperatorFamily family;
    LocationDimension dimension;
    String name;
    @Singular
    List<String> values;

    public String qualifiedName() {
        return OperatorGrammar.qualifiedName(family, dimension, name);
    }
}
