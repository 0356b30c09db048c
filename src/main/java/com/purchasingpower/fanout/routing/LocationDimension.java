package com.purchasingpower.fanout.routing;

import java.util.Locale;

/**
 * Sub-dimensions of the {@link OperatorFamily#LOCATION} family.
 *
 * @since 1.0.0
 */
public enum LocationDimension {
    TEMPORAL,
    GEOGRAPHIC,
    TEXTUAL,
    ADDRESS,
    FORMAT,
    CATEGORY;

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
