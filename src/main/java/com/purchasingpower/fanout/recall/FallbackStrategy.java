package com.purchasingpower.fanout.recall;

import java.util.Set;

/**
 * A named relaxation to try when a round under-delivers.
 *
 * @param modifications switches the strategy turns on, e.g. {@code remove_quotes}
 */
public record FallbackStrategy(String name, String description, Set<String> modifications) {
}
