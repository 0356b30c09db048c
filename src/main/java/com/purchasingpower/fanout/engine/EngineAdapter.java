package com.purchasingpower.fanout.engine;

import com.purchasingpower.fanout.model.RawResult;

import java.util.List;

/**
 * A third-party search source.
 *
 * <p>Adapters block until the call completes and own their own request timeouts.
 * Failures are reported by throwing, typically {@link EngineException}.
 */
public interface EngineAdapter {

    /**
     * Short fixed source code, e.g. {@code BR}.
     */
    String code();

    List<RawResult> search(String query, int maxResults);
}
