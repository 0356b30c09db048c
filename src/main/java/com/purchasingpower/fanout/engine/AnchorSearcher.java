package com.purchasingpower.fanout.engine;

import com.purchasingpower.fanout.model.RawResult;

import java.util.List;

/**
 * Issues domain-scoped follow-up queries for anchor expansion.
 */
public interface AnchorSearcher {

    /**
     * Source code anchor results are tagged with.
     */
    String ANCHOR_CODE = "ANCHOR";

    List<RawResult> search(String anchorQuery, int maxResults);
}
