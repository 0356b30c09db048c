package com.purchasingpower.fanout.query;

import com.purchasingpower.fanout.model.SearchResult;

/**
 * Assigns a coarse category (news, blog, ...) to a newly seen result.
 * Implementations may be slow or fail; callers treat failures as best effort.
 */
public interface ResultCategorizer {

    String UNCATEGORIZED = "uncategorized";

    String categorize(SearchResult result);
}
