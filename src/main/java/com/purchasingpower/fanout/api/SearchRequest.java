package com.purchasingpower.fanout.api;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Search request.
 *
 * @since 1.0.0
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchRequest {

    private String query;
    private List<String> engines;
    private Integer level;

    /** {@code web}, {@code corpus} or {@code both}. */
    private String scope;
}
