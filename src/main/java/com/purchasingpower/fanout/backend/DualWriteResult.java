package com.purchasingpower.fanout.backend;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * Outcome of writing one document to both backends in parallel.
 * {@code canonicalId} comes from the primary when it succeeded, from the secondary otherwise.
 */
@Value
@Builder
public class DualWriteResult {

    String primaryId;
    String secondaryId;
    boolean success;
    BackendRole canonicalRole;
    String canonicalBackend;
    String canonicalId;
    @Singular
    List<String> errors;
}
