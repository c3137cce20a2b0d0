package com.netcracker.core.tagsync.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SyncOptions {
    /**
     * Compute and report the full plan without any mutating remote call.
     */
    @Builder.Default boolean dryRun = false;
    /**
     * Delete current entities absent from the desired state, subject to the deletion policy.
     */
    @Builder.Default boolean deleteMissing = false;
    @Builder.Default boolean updateExisting = true;
    /**
     * Warn about {@code {{ name }}} references to variables that are neither desired nor present.
     */
    @Builder.Default boolean validateVariableRefs = false;
}
