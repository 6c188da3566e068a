package com.pmmsentinel.engine.complaint;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Hours from creation to resolution. The averages are null when nothing was resolved.
 */
@JsonInclude(JsonInclude.Include.ALWAYS)
public record ResolutionStats(
        int resolvedCount,
        Double avgResolutionHours,
        Double minResolutionHours,
        Double maxResolutionHours
) {
    static ResolutionStats none() {
        return new ResolutionStats(0, null, null, null);
    }
}
