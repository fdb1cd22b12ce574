package com.firesim.core.consistency;

import java.util.List;

/**
 * Outcome of scoring one image set. Recommendations are only present when the set failed.
 */
public record ConsistencyReport(
    int score,
    boolean passed,
    List<ConsistencyCheck> checks,
    List<String> warnings,
    List<String> recommendations
) {

    public ConsistencyReport {
        checks = List.copyOf(checks);
        warnings = List.copyOf(warnings);
        recommendations = List.copyOf(recommendations);
    }
}
