package com.canvaslink.canvasComposition;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Outcome of one pane change: the pairs whose connections were rebuilt and those that failed.
 * A failed pair has no connections until a later transition succeeds for it.
 */
@Getter
@AllArgsConstructor
public class TransitionReport {
    private final String paneId;
    private final List<PanePair> updatedPairs;
    private final List<PairFailure> failures;

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
