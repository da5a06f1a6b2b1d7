package com.canvaslink.canvasComposition;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class PairFailure {
    private final PanePair pair;
    private final RuntimeException error;

    @Override
    public String toString() {
        return pair + ": " + error.getMessage();
    }
}
