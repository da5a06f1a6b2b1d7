package com.canvaslink.canvasComposition;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Two panes in canvas order: {@code first} comes before {@code second} and supplies the first point of
 * every connection between them.
 */
@Getter
@EqualsAndHashCode
public class PanePair implements Comparable<PanePair> {
    private final String firstId;
    private final String secondId;
    @EqualsAndHashCode.Exclude
    private final int firstOrder;
    @EqualsAndHashCode.Exclude
    private final int secondOrder;

    PanePair(String firstId, int firstOrder, String secondId, int secondOrder) {
        this.firstId = firstId;
        this.firstOrder = firstOrder;
        this.secondId = secondId;
        this.secondOrder = secondOrder;
    }

    public boolean involves(String paneId) {
        return firstId.equals(paneId) || secondId.equals(paneId);
    }

    @Override
    public int compareTo(PanePair o) {
        if (firstOrder != o.firstOrder) return Integer.compare(firstOrder, o.firstOrder);
        return Integer.compare(secondOrder, o.secondOrder);
    }

    @Override
    public String toString() {
        return firstId + "~" + secondId;
    }
}
