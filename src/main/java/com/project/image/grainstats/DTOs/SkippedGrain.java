package com.project.image.grainstats.DTOs;

/** A labelled region that produced no grain record, and why. */
public record SkippedGrain(int label, Reason reason) {

    public enum Reason {
        /** Shorter bounding box side below the minimum grain size. */
        TOO_SMALL,
        /** Fewer than three boundary points. */
        INSUFFICIENT_POINTS,
        /** All hull vertices coincide. */
        DEGENERATE_HULL
    }
}
