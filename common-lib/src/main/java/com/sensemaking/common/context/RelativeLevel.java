package com.sensemaking.common.context;

/**
 * Where a value sits in its sibling distribution.
 *
 * <pre>
 *   value &lt; mean − σ  → LOW
 *   value &lt; mean      → MODERATELY_LOW
 *   value &lt; mean + σ  → MODERATELY_HIGH
 *   otherwise         → HIGH
 * </pre>
 */
public enum RelativeLevel {
    LOW("low"),
    MODERATELY_LOW("moderately low"),
    MODERATELY_HIGH("moderately high"),
    HIGH("high");

    private final String phrase;

    RelativeLevel(String phrase) {
        this.phrase = phrase;
    }

    public static RelativeLevel classify(double value, double mean, double standardDeviation) {
        if (value < mean - standardDeviation) return LOW;
        if (value < mean)                     return MODERATELY_LOW;
        if (value < mean + standardDeviation) return MODERATELY_HIGH;
        return HIGH;
    }

    /** e.g. {@code MODERATELY_HIGH.describe("alignment") → "moderately high alignment"}. */
    public String describe(String noun) {
        return phrase + " " + noun;
    }
}
