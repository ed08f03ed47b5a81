package com.sensemaking.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Agree / disagree / pass counts for one entity: either the whole participant body
 * or a single opinion group.
 *
 * <p>All counts are non-negative. Pure value type, no logic beyond totals and addition.
 */
public record VoteTally(
    @JsonProperty("agreeCount")    int agreeCount,
    @JsonProperty("disagreeCount") int disagreeCount,
    @JsonProperty("passCount")     int passCount
) {

    public static final VoteTally EMPTY = new VoteTally(0, 0, 0);

    public VoteTally {
        if (agreeCount < 0 || disagreeCount < 0 || passCount < 0) {
            throw new IllegalArgumentException(
                "Vote counts must be non-negative: agree=" + agreeCount
                    + " disagree=" + disagreeCount + " pass=" + passCount);
        }
    }

    /** Tally without pass votes. */
    public static VoteTally of(int agreeCount, int disagreeCount) {
        return new VoteTally(agreeCount, disagreeCount, 0);
    }

    public static VoteTally of(int agreeCount, int disagreeCount, int passCount) {
        return new VoteTally(agreeCount, disagreeCount, passCount);
    }

    /**
     * @param includePasses whether pass votes count toward the total
     * @return agree + disagree (+ pass)
     */
    public int totalCount(boolean includePasses) {
        return includePasses
            ? agreeCount + disagreeCount + passCount
            : agreeCount + disagreeCount;
    }

    /** Count-wise sum of this tally and {@code other}. */
    public VoteTally plus(VoteTally other) {
        return new VoteTally(
            agreeCount + other.agreeCount,
            disagreeCount + other.disagreeCount,
            passCount + other.passCount);
    }
}
