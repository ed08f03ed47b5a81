package com.sensemaking.common.estimate;

import com.sensemaking.common.exception.MissingGroupDataException;
import com.sensemaking.common.model.GroupedVotes;
import com.sensemaking.common.model.VoteInfo;
import com.sensemaking.common.model.VoteInfoKind;
import com.sensemaking.common.model.VoteTally;

import java.util.Map;

/**
 * Rate estimates derived from vote tallies.
 *
 * <h3>Estimate</h3>
 * <pre>
 *   raw:      numerator / denominator
 *   estimate: (numerator + 1) / (denominator + 2)
 * </pre>
 * The estimate is the MAP value under a Beta(2, 2) prior: it never divides by zero and
 * pulls sparse tallies toward 0.5. With passes excluded, agree and disagree estimates of
 * the same tally always sum to exactly 1.
 *
 * <h3>Pooled vs grouped</h3>
 * The {@code total*} functions accept either {@link VoteInfo} shape; for grouped data they
 * add every group's counts first and estimate once on the sum. The group functions
 * ({@link #groupInformedConsensus}, {@link #minAgreeRate}, {@link #groupAgreeRateDifference}
 * and friends) need a per-group breakdown and throw {@link MissingGroupDataException} for
 * pooled data. Group functions always count passes in the denominator unless told otherwise.
 *
 * <p>Pure static utility with no state and no logging.
 */
public final class VoteRates {

    private VoteRates() {}

    // ── single tally ─────────────────────────────────────────────────────────

    public static double agreeRate(VoteTally tally, boolean includePasses, boolean useEstimate) {
        return rate(tally.agreeCount(), tally.totalCount(includePasses), useEstimate);
    }

    public static double agreeRate(VoteTally tally, boolean includePasses) {
        return agreeRate(tally, includePasses, true);
    }

    public static double disagreeRate(VoteTally tally, boolean includePasses, boolean useEstimate) {
        return rate(tally.disagreeCount(), tally.totalCount(includePasses), useEstimate);
    }

    public static double disagreeRate(VoteTally tally, boolean includePasses) {
        return disagreeRate(tally, includePasses, true);
    }

    /** Pass rate; passes are always part of the denominator here. */
    public static double passRate(VoteTally tally, boolean useEstimate) {
        return rate(tally.passCount(), tally.totalCount(true), useEstimate);
    }

    public static double passRate(VoteTally tally) {
        return passRate(tally, true);
    }

    // ── either shape, summed before estimating ───────────────────────────────

    public static double totalAgreeRate(VoteInfo voteInfo, boolean includePasses, boolean useEstimate) {
        return agreeRate(voteInfo.combined(), includePasses, useEstimate);
    }

    public static double totalDisagreeRate(VoteInfo voteInfo, boolean includePasses, boolean useEstimate) {
        return disagreeRate(voteInfo.combined(), includePasses, useEstimate);
    }

    public static double totalPassRate(VoteInfo voteInfo, boolean useEstimate) {
        return passRate(voteInfo.combined(), useEstimate);
    }

    // ── group comparisons ────────────────────────────────────────────────────

    /**
     * Product of every group's agree estimate. Rewards comments that all groups agree
     * with at once over comments one group agrees with strongly.
     */
    public static double groupInformedConsensus(VoteInfo voteInfo, boolean includePasses, boolean useEstimate) {
        double product = 1.0;
        for (VoteTally tally : requireGroups(voteInfo, "groupInformedConsensus").values()) {
            product *= agreeRate(tally, includePasses, useEstimate);
        }
        return product;
    }

    public static double groupInformedConsensus(VoteInfo voteInfo) {
        return groupInformedConsensus(voteInfo, true, true);
    }

    /** Product of every group's disagree estimate. */
    public static double groupInformedDisagreeConsensus(VoteInfo voteInfo, boolean includePasses, boolean useEstimate) {
        double product = 1.0;
        for (VoteTally tally : requireGroups(voteInfo, "groupInformedDisagreeConsensus").values()) {
            product *= disagreeRate(tally, includePasses, useEstimate);
        }
        return product;
    }

    public static double groupInformedDisagreeConsensus(VoteInfo voteInfo) {
        return groupInformedDisagreeConsensus(voteInfo, true, true);
    }

    /** Lowest agree estimate of any single group. */
    public static double minAgreeRate(VoteInfo voteInfo, boolean includePasses, boolean useEstimate) {
        double min = Double.POSITIVE_INFINITY;
        for (VoteTally tally : requireGroups(voteInfo, "minAgreeRate").values()) {
            min = Math.min(min, agreeRate(tally, includePasses, useEstimate));
        }
        return min;
    }

    public static double minAgreeRate(VoteInfo voteInfo) {
        return minAgreeRate(voteInfo, true, true);
    }

    /** Lowest disagree estimate of any single group. */
    public static double minDisagreeRate(VoteInfo voteInfo, boolean includePasses, boolean useEstimate) {
        double min = Double.POSITIVE_INFINITY;
        for (VoteTally tally : requireGroups(voteInfo, "minDisagreeRate").values()) {
            min = Math.min(min, disagreeRate(tally, includePasses, useEstimate));
        }
        return min;
    }

    public static double minDisagreeRate(VoteInfo voteInfo) {
        return minDisagreeRate(voteInfo, true, true);
    }

    /**
     * Signed difference between {@code groupId}'s agree estimate and the agree estimate of
     * all other groups pooled together. Positive = the group agrees more than the rest.
     *
     * @throws IllegalArgumentException if the comment has no tally for {@code groupId}
     */
    public static double groupAgreeRateDifference(VoteInfo voteInfo, String groupId,
                                                  boolean includePasses, boolean useEstimate) {
        GroupedVotes grouped = requireGrouped(voteInfo, "groupAgreeRateDifference");
        VoteTally groupTally = grouped.tallyFor(groupId);
        if (groupTally == null) {
            throw new IllegalArgumentException("No votes recorded for group " + groupId);
        }
        return agreeRate(groupTally, includePasses, useEstimate)
             - agreeRate(grouped.complementOf(groupId), includePasses, useEstimate);
    }

    public static double groupAgreeRateDifference(VoteInfo voteInfo, String groupId) {
        return groupAgreeRateDifference(voteInfo, groupId, true, true);
    }

    /** Largest absolute {@link #groupAgreeRateDifference} over all groups. */
    public static double maxGroupAgreeRateDifference(VoteInfo voteInfo, boolean includePasses, boolean useEstimate) {
        GroupedVotes grouped = requireGrouped(voteInfo, "maxGroupAgreeRateDifference");
        double max = 0.0;
        for (String groupId : grouped.talliesByGroup().keySet()) {
            max = Math.max(max,
                Math.abs(groupAgreeRateDifference(grouped, groupId, includePasses, useEstimate)));
        }
        return max;
    }

    public static double maxGroupAgreeRateDifference(VoteInfo voteInfo) {
        return maxGroupAgreeRateDifference(voteInfo, true, true);
    }

    // ── internals ────────────────────────────────────────────────────────────

    static double rate(int numerator, int denominator, boolean useEstimate) {
        if (useEstimate) {
            return (numerator + 1.0) / (denominator + 2.0);
        }
        // 0/0 yields NaN, which fails every threshold comparison
        return (double) numerator / denominator;
    }

    private static GroupedVotes requireGrouped(VoteInfo voteInfo, String operation) {
        if (voteInfo == null || voteInfo.kind() != VoteInfoKind.GROUPED) {
            throw new MissingGroupDataException(operation);
        }
        return (GroupedVotes) voteInfo;
    }

    private static Map<String, VoteTally> requireGroups(VoteInfo voteInfo, String operation) {
        return requireGrouped(voteInfo, operation).talliesByGroup();
    }
}
