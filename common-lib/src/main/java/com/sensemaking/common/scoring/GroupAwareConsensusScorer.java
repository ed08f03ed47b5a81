package com.sensemaking.common.scoring;

import com.sensemaking.common.estimate.VoteRates;
import com.sensemaking.common.exception.MissingGroupDataException;
import com.sensemaking.common.model.Comment;
import com.sensemaking.common.model.GroupStats;
import com.sensemaking.common.model.GroupedVotes;
import com.sensemaking.common.model.VoteInfoKind;
import com.sensemaking.common.model.VoteTally;
import com.sensemaking.common.util.Percentages;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * {@link ConsensusScorer} that compares opinion groups with each other. Every ranked
 * comment must carry per-group tallies; pooled data raises {@link MissingGroupDataException}.
 *
 * <h3>Algorithm</h3>
 * <pre>
 *   common ground agree    : score = Π agreeRate(g),    eligible min agreeRate(g)    ≥ minCommonGroundProb
 *   common ground disagree : score = Π disagreeRate(g), eligible min disagreeRate(g) ≥ minCommonGroundProb
 *   difference of opinion  : score = max |agreeRate(g) − agreeRate(rest of g)|
 *                            eligible min agreeRate(g) &lt; minCommonGroundProb
 *                                 and score &gt; minAgreeProbDifference
 *   representative of g    : score = agreeRate(g) − agreeRate(rest of g)
 *                            eligible min agreeRate &lt; minCommonGroundProb
 *                                 and score &gt; minAgreeProbDifference
 * </pre>
 * The minimum-rate gate means a single dissenting group keeps a comment out of common
 * ground; the product then prefers comments every group agrees with at once.
 *
 * <p>Immutable once constructed.
 */
public class GroupAwareConsensusScorer extends AbstractConsensusScorer {

    public GroupAwareConsensusScorer(List<Comment> comments) {
        this(comments, ScoringSettings.groupAwareDefaults());
    }

    public GroupAwareConsensusScorer(List<Comment> comments, ScoringSettings settings) {
        super(comments, settings);
    }

    @Override
    public ScoringStrategy strategy() {
        return ScoringStrategy.GROUP_AWARE;
    }

    // ── common ground ────────────────────────────────────────────────────────

    @Override
    protected double commonGroundAgreeScore(Comment comment) {
        return VoteRates.groupInformedConsensus(comment.voteInfo(), includePasses(), useEstimate());
    }

    @Override
    protected double commonGroundDisagreeScore(Comment comment) {
        return VoteRates.groupInformedDisagreeConsensus(comment.voteInfo(), includePasses(), useEstimate());
    }

    @Override
    protected boolean isCommonGroundAgree(Comment comment) {
        return minAgreeRate(comment) >= settings.getMinCommonGroundProb();
    }

    @Override
    protected boolean isCommonGroundDisagree(Comment comment) {
        return VoteRates.minDisagreeRate(comment.voteInfo(), includePasses(), useEstimate())
            >= settings.getMinCommonGroundProb();
    }

    @Override
    public String noCommonGroundMessage() {
        return "No statements met the thresholds necessary to be considered as a point of common "
            + "ground (at least " + settings.getMinVoteCount() + " votes, and at least "
            + Percentages.format(settings.getMinCommonGroundProb()) + " agreement across groups).";
    }

    // ── differences of opinion ───────────────────────────────────────────────

    @Override
    public double differenceOfOpinionScore(Comment comment) {
        return VoteRates.maxGroupAgreeRateDifference(comment.voteInfo(), includePasses(), useEstimate());
    }

    @Override
    protected boolean splitsOpinion(Comment comment) {
        return minAgreeRate(comment) < settings.getMinCommonGroundProb()
            && differenceOfOpinionScore(comment) > settings.getMinAgreeProbDifference();
    }

    @Override
    public String noDifferencesMessage() {
        return "No statements met the thresholds necessary to be considered as a significant "
            + "difference of opinion (at least " + settings.getMinVoteCount() + " votes, and more than "
            + Percentages.format(settings.getMinAgreeProbDifference())
            + " difference in agreement rate between groups).";
    }

    // ── per-group ────────────────────────────────────────────────────────────

    /**
     * Comments that {@code groupId} agrees with noticeably more than everyone else, on
     * statements without cross-group common ground. Comments the group did not vote on
     * are skipped.
     */
    public List<Comment> selectGroupRepresentative(String groupId, int k) {
        return topK(
            comment -> groupAgreeRateDifference(comment, groupId),
            k,
            comment -> hasGroup(comment, groupId)
                && minAgreeRate(comment) < settings.getMinCommonGroundProb()
                && groupAgreeRateDifference(comment, groupId) > settings.getMinAgreeProbDifference());
    }

    public List<Comment> selectGroupRepresentative(String groupId) {
        return selectGroupRepresentative(groupId, settings.getMaxSampleSize());
    }

    /** Group ids seen across all comments with vote data, in first-seen order. */
    public List<String> groupIds() {
        Set<String> ids = new LinkedHashSet<>();
        for (Comment comment : comments()) {
            if (comment.hasVotes()) {
                ids.addAll(grouped(comment, "groupIds").talliesByGroup().keySet());
            }
        }
        return new ArrayList<>(ids);
    }

    /**
     * Votes cast by each group (passes included) over all comments, in first-seen order.
     * Comments without vote data are skipped.
     */
    public List<GroupStats> statsByGroup() {
        Map<String, Long> votesByGroup = new LinkedHashMap<>();
        for (Comment comment : comments()) {
            if (!comment.hasVotes()) continue;
            for (Map.Entry<String, VoteTally> entry : grouped(comment, "statsByGroup").talliesByGroup().entrySet()) {
                votesByGroup.merge(entry.getKey(), (long) entry.getValue().totalCount(true), Long::sum);
            }
        }
        List<GroupStats> stats = new ArrayList<>(votesByGroup.size());
        votesByGroup.forEach((name, votes) -> stats.add(new GroupStats(name, votes)));
        return stats;
    }

    // ── helpers ──────────────────────────────────────────────────────────────

    public double minAgreeRate(Comment comment) {
        return VoteRates.minAgreeRate(comment.voteInfo(), includePasses(), useEstimate());
    }

    public double groupAgreeRateDifference(Comment comment, String groupId) {
        return VoteRates.groupAgreeRateDifference(comment.voteInfo(), groupId, includePasses(), useEstimate());
    }

    private static boolean hasGroup(Comment comment, String groupId) {
        return grouped(comment, "selectGroupRepresentative").tallyFor(groupId) != null;
    }

    private static GroupedVotes grouped(Comment comment, String operation) {
        if (comment.voteInfo().kind() != VoteInfoKind.GROUPED) {
            throw new MissingGroupDataException(operation, comment.id());
        }
        return (GroupedVotes) comment.voteInfo();
    }
}
