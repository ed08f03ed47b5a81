package com.sensemaking.common.context;

import com.sensemaking.common.estimate.Distributions;
import com.sensemaking.common.model.Comment;
import com.sensemaking.common.scoring.ConsensusScorer;
import com.sensemaking.common.topic.TopicStats;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Compares sibling topics with each other so a report can call one topic's engagement or
 * alignment high or low <i>relative to its siblings</i>. Labels are never absolute.
 *
 * <h3>Metrics</h3>
 * <pre>
 *   alignment  = |common ground agree ∪ common ground disagree| / commentCount
 *                with both selections unbounded
 *   engagement = commentCount / max sibling commentCount
 *              + voteCount    / max sibling voteCount          ∈ [0, 2]
 * </pre>
 * Mean and sample standard deviation of each metric are taken over the siblings; each node
 * is then bucketed with {@link RelativeLevel#classify}.
 *
 * <p>Immutable once constructed.
 */
public class RelativeContext {

    public static final String ENGAGEMENT = "engagement";
    public static final String ALIGNMENT  = "alignment";

    private final int maxCommentCount;
    private final long maxVoteCount;

    private final double averageEngagement;
    private final double engagementStdDeviation;
    private final double averageAlignment;
    private final double alignmentStdDeviation;

    /**
     * @param siblings direct children of one topic (or the top-level topics)
     */
    public RelativeContext(List<TopicStats> siblings) {
        Objects.requireNonNull(siblings, "siblings");

        int maxComments = 0;
        long maxVotes = 0;
        for (TopicStats sibling : siblings) {
            maxComments = Math.max(maxComments, sibling.scorer().commentCount());
            maxVotes = Math.max(maxVotes, sibling.scorer().voteCount());
        }
        this.maxCommentCount = maxComments;
        this.maxVoteCount = maxVotes;

        List<Double> engagement = new ArrayList<>(siblings.size());
        List<Double> alignment = new ArrayList<>(siblings.size());
        for (TopicStats sibling : siblings) {
            engagement.add(engagement(sibling.scorer()));
            alignment.add(alignment(sibling.scorer()));
        }
        this.averageEngagement = Distributions.mean(engagement);
        this.engagementStdDeviation = Distributions.sampleStandardDeviation(engagement);
        this.averageAlignment = Distributions.mean(alignment);
        this.alignmentStdDeviation = Distributions.sampleStandardDeviation(alignment);
    }

    // ── engagement ───────────────────────────────────────────────────────────

    /** Engagement metric in [0, 2]; a zero maximum contributes 0 for that half. */
    public double engagement(ConsensusScorer scorer) {
        double comments = maxCommentCount == 0 ? 0.0 : (double) scorer.commentCount() / maxCommentCount;
        double votes = maxVoteCount == 0 ? 0.0 : (double) scorer.voteCount() / maxVoteCount;
        return comments + votes;
    }

    public RelativeLevel relativeEngagement(TopicStats node) {
        return RelativeLevel.classify(engagement(node.scorer()), averageEngagement, engagementStdDeviation);
    }

    /** e.g. "moderately low engagement". */
    public String describeEngagement(TopicStats node) {
        return relativeEngagement(node).describe(ENGAGEMENT);
    }

    // ── alignment ────────────────────────────────────────────────────────────

    /**
     * Share of a node's comments that are common ground either way; 0 for an empty node.
     * A comment in both halves (possible when minCommonGroundProb is at most 0.5) counts once.
     */
    public static double alignment(ConsensusScorer scorer) {
        if (scorer.commentCount() == 0) return 0.0;
        int unbounded = scorer.commentCount();
        Set<String> highAlignment = new HashSet<>();
        for (Comment comment : scorer.selectCommonGroundAgree(unbounded)) {
            highAlignment.add(comment.id());
        }
        for (Comment comment : scorer.selectCommonGroundDisagree(unbounded)) {
            highAlignment.add(comment.id());
        }
        return (double) highAlignment.size() / scorer.commentCount();
    }

    public RelativeLevel relativeAlignment(TopicStats node) {
        return RelativeLevel.classify(alignment(node.scorer()), averageAlignment, alignmentStdDeviation);
    }

    /** e.g. "high alignment". */
    public String describeAlignment(TopicStats node) {
        return relativeAlignment(node).describe(ALIGNMENT);
    }

    // ── distribution accessors ───────────────────────────────────────────────

    public double averageEngagement() {
        return averageEngagement;
    }

    public double engagementStdDeviation() {
        return engagementStdDeviation;
    }

    public double averageAlignment() {
        return averageAlignment;
    }

    public double alignmentStdDeviation() {
        return alignmentStdDeviation;
    }
}
