package com.sensemaking.common.scoring;

import com.sensemaking.common.estimate.Distributions;
import com.sensemaking.common.estimate.VoteRates;
import com.sensemaking.common.model.Comment;
import com.sensemaking.common.model.Topic;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.function.Predicate;
import java.util.function.ToDoubleFunction;

/**
 * Shared plumbing for both {@link ConsensusScorer} strategies: vote-count filtering,
 * top-k ranking, aggregate counts, and the adaptive uncertainty threshold.
 *
 * <h3>Uncertainty threshold</h3>
 * <pre>
 *   rates     = pass rate of every filtered comment
 *   empty or max(rates) − min(rates) &lt; 1e-9  → minUncertaintyProb
 *   otherwise → max(percentile(rates, uncertaintyPercentile), minUncertaintyProb)
 * </pre>
 * A comment is uncertain when its pass rate exceeds the threshold.
 */
abstract class AbstractConsensusScorer implements ConsensusScorer {

    private static final double FLAT_SPREAD = 1e-9;

    protected final ScoringSettings settings;
    private final List<Comment> comments;
    private final List<Comment> filteredComments;
    private final double uncertaintyThreshold;

    protected AbstractConsensusScorer(List<Comment> comments, ScoringSettings settings) {
        Objects.requireNonNull(comments, "comments");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.comments = List.copyOf(comments);
        this.filteredComments = this.comments.stream()
            .filter(Comment::hasVotes)
            .filter(c -> c.voteCount(true) >= settings.getMinVoteCount())
            .toList();
        this.uncertaintyThreshold = computeUncertaintyThreshold();
    }

    @Override
    public ScoringSettings settings() {
        return settings;
    }

    @Override
    public List<Comment> comments() {
        return comments;
    }

    @Override
    public List<Comment> filteredComments() {
        return filteredComments;
    }

    @Override
    public int commentCount() {
        return comments.size();
    }

    @Override
    public long voteCount() {
        long total = 0;
        for (Comment comment : comments) {
            total += comment.voteCount(true);
        }
        return total;
    }

    @Override
    public boolean containsSubtopics() {
        for (Comment comment : comments) {
            for (Topic topic : comment.topics()) {
                if (!topic.isLeaf()) return true;
            }
        }
        return false;
    }

    // ── common ground: both halves ranked together ───────────────────────────

    @Override
    public List<Comment> selectCommonGround(int k) {
        return topK(this::commonGroundScore, k, this::isCommonGround);
    }

    @Override
    public double commonGroundScore(Comment comment) {
        return Math.max(commonGroundAgreeScore(comment), commonGroundDisagreeScore(comment));
    }

    @Override
    public List<Comment> selectCommonGroundAgree(int k) {
        return topK(this::commonGroundAgreeScore, k, this::isCommonGroundAgree);
    }

    @Override
    public List<Comment> selectCommonGroundDisagree(int k) {
        return topK(this::commonGroundDisagreeScore, k, this::isCommonGroundDisagree);
    }

    @Override
    public boolean isCommonGround(Comment comment) {
        return isCommonGroundAgree(comment) || isCommonGroundDisagree(comment);
    }

    protected abstract double commonGroundAgreeScore(Comment comment);

    protected abstract double commonGroundDisagreeScore(Comment comment);

    protected abstract boolean isCommonGroundAgree(Comment comment);

    protected abstract boolean isCommonGroundDisagree(Comment comment);

    // ── differences of opinion ───────────────────────────────────────────────

    @Override
    public List<Comment> selectDifferencesOfOpinion(int k) {
        return topK(this::differenceOfOpinionScore, k, this::isDifferenceOfOpinion);
    }

    @Override
    public boolean isDifferenceOfOpinion(Comment comment) {
        return !isCommonGround(comment) && splitsOpinion(comment);
    }

    /** Strategy-specific test for a split; common ground is already excluded by the caller. */
    protected abstract boolean splitsOpinion(Comment comment);

    // ── uncertainty ──────────────────────────────────────────────────────────

    @Override
    public List<Comment> selectUncertain(int k) {
        return topK(this::uncertaintyScore, k, this::isUncertain);
    }

    @Override
    public final double uncertaintyScore(Comment comment) {
        return VoteRates.totalPassRate(comment.voteInfo(), settings.isUseEstimate());
    }

    @Override
    public boolean isUncertain(Comment comment) {
        return uncertaintyScore(comment) > uncertaintyThreshold;
    }

    @Override
    public double uncertaintyThreshold() {
        return uncertaintyThreshold;
    }

    private double computeUncertaintyThreshold() {
        List<Double> passRates = new ArrayList<>(filteredComments.size());
        for (Comment comment : filteredComments) {
            passRates.add(uncertaintyScore(comment));
        }
        double floor = settings.getMinUncertaintyProb();
        if (passRates.isEmpty() || Distributions.spread(passRates) < FLAT_SPREAD) {
            return floor;
        }
        return Math.max(Distributions.percentile(passRates, settings.getUncertaintyPercentile()), floor);
    }

    // ── ranking ──────────────────────────────────────────────────────────────

    /**
     * Filtered comments passing {@code eligible}, sorted by {@code score} descending
     * (stable), truncated to {@code k}.
     */
    protected List<Comment> topK(ToDoubleFunction<Comment> score, int k, Predicate<Comment> eligible) {
        if (k < 0) {
            throw new IllegalArgumentException("k must not be negative: " + k);
        }
        return filteredComments.stream()
            .filter(eligible)
            .sorted(Comparator.comparingDouble(score).reversed())
            .limit(k)
            .toList();
    }

    protected boolean includePasses() {
        return settings.isIncludePasses();
    }

    protected boolean useEstimate() {
        return settings.isUseEstimate();
    }
}
