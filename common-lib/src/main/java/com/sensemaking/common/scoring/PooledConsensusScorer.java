package com.sensemaking.common.scoring;

import com.sensemaking.common.estimate.VoteRates;
import com.sensemaking.common.model.Comment;
import com.sensemaking.common.util.Percentages;

import java.util.List;

/**
 * {@link ConsensusScorer} that ignores opinion groups and looks at everyone's votes together.
 * Grouped vote data is summed across groups before any rate is computed.
 *
 * <h3>Algorithm</h3>
 * <pre>
 *   agree    = totalAgreeRate(votes)       (passes per includePasses)
 *   disagree = totalDisagreeRate(votes)
 *   pass     = totalPassRate(votes)        (passes always counted)
 *
 *   common ground agree     : score = agree,    eligible agree    ≥ minCommonGroundProb
 *   common ground disagree  : score = disagree, eligible disagree ≥ minCommonGroundProb
 *   difference of opinion   : score = 1 − |agree − disagree| − pass
 *                             eligible agree, disagree ∈ [minDifferenceProb, maxDifferenceProb]
 *                                  and pass &lt; uncertaintyThreshold − uncertaintyBuffer
 * </pre>
 * The difference score peaks when agree and disagree are both near one half and few
 * participants passed.
 *
 * <p>Immutable once constructed.
 */
public class PooledConsensusScorer extends AbstractConsensusScorer {

    public PooledConsensusScorer(List<Comment> comments) {
        this(comments, ScoringSettings.pooledDefaults());
    }

    public PooledConsensusScorer(List<Comment> comments, ScoringSettings settings) {
        super(comments, settings);
    }

    @Override
    public ScoringStrategy strategy() {
        return ScoringStrategy.POOLED;
    }

    // ── common ground ────────────────────────────────────────────────────────

    @Override
    protected double commonGroundAgreeScore(Comment comment) {
        return agreeRate(comment);
    }

    @Override
    protected double commonGroundDisagreeScore(Comment comment) {
        return disagreeRate(comment);
    }

    @Override
    protected boolean isCommonGroundAgree(Comment comment) {
        return agreeRate(comment) >= settings.getMinCommonGroundProb();
    }

    @Override
    protected boolean isCommonGroundDisagree(Comment comment) {
        return disagreeRate(comment) >= settings.getMinCommonGroundProb();
    }

    @Override
    public String noCommonGroundMessage() {
        return "No statements met the thresholds necessary to be considered as a point of common "
            + "ground (at least " + settings.getMinVoteCount() + " votes, and at least "
            + Percentages.format(settings.getMinCommonGroundProb()) + " agreement).";
    }

    // ── differences of opinion ───────────────────────────────────────────────

    @Override
    public double differenceOfOpinionScore(Comment comment) {
        return 1.0 - Math.abs(agreeRate(comment) - disagreeRate(comment)) - uncertaintyScore(comment);
    }

    @Override
    protected boolean splitsOpinion(Comment comment) {
        return inMidBand(agreeRate(comment))
            && inMidBand(disagreeRate(comment))
            && uncertaintyScore(comment) < uncertaintyThreshold() - settings.getUncertaintyBuffer();
    }

    @Override
    public String noDifferencesMessage() {
        return "No statements met the thresholds necessary to be considered as a significant "
            + "difference of opinion (at least " + settings.getMinVoteCount() + " votes, and both an "
            + "agreement rate and disagree rate between "
            + Percentages.format(settings.getMinDifferenceProb()) + " and "
            + Percentages.format(settings.getMaxDifferenceProb()) + ").";
    }

    // ── rates ────────────────────────────────────────────────────────────────

    public double agreeRate(Comment comment) {
        return VoteRates.totalAgreeRate(comment.voteInfo(), includePasses(), useEstimate());
    }

    public double disagreeRate(Comment comment) {
        return VoteRates.totalDisagreeRate(comment.voteInfo(), includePasses(), useEstimate());
    }

    private boolean inMidBand(double rate) {
        return rate >= settings.getMinDifferenceProb() && rate <= settings.getMaxDifferenceProb();
    }
}
