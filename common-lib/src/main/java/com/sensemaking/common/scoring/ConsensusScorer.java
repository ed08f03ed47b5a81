package com.sensemaking.common.scoring;

import com.sensemaking.common.model.Comment;

import java.util.List;

/**
 * Strategy contract for ranking the comments of one comment set by how well they
 * represent common ground, differences of opinion, or uncertainty.
 *
 * <p>An instance is bound to exactly the comments it was created with. Only comments that
 * carry votes and reach {@link ScoringSettings#getMinVoteCount()} are ranked
 * ({@link #filteredComments()}); the rest still count toward {@link #commentCount()} and
 * {@link #voteCount()}.
 *
 * <p>Implementations:
 * <ul>
 *   <li>{@link PooledConsensusScorer}    : everyone's votes taken together</li>
 *   <li>{@link GroupAwareConsensusScorer}: per-group tallies compared with each other</li>
 * </ul>
 *
 * <p>Selectors return at most {@code k} comments, best first, never padded. Ties keep input
 * order. An empty result is a normal outcome: the {@code no*Message()} methods explain which
 * thresholds were not met.
 */
public interface ConsensusScorer {

    /** Which strategy produced this scorer. */
    ScoringStrategy strategy();

    ScoringSettings settings();

    /** All comments this scorer was created with, in input order. */
    List<Comment> comments();

    /** Comments eligible for ranking: with votes and at least {@code minVoteCount} of them. */
    List<Comment> filteredComments();

    int commentCount();

    /** Sum of all votes, passes included, over {@link #comments()}. */
    long voteCount();

    /** Whether any comment carries a topic with nested subtopics. */
    boolean containsSubtopics();

    // ── common ground ────────────────────────────────────────────────────────

    /** Comments broadly agreed with, or broadly disagreed with. */
    List<Comment> selectCommonGround(int k);

    default List<Comment> selectCommonGround() {
        return selectCommonGround(settings().getMaxSampleSize());
    }

    /** Comments broadly agreed with. */
    List<Comment> selectCommonGroundAgree(int k);

    default List<Comment> selectCommonGroundAgree() {
        return selectCommonGroundAgree(settings().getMaxSampleSize());
    }

    /** Comments broadly disagreed with. */
    List<Comment> selectCommonGroundDisagree(int k);

    default List<Comment> selectCommonGroundDisagree() {
        return selectCommonGroundDisagree(settings().getMaxSampleSize());
    }

    double commonGroundScore(Comment comment);

    boolean isCommonGround(Comment comment);

    String noCommonGroundMessage();

    // ── differences of opinion ───────────────────────────────────────────────

    /** Comments that split opinion without qualifying as common ground. */
    List<Comment> selectDifferencesOfOpinion(int k);

    default List<Comment> selectDifferencesOfOpinion() {
        return selectDifferencesOfOpinion(settings().getMaxSampleSize());
    }

    double differenceOfOpinionScore(Comment comment);

    boolean isDifferenceOfOpinion(Comment comment);

    String noDifferencesMessage();

    // ── uncertainty ──────────────────────────────────────────────────────────

    /** Comments with an unusually high pass rate for this comment set. */
    List<Comment> selectUncertain(int k);

    default List<Comment> selectUncertain() {
        return selectUncertain(settings().getMaxSampleSize());
    }

    double uncertaintyScore(Comment comment);

    boolean isUncertain(Comment comment);

    /** Pass rate above which a comment counts as uncertain, derived from this comment set. */
    double uncertaintyThreshold();
}
