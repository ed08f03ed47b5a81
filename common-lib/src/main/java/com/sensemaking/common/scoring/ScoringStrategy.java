package com.sensemaking.common.scoring;

/**
 * The available {@link ConsensusScorer} implementations.
 */
public enum ScoringStrategy {

    /** Ignores opinion groups; works with either vote shape. */
    POOLED,

    /** Compares opinion groups; requires per-group vote tallies. */
    GROUP_AWARE;

    /** Settings this strategy uses when none are supplied. */
    public ScoringSettings defaultSettings() {
        return switch (this) {
            case POOLED      -> ScoringSettings.pooledDefaults();
            case GROUP_AWARE -> ScoringSettings.groupAwareDefaults();
        };
    }

    public ScorerFactory factory() {
        return factory(defaultSettings());
    }

    public ScorerFactory factory(ScoringSettings settings) {
        return switch (this) {
            case POOLED      -> comments -> new PooledConsensusScorer(comments, settings);
            case GROUP_AWARE -> comments -> new GroupAwareConsensusScorer(comments, settings);
        };
    }
}
