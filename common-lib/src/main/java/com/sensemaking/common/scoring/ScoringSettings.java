package com.sensemaking.common.scoring;

import lombok.Builder;
import lombok.Value;

/**
 * Thresholds and flags used by a {@link ConsensusScorer}.
 *
 * <p>Immutable. Start from {@link #groupAwareDefaults()} or {@link #pooledDefaults()} and
 * override single values with {@code toBuilder()}:
 * <pre>
 *   ScoringSettings strict = ScoringSettings.groupAwareDefaults().toBuilder()
 *       .minVoteCount(50)
 *       .build();
 * </pre>
 *
 * <table>
 *   <caption>Defaults</caption>
 *   <tr><th>field</th><th>group-aware</th><th>pooled</th></tr>
 *   <tr><td>minVoteCount</td><td>20</td><td>20</td></tr>
 *   <tr><td>minCommonGroundProb</td><td>0.6</td><td>0.7</td></tr>
 *   <tr><td>minAgreeProbDifference</td><td>0.3</td><td>0.3</td></tr>
 *   <tr><td>minDifferenceProb / maxDifferenceProb</td><td>0.4 / 0.6</td><td>0.4 / 0.6</td></tr>
 *   <tr><td>uncertaintyBuffer</td><td>0.05</td><td>0.05</td></tr>
 *   <tr><td>uncertaintyPercentile / minUncertaintyProb</td><td>0.75 / 0.2</td><td>0.75 / 0.2</td></tr>
 *   <tr><td>maxSampleSize</td><td>12</td><td>12</td></tr>
 *   <tr><td>includePasses</td><td>true</td><td>false</td></tr>
 *   <tr><td>useEstimate</td><td>true</td><td>false</td></tr>
 * </table>
 */
@Value
@Builder(toBuilder = true)
public class ScoringSettings {

    /** Comments with fewer total votes (passes included) are not ranked. */
    @Builder.Default int minVoteCount = 20;

    /** Agreement (or disagreement) a comment needs to count as common ground. */
    @Builder.Default double minCommonGroundProb = 0.6;

    /** Group-vs-rest agree-rate gap a comment needs to count as a difference of opinion. */
    @Builder.Default double minAgreeProbDifference = 0.3;

    /** Pooled differences of opinion: lower edge of the agree / disagree mid-band. */
    @Builder.Default double minDifferenceProb = 0.4;

    /** Pooled differences of opinion: upper edge of the agree / disagree mid-band. */
    @Builder.Default double maxDifferenceProb = 0.6;

    /** Pooled differences of opinion must sit this far below the uncertainty threshold. */
    @Builder.Default double uncertaintyBuffer = 0.05;

    /** Quantile of observed pass rates used as the uncertainty threshold. */
    @Builder.Default double uncertaintyPercentile = 0.75;

    /** Floor for the uncertainty threshold. */
    @Builder.Default double minUncertaintyProb = 0.2;

    /** Number of comments returned when a selector is called without {@code k}. */
    @Builder.Default int maxSampleSize = 12;

    /** Whether pass votes count toward agree / disagree denominators. */
    @Builder.Default boolean includePasses = true;

    /** Whether rates use the (n + 1) / (d + 2) estimate instead of the raw ratio. */
    @Builder.Default boolean useEstimate = true;

    public static ScoringSettings groupAwareDefaults() {
        return ScoringSettings.builder().build();
    }

    public static ScoringSettings pooledDefaults() {
        return ScoringSettings.builder()
            .minCommonGroundProb(0.7)
            .includePasses(false)
            .useEstimate(false)
            .build();
    }
}
