package com.sensemaking.analysis.config;

import com.sensemaking.common.scoring.ScorerFactory;
import com.sensemaking.common.scoring.ScoringSettings;
import com.sensemaking.common.scoring.ScoringStrategy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.ComponentScan;
import org.springframework.context.annotation.Configuration;

/**
 * Binds {@code sensemaking.stats.*} properties to the scoring strategy and its thresholds.
 *
 * <p>Any threshold left unset falls back to the strategy's own default, so switching
 * {@code sensemaking.stats.strategy} alone gives the right preset.
 */
@Configuration
@ComponentScan("com.sensemaking.analysis.service")
public class StatsEngineConfig {

    @Value("${sensemaking.stats.strategy:GROUP_AWARE}")
    private ScoringStrategy strategy;

    @Value("${sensemaking.stats.min-vote-count:#{null}}")
    private Integer minVoteCount;

    @Value("${sensemaking.stats.min-common-ground-prob:#{null}}")
    private Double minCommonGroundProb;

    @Value("${sensemaking.stats.min-agree-prob-difference:#{null}}")
    private Double minAgreeProbDifference;

    @Value("${sensemaking.stats.min-difference-prob:#{null}}")
    private Double minDifferenceProb;

    @Value("${sensemaking.stats.max-difference-prob:#{null}}")
    private Double maxDifferenceProb;

    @Value("${sensemaking.stats.uncertainty-buffer:#{null}}")
    private Double uncertaintyBuffer;

    @Value("${sensemaking.stats.uncertainty-percentile:#{null}}")
    private Double uncertaintyPercentile;

    @Value("${sensemaking.stats.min-uncertainty-prob:#{null}}")
    private Double minUncertaintyProb;

    @Value("${sensemaking.stats.max-sample-size:#{null}}")
    private Integer maxSampleSize;

    @Value("${sensemaking.stats.include-passes:#{null}}")
    private Boolean includePasses;

    @Value("${sensemaking.stats.use-estimate:#{null}}")
    private Boolean useEstimate;

    @Bean
    public ScoringStrategy scoringStrategy() {
        return strategy;
    }

    @Bean
    public ScoringSettings scoringSettings() {
        ScoringSettings.ScoringSettingsBuilder builder = strategy.defaultSettings().toBuilder();
        if (minVoteCount != null)           builder.minVoteCount(minVoteCount);
        if (minCommonGroundProb != null)    builder.minCommonGroundProb(minCommonGroundProb);
        if (minAgreeProbDifference != null) builder.minAgreeProbDifference(minAgreeProbDifference);
        if (minDifferenceProb != null)      builder.minDifferenceProb(minDifferenceProb);
        if (maxDifferenceProb != null)      builder.maxDifferenceProb(maxDifferenceProb);
        if (uncertaintyBuffer != null)      builder.uncertaintyBuffer(uncertaintyBuffer);
        if (uncertaintyPercentile != null)  builder.uncertaintyPercentile(uncertaintyPercentile);
        if (minUncertaintyProb != null)     builder.minUncertaintyProb(minUncertaintyProb);
        if (maxSampleSize != null)          builder.maxSampleSize(maxSampleSize);
        if (includePasses != null)          builder.includePasses(includePasses);
        if (useEstimate != null)            builder.useEstimate(useEstimate);
        return builder.build();
    }

    @Bean
    public ScorerFactory scorerFactory(ScoringSettings scoringSettings) {
        return strategy.factory(scoringSettings);
    }
}
