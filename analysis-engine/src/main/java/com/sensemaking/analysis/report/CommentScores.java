package com.sensemaking.analysis.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sensemaking.common.model.VoteInfo;

/**
 * Per-comment scoring snapshot.
 *
 * <ul>
 *   <li>{@code highAlignment*}  : common ground membership and score</li>
 *   <li>{@code lowAlignment*}   : difference-of-opinion membership and score</li>
 *   <li>{@code highUncertainty*}: uncertainty membership and score (pass rate)</li>
 *   <li>{@code filteredOut}     : true when the comment had too few votes to be ranked</li>
 * </ul>
 * Rate and score fields are {@code null} for comments without vote data.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record CommentScores(
    @JsonProperty("id")                   String id,
    @JsonProperty("text")                 String text,
    @JsonProperty("votes")                VoteInfo votes,
    @JsonProperty("topics")               String topics,
    @JsonProperty("agreeRate")            Double agreeRate,
    @JsonProperty("disagreeRate")         Double disagreeRate,
    @JsonProperty("passRate")             Double passRate,
    @JsonProperty("isHighAlignment")      Boolean highAlignment,
    @JsonProperty("highAlignmentScore")   Double highAlignmentScore,
    @JsonProperty("isLowAlignment")       Boolean lowAlignment,
    @JsonProperty("lowAlignmentScore")    Double lowAlignmentScore,
    @JsonProperty("isHighUncertainty")    Boolean highUncertainty,
    @JsonProperty("highUncertaintyScore") Double highUncertaintyScore,
    @JsonProperty("isFilteredOut")        Boolean filteredOut
) {

    /** Entry for a comment that carries no votes. */
    public static CommentScores unvoted(String id, String text, String topics) {
        return new CommentScores(id, text, null, topics,
            null, null, null, null, null, null, null, null, null, null);
    }
}
