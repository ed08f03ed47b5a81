package com.sensemaking.analysis.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sensemaking.common.model.GroupStats;
import com.sensemaking.common.scoring.ScoringStrategy;

import java.util.List;
import java.util.Map;

/**
 * Everything the narrative generator needs about one conversation.
 *
 * <p>{@code noCommonGroundMessage} / {@code noDifferencesMessage} are set only when the
 * matching selection is empty. {@code groupStats} and {@code groupRepresentativeIds} are empty
 * for the pooled strategy; otherwise every group has a representative entry, possibly empty.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ConversationReport(
    @JsonProperty("strategy")              ScoringStrategy strategy,
    @JsonProperty("commentCount")          int commentCount,
    @JsonProperty("filteredCommentCount")  int filteredCommentCount,
    @JsonProperty("voteCount")             long voteCount,
    @JsonProperty("topicStats")            List<TopicStatsView> topicStats,
    @JsonProperty("groupStats")            List<GroupStats> groupStats,
    @JsonProperty("commonGroundIds")       List<String> commonGroundIds,
    @JsonProperty("differenceOfOpinionIds") List<String> differenceOfOpinionIds,
    @JsonProperty("uncertainIds")          List<String> uncertainIds,
    @JsonProperty("groupRepresentativeIds") Map<String, List<String>> groupRepresentativeIds,
    @JsonProperty("noCommonGroundMessage") String noCommonGroundMessage,
    @JsonProperty("noDifferencesMessage")  String noDifferencesMessage,
    @JsonProperty("commentScores")         List<CommentScores> commentScores
) {}
