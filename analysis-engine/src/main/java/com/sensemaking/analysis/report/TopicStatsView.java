package com.sensemaking.analysis.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Serialisable view of one topic node, stripped of its comments and scorer, with the
 * relative labels a narrative generator quotes verbatim.
 *
 * <p>No logic, pure model.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TopicStatsView(
    @JsonProperty("name")               String name,
    @JsonProperty("commentCount")       int commentCount,
    @JsonProperty("voteCount")          long voteCount,
    @JsonProperty("relativeEngagement") String relativeEngagement,
    @JsonProperty("relativeAlignment")  String relativeAlignment,
    @JsonProperty("subtopicStats")      List<TopicStatsView> subtopicStats
) {}
