package com.sensemaking.common.topic;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.sensemaking.common.scoring.ConsensusScorer;

import java.util.List;
import java.util.Objects;

/**
 * One node of the topic tree produced by {@link TopicAggregator}.
 *
 * <ul>
 *   <li>{@code commentCount} : distinct comments under this node (by id)</li>
 *   <li>{@code subtopicStats}: child nodes, largest first, {@code "Other"} last; empty for leaves</li>
 *   <li>{@code scorer}       : scorer bound to exactly this node's comments</li>
 * </ul>
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record TopicStats(
    @JsonProperty("name")          String name,
    @JsonProperty("commentCount")  int commentCount,
    @JsonProperty("subtopicStats") List<TopicStats> subtopicStats,
    @JsonIgnore                    ConsensusScorer scorer
) {

    public TopicStats {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(scorer, "scorer");
        subtopicStats = subtopicStats == null ? List.of() : List.copyOf(subtopicStats);
    }

    @JsonProperty("voteCount")
    public long voteCount() {
        return scorer.voteCount();
    }

    public boolean hasSubtopics() {
        return !subtopicStats.isEmpty();
    }
}
