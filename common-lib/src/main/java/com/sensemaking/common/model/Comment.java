package com.sensemaking.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Objects;

/**
 * A participant statement with optional vote data and topic labels.
 *
 * <p>Identity is the {@code id}: two comments with the same id are the same statement,
 * whatever object holds them.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Comment(
    @JsonProperty("id")       String id,
    @JsonProperty("text")     String text,
    @JsonProperty("voteInfo") VoteInfo voteInfo,   // nullable
    @JsonProperty("topics")   List<Topic> topics
) {

    public Comment {
        Objects.requireNonNull(id, "id");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Comment id must not be blank");
        }
        text = text == null ? "" : text;
        topics = topics == null ? List.of() : List.copyOf(topics);
    }

    public static Comment of(String id, String text) {
        return new Comment(id, text, null, List.of());
    }

    public static Comment of(String id, String text, VoteInfo voteInfo) {
        return new Comment(id, text, voteInfo, List.of());
    }

    public boolean hasVotes() {
        return voteInfo != null;
    }

    public boolean hasTopics() {
        return !topics.isEmpty();
    }

    /** Total votes on this comment; 0 when there is no vote data. */
    public int voteCount(boolean includePasses) {
        return voteInfo == null ? 0 : voteInfo.totalCount(includePasses);
    }
}
