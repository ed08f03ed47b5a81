package com.sensemaking.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Number of votes an opinion group cast across a set of comments (passes included).
 */
public record GroupStats(
    @JsonProperty("name")      String name,
    @JsonProperty("voteCount") long voteCount
) {}
