package com.sensemaking.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * {@link VoteInfo} variant holding one tally for the whole participant body.
 */
public record PooledVotes(
    @JsonProperty("tally") VoteTally tally
) implements VoteInfo {

    public PooledVotes {
        Objects.requireNonNull(tally, "tally");
    }

    @Override
    @JsonProperty("kind")
    public VoteInfoKind kind() {
        return VoteInfoKind.POOLED;
    }

    @Override
    public int totalCount(boolean includePasses) {
        return tally.totalCount(includePasses);
    }

    @Override
    @JsonIgnore
    public VoteTally combined() {
        return tally;
    }
}
