package com.sensemaking.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * {@link VoteInfo} variant holding one tally per opinion group.
 *
 * <p>Group iteration order is the insertion order of the supplied map, which keeps
 * every product / minimum / difference computation reproducible.
 */
public record GroupedVotes(
    @JsonProperty("talliesByGroup") Map<String, VoteTally> talliesByGroup
) implements VoteInfo {

    public GroupedVotes {
        Objects.requireNonNull(talliesByGroup, "talliesByGroup");
        if (talliesByGroup.isEmpty()) {
            throw new IllegalArgumentException("Grouped votes need at least one group");
        }
        Map<String, VoteTally> copy = new LinkedHashMap<>();
        talliesByGroup.forEach((group, tally) -> copy.put(
            Objects.requireNonNull(group, "group id"),
            Objects.requireNonNull(tally, "tally for group " + group)));
        talliesByGroup = Collections.unmodifiableMap(copy);
    }

    @Override
    @JsonProperty("kind")
    public VoteInfoKind kind() {
        return VoteInfoKind.GROUPED;
    }

    @Override
    public int totalCount(boolean includePasses) {
        int total = 0;
        for (VoteTally tally : talliesByGroup.values()) {
            total += tally.totalCount(includePasses);
        }
        return total;
    }

    @Override
    @JsonIgnore
    public VoteTally combined() {
        VoteTally sum = VoteTally.EMPTY;
        for (VoteTally tally : talliesByGroup.values()) {
            sum = sum.plus(tally);
        }
        return sum;
    }

    /** Tally for {@code groupId}, or {@code null} if the group did not vote on this comment. */
    public VoteTally tallyFor(String groupId) {
        return talliesByGroup.get(groupId);
    }

    /**
     * Sum of every tally except the one for {@code groupId}: the rest of the
     * conversation as seen from that group.
     */
    public VoteTally complementOf(String groupId) {
        VoteTally sum = VoteTally.EMPTY;
        for (Map.Entry<String, VoteTally> entry : talliesByGroup.entrySet()) {
            if (!entry.getKey().equals(groupId)) {
                sum = sum.plus(entry.getValue());
            }
        }
        return sum;
    }
}
