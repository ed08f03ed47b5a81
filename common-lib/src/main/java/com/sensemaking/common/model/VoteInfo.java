package com.sensemaking.common.model;

import java.util.Map;

/**
 * Vote data attached to a comment. Exactly one of two shapes:
 * <ul>
 *   <li>{@link PooledVotes} : one {@link VoteTally} for everyone</li>
 *   <li>{@link GroupedVotes}: a {@link VoteTally} per opinion-group id</li>
 * </ul>
 * Callers branch on {@link #kind()} instead of probing the structure. A dataset is
 * expected to use one shape throughout; mixing shapes is a caller error.
 */
public interface VoteInfo {

    VoteInfoKind kind();

    /**
     * Total votes across the whole shape.
     *
     * @param includePasses whether pass votes are counted
     */
    int totalCount(boolean includePasses);

    /**
     * The tally obtained by adding every count in this shape together.
     * For pooled data this is the tally itself.
     */
    VoteTally combined();

    static VoteInfo pooled(VoteTally tally) {
        return new PooledVotes(tally);
    }

    static VoteInfo pooled(int agreeCount, int disagreeCount, int passCount) {
        return new PooledVotes(VoteTally.of(agreeCount, disagreeCount, passCount));
    }

    static VoteInfo grouped(Map<String, VoteTally> talliesByGroup) {
        return new GroupedVotes(talliesByGroup);
    }
}
