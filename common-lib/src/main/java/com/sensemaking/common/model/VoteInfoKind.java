package com.sensemaking.common.model;

/**
 * Explicit variant marker of a {@link VoteInfo}.
 */
public enum VoteInfoKind {
    /** A single tally for the whole participant body. */
    POOLED,
    /** One tally per opinion group. */
    GROUPED
}
