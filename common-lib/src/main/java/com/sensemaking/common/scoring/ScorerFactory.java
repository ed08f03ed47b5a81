package com.sensemaking.common.scoring;

import com.sensemaking.common.model.Comment;

import java.util.List;

/**
 * Creates a {@link ConsensusScorer} scoped to a given comment set.
 *
 * <p>Resolved once for a whole computation and handed down, so every node of a topic tree
 * is scored with the same strategy and settings as its root.
 */
@FunctionalInterface
public interface ScorerFactory {

    ConsensusScorer create(List<Comment> comments);
}
