package com.sensemaking.common.topic;

import com.sensemaking.common.model.Comment;
import com.sensemaking.common.model.Topic;
import com.sensemaking.common.scoring.ScorerFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the {@link TopicStats} tree for a flat comment collection.
 *
 * <h3>Algorithm</h3>
 * <ol>
 *   <li>Walk every comment's topic labels into a name-keyed tree. Each node keeps the comments
 *       labelled with it as a leaf; comments are keyed by id so a statement filed under several
 *       subtopics of one topic counts once for that topic.</li>
 *   <li>A node's comment set is its own comments plus those of all descendants, deduplicated.
 *       For the usual topic → subtopic labels this is the union of the subtopic sets.</li>
 *   <li>Every node gets a fresh scorer from the supplied {@link ScorerFactory}, bound to
 *       exactly that comment set.</li>
 *   <li>Siblings are ordered by {@link TopicOrdering} at every level.</li>
 * </ol>
 *
 * <p>Comments without topics are skipped. Sibling names are assumed unique; duplicates are
 * merged into one node. Input comments are never modified.
 */
public final class TopicAggregator {

    private static final Logger log = LoggerFactory.getLogger(TopicAggregator.class);

    private TopicAggregator() {}

    /**
     * @param comments categorized comments
     * @param factory  produces the scorer for each node, usually the root's strategy
     * @return top-level topics, sorted; empty if no comment carries topics
     */
    public static List<TopicStats> statsByTopic(List<Comment> comments, ScorerFactory factory) {
        Objects.requireNonNull(comments, "comments");
        Objects.requireNonNull(factory, "factory");

        Map<String, Node> roots = new LinkedHashMap<>();
        for (Comment comment : comments) {
            if (!comment.hasTopics()) {
                log.debug("Comment with id={} has no topics assigned, skipping", comment.id());
                continue;
            }
            for (Topic topic : comment.topics()) {
                roots.computeIfAbsent(topic.name(), Node::new).add(topic, comment);
            }
        }

        List<TopicStats> stats = new ArrayList<>(roots.size());
        for (Node root : roots.values()) {
            stats.add(root.toStats(factory));
        }
        return TopicOrdering.sort(stats);
    }

    // ── tree under construction ──────────────────────────────────────────────

    private static final class Node {
        private final String name;
        private final Map<String, Comment> ownComments = new LinkedHashMap<>();
        private final Map<String, Node> children = new LinkedHashMap<>();

        Node(String name) {
            this.name = name;
        }

        void add(Topic label, Comment comment) {
            if (label.isLeaf()) {
                ownComments.putIfAbsent(comment.id(), comment);
                return;
            }
            for (Topic sub : label.subtopics()) {
                children.computeIfAbsent(sub.name(), Node::new).add(sub, comment);
            }
        }

        TopicStats toStats(ScorerFactory factory) {
            Map<String, Comment> all = new LinkedHashMap<>(ownComments);
            List<TopicStats> childStats = new ArrayList<>(children.size());
            for (Node child : children.values()) {
                TopicStats stats = child.toStats(factory);
                childStats.add(stats);
                for (Comment comment : stats.scorer().comments()) {
                    all.putIfAbsent(comment.id(), comment);
                }
            }
            List<Comment> members = List.copyOf(all.values());
            return new TopicStats(name, members.size(), TopicOrdering.sort(childStats), factory.create(members));
        }
    }
}
