package com.sensemaking.analysis.service;

import com.sensemaking.analysis.report.CommentScores;
import com.sensemaking.analysis.report.ConversationReport;
import com.sensemaking.analysis.report.TopicStatsView;
import com.sensemaking.common.context.RelativeContext;
import com.sensemaking.common.estimate.VoteRates;
import com.sensemaking.common.model.Comment;
import com.sensemaking.common.model.GroupStats;
import com.sensemaking.common.model.Topic;
import com.sensemaking.common.scoring.ConsensusScorer;
import com.sensemaking.common.scoring.GroupAwareConsensusScorer;
import com.sensemaking.common.scoring.ScorerFactory;
import com.sensemaking.common.scoring.ScoringSettings;
import com.sensemaking.common.topic.TopicAggregator;
import com.sensemaking.common.topic.TopicStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Computes the full statistical report for one conversation.
 *
 * <p>The {@link ScorerFactory} is resolved once (see
 * {@link com.sensemaking.analysis.config.StatsEngineConfig}) and used for the root scorer
 * and every topic node, so the whole report is computed with one strategy.
 *
 * <p>Stateless; every call recomputes from its input.
 */
@Service
public class ConversationStatsService {

    private static final Logger log = LoggerFactory.getLogger(ConversationStatsService.class);

    private final ScorerFactory scorerFactory;

    public ConversationStatsService(ScorerFactory scorerFactory) {
        this.scorerFactory = scorerFactory;
    }

    public ConversationReport analyze(List<Comment> comments) {
        ConsensusScorer root = scorerFactory.create(comments);
        List<TopicStats> topics = TopicAggregator.statsByTopic(comments, scorerFactory);
        log.info("Analyzing conversation: comments={} ranked={} topics={} strategy={}",
            root.commentCount(), root.filteredComments().size(), topics.size(), root.strategy());

        List<Comment> commonGround = root.selectCommonGround();
        List<Comment> differences = root.selectDifferencesOfOpinion();
        List<Comment> uncertain = root.selectUncertain();

        List<GroupStats> groupStats = List.of();
        Map<String, List<String>> representatives = Map.of();
        if (root instanceof GroupAwareConsensusScorer grouped) {
            groupStats = grouped.statsByGroup();
            representatives = groupRepresentatives(grouped);
        }

        return new ConversationReport(
            root.strategy(),
            root.commentCount(),
            root.filteredComments().size(),
            root.voteCount(),
            topicViews(topics),
            groupStats,
            ids(commonGround),
            ids(differences),
            ids(uncertain),
            representatives,
            commonGround.isEmpty() ? root.noCommonGroundMessage() : null,
            differences.isEmpty() ? root.noDifferencesMessage() : null,
            commentScores(root));
    }

    /** Representative comment ids per group, in first-seen group order. */
    public Map<String, List<String>> groupRepresentatives(GroupAwareConsensusScorer scorer) {
        Map<String, List<String>> representatives = new LinkedHashMap<>();
        for (String groupId : scorer.groupIds()) {
            List<String> selected = ids(scorer.selectGroupRepresentative(groupId));
            log.debug("Group id={} representatives={}", groupId, selected.size());
            representatives.put(groupId, selected);
        }
        return representatives;
    }

    /** Topic tree with relative labels computed among each sibling list. */
    public List<TopicStatsView> topicViews(List<TopicStats> siblings) {
        RelativeContext context = new RelativeContext(siblings);
        List<TopicStatsView> views = new ArrayList<>(siblings.size());
        for (TopicStats node : siblings) {
            log.debug("Topic name={} comments={} votes={}", node.name(), node.commentCount(), node.voteCount());
            views.add(new TopicStatsView(
                node.name(),
                node.commentCount(),
                node.voteCount(),
                context.describeEngagement(node),
                context.describeAlignment(node),
                node.hasSubtopics() ? topicViews(node.subtopicStats()) : List.of()));
        }
        return views;
    }

    /** One scoring snapshot per input comment, in input order. */
    public List<CommentScores> commentScores(ConsensusScorer scorer) {
        int unbounded = scorer.commentCount();
        Set<String> highAlignment = idSet(scorer.selectCommonGround(unbounded));
        Set<String> lowAlignment = idSet(scorer.selectDifferencesOfOpinion(unbounded));
        Set<String> highUncertainty = idSet(scorer.selectUncertain(unbounded));
        Set<String> ranked = idSet(scorer.filteredComments());
        ScoringSettings settings = scorer.settings();

        List<CommentScores> scores = new ArrayList<>(scorer.commentCount());
        for (Comment comment : scorer.comments()) {
            String topics = describeTopics(comment);
            if (!comment.hasVotes()) {
                scores.add(CommentScores.unvoted(comment.id(), comment.text(), topics));
                continue;
            }
            boolean isRanked = ranked.contains(comment.id());
            scores.add(new CommentScores(
                comment.id(),
                comment.text(),
                comment.voteInfo(),
                topics,
                VoteRates.totalAgreeRate(comment.voteInfo(), settings.isIncludePasses(), settings.isUseEstimate()),
                VoteRates.totalDisagreeRate(comment.voteInfo(), settings.isIncludePasses(), settings.isUseEstimate()),
                VoteRates.totalPassRate(comment.voteInfo(), settings.isUseEstimate()),
                highAlignment.contains(comment.id()),
                isRanked ? scorer.commonGroundScore(comment) : null,
                lowAlignment.contains(comment.id()),
                isRanked ? scorer.differenceOfOpinionScore(comment) : null,
                highUncertainty.contains(comment.id()),
                scorer.uncertaintyScore(comment),
                !isRanked));
        }
        return scores;
    }

    /** {@code "Topic:Subtopic;Topic"} rendering of a comment's labels. */
    static String describeTopics(Comment comment) {
        List<String> parts = new ArrayList<>();
        for (Topic topic : comment.topics()) {
            if (topic.isLeaf()) {
                parts.add(topic.name());
            } else {
                for (Topic subtopic : topic.subtopics()) {
                    parts.add(topic.name() + ":" + subtopic.name());
                }
            }
        }
        return String.join(";", parts);
    }

    private static List<String> ids(List<Comment> comments) {
        return comments.stream().map(Comment::id).collect(Collectors.toList());
    }

    private static Set<String> idSet(List<Comment> comments) {
        return new HashSet<>(ids(comments));
    }
}
