package com.sensemaking.analysis.service;

import com.sensemaking.analysis.report.CommentScores;
import com.sensemaking.analysis.report.ConversationReport;
import com.sensemaking.analysis.report.TopicStatsView;
import com.sensemaking.common.model.Comment;
import com.sensemaking.common.model.GroupStats;
import com.sensemaking.common.model.Topic;
import com.sensemaking.common.model.VoteInfo;
import com.sensemaking.common.model.VoteTally;
import com.sensemaking.common.scoring.ScoringStrategy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end report over a small two-group conversation.
 *
 * <pre>
 *   c1  Environment:Parks    everyone agrees           → common ground
 *   c2  Environment:Parks    group a for, group b not  → difference of opinion, represents a
 *   c3  Environment:Transit  mostly passes             → uncertain
 *   c4  Economy              7 votes                   → filtered out
 *   c5  Other                no votes
 * </pre>
 */
class ConversationStatsServiceTest {

    private static VoteInfo groups(VoteTally a, VoteTally b) {
        Map<String, VoteTally> tallies = new LinkedHashMap<>();
        tallies.put("a", a);
        tallies.put("b", b);
        return VoteInfo.grouped(tallies);
    }

    private static final List<Comment> CONVERSATION = List.of(
        new Comment("c1", "More trees in parks", groups(VoteTally.of(40, 1, 0), VoteTally.of(40, 1, 0)),
            List.of(Topic.withSubtopics("Environment", "Parks"))),
        new Comment("c2", "Fence the dog park", groups(VoteTally.of(20, 10, 0), VoteTally.of(5, 10, 5)),
            List.of(Topic.withSubtopics("Environment", "Parks"))),
        new Comment("c3", "Congestion pricing", groups(VoteTally.of(5, 5, 20), VoteTally.of(5, 5, 20)),
            List.of(Topic.withSubtopics("Environment", "Transit"))),
        new Comment("c4", "Lower business taxes", groups(VoteTally.of(3, 2, 0), VoteTally.of(1, 1, 0)),
            List.of(Topic.leaf("Economy"))),
        new Comment("c5", "Unrelated remark", null, List.of(Topic.leaf("Other"))));

    private final ConversationStatsService service =
        new ConversationStatsService(ScoringStrategy.GROUP_AWARE.factory());

    // ── headline selections ───────────────────────────────────────────────

    @Nested
    @DisplayName("selections")
    class SelectionTests {

        private final ConversationReport report = service.analyze(CONVERSATION);

        @Test
        @DisplayName("counts cover every statement, ranked ones separately")
        void counts() {
            assertEquals(ScoringStrategy.GROUP_AWARE, report.strategy());
            assertEquals(5, report.commentCount());
            assertEquals(3, report.filteredCommentCount());
            assertEquals(82 + 50 + 60 + 7, report.voteCount());
        }

        @Test
        @DisplayName("each statement lands in its own category")
        void categories() {
            assertEquals(List.of("c1"), report.commonGroundIds());
            assertEquals(List.of("c2"), report.differenceOfOpinionIds());
            assertEquals(List.of("c3"), report.uncertainIds());
        }

        @Test
        @DisplayName("no fallback messages when selections are non-empty")
        void noMessages() {
            assertNull(report.noCommonGroundMessage());
            assertNull(report.noDifferencesMessage());
        }

        @Test
        @DisplayName("each group lists the statements it favours over everyone else")
        void groupRepresentatives() {
            Map<String, List<String>> representatives = report.groupRepresentativeIds();

            assertEquals(List.of("a", "b"), List.copyOf(representatives.keySet()));
            assertEquals(List.of("c2"), representatives.get("a"));
            assertTrue(representatives.get("b").isEmpty());
        }

        @Test
        @DisplayName("votes per opinion group")
        void groupStats() {
            assertEquals(List.of(new GroupStats("a", 106), new GroupStats("b", 93)), report.groupStats());
        }
    }

    // ── topics ────────────────────────────────────────────────────────────

    @Nested
    @DisplayName("topic views")
    class TopicTests {

        private final List<TopicStatsView> topics = service.analyze(CONVERSATION).topicStats();

        @Test
        @DisplayName("largest topic first, Other last")
        void order() {
            assertEquals(List.of("Environment", "Economy", "Other"),
                topics.stream().map(TopicStatsView::name).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("subtopics carry their own counts")
        void subtopics() {
            TopicStatsView environment = topics.get(0);
            assertEquals(3, environment.commentCount());
            assertEquals(192, environment.voteCount());
            assertEquals("Parks", environment.subtopicStats().get(0).name());
            assertEquals(2, environment.subtopicStats().get(0).commentCount());
            assertEquals("Transit", environment.subtopicStats().get(1).name());
        }

        @Test
        @DisplayName("relative labels are set at every level")
        void labels() {
            TopicStatsView environment = topics.get(0);
            assertEquals("high engagement", environment.relativeEngagement());
            assertTrue(environment.relativeAlignment().endsWith(" alignment"));
            for (TopicStatsView subtopic : environment.subtopicStats()) {
                assertNotNull(subtopic.relativeEngagement());
                assertNotNull(subtopic.relativeAlignment());
            }
            assertTrue(topics.get(1).subtopicStats().isEmpty());
        }
    }

    // ── per-statement scores ──────────────────────────────────────────────

    @Nested
    @DisplayName("comment scores")
    class CommentScoreTests {

        private final List<CommentScores> scores = service.analyze(CONVERSATION).commentScores();

        @Test
        @DisplayName("one entry per statement in input order")
        void order() {
            assertEquals(List.of("c1", "c2", "c3", "c4", "c5"),
                scores.stream().map(CommentScores::id).collect(Collectors.toList()));
        }

        @Test
        @DisplayName("ranked statement carries flags and scores")
        void ranked() {
            CommentScores c1 = scores.get(0);
            assertTrue(c1.highAlignment());
            assertFalse(c1.lowAlignment());
            assertFalse(c1.filteredOut());
            assertEquals((41.0 / 43.0) * (41.0 / 43.0), c1.highAlignmentScore(), 1e-9);
            assertEquals(81.0 / 84.0, c1.agreeRate(), 1e-9);
            assertEquals("Environment:Parks", c1.topics());
        }

        @Test
        @DisplayName("statement under the vote floor is marked filtered out")
        void filteredOut() {
            CommentScores c4 = scores.get(3);
            assertTrue(c4.filteredOut());
            assertFalse(c4.highAlignment());
            assertNull(c4.highAlignmentScore());
            assertNull(c4.lowAlignmentScore());
            assertNotNull(c4.agreeRate());
        }

        @Test
        @DisplayName("statement without votes has no rates")
        void unvoted() {
            CommentScores c5 = scores.get(4);
            assertNull(c5.votes());
            assertNull(c5.agreeRate());
            assertNull(c5.filteredOut());
            assertEquals("Other", c5.topics());
        }
    }

    // ── edge cases ────────────────────────────────────────────────────────

    @Test
    @DisplayName("empty conversation reports both fallback messages")
    void emptyConversation() {
        ConversationReport report = service.analyze(List.of());

        assertEquals(0, report.commentCount());
        assertTrue(report.topicStats().isEmpty());
        assertTrue(report.commonGroundIds().isEmpty());
        assertTrue(report.groupRepresentativeIds().isEmpty());
        assertTrue(report.noCommonGroundMessage().contains("20 votes"));
        assertNotNull(report.noDifferencesMessage());
    }

    @Test
    @DisplayName("pooled strategy reports no group stats")
    void pooledStrategy() {
        ConversationStatsService pooled = new ConversationStatsService(ScoringStrategy.POOLED.factory());
        ConversationReport report = pooled.analyze(CONVERSATION);

        assertEquals(ScoringStrategy.POOLED, report.strategy());
        assertTrue(report.groupStats().isEmpty());
        assertTrue(report.groupRepresentativeIds().isEmpty());
        assertEquals(List.of("c1"), report.commonGroundIds());
    }

    @Test
    @DisplayName("topic labels render as Topic:Subtopic pairs")
    void describeTopics() {
        Comment comment = new Comment("x", "text", null, List.of(
            Topic.withSubtopics("Transit", "Buses", "Trains"), Topic.leaf("Safety")));
        assertEquals("Transit:Buses;Transit:Trains;Safety", ConversationStatsService.describeTopics(comment));
    }
}
