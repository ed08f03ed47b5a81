package com.sensemaking.analysis.report;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sensemaking.common.model.Comment;
import com.sensemaking.common.model.Topic;
import com.sensemaking.common.model.VoteInfo;
import com.sensemaking.common.model.VoteTally;
import com.sensemaking.common.scoring.PooledConsensusScorer;
import com.sensemaking.common.topic.TopicStats;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ReportJsonTest {

    private final ObjectMapper mapper = new ObjectMapper();

    @Test
    @DisplayName("comment scores use the is-prefixed flag names")
    void flagNames() throws Exception {
        CommentScores scores = new CommentScores("1", "text", VoteInfo.pooled(3, 1, 0), "Economy",
            0.75, 0.25, 0.0, true, 0.75, false, 0.5, false, 0.0, false);

        JsonNode json = mapper.readTree(mapper.writeValueAsString(scores));

        assertTrue(json.get("isHighAlignment").asBoolean());
        assertFalse(json.get("isFilteredOut").asBoolean());
        assertEquals(0.75, json.get("agreeRate").asDouble());
        assertEquals("POOLED", json.get("votes").get("kind").asText());
        assertFalse(json.has("highAlignment"));
    }

    @Test
    @DisplayName("vote data carries its variant marker")
    void voteKind() throws Exception {
        Map<String, VoteTally> tallies = new LinkedHashMap<>();
        tallies.put("a", VoteTally.of(4, 1));
        tallies.put("b", VoteTally.of(1, 4));

        JsonNode pooled = mapper.readTree(mapper.writeValueAsString(VoteInfo.pooled(3, 1, 0)));
        JsonNode grouped = mapper.readTree(mapper.writeValueAsString(VoteInfo.grouped(tallies)));

        assertEquals("POOLED", pooled.get("kind").asText());
        assertEquals(3, pooled.get("tally").get("agreeCount").asInt());
        assertEquals("GROUPED", grouped.get("kind").asText());
        assertEquals(4, grouped.get("talliesByGroup").get("b").get("disagreeCount").asInt());
        assertFalse(grouped.has("combined"));
    }

    @Test
    @DisplayName("unvoted statements omit their rate fields")
    void unvoted() throws Exception {
        JsonNode json = mapper.readTree(mapper.writeValueAsString(CommentScores.unvoted("2", "text", "")));

        assertEquals("2", json.get("id").asText());
        assertFalse(json.has("agreeRate"));
        assertFalse(json.has("votes"));
        assertFalse(json.has("isFilteredOut"));
    }

    @Test
    @DisplayName("topic stats expose vote count but not the scorer")
    void topicStats() throws Exception {
        List<Comment> comments = List.of(
            new Comment("1", "a", VoteInfo.pooled(10, 2, 1), List.of(Topic.leaf("Parks"))));
        TopicStats stats = new TopicStats("Parks", 1, List.of(), new PooledConsensusScorer(comments));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(stats));

        assertEquals("Parks", json.get("name").asText());
        assertEquals(13, json.get("voteCount").asLong());
        assertFalse(json.has("scorer"));
        assertFalse(json.has("subtopicStats"));
    }

    @Test
    @DisplayName("topic view nests subtopics")
    void topicView() throws Exception {
        TopicStatsView leaf = new TopicStatsView("Buses", 2, 40, "low engagement", "high alignment", List.of());
        TopicStatsView view = new TopicStatsView("Transit", 2, 40, "high engagement", "low alignment", List.of(leaf));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(view));

        assertEquals("high engagement", json.get("relativeEngagement").asText());
        assertEquals("Buses", json.get("subtopicStats").get(0).get("name").asText());
    }
}
