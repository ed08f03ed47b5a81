package com.sensemaking.common.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * A topic label: either a leaf ({@code subtopics} empty) or a node with nested subtopics.
 *
 * <p>Names are expected to be unique among siblings. This is not checked here; see
 * {@link com.sensemaking.common.topic.TopicAggregator}.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
public record Topic(
    @JsonProperty("name")      String name,
    @JsonProperty("subtopics") List<Topic> subtopics
) {

    public Topic {
        Objects.requireNonNull(name, "name");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Topic name must not be blank");
        }
        subtopics = subtopics == null ? List.of() : List.copyOf(subtopics);
    }

    public static Topic leaf(String name) {
        return new Topic(name, List.of());
    }

    public static Topic of(String name, Topic... subtopics) {
        return new Topic(name, Arrays.asList(subtopics));
    }

    /** Shorthand for a topic whose subtopics are all leaves. */
    public static Topic withSubtopics(String name, String... subtopicNames) {
        return new Topic(name, Arrays.stream(subtopicNames).map(Topic::leaf).toList());
    }

    public boolean isLeaf() {
        return subtopics.isEmpty();
    }
}
