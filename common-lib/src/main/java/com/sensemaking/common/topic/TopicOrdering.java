package com.sensemaking.common.topic;

import java.util.Comparator;
import java.util.List;

/**
 * Sibling order for topic trees: descending comment count, with the catch-all
 * {@value #OTHER} always last. Equal counts keep their existing order.
 */
public final class TopicOrdering {

    public static final String OTHER = "Other";

    public static final Comparator<TopicStats> BY_DESCENDING_COUNT_OTHER_LAST =
        Comparator.comparing((TopicStats t) -> OTHER.equals(t.name()))
            .thenComparing(TopicStats::commentCount, Comparator.reverseOrder());

    private TopicOrdering() {}

    /** Sorted copy of {@code siblings}; does not descend into subtopics. */
    public static List<TopicStats> sort(List<TopicStats> siblings) {
        return siblings.stream().sorted(BY_DESCENDING_COUNT_OTHER_LAST).toList();
    }
}
