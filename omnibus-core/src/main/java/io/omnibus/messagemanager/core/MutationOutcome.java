package io.omnibus.messagemanager.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Which of the requested ids a delete or move handled, and which were not found on the queue.
 */
public final class MutationOutcome {
    private final List<String> _matchedIds;
    private final List<String> _missingIds;

    public MutationOutcome(List<String> matchedIds, List<String> missingIds) {
        _matchedIds = Collections.unmodifiableList(new ArrayList<>(matchedIds));
        _missingIds = Collections.unmodifiableList(new ArrayList<>(missingIds));
    }

    public List<String> getMatchedIds() {
        return _matchedIds;
    }

    public List<String> getMissingIds() {
        return _missingIds;
    }

    @Override
    public String toString() {
        return "MutationOutcome{matched=" + _matchedIds.size() + ", missing=" + _missingIds + "}";
    }
}
