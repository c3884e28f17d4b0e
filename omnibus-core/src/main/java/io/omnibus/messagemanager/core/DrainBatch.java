package io.omnibus.messagemanager.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import io.omnibus.messagemanager.api.BrokerMessage;
import io.omnibus.messagemanager.api.RawMessage;

/**
 * The messages of one drain round, each tagged as either {@link Tag#TARGET} (to be deleted or moved) or
 * {@link Tag#KEEP} (to be published back to the source). Lives only for the duration of one operation; once the
 * round is settled, the batch is garbage.
 */
public final class DrainBatch {

    public enum Tag {
        TARGET,

        KEEP
    }

    private final List<Entry> _entries;
    private final Map<String, Integer> _ambiguousTargetIds;

    private DrainBatch(List<Entry> entries, Map<String, Integer> ambiguousTargetIds) {
        _entries = entries;
        _ambiguousTargetIds = ambiguousTargetIds;
    }

    /**
     * Normalizes the drained messages and tags them. When a targeted id is derived by more than one message, the
     * policy decides which one is the target: {@link DuplicateIdPolicy#FIRST_OCCURRENCE} and
     * {@link DuplicateIdPolicy#LAST_OCCURRENCE} pick one, while for {@link DuplicateIdPolicy#ABORT} none of them is
     * tagged as target and the id is reported by {@link #getAmbiguousTargetIds()}.
     */
    public static DrainBatch classify(List<RawMessage> drained, MessageProjection projection, Set<String> targetIds,
            DuplicateIdPolicy duplicateIdPolicy) {
        List<BrokerMessage> normalized = new ArrayList<>(drained.size());
        // Id -> indices of the messages deriving that id, only for targeted ids
        Map<String, List<Integer>> occurrences = new LinkedHashMap<>();
        for (int i = 0; i < drained.size(); i++) {
            BrokerMessage message = projection.normalize(drained.get(i));
            normalized.add(message);
            if (targetIds.contains(message.getId())) {
                occurrences.computeIfAbsent(message.getId(), id -> new ArrayList<>()).add(i);
            }
        }

        boolean[] isTarget = new boolean[drained.size()];
        Map<String, Integer> ambiguous = new LinkedHashMap<>();
        for (Map.Entry<String, List<Integer>> entry : occurrences.entrySet()) {
            List<Integer> indices = entry.getValue();
            // ?: Single occurrence?
            if (indices.size() == 1) {
                // -> Yes, the normal case.
                isTarget[indices.get(0)] = true;
                continue;
            }
            ambiguous.put(entry.getKey(), indices.size());
            switch (duplicateIdPolicy) {
                case FIRST_OCCURRENCE:
                    isTarget[indices.get(0)] = true;
                    break;
                case LAST_OCCURRENCE:
                    isTarget[indices.get(indices.size() - 1)] = true;
                    break;
                case ABORT:
                    // None targeted, the engine aborts.
                    break;
                default:
                    throw new AssertionError("Unknown DuplicateIdPolicy [" + duplicateIdPolicy + "]");
            }
        }

        List<Entry> entries = new ArrayList<>(drained.size());
        for (int i = 0; i < drained.size(); i++) {
            entries.add(new Entry(drained.get(i), normalized.get(i), isTarget[i] ? Tag.TARGET : Tag.KEEP));
        }
        return new DrainBatch(Collections.unmodifiableList(entries), Collections.unmodifiableMap(ambiguous));
    }

    public List<Entry> getEntries() {
        return _entries;
    }

    public List<Entry> getTargets() {
        return withTag(Tag.TARGET);
    }

    public List<Entry> getKeeps() {
        return withTag(Tag.KEEP);
    }

    /**
     * @return the targeted ids which more than one message derived, with their number of occurrences.
     */
    public Map<String, Integer> getAmbiguousTargetIds() {
        return _ambiguousTargetIds;
    }

    public int size() {
        return _entries.size();
    }

    private List<Entry> withTag(Tag tag) {
        List<Entry> result = new ArrayList<>();
        for (Entry entry : _entries) {
            if (entry.getTag() == tag) {
                result.add(entry);
            }
        }
        return result;
    }

    public static final class Entry {
        private final RawMessage _raw;
        private final BrokerMessage _message;
        private final Tag _tag;

        private Entry(RawMessage raw, BrokerMessage message, Tag tag) {
            _raw = raw;
            _message = message;
            _tag = tag;
        }

        public RawMessage getRaw() {
            return _raw;
        }

        public BrokerMessage getMessage() {
            return _message;
        }

        public String getId() {
            return _message.getId();
        }

        public Tag getTag() {
            return _tag;
        }

        @Override
        public String toString() {
            return "Entry{" + _tag + ":" + _message.getId() + "}";
        }
    }
}
