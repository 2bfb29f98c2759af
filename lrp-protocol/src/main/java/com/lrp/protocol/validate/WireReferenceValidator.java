package com.lrp.protocol.validate;

import com.lrp.protocol.error.UnresolvedReferenceException;
import com.lrp.protocol.model.WireRecord;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Checks that every {@code refs} entry of a response tree points at a record of the same tree.
 * An empty ref value means "no target" (e.g. a state machine without initial state) and is accepted.
 */
public final class WireReferenceValidator {

    private WireReferenceValidator() {
    }

    /**
     * @param root  response root record
     * @param known ids of nodes present elsewhere in the response (outside {@code root}); may be empty
     * @throws UnresolvedReferenceException on the first dangling ref found (pre-order)
     */
    public static void validate(WireRecord root, Set<String> known) {
        Set<String> ids = new HashSet<>(known);
        collectIds(root, ids);
        Deque<WireRecord> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            WireRecord record = pending.pop();
            for (Map.Entry<String, String> ref : record.getRefs().entrySet()) {
                String target = ref.getValue();
                if (!target.isEmpty() && !ids.contains(target)) {
                    throw new UnresolvedReferenceException(record.getId(), ref.getKey(), target);
                }
            }
            List<WireRecord> children = record.getDirectChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                pending.push(children.get(i));
            }
        }
    }

    public static void validate(WireRecord root) {
        validate(root, Set.of());
    }

    /** Ids of every record in the tree; duplicated ids appear once. */
    public static Set<String> collectIds(WireRecord root) {
        Set<String> ids = new HashSet<>();
        collectIds(root, ids);
        return ids;
    }

    /** Number of records in the tree, duplicates included. */
    public static int countRecords(WireRecord root) {
        int count = 1;
        for (WireRecord child : root.getDirectChildren()) {
            count += countRecords(child);
        }
        return count;
    }

    private static void collectIds(WireRecord root, Set<String> into) {
        Deque<WireRecord> pending = new ArrayDeque<>();
        pending.push(root);
        while (!pending.isEmpty()) {
            WireRecord record = pending.pop();
            into.add(record.getId());
            record.getDirectChildren().forEach(pending::push);
        }
    }
}
