package com.apicatalog.collectionsync.dto.sync;

import lombok.Value;

import java.util.*;

/**
 * Ordered operations that bring the remote tree in line with the canonical tree.
 * Creates are parent-before-child, deletes child-before-parent.
 */
@Value
public class EditScript {
    List<DiffOp> ops;

    public EditScript(List<DiffOp> ops) {
        this.ops = List.copyOf(ops);
    }

    public long mutatingCount() {
        return ops.stream().filter(op -> op.getType().isMutating()).count();
    }

    public boolean isAllKeep() {
        return ops.stream().allMatch(op -> op.getType() == DiffOpType.KEEP);
    }

    public Map<DiffOpType, Integer> countByType() {
        Map<DiffOpType, Integer> counts = new EnumMap<>(DiffOpType.class);
        for (DiffOpType type : DiffOpType.values()) {
            counts.put(type, 0);
        }
        for (DiffOp op : ops) {
            counts.merge(op.getType(), 1, Integer::sum);
        }
        return counts;
    }

    /**
     * Ops grouped by top-level subtree, script order kept inside each group.
     * Groups touch disjoint remote nodes and can be applied independently.
     */
    public Map<String, List<DiffOp>> partitionByTopLevel() {
        Map<String, List<DiffOp>> partitions = new LinkedHashMap<>();
        for (DiffOp op : ops) {
            partitions.computeIfAbsent(op.topLevelName(), k -> new ArrayList<>()).add(op);
        }
        return partitions;
    }
}
