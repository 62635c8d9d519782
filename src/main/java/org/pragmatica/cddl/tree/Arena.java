package org.pragmatica.cddl.tree;

import com.google.common.collect.ImmutableList;
import org.pragmatica.cddl.ast.CddlNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Append-only slot storage used while a parent index is being built.
 */
final class Arena {
    private static final Logger log = LoggerFactory.getLogger(Arena.class);
    private static final int NO_PARENT = -1;

    private final IndexConfig config;
    private final List<Slot> slots = new ArrayList<>();
    private final Map<CddlNode, Integer> lookup;

    Arena(IndexConfig config) {
        this.config = config;
        this.lookup = config.interning() == Interning.IDENTITY
                      ? new IdentityHashMap<>()
                      : new HashMap<>();
    }

    /**
     * Index of the slot holding {@code node}, appending a slot when there is none.
     */
    int intern(CddlNode node) {
        var existing = lookup.get(node);
        if (existing != null) {
            return existing;
        }
        int index = slots.size();
        slots.add(new Slot(node));
        lookup.put(node, index);
        return index;
    }

    void link(int parent, int child) throws TreeException {
        var slot = slots.get(child);
        if (slot.parent == NO_PARENT) {
            slot.parent = parent;
        }else if (slot.parent != parent) {
            if (config.overwritePolicy() == OverwritePolicy.REJECT) {
                throw new TreeException(TreeError.OVERWRITE,
                                        "slot " + child + " (" + slot.node + ") has parent " + slot.parent
                                        + ", relinked to " + parent);
            }
            log.trace("Slot {} keeps parent {}, also listed under {}", child, slot.parent, parent);
        }
        slots.get(parent).children.add(child);
    }

    int size() {
        return slots.size();
    }

    ImmutableList<ArenaNode> snapshot() {
        var result = ImmutableList.<ArenaNode>builderWithExpectedSize(slots.size());
        for (int i = 0; i < slots.size(); i++ ) {
            var slot = slots.get(i);
            result.add(new ArenaNode(i,
                                     NodeKind.of(slot.node),
                                     slot.node,
                                     slot.parent == NO_PARENT
                                     ? Optional.empty()
                                     : Optional.of(slot.parent),
                                     ImmutableList.copyOf(slot.children)));
        }
        return result.build();
    }

    /**
     * Frozen node-to-slot lookup with the same matching rule as {@link #intern(CddlNode)}.
     */
    Map<CddlNode, Integer> lookup() {
        return config.interning() == Interning.IDENTITY
               ? new IdentityHashMap<>(lookup)
               : Map.copyOf(lookup);
    }

    private static final class Slot {
        private final CddlNode node;
        private final List<Integer> children = new ArrayList<>();
        private int parent = NO_PARENT;

        private Slot(CddlNode node) {
            this.node = node;
        }
    }
}
