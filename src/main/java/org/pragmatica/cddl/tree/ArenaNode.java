package org.pragmatica.cddl.tree;

import com.google.common.collect.ImmutableList;
import org.pragmatica.cddl.ast.CddlNode;

import java.util.Optional;

/**
 * One arena slot: the node, its kind, the index of its parent and the indices of its children.
 */
public record ArenaNode(int index,
                        NodeKind kind,
                        CddlNode node,
                        Optional<Integer> parent,
                        ImmutableList<Integer> children) {
    public boolean isRoot() {
        return parent.isEmpty();
    }
}
