package org.pragmatica.cddl.tree;

/**
 * How nodes are matched to existing arena slots.
 */
public enum Interning {
    /**
     * Equal nodes share a slot. Nodes without a source span, such as literal values, collapse
     * into one slot wherever they occur.
     */
    STRUCTURAL,

    /**
     * Only the same node instance shares a slot, which keeps the arena a strict tree.
     */
    IDENTITY
}
