package org.pragmatica.cddl.tree;

/**
 * Parent index configuration.
 *
 * @param overwritePolicy behaviour when a slot gets a second parent
 * @param interning       slot matching rule
 */
public record IndexConfig(OverwritePolicy overwritePolicy, Interning interning) {
    public static final IndexConfig DEFAULT = new IndexConfig(OverwritePolicy.KEEP_FIRST, Interning.STRUCTURAL);

    public static IndexConfig indexConfig(OverwritePolicy overwritePolicy) {
        return new IndexConfig(overwritePolicy, Interning.STRUCTURAL);
    }

    public static IndexConfig indexConfig(Interning interning) {
        return new IndexConfig(OverwritePolicy.KEEP_FIRST, interning);
    }
}
