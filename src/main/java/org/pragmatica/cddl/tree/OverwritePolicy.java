package org.pragmatica.cddl.tree;

/**
 * What linking does when a child slot already has a different parent.
 */
public enum OverwritePolicy {
    /**
     * Keep the first parent. The child is still listed among the new parent's children, so shared
     * slots make the arena a DAG.
     */
    KEEP_FIRST,

    /**
     * Fail the build with {@link TreeError#OVERWRITE}.
     */
    REJECT
}
