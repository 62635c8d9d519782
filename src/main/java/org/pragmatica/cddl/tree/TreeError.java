package org.pragmatica.cddl.tree;

/**
 * Failures of parent index construction.
 */
public enum TreeError {
    /**
     * A node already linked to one parent was linked to another while
     * {@link OverwritePolicy#REJECT} was in effect.
     */
    OVERWRITE("Node already has a different parent");

    private final String description;

    TreeError(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
