package org.pragmatica.cddl.tree;

/**
 * Raised when a parent index cannot be built under the configured policy.
 */
public class TreeException extends Exception {

    private final TreeError error;

    public TreeException(TreeError error, String detail) {
        super(error.description() + ": " + detail);
        this.error = error;
    }

    public TreeError error() {
        return error;
    }
}
