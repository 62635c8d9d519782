package org.pragmatica.cddl.ast;

/**
 * Assignment operator of a rule.
 */
public enum Assignment {
    DEFINE("="),
    TYPE_CHOICE_ALT("/="),
    GROUP_CHOICE_ALT("//=");

    private final String symbol;

    Assignment(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }
}
