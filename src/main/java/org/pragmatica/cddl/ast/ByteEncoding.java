package org.pragmatica.cddl.ast;

public enum ByteEncoding {
    UTF8(""),
    BASE16("h"),
    BASE64("b64");

    private final String prefix;

    ByteEncoding(String prefix) {
        this.prefix = prefix;
    }

    /**
     * Text written before the opening quote of a byte string in this encoding.
     */
    public String prefix() {
        return prefix;
    }
}
