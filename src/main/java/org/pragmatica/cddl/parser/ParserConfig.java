package org.pragmatica.cddl.parser;

import org.pragmatica.cddl.error.RecoveryStrategy;

/**
 * Parser configuration options.
 */
public record ParserConfig(RecoveryStrategy recovery) {
    public static final ParserConfig DEFAULT = new ParserConfig(RecoveryStrategy.BASIC);
}
