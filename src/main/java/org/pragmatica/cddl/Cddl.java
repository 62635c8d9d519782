package org.pragmatica.cddl;

import org.pragmatica.cddl.error.RecoveryStrategy;
import org.pragmatica.cddl.parser.CddlParser;
import org.pragmatica.cddl.parser.ParseResult;
import org.pragmatica.cddl.parser.ParserConfig;
import org.pragmatica.cddl.tree.IndexConfig;
import org.pragmatica.cddl.tree.Interning;
import org.pragmatica.cddl.tree.OverwritePolicy;
import org.pragmatica.cddl.tree.ParentIndex;
import org.pragmatica.cddl.tree.TreeException;

/**
 * Entry point for parsing CDDL and indexing the result.
 *
 * <p>Example usage:
 * <pre>{@code
 * var document = Cddl.parse("""
 *     person = { name: tstr, ? age: uint }
 *     """).unwrap();
 *
 * var index = Cddl.builder(text)
 *                 .overwritePolicy(OverwritePolicy.REJECT)
 *                 .index();
 * }</pre>
 */
public final class Cddl {
    private Cddl() {}

    /**
     * Parse CDDL text with the default configuration.
     */
    public static ParseResult parse(String text) {
        return CddlParser.parse(text);
    }

    /**
     * Parse CDDL text and build a parent index with the default configuration.
     *
     * @throws IllegalStateException when the text does not parse
     */
    public static ParentIndex index(String text) throws TreeException {
        return builder(text).index();
    }

    /**
     * Create a builder for more complex configuration.
     */
    public static Builder builder(String text) {
        return new Builder(text);
    }

    public static final class Builder {
        private final String text;
        private RecoveryStrategy recoveryStrategy = RecoveryStrategy.BASIC;
        private OverwritePolicy overwritePolicy = OverwritePolicy.KEEP_FIRST;
        private Interning interning = Interning.STRUCTURAL;

        private Builder(String text) {
            this.text = text;
        }

        public Builder recovery(RecoveryStrategy strategy) {
            this.recoveryStrategy = strategy;
            return this;
        }

        public Builder overwritePolicy(OverwritePolicy policy) {
            this.overwritePolicy = policy;
            return this;
        }

        public Builder interning(Interning interning) {
            this.interning = interning;
            return this;
        }

        public ParseResult parse() {
            return CddlParser.parse(text, new ParserConfig(recoveryStrategy));
        }

        /**
         * Parse the text and index the resulting document.
         *
         * @throws IllegalStateException listing the parse errors when the text does not parse
         */
        public ParentIndex index() throws TreeException {
            return ParentIndex.build(parse().unwrap(), new IndexConfig(overwritePolicy, interning));
        }
    }
}
