package org.pragmatica.cddl.ast;

import java.util.Optional;

/**
 * Primary type expressions. This is the widest variant set of the tree.
 */
public sealed interface Type2 extends CddlNode {
    Span span();

    /**
     * Literal value: {@code 1}, {@code -2.5}, {@code "text"}, {@code h'00ff'}
     */
    record Literal(Span span, Value value) implements Type2 {
        @Override
        public String toString() {
            return value.toString();
        }
    }

    /**
     * Type name reference: {@code name}, {@code name<args>}
     */
    record Typename(Span span, Identifier name, Optional<GenericArgs> genericArgs) implements Type2 {
        @Override
        public String toString() {
            return name + genericArgs.map(GenericArgs::toString)
                                     .orElse("");
        }
    }

    /**
     * Parenthesized type: {@code ( type )}
     */
    record Parenthesized(Span span, Type type) implements Type2 {
        @Override
        public String toString() {
            return "(" + type + ")";
        }
    }

    /**
     * Map: {@code { group }}
     */
    record Map(Span span, Group group) implements Type2 {
        @Override
        public String toString() {
            return "{" + group + "}";
        }
    }

    /**
     * Array: {@code [ group ]}
     */
    record Array(Span span, Group group) implements Type2 {
        @Override
        public String toString() {
            return "[" + group + "]";
        }
    }

    /**
     * Unwrap: {@code ~name}, {@code ~name<args>}
     */
    record Unwrap(Span span, Identifier name, Optional<GenericArgs> genericArgs) implements Type2 {
        @Override
        public String toString() {
            return "~" + name + genericArgs.map(GenericArgs::toString)
                                           .orElse("");
        }
    }

    /**
     * Enumeration from an inline group: {@code &( group )}
     */
    record ChoiceFromInlineGroup(Span span, Group group) implements Type2 {
        @Override
        public String toString() {
            return "&(" + group + ")";
        }
    }

    /**
     * Enumeration from a named group: {@code &name}, {@code &name<args>}
     */
    record ChoiceFromGroup(Span span, Identifier name, Optional<GenericArgs> genericArgs) implements Type2 {
        @Override
        public String toString() {
            return "&" + name + genericArgs.map(GenericArgs::toString)
                                           .orElse("");
        }
    }

    /**
     * Tagged data item: {@code #6.32(type)}, {@code #6(type)}
     */
    record TaggedData(Span span, Optional<Long> tag, Type type) implements Type2 {
        @Override
        public String toString() {
            return "#6" + tag.map(t -> "." + Long.toUnsignedString(t))
                             .orElse("") + "(" + type + ")";
        }
    }

    /**
     * Data item of a major type: {@code #1}, {@code #7.25}
     */
    record DataMajorType(Span span, int major, Optional<Long> constraint) implements Type2 {
        @Override
        public String toString() {
            return "#" + major + constraint.map(c -> "." + Long.toUnsignedString(c))
                                           .orElse("");
        }
    }

    /**
     * Any data item: {@code #}
     */
    record Any(Span span) implements Type2 {
        @Override
        public String toString() {
            return "#";
        }
    }
}
