package org.pragmatica.cddl.ast;

import com.google.common.collect.ImmutableList;

import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Ordered type choices {@code type1 / type1 / ...}. Earlier choices match first.
 */
public record Type(Span span, ImmutableList<TypeChoice> choices) implements CddlNode {
    public Type {
        checkArgument(!choices.isEmpty(), "type must have at least one choice");
    }

    @Override
    public String toString() {
        return choices.stream()
                      .map(TypeChoice::toString)
                      .collect(Collectors.joining(" / "));
    }
}
