package org.pragmatica.cddl.ast;

import com.google.common.collect.ImmutableList;

import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Group choices {@code grpchoice // grpchoice // ...}.
 */
public record Group(Span span, ImmutableList<GroupChoice> choices) implements CddlNode {
    public Group {
        checkArgument(!choices.isEmpty(), "group must have at least one choice");
    }

    @Override
    public String toString() {
        return choices.stream()
                      .map(GroupChoice::toString)
                      .collect(Collectors.joining(" // "));
    }
}
