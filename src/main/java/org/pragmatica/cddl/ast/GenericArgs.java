package org.pragmatica.cddl.ast;

import com.google.common.collect.ImmutableList;

import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * {@code <arg1, arg2, ...>} supplied where a generic rule is used.
 */
public record GenericArgs(Span span, ImmutableList<GenericArg> args) implements CddlNode {
    public GenericArgs {
        checkArgument(!args.isEmpty(), "generic argument list must not be empty");
    }

    @Override
    public String toString() {
        return args.stream()
                   .map(GenericArg::toString)
                   .collect(Collectors.joining(", ", "<", ">"));
    }
}
