package org.pragmatica.cddl.ast;

import com.google.common.collect.ImmutableList;

import java.util.stream.Collectors;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * {@code <p1, p2, ...>} declared on a rule.
 */
public record GenericParams(Span span, ImmutableList<GenericParam> params) implements CddlNode {
    public GenericParams {
        checkArgument(!params.isEmpty(), "generic parameter list must not be empty");
    }

    @Override
    public String toString() {
        return params.stream()
                     .map(GenericParam::toString)
                     .collect(Collectors.joining(", ", "<", ">"));
    }
}
