package org.pragmatica.cddl.ast;

import static com.google.common.base.Preconditions.checkArgument;

public record Identifier(Span span, String name) implements CddlNode {
    public Identifier {
        checkArgument(!name.isEmpty(), "identifier must not be empty");
    }

    @Override
    public String toString() {
        return name;
    }
}
