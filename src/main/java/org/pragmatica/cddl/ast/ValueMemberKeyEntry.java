package org.pragmatica.cddl.ast;

import java.util.Optional;

public record ValueMemberKeyEntry(Span span,
                                  Optional<Occurrence> occurrence,
                                  Optional<MemberKey> memberKey,
                                  Type entryType) implements CddlNode {
    @Override
    public String toString() {
        return occurrence.map(o -> o + " ")
                         .orElse("") + memberKey.map(k -> k + " ")
                                                .orElse("") + entryType;
    }
}
