package org.pragmatica.cddl.ast;

import com.google.common.collect.ImmutableList;

import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Root of a parsed CDDL document. Rule order follows the source.
 */
public record Document(ImmutableList<Rule> rules) implements CddlNode {

    /**
     * First rule bound to {@code name}. Later {@code /=} and {@code //=} extensions are not merged.
     */
    public Optional<Rule> rule(String name) {
        return rules.stream()
                    .filter(r -> r.name()
                                  .name()
                                  .equals(name))
                    .findFirst();
    }

    @Override
    public String toString() {
        return rules.stream()
                    .map(Rule::toString)
                    .collect(Collectors.joining("\n"));
    }
}
