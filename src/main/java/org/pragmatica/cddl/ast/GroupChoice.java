package org.pragmatica.cddl.ast;

import com.google.common.collect.ImmutableList;

import java.util.stream.Collectors;

/**
 * Sequence of group entries. May be empty, as in {@code {}}.
 */
public record GroupChoice(Span span, ImmutableList<Entry> entries) implements CddlNode {

    /**
     * An entry and whether a comma followed it in the source.
     */
    public record Entry(GroupEntry entry, boolean trailingComma) {
        @Override
        public String toString() {
            return trailingComma ? entry + "," : entry.toString();
        }
    }

    public ImmutableList<GroupEntry> groupEntries() {
        return entries.stream()
                      .map(Entry::entry)
                      .collect(ImmutableList.toImmutableList());
    }

    @Override
    public String toString() {
        return entries.stream()
                      .map(Entry::toString)
                      .collect(Collectors.joining(" "));
    }
}
