package org.pragmatica.cddl.tree;

import com.google.common.collect.ImmutableList;
import org.pragmatica.cddl.ast.CddlNode;
import org.pragmatica.cddl.ast.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;

/**
 * Upward navigation over a parsed {@link Document}.
 *
 * <p>The syntax tree itself holds no parent references. The index stores every node in an arena
 * slot together with the index of its parent and of its children, and answers parent queries
 * from there. The index refers to the document it was built from; it never copies or changes it.
 *
 * <p>An index is read-only once built. Queries never add slots.
 */
public final class ParentIndex {
    private static final Logger log = LoggerFactory.getLogger(ParentIndex.class);

    private final Document document;
    private final IndexConfig config;
    private final ImmutableList<ArenaNode> slots;
    private final Map<CddlNode, Integer> lookup;

    private ParentIndex(Document document,
                        IndexConfig config,
                        ImmutableList<ArenaNode> slots,
                        Map<CddlNode, Integer> lookup) {
        this.document = document;
        this.config = config;
        this.slots = slots;
        this.lookup = lookup;
    }

    public static ParentIndex build(Document document) throws TreeException {
        return build(document, IndexConfig.DEFAULT);
    }

    /**
     * Walk {@code document} from the root and record the parent of every node.
     *
     * @throws TreeException when a node would be re-parented under {@link OverwritePolicy#REJECT}
     */
    public static ParentIndex build(Document document, IndexConfig config) throws TreeException {
        var arena = new Arena(config);
        new ParentIndexer(arena).visitDocument(document);
        log.debug("Parent index built: {} slots, {} rules", arena.size(), document.rules()
                                                                              .size());
        return new ParentIndex(document, config, arena.snapshot(), arena.lookup());
    }

    /**
     * Parent of {@code child} under the given relation.
     *
     * @return the parent, or empty when {@code child} is not indexed, is the root, or its parent
     *         is not of the relation's parent type
     */
    public <C extends CddlNode, P extends CddlNode> Optional<P> parentOf(C child, Containment<C, P> relation) {
        return parent(child).filter(relation::admitsParent)
                            .map(relation.parent()::cast);
    }

    /**
     * Parent of {@code node}, whatever its kind.
     */
    public Optional<CddlNode> parent(CddlNode node) {
        return slot(node).flatMap(ArenaNode::parent)
                         .map(index -> slots.get(index)
                                            .node());
    }

    /**
     * Children of {@code node} in visiting order. Shared slots appear under every node that
     * contains them.
     */
    public ImmutableList<CddlNode> children(CddlNode node) {
        return slot(node).map(slot -> slot.children()
                                          .stream()
                                          .map(index -> slots.get(index)
                                                             .node())
                                          .collect(ImmutableList.toImmutableList()))
                         .orElse(ImmutableList.of());
    }

    /**
     * Slot holding {@code node}, located without interning.
     */
    public Optional<ArenaNode> slot(CddlNode node) {
        return Optional.ofNullable(lookup.get(node))
                       .map(slots::get);
    }

    public ImmutableList<ArenaNode> slots() {
        return slots;
    }

    public int size() {
        return slots.size();
    }

    public Document document() {
        return document;
    }

    public IndexConfig config() {
        return config;
    }
}
