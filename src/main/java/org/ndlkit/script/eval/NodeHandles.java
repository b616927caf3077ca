package org.ndlkit.script.eval;

import org.ndlkit.script.model.NdlNode;

import java.util.Collection;
import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Maps NDL nodes (by identity) to the handles an evaluator produced for them.
 *
 * @param <H> The evaluator's handle type.
 */
public class NodeHandles<H> {

    private final Map<NdlNode, H> handles = new IdentityHashMap<>();

    public H get(NdlNode node) {
        return node == null ? null : handles.get(node);
    }

    public void put(NdlNode node, H handle) {
        handles.put(node, handle);
    }

    public H remove(NdlNode node) {
        return handles.remove(node);
    }

    public boolean contains(NdlNode node) {
        return handles.containsKey(node);
    }

    /**
     * Forgets the handles of the given nodes.
     * @param nodes The nodes, typically the arena of a macro body.
     */
    public void clear(Collection<NdlNode> nodes) {
        for (NdlNode node : nodes) {
            handles.remove(node);
        }
    }

    public void clear() {
        handles.clear();
    }

    public int size() {
        return handles.size();
    }
}
