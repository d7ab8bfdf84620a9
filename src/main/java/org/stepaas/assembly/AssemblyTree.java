package org.stepaas.assembly;

import org.stepaas.assembly.model.ComponentNode;
import org.stepaas.assembly.model.ParentConflict;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * 单根、有限、无环的装配树，附带 synthetic id 查找表。
 * <p>
 * 查找表只包含从根可达的节点；{@link #detached()} 列出存在唯一真实根时不可达的组件。
 */
public final class AssemblyTree {

    private final ComponentNode root;
    private final Map<String, ComponentNode> index;
    private final List<ParentConflict> conflicts;
    private final List<ComponentNode> detached;

    AssemblyTree(ComponentNode root, List<ParentConflict> conflicts, List<ComponentNode> detached) {
        this.root = root;
        this.conflicts = List.copyOf(conflicts);
        this.detached = List.copyOf(detached);
        Map<String, ComponentNode> map = new LinkedHashMap<>();
        for (ComponentNode node : preOrder(root)) {
            map.put(node.syntheticId(), node);
        }
        this.index = Collections.unmodifiableMap(map);
    }

    public ComponentNode root() {
        return root;
    }

    public boolean isVirtualRoot() {
        return root.isVirtual();
    }

    public Optional<ComponentNode> find(String syntheticId) {
        return Optional.ofNullable(index.get(syntheticId));
    }

    public boolean contains(ComponentNode node) {
        return index.get(node.syntheticId()) == node;
    }

    /**
     * 先序遍历的全部节点（根在最前）。
     */
    public List<ComponentNode> nodes() {
        return List.copyOf(index.values());
    }

    public int size() {
        return index.size();
    }

    /**
     * @return 节点深度（根为 0）
     */
    public int depthOf(ComponentNode node) {
        int depth = 0;
        for (ComponentNode n = node.parent(); n != null; n = n.parent()) {
            depth++;
        }
        return depth;
    }

    public List<ParentConflict> conflicts() {
        return conflicts;
    }

    public List<ComponentNode> detached() {
        return detached;
    }

    private static List<ComponentNode> preOrder(ComponentNode root) {
        List<ComponentNode> out = new ArrayList<>();
        Deque<ComponentNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            ComponentNode node = stack.pop();
            out.add(node);
            List<ComponentNode> children = node.children();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return out;
    }
}
