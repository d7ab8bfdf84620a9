package org.stepaas.assembly;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stepaas.assembly.model.AssemblyEdge;
import org.stepaas.assembly.model.ComponentNode;
import org.stepaas.assembly.model.ParentConflict;
import org.stepaas.assembly.model.ParentConflict.Reason;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 装配树构建器（只处理主文档）。
 * <p>
 * 规则：
 * <ul>
 *   <li>每个子节点只接受一个父节点：按文档顺序先到先得，后到的不同父节点记为冲突，不抛异常</li>
 *   <li>会形成环的关系（子节点是父节点本身或其祖先）被拒绝并记录</li>
 *   <li>根节点：唯一一个“做过父节点、从未做过子节点”的组件（按全部已解析关系统计，含被拒绝的）；否则合成虚拟根，收养所有没有父节点的组件</li>
 * </ul>
 * 构建结果在任何输入下都满足：单根、有限、无环。
 */
public class AssemblyTreeBuilder {

    public static final String VIRTUAL_ROOT_ID = "root_assembly";

    private static final Logger log = LoggerFactory.getLogger(AssemblyTreeBuilder.class);

    private final IdentifierAllocator allocator;
    private final String virtualRootName;

    public AssemblyTreeBuilder(IdentifierAllocator allocator, String virtualRootName) {
        this.allocator = allocator;
        this.virtualRootName = virtualRootName;
    }

    public AssemblyTree build(ComponentRegistry registry, List<AssemblyEdge> edges) {
        List<ParentConflict> conflicts = new ArrayList<>();
        Set<ComponentNode> parents = new LinkedHashSet<>();
        Set<ComponentNode> children = new LinkedHashSet<>();

        for (AssemblyEdge edge : edges) {
            ComponentNode parent = registry.findByNativeId(edge.parentProductId()).orElse(null);
            ComponentNode child = registry.findByNativeId(edge.childProductId()).orElse(null);
            if (parent == null || child == null) {
                continue;
            }
            // 根候选按全部已解析关系统计，被拒绝的关系同样算数
            parents.add(parent);
            children.add(child);
            if (child.parent() == parent) {
                // 重复的同一关系（多个实例引用同一零件）
                continue;
            }
            if (child.isAncestorOrSelf(parent)) {
                String kept = (child.parent() == null) ? null : child.parent().syntheticId();
                conflicts.add(new ParentConflict(edge.usageId(), child.syntheticId(), kept, parent.syntheticId(), Reason.CYCLE));
                log.debug("拒绝成环关系 #{}: {} -> {}", edge.usageId(), parent.syntheticId(), child.syntheticId());
                continue;
            }
            if (child.parent() != null) {
                conflicts.add(new ParentConflict(edge.usageId(), child.syntheticId(),
                        child.parent().syntheticId(), parent.syntheticId(), Reason.CONFLICTING_PARENT));
                log.debug("子节点 {} 已有父节点 {}，忽略关系 #{}（父节点 {}）",
                        child.syntheticId(), child.parent().syntheticId(), edge.usageId(), parent.syntheticId());
                continue;
            }
            parent.addChild(child);
        }

        List<ComponentNode> candidates = new ArrayList<>();
        for (ComponentNode node : parents) {
            if (!children.contains(node)) {
                candidates.add(node);
            }
        }

        if (candidates.size() == 1) {
            ComponentNode root = candidates.get(0);
            AssemblyTree tree = new AssemblyTree(root, conflicts, List.of());
            List<ComponentNode> detached = new ArrayList<>();
            for (ComponentNode node : registry.components()) {
                if (!tree.contains(node)) {
                    detached.add(node);
                }
            }
            return detached.isEmpty() ? tree : new AssemblyTree(root, conflicts, detached);
        }

        // 没有或有多个根候选（数据不连通/成环）：合成虚拟根
        allocator.reserve(VIRTUAL_ROOT_ID);
        ComponentNode virtualRoot = ComponentNode.virtualRoot(VIRTUAL_ROOT_ID, virtualRootName);
        for (ComponentNode node : registry.components()) {
            if (node.parent() == null) {
                virtualRoot.addChild(node);
            }
        }
        log.debug("根候选数 {}，使用虚拟根 {} 收养 {} 个组件", candidates.size(), virtualRootName, virtualRoot.children().size());
        return new AssemblyTree(virtualRoot, conflicts, List.of());
    }
}
