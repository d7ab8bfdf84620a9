package org.stepaas.assembly;

import org.stepaas.assembly.dto.AssemblyBuildReport;
import org.stepaas.assembly.dto.AssemblyNodeView;
import org.stepaas.assembly.dto.AssemblyStructure;
import org.stepaas.assembly.dto.step.StepHeader;
import org.stepaas.assembly.model.ComponentNode;
import org.stepaas.assembly.model.NodeKind;
import org.stepaas.assembly.step.ResolutionStats;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * 一次批量构建的完整结果。
 *
 * @param directory         输入目录
 * @param primaryDocument   主文档
 * @param documents         发现的全部 STEP 文档（发现顺序）
 * @param header            主文档 HEADER
 * @param registry          组件登记表
 * @param tree              装配树
 * @param outcomes          辅助文档处理结果（发现顺序）
 * @param resolutionStats   主文档引用解析计数
 * @param statementsScanned 主文档定位到的语句数
 * @param statementsDropped 主文档丢弃的畸形语句数
 * @param structure         输出结构
 * @param warnings          非致命提示
 */
public record AssemblyRun(
        Path directory,
        Path primaryDocument,
        List<Path> documents,
        StepHeader header,
        ComponentRegistry registry,
        AssemblyTree tree,
        List<SupplementOutcome> outcomes,
        ResolutionStats resolutionStats,
        int statementsScanned,
        int statementsDropped,
        AssemblyStructure structure,
        List<String> warnings
) {

    public List<SupplementOutcome> outcomes(SupplementOutcome.Status status) {
        return outcomes.stream().filter(o -> o.status() == status).toList();
    }

    public AssemblyBuildReport toReport(Function<Path, String> displayPath, int maxItems) {
        List<ComponentNode> components = registry.components();
        int leaves = 0;
        int withAnnotations = 0;
        int annotations = 0;
        int standard = 0;
        int relationships = 0;
        for (ComponentNode c : components) {
            if (c.isLeaf()) {
                leaves++;
            }
            if (!c.annotations().isEmpty()) {
                withAnnotations++;
            }
            annotations += c.annotations().size();
            if (c.kind() == NodeKind.STANDARD_PART) {
                standard++;
            }
            if (c.parent() != null && !c.parent().isVirtual()) {
                relationships++;
            }
        }

        List<SupplementOutcome> processed = outcomes.stream()
                .filter(o -> o.status() != SupplementOutcome.Status.UNREADABLE)
                .toList();

        return new AssemblyBuildReport(
                displayPath.apply(primaryDocument),
                documents.size(),
                processed.size(),
                outcomes(SupplementOutcome.Status.MATCHED).size(),
                components.size(),
                leaves,
                withAnnotations,
                annotations,
                standard,
                relationships,
                tree.root().syntheticId(),
                tree.root().name(),
                tree.isVirtualRoot(),
                limit(tree.conflicts(), maxItems),
                limit(tree.detached().stream().map(ComponentNode::syntheticId).toList(), maxItems),
                limit(paths(outcomes(SupplementOutcome.Status.UNMATCHED), displayPath), maxItems),
                limit(paths(outcomes(SupplementOutcome.Status.UNREADABLE), displayPath), maxItems),
                limit(registry.duplicateNames(), maxItems),
                resolutionStats,
                statementsScanned,
                statementsDropped,
                warnings.isEmpty() ? null : limit(warnings, maxItems)
        );
    }

    /**
     * 层级视图；{@code maxDepth} 之下的子节点不展开。
     */
    public AssemblyNodeView toView(int maxDepth) {
        return view(tree.root(), 0, maxDepth);
    }

    private static AssemblyNodeView view(ComponentNode node, int level, int maxDepth) {
        List<AssemblyNodeView> children = new ArrayList<>();
        if (level < maxDepth) {
            for (ComponentNode child : node.children()) {
                children.add(view(child, level + 1, maxDepth));
            }
        }
        return new AssemblyNodeView(node.syntheticId(), node.name(), node.kind().name(), level,
                node.annotations().size(), children);
    }

    private static List<String> paths(List<SupplementOutcome> outcomes, Function<Path, String> displayPath) {
        return outcomes.stream().map(o -> displayPath.apply(o.document())).toList();
    }

    private static <T> List<T> limit(List<T> values, int maxItems) {
        return (values.size() <= maxItems) ? List.copyOf(values) : List.copyOf(values.subList(0, maxItems));
    }
}
