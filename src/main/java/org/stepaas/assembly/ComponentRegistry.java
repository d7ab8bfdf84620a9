package org.stepaas.assembly;

import org.stepaas.assembly.dto.step.StepProduct;
import org.stepaas.assembly.model.AssemblyEdge;
import org.stepaas.assembly.model.ComponentNode;
import org.stepaas.assembly.model.NodeKind;
import org.stepaas.assembly.step.ComponentClassifier;
import org.stepaas.assembly.step.ResolvedDocument;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 组件登记表：为解析出的产品创建 {@link ComponentNode}，并维护三个索引。
 * <ul>
 *   <li>synthetic id -> 节点（输出使用的标识）</li>
 *   <li>native id -> 节点（只表示来源，仅在主文档内有意义）</li>
 *   <li>规范化名称 -> 节点（跨文档按文件名匹配用，先登记者占位）</li>
 * </ul>
 */
public class ComponentRegistry {

    private static final Pattern TRAILING_INSTANCE_SUFFIX = Pattern.compile("-\\d+$");

    private final IdentifierAllocator allocator;
    private final ComponentClassifier classifier;

    private final Map<String, ComponentNode> bySyntheticId = new LinkedHashMap<>();
    private final Map<Integer, ComponentNode> byNativeId = new HashMap<>();
    private final Map<String, ComponentNode> byNormalizedName = new HashMap<>();
    private final List<String> duplicateNames = new ArrayList<>();

    public ComponentRegistry(IdentifierAllocator allocator, ComponentClassifier classifier) {
        this.allocator = allocator;
        this.classifier = classifier;
    }

    /**
     * 按文档顺序登记全部产品。
     *
     * @return 本次新登记的节点（文档顺序）
     */
    public List<ComponentNode> registerAll(ResolvedDocument document, Path sourceDocument) {
        Set<Integer> parents = new HashSet<>();
        for (AssemblyEdge edge : document.edges()) {
            parents.add(edge.parentProductId());
        }

        List<ComponentNode> registered = new ArrayList<>(document.products().size());
        for (StepProduct product : document.products().values()) {
            var annotations = document.annotationsOf(product.id());
            NodeKind kind = classifier.classify(
                    product.displayName(), product.description(), annotations, parents.contains(product.id()));
            ComponentNode node = new ComponentNode(
                    allocator.nextSequenceId("P"),
                    product.id(),
                    product.displayName(),
                    product.description(),
                    sourceDocument,
                    kind
            );
            node.addAnnotations(annotations);
            register(node);
            registered.add(node);
        }
        return registered;
    }

    private void register(ComponentNode node) {
        bySyntheticId.put(node.syntheticId(), node);
        if (node.nativeId() != null) {
            byNativeId.putIfAbsent(node.nativeId(), node);
        }
        String key = normalizeName(node.name());
        if (key.isEmpty()) {
            return;
        }
        if (byNormalizedName.putIfAbsent(key, node) != null) {
            duplicateNames.add(node.name());
        }
    }

    public Optional<ComponentNode> findBySyntheticId(String syntheticId) {
        return Optional.ofNullable(bySyntheticId.get(syntheticId));
    }

    public Optional<ComponentNode> findByNativeId(int nativeId) {
        return Optional.ofNullable(byNativeId.get(nativeId));
    }

    public Optional<ComponentNode> findByNormalizedName(String normalizedName) {
        return Optional.ofNullable(byNormalizedName.get(normalizedName));
    }

    /**
     * 名称规范化：去首尾空白，去掉末尾的 {@code -<数字>} 实例后缀，转大写。
     * 例：{@code " Bolt-2 " -> "BOLT"}。
     */
    public static String normalizeName(String name) {
        if (name == null) {
            return "";
        }
        return TRAILING_INSTANCE_SUFFIX.matcher(name.strip()).replaceAll("").toUpperCase(Locale.ROOT);
    }

    public List<ComponentNode> components() {
        return List.copyOf(bySyntheticId.values());
    }

    public int size() {
        return bySyntheticId.size();
    }

    /**
     * 规范化名称与先登记者重复、因此只能通过 synthetic id 访问的组件名称。
     */
    public List<String> duplicateNames() {
        return Collections.unmodifiableList(duplicateNames);
    }
}
