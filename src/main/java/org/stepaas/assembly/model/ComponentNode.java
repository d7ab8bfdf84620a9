package org.stepaas.assembly.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * 装配树中的组件节点（零件或子装配）。
 * <p>
 * 所有权约定：
 * <ul>
 *   <li>{@link #children()} 由父节点独占持有，同一节点只会挂在一个父节点下。</li>
 *   <li>{@link #parent()} 只用于向上遍历，不参与输出（DTO 转换时不会沿 parent 展开）。</li>
 * </ul>
 * 节点在主文档处理阶段创建；之后只有补充标注流程会追加 {@code annotations}/{@code annotationSources}。
 */
public final class ComponentNode {

    private final String syntheticId;
    private final Integer nativeId;
    private final String name;
    private final String description;
    private final Path sourceDocument;
    private final NodeKind kind;
    private final boolean virtual;

    private final List<Annotation> annotations = new ArrayList<>();
    // 标注来源文档 -> 逻辑文件名（插入顺序即处理顺序）
    private final Map<Path, String> annotationSources = new LinkedHashMap<>();
    private final List<ComponentNode> children = new ArrayList<>();
    private ComponentNode parent;
    private GeometryInfo geometry;

    public ComponentNode(String syntheticId, Integer nativeId, String name, String description,
                         Path sourceDocument, NodeKind kind) {
        this(syntheticId, nativeId, name, description, sourceDocument, kind, false);
    }

    private ComponentNode(String syntheticId, Integer nativeId, String name, String description,
                          Path sourceDocument, NodeKind kind, boolean virtual) {
        this.syntheticId = Objects.requireNonNull(syntheticId, "syntheticId");
        this.nativeId = nativeId;
        this.name = (name == null) ? "" : name;
        this.description = (description == null) ? "" : description;
        this.sourceDocument = sourceDocument;
        this.kind = Objects.requireNonNull(kind, "kind");
        this.virtual = virtual;
    }

    /**
     * 创建虚拟根节点（无来源文档、无原生 id，类型固定为 ASSEMBLY）。
     */
    public static ComponentNode virtualRoot(String syntheticId, String name) {
        return new ComponentNode(syntheticId, null, name, "", null, NodeKind.ASSEMBLY, true);
    }

    public String syntheticId() {
        return syntheticId;
    }

    public Integer nativeId() {
        return nativeId;
    }

    public String name() {
        return name;
    }

    public String description() {
        return description;
    }

    public Path sourceDocument() {
        return sourceDocument;
    }

    public NodeKind kind() {
        return kind;
    }

    public boolean isVirtual() {
        return virtual;
    }

    public List<Annotation> annotations() {
        return Collections.unmodifiableList(annotations);
    }

    public Set<Path> annotationSources() {
        return Collections.unmodifiableSet(annotationSources.keySet());
    }

    public boolean hasAnnotationSource(Path document) {
        return annotationSources.containsKey(document);
    }

    /**
     * @return 来源文档在输出包中的逻辑文件名；未登记时为 null
     */
    public String annotationFileName(Path document) {
        return annotationSources.get(document);
    }

    public List<ComponentNode> children() {
        return Collections.unmodifiableList(children);
    }

    public ComponentNode parent() {
        return parent;
    }

    public GeometryInfo geometry() {
        return geometry;
    }

    public void setGeometry(GeometryInfo geometry) {
        this.geometry = geometry;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * 追加一条标注；已存在相同 (name, description) 时忽略。
     *
     * @return 是否真正追加
     */
    public boolean addAnnotation(Annotation annotation) {
        if (annotation == null || annotations.contains(annotation)) {
            return false;
        }
        annotations.add(annotation);
        return true;
    }

    /**
     * @return 实际新增的条数
     */
    public int addAnnotations(List<Annotation> candidates) {
        int added = 0;
        for (Annotation a : candidates) {
            if (addAnnotation(a)) {
                added++;
            }
        }
        return added;
    }

    /**
     * 登记标注来源文档；同一文档重复登记时保留第一次的逻辑文件名。
     *
     * @return 是否为新来源
     */
    public boolean addAnnotationSource(Path document, String fileName) {
        if (document == null || annotationSources.containsKey(document)) {
            return false;
        }
        annotationSources.put(document, fileName);
        return true;
    }

    /**
     * 挂接子节点。调用方（装配树构建器）负责保证子节点尚无父节点且不会成环。
     */
    public void addChild(ComponentNode child) {
        if (child.parent != null) {
            throw new IllegalStateException("节点 " + child.syntheticId + " 已挂在 " + child.parent.syntheticId + " 下");
        }
        child.parent = this;
        children.add(child);
    }

    /**
     * 判断当前节点是否为 {@code other} 本身或其祖先。
     */
    public boolean isAncestorOrSelf(ComponentNode other) {
        for (ComponentNode n = other; n != null; n = n.parent) {
            if (n == this) {
                return true;
            }
        }
        return false;
    }

    @Override
    public String toString() {
        return "ComponentNode[" + syntheticId + " '" + name + "' " + kind + "]";
    }
}
