package org.stepaas.assembly;

import org.stepaas.assembly.dto.AssemblyStructure;
import org.stepaas.assembly.dto.ElementNode;
import org.stepaas.assembly.dto.ReferencedFile;
import org.stepaas.assembly.dto.step.StepHeader;
import org.stepaas.assembly.model.Annotation;
import org.stepaas.assembly.model.ComponentNode;
import org.stepaas.assembly.model.GeometryInfo;
import org.stepaas.assembly.model.GeometryInfo.Vector3;
import org.stepaas.assembly.model.NodeKind;
import org.stepaas.assembly.step.ComponentClassifier;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 把完成的装配树转换为嵌套的属性/集合元素树（{@code AssemblyStructure} 子模型），并列出引用文件。
 * <p>
 * 每个组件输出：{@code Product_ID}、{@code Type}、{@code Level}、{@code Source_File}、
 * 标准件的 {@code Standard_Type}、{@code Annotations}（只含 name 与 description 都非空的标注）、
 * {@code Files}（补充标注来源文档）、根节点的 {@code Geometry}，以及子组件集合 {@code Components}。
 * 根节点的元素直接放在 {@code Main_Assembly} 集合中，并附带主文档 HEADER 中的名称/作者/组织。
 * <p>
 * idShort 全部经由本次运行的 {@link IdentifierAllocator} 分配，语义 ID 来自 {@link TaxonomyService}。
 */
public class AssemblyStructureMapper {

    public static final String SUBMODEL_ID_SHORT = "AssemblyStructure";
    static final String STEP_MIME_TYPE = "application/step";

    private static final String XS_STRING = "xs:string";
    private static final String XS_INT = "xs:int";
    private static final String XS_DOUBLE = "xs:double";

    private final TaxonomyService taxonomy;
    private final ComponentClassifier classifier;

    public AssemblyStructureMapper(TaxonomyService taxonomy, ComponentClassifier classifier) {
        this.taxonomy = taxonomy;
        this.classifier = classifier;
    }

    public AssemblyStructure map(AssemblyTree tree, StepHeader header, Path primaryDocument, IdentifierAllocator allocator) {
        Session session = new Session(allocator);
        ComponentNode root = tree.root();

        List<ElementNode> rootElements = session.componentElements(root, 0);
        rootElements.add(session.property("Main_Assembly_Name", XS_STRING,
                primaryDocument.getFileName().toString(), "Name"));
        String author = (header == null) ? null : header.firstAuthor();
        if (author != null) {
            rootElements.add(session.property("Main_Assembly_Author", XS_STRING, author, "Author"));
        }
        String organization = (header == null) ? null : header.firstOrganization();
        if (organization != null) {
            rootElements.add(session.property("Main_Assembly_Organization", XS_STRING, organization, "Organization"));
        }
        if (!root.children().isEmpty()) {
            rootElements.add(session.childrenCollection(root, 1));
        }
        ElementNode mainAssembly = session.collection("Main_Assembly", root.syntheticId(), "Main_Assembly", rootElements);

        ElementNode submodel = new ElementNode(SUBMODEL_ID_SHORT, ElementNode.Kind.SUBMODEL, null, null,
                semanticId(SUBMODEL_ID_SHORT), List.of(mainAssembly));
        return new AssemblyStructure(submodel, List.copyOf(session.files));
    }

    private String semanticId(String label) {
        return taxonomy.lookup(label).semanticId();
    }

    /**
     * 单次映射的状态：分配器与引用文件列表。
     */
    private final class Session {

        private final IdentifierAllocator allocator;
        private final List<ReferencedFile> files = new ArrayList<>();

        Session(IdentifierAllocator allocator) {
            this.allocator = allocator;
        }

        List<ElementNode> componentElements(ComponentNode node, int level) {
            List<ElementNode> elements = new ArrayList<>();
            elements.add(structural("Product_ID", XS_STRING, node.syntheticId(), "Product_ID"));
            elements.add(structural("Type", XS_STRING, node.kind().name(), "Type"));
            elements.add(structural("Level", XS_INT, Integer.toString(level), "Level"));
            elements.add(structural("Source_File", XS_STRING, sourceFileName(node), "Source_File"));
            if (node.kind() == NodeKind.STANDARD_PART) {
                String keyword = classifier.standardKeyword(node.name(), node.description(), node.annotations());
                elements.add(structural("Standard_Type", XS_STRING,
                        (keyword == null) ? NodeKind.STANDARD_PART.name() : keyword.toUpperCase(Locale.ROOT),
                        "Standard_Type"));
            }

            List<ElementNode> annotations = new ArrayList<>();
            for (Annotation a : node.annotations()) {
                if (a.isComplete()) {
                    annotations.add(property(a.name(), XS_STRING, a.description(), a.name()));
                }
            }
            if (!annotations.isEmpty()) {
                elements.add(collection("Annotations", node.syntheticId(), "Annotations", annotations));
            }

            List<ElementNode> fileElements = new ArrayList<>();
            int idx = 0;
            for (Path source : node.annotationSources()) {
                String logicalPath = node.annotationFileName(source);
                String idShort = allocator.allocate("AnnotationFile_" + idx, node.syntheticId());
                fileElements.add(ElementNode.file(idShort, STEP_MIME_TYPE, logicalPath));
                files.add(new ReferencedFile(source.toString(), logicalPath, STEP_MIME_TYPE));
                idx++;
            }
            if (!fileElements.isEmpty()) {
                elements.add(collection("Files", node.syntheticId(), "Files", fileElements));
            }

            if (level == 0 && node.geometry() != null) {
                ElementNode geometry = geometry(node.geometry());
                if (geometry != null) {
                    elements.add(geometry);
                }
            }
            return elements;
        }

        ElementNode childrenCollection(ComponentNode node, int childLevel) {
            List<ElementNode> children = new ArrayList<>();
            for (ComponentNode child : node.children()) {
                children.add(componentCollection(child, childLevel));
            }
            return collection("Components", node.syntheticId(), "Components", children);
        }

        private ElementNode componentCollection(ComponentNode node, int level) {
            List<ElementNode> elements = componentElements(node, level);
            if (!node.children().isEmpty()) {
                elements.add(childrenCollection(node, level + 1));
            }
            // 同名组件（多个实例）依靠上下文与数字后缀区分
            String idShort = allocator.allocate(node.name(), node.syntheticId());
            return ElementNode.collection(idShort, semanticId("Component"), elements);
        }

        private ElementNode geometry(GeometryInfo geometry) {
            List<ElementNode> elements = new ArrayList<>();
            if (geometry.volume() != null && geometry.volume() > 0) {
                elements.add(structural("Volume", XS_DOUBLE, number(geometry.volume()), "Volume"));
            }
            if (geometry.surfaceArea() != null && geometry.surfaceArea() > 0) {
                elements.add(structural("Surface_Area", XS_DOUBLE, number(geometry.surfaceArea()), "Surface_Area"));
            }
            if (geometry.centerOfMass() != null) {
                elements.add(vector("Center_of_Mass", geometry.centerOfMass(), "Center of mass", "X", "Y", "Z"));
            }
            if (geometry.boundingBox() != null) {
                var box = geometry.boundingBox();
                List<ElementNode> boxElements = List.of(
                        vector("Min", box.min(), "Bounding_Box_Min", "X", "Y", "Z"),
                        vector("Max", box.max(), "Bounding_Box_Max", "X", "Y", "Z"),
                        vector("Range", box.range(), "Bounding_Box_Range", "Length", "Width", "Height")
                );
                elements.add(collection("Bounding_Box", null, "Bounding_Box", boxElements));
            }
            return elements.isEmpty() ? null : collection("Geometry", null, "Geometry", elements);
        }

        private ElementNode vector(String idShort, Vector3 v, String semanticLabel, String x, String y, String z) {
            List<ElementNode> axes = List.of(
                    structural(x, XS_DOUBLE, number(v.x()), semanticLabel),
                    structural(y, XS_DOUBLE, number(v.y()), semanticLabel),
                    structural(z, XS_DOUBLE, number(v.z()), semanticLabel)
            );
            return collection(idShort, null, semanticLabel, axes);
        }

        ElementNode structural(String label, String valueType, String value, String semanticLabel) {
            return ElementNode.property(allocator.allocateStructural(label), valueType, value, semanticId(semanticLabel));
        }

        ElementNode property(String label, String valueType, String value, String semanticLabel) {
            return ElementNode.property(allocator.allocate(label, null), valueType, value, semanticId(semanticLabel));
        }

        ElementNode collection(String label, String context, String semanticLabel, List<ElementNode> children) {
            return ElementNode.collection(allocator.allocate(label, context), semanticId(semanticLabel), children);
        }

        private String sourceFileName(ComponentNode node) {
            Path source = node.sourceDocument();
            return (source == null || source.getFileName() == null) ? "virtual" : source.getFileName().toString();
        }

        private String number(double value) {
            return Double.toString(value);
        }
    }
}
