package org.stepaas.assembly;

import org.junit.jupiter.api.Test;
import org.stepaas.assembly.dto.AssemblyStructure;
import org.stepaas.assembly.dto.ElementNode;
import org.stepaas.assembly.dto.ReferencedFile;
import org.stepaas.assembly.dto.step.StepHeader;
import org.stepaas.assembly.model.Annotation;
import org.stepaas.assembly.model.ComponentNode;
import org.stepaas.assembly.model.GeometryInfo;
import org.stepaas.assembly.model.GeometryInfo.BoundingBox;
import org.stepaas.assembly.model.GeometryInfo.Vector3;
import org.stepaas.assembly.step.ComponentClassifier;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.stepaas.assembly.AssemblyTestSupport.document;
import static org.stepaas.assembly.AssemblyTestSupport.edge;
import static org.stepaas.assembly.AssemblyTestSupport.register;

class AssemblyStructureMapperTest {

    private static final StepHeader HEADER = new StepHeader(null, null, "Gripper.stp", null,
            List.of("Müller"), List.of("Institut"), null, null, null, null, null);

    private final IdentifierAllocator allocator = new IdentifierAllocator();
    private final AssemblyStructureMapper mapper =
            new AssemblyStructureMapper(AssemblyTestSupport.labelTaxonomy(), new ComponentClassifier());

    @Test
    void map_writesRootElementsHeaderMetadataAndComponents() {
        AssemblyTree tree = gripperTree();

        AssemblyStructure structure = mapper.map(tree, HEADER, Path.of("/data/Gripper.stp"), allocator);

        ElementNode submodel = structure.submodel();
        assertThat(submodel.idShort()).isEqualTo(AssemblyStructureMapper.SUBMODEL_ID_SHORT);
        assertThat(submodel.kind()).isEqualTo(ElementNode.Kind.SUBMODEL);
        ElementNode main = submodel.child("Main_Assembly");
        assertThat(main.semanticId()).isEqualTo("id:Main_Assembly");
        assertThat(main.children()).extracting(ElementNode::idShort).containsExactly(
                "Product_ID", "Type", "Level", "Source_File", "Geometry",
                "Main_Assembly_Name", "Main_Assembly_Author", "Main_Assembly_Organization", "Components");
        assertThat(main.child("Product_ID").value()).isEqualTo("P00001");
        assertThat(main.child("Type").value()).isEqualTo("ASSEMBLY");
        assertThat(main.child("Level").valueType()).isEqualTo("xs:int");
        assertThat(main.child("Source_File").value()).isEqualTo("primary.stp");
        assertThat(main.child("Main_Assembly_Name").value()).isEqualTo("Gripper.stp");
        assertThat(main.child("Main_Assembly_Author").value()).isEqualTo("Müller");
    }

    @Test
    void map_geometryIsWrittenForRootOnly() {
        AssemblyTree tree = gripperTree();

        ElementNode main = mapper.map(tree, HEADER, Path.of("/data/Gripper.stp"), allocator)
                .submodel().child("Main_Assembly");

        ElementNode geometry = main.child("Geometry");
        assertThat(geometry.child("Volume").value()).isEqualTo("12.5");
        assertThat(geometry.child("Surface_Area")).isNull();
        assertThat(geometry.child("Center_of_Mass").children()).extracting(ElementNode::value)
                .containsExactly("1.0", "2.0", "3.0");
        ElementNode range = geometry.child("Bounding_Box").child("Range");
        assertThat(range.children()).extracting(ElementNode::idShort).containsExactly("Length", "Width", "Height");
        assertThat(range.child("Height").value()).isEqualTo("30.0");
        assertThat(main.child("Components").children())
                .allMatch(component -> component.child("Geometry") == null);
    }

    @Test
    void map_componentsGetUniqueIdsAnnotationsAndFiles() {
        AssemblyTree tree = gripperTree();

        AssemblyStructure structure = mapper.map(tree, HEADER, Path.of("/data/Gripper.stp"), allocator);

        ElementNode components = structure.submodel().child("Main_Assembly").child("Components");
        assertThat(components.children()).extracting(ElementNode::idShort)
                .containsExactly("Bracket", "Bracket_P00003", "M6_Screw");
        assertThat(components.children()).extracting(ElementNode::semanticId).containsOnly("id:Component");

        ElementNode bracket = components.child("Bracket");
        assertThat(bracket.child("Level").value()).isEqualTo("1");
        assertThat(bracket.child("Standard_Type")).isNull();
        assertThat(bracket.child("Annotations").children()).singleElement().satisfies(a -> {
            assertThat(a.idShort()).isEqualTo("Material");
            assertThat(a.value()).isEqualTo("S235");
        });
        ElementNode file = bracket.child("Files").children().get(0);
        assertThat(file.kind()).isEqualTo(ElementNode.Kind.FILE);
        assertThat(file.valueType()).isEqualTo("application/step");
        assertThat(file.value()).isEqualTo("/aasx/stp/annotations/Annotation_Bracket_2.stp");

        assertThat(components.child("Bracket_P00003").child("Annotations")).isNull();
        assertThat(components.child("M6_Screw").child("Standard_Type").value()).isEqualTo("SCREW");
        assertThat(structure.files()).containsExactly(new ReferencedFile(
                Path.of("/data/Bracket-2.stp").toString(),
                "/aasx/stp/annotations/Annotation_Bracket_2.stp",
                "application/step"));
    }

    @Test
    void map_boundingBoxAxesKeepPlainLabelsInEveryVector() {
        AssemblyTree tree = gripperTree();

        ElementNode box = mapper.map(tree, HEADER, Path.of("/data/Gripper.stp"), allocator)
                .submodel().child("Main_Assembly").child("Geometry").child("Bounding_Box");

        assertThat(box.child("Min").children()).extracting(ElementNode::idShort).containsExactly("X", "Y", "Z");
        assertThat(box.child("Max").children()).extracting(ElementNode::idShort).containsExactly("X", "Y", "Z");
        assertThat(box.child("Max").child("Z").value()).isEqualTo("30.0");
    }

    @Test
    void map_componentsNamedLikeStructuralLabelsDoNotCollide() {
        var doc = document(
                List.of("Frame", "Type", "Type"),
                List.of(edge(10, 1, 2), edge(11, 1, 3)),
                Map.of(2, List.of(new Annotation("Level", "high"))));
        ComponentRegistry registry = register(allocator, doc);
        AssemblyTree tree = new AssemblyTreeBuilder(allocator, "Assembly_Root").build(registry, doc.edges());

        ElementNode components = mapper.map(tree, HEADER, Path.of("/data/Frame.stp"), allocator)
                .submodel().child("Main_Assembly").child("Components");

        assertThat(components.children()).extracting(ElementNode::idShort)
                .containsExactly("Type_P00002", "Type_P00003");
        ElementNode first = components.child("Type_P00002");
        assertThat(first.child("Type").value()).isEqualTo("PART");
        assertThat(first.child("Level").value()).isEqualTo("1");
        assertThat(first.child("Annotations").children()).extracting(ElementNode::idShort).containsExactly("Level_1");
    }

    @Test
    void map_virtualRootHasNoSourceFileOrGeometry() {
        var doc = document(List.of("Bracket"), List.of());
        AssemblyTree tree = new AssemblyTreeBuilder(allocator, "Assembly_Root").build(register(allocator, doc), List.of());

        ElementNode main = mapper.map(tree, null, Path.of("Bracket.stp"), allocator)
                .submodel().child("Main_Assembly");

        assertThat(main.child("Product_ID").value()).isEqualTo(AssemblyTreeBuilder.VIRTUAL_ROOT_ID);
        assertThat(main.child("Source_File").value()).isEqualTo("virtual");
        assertThat(main.child("Geometry")).isNull();
        assertThat(main.child("Main_Assembly_Author")).isNull();
        assertThat(main.child("Components").children()).extracting(ElementNode::idShort).containsExactly("Bracket");
    }

    private AssemblyTree gripperTree() {
        var doc = document(
                List.of("Frame", "Bracket", "Bracket", "M6 Screw"),
                List.of(edge(10, 1, 2), edge(11, 1, 3), edge(12, 1, 4)),
                Map.of(2, List.of(new Annotation("Material", "S235"), new Annotation("Note", ""))));
        ComponentRegistry registry = register(allocator, doc);
        AssemblyTree tree = new AssemblyTreeBuilder(allocator, "Assembly_Root").build(registry, doc.edges());

        tree.root().setGeometry(new GeometryInfo(12.5, null, new Vector3(1, 2, 3),
                BoundingBox.of(new Vector3(0, 0, 0), new Vector3(10, 20, 30))));
        ComponentNode bracket = registry.findBySyntheticId("P00002").orElseThrow();
        bracket.addAnnotationSource(Path.of("/data/Bracket-2.stp"), "/aasx/stp/annotations/Annotation_Bracket_2.stp");
        return tree;
    }
}
