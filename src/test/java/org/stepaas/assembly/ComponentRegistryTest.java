package org.stepaas.assembly;

import org.junit.jupiter.api.Test;
import org.stepaas.assembly.model.Annotation;
import org.stepaas.assembly.model.ComponentNode;
import org.stepaas.assembly.model.NodeKind;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.stepaas.assembly.AssemblyTestSupport.document;
import static org.stepaas.assembly.AssemblyTestSupport.edge;
import static org.stepaas.assembly.AssemblyTestSupport.register;

class ComponentRegistryTest {

    @Test
    void registerAll_assignsSequenceIdsAndClassifies() {
        ComponentRegistry registry = register(new IdentifierAllocator(), document(
                List.of("Frame", "Bracket", "M6 Screw"),
                List.of(edge(10, 1, 2), edge(11, 1, 3)),
                Map.of(2, List.of(new Annotation("Material", "S235")))));

        assertThat(registry.components()).extracting(ComponentNode::syntheticId)
                .containsExactly("P00001", "P00002", "P00003");
        assertThat(registry.components()).extracting(ComponentNode::kind)
                .containsExactly(NodeKind.ASSEMBLY, NodeKind.PART, NodeKind.STANDARD_PART);
        assertThat(registry.findByNativeId(2)).get().extracting(ComponentNode::annotations)
                .isEqualTo(List.of(new Annotation("Material", "S235")));
        assertThat(registry.findBySyntheticId("P00003")).get().extracting(ComponentNode::name).isEqualTo("M6 Screw");
    }

    @Test
    void normalizeName_stripsInstanceSuffixAndUppercases() {
        assertThat(ComponentRegistry.normalizeName(" Bolt-2 ")).isEqualTo("BOLT");
        assertThat(ComponentRegistry.normalizeName("Base Plate-12")).isEqualTo("BASE PLATE");
        assertThat(ComponentRegistry.normalizeName("AB-123X")).isEqualTo("AB-123X");
        assertThat(ComponentRegistry.normalizeName(null)).isEmpty();
    }

    @Test
    void nameIndex_keepsFirstRegisteredComponentAndReportsDuplicates() {
        ComponentRegistry registry = register(new IdentifierAllocator(), document(
                List.of("Bracket", "Bracket-2", "Frame"), List.of()));

        assertThat(registry.findByNormalizedName("BRACKET")).get()
                .extracting(ComponentNode::syntheticId).isEqualTo("P00001");
        assertThat(registry.duplicateNames()).containsExactly("Bracket-2");
        assertThat(registry.size()).isEqualTo(3);
        assertThat(registry.findByNormalizedName("MISSING")).isEmpty();
    }
}
