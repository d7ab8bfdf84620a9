package org.stepaas.assembly.step;

import org.junit.jupiter.api.Test;
import org.stepaas.assembly.model.Annotation;
import org.stepaas.assembly.model.NodeKind;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ComponentClassifierTest {

    private final ComponentClassifier classifier = new ComponentClassifier();

    @Test
    void classify_structuralParentWinsOverKeywords() {
        assertThat(classifier.classify("Screw Set", "", List.of(), true)).isEqualTo(NodeKind.ASSEMBLY);
    }

    @Test
    void classify_keywordMakesStandardPart() {
        assertThat(classifier.classify("M6 Screw", "", List.of(), false)).isEqualTo(NodeKind.STANDARD_PART);
        assertThat(classifier.standardKeyword("M6 Screw", "", List.of())).isEqualTo("screw");
    }

    @Test
    void classify_plainNameIsPart() {
        assertThat(classifier.classify("Bracket", "left side", List.of(), false)).isEqualTo(NodeKind.PART);
        assertThat(classifier.standardKeyword("Bracket", "left side", List.of())).isNull();
    }

    @Test
    void classify_manufacturerAndCatalogPatterns() {
        assertThat(classifier.classify("Festo DSNU", "", List.of(), false)).isEqualTo(NodeKind.STANDARD_PART);
        assertThat(classifier.classify("Clamp", "AB-123", List.of(), false)).isEqualTo(NodeKind.STANDARD_PART);
        assertThat(classifier.classify("Clamp", "K12345", List.of(), false)).isEqualTo(NodeKind.STANDARD_PART);
        // 型号规则区分大小写
        assertThat(classifier.classify("Clamp", "ab-123", List.of(), false)).isEqualTo(NodeKind.PART);
    }

    @Test
    void classify_considersAnnotationText() {
        List<Annotation> annotations = List.of(new Annotation("Supplier", "Balluff"));

        assertThat(classifier.classify("Probe", "", annotations, false)).isEqualTo(NodeKind.STANDARD_PART);
        assertThat(classifier.standardKeyword("Probe", "", annotations)).isNull();
    }
}
