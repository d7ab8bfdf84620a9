package org.stepaas.assembly;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.stepaas.assembly.SupplementOutcome.Status;
import org.stepaas.assembly.dto.AssemblyBuildReport;
import org.stepaas.assembly.dto.AssemblyNodeView;
import org.stepaas.assembly.model.Annotation;
import org.stepaas.assembly.model.ComponentNode;
import org.stepaas.assembly.model.GeometryInfo.Vector3;

import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AssemblyBatchBuilderTest {

    @TempDir
    Path dir;

    private final AssemblyServerProperties properties = new AssemblyServerProperties();
    private final AssemblyBatchBuilder builder = AssemblyTestSupport.batchBuilder(properties);

    @Test
    void build_createsAnnotatedTreeFromPrimaryAndAuxiliaryDocuments() throws Exception {
        Path primary = StepFixtures.writeGripperDirectory(dir);

        AssemblyRun run = builder.build(dir, primary, false);

        ComponentNode root = run.tree().root();
        assertThat(root.name()).isEqualTo("Gripper");
        assertThat(run.tree().isVirtualRoot()).isFalse();
        assertThat(root.children()).extracting(ComponentNode::name).containsExactly("Base Plate", "M6 Screw");
        ComponentNode plate = root.children().get(0);
        assertThat(plate.annotations()).containsExactly(
                new Annotation("Material", "S235"), new Annotation("Torque", "10 Nm"));
        assertThat(plate.annotationSources()).hasSize(2);
        assertThat(run.header().firstAuthor()).isEqualTo("Müller");
        assertThat(root.geometry().boundingBox().max()).isEqualTo(new Vector3(100, 50, 20));
        assertThat(run.outcomes()).extracting(SupplementOutcome::status).containsExactly(
                Status.MATCHED, Status.MATCHED, Status.NO_ANNOTATIONS, Status.UNMATCHED);
        assertThat(run.structure().files()).hasSize(2);
    }

    @Test
    void build_reportSummarisesTheRun() throws Exception {
        Path primary = StepFixtures.writeGripperDirectory(dir);

        AssemblyBuildReport report = builder.build(dir, primary, false)
                .toReport(p -> dir.relativize(p).toString(), 100);

        assertThat(report.primaryDocument()).isEqualTo("Gripper.stp");
        assertThat(report.documentsDiscovered()).isEqualTo(5);
        assertThat(report.annotationDocumentsProcessed()).isEqualTo(4);
        assertThat(report.annotationDocumentsMatched()).isEqualTo(2);
        assertThat(report.totalComponents()).isEqualTo(3);
        assertThat(report.leafParts()).isEqualTo(2);
        assertThat(report.standardParts()).isEqualTo(1);
        assertThat(report.assemblyRelationships()).isEqualTo(2);
        assertThat(report.componentsWithAnnotations()).isEqualTo(1);
        assertThat(report.totalAnnotations()).isEqualTo(2);
        assertThat(report.rootName()).isEqualTo("Gripper");
        assertThat(report.virtualRoot()).isFalse();
        assertThat(report.unmatchedDocuments()).containsExactly("Unknown Bracket.STEP");
        assertThat(report.unreadableDocuments()).isEmpty();
        assertThat(report.conflicts()).isEmpty();
        assertThat(report.statementsDropped()).isZero();
        assertThat(report.warnings()).isNull();
    }

    @Test
    void build_isRepeatableForTheSameDirectory() throws Exception {
        Path primary = StepFixtures.writeGripperDirectory(dir);

        AssemblyRun first = builder.build(dir, primary, false);
        AssemblyRun second = builder.build(dir, primary, false);

        assertThat(second.structure()).isEqualTo(first.structure());
        assertThat(second.toView(32)).isEqualTo(first.toView(32));
    }

    @Test
    void build_singleProductPrimaryGetsVirtualRootWithoutGeometry() throws Exception {
        Path primary = StepFixtures.write(dir, "Screw.stp", StepFixtures.annotated("M6 Screw", "Length", "20 mm"));

        AssemblyRun run = builder.build(dir, primary, false);

        assertThat(run.tree().isVirtualRoot()).isTrue();
        assertThat(run.tree().root().geometry()).isNull();
        AssemblyNodeView view = run.toView(32);
        assertThat(view.children()).singleElement().satisfies(child -> {
            assertThat(child.kind()).isEqualTo("STANDARD_PART");
            assertThat(child.level()).isEqualTo(1);
            assertThat(child.annotationCount()).isEqualTo(1);
        });
    }

    @Test
    void build_hierarchyViewStopsAtMaxDepth() throws Exception {
        Path primary = StepFixtures.writeGripperDirectory(dir);

        AssemblyNodeView view = builder.build(dir, primary, false).toView(0);

        assertThat(view.name()).isEqualTo("Gripper");
        assertThat(view.children()).isEmpty();
    }

    @Test
    void build_rejectsMissingPrimaryDocument() {
        assertThatThrownBy(() -> builder.build(dir, null, false))
                .isInstanceOf(AssemblyBuildException.class);
        assertThatThrownBy(() -> builder.build(dir, dir.resolve("absent.stp"), false))
                .isInstanceOf(AssemblyBuildException.class)
                .hasMessageContaining("absent.stp");
    }

    @Test
    void build_rejectsPrimaryDocumentWithoutProducts() throws Exception {
        Path primary = StepFixtures.write(dir, "Empty.stp", """
                ISO-10303-21;
                HEADER;
                FILE_NAME('Empty.stp','',(''),(''),'','','');
                ENDSEC;
                DATA;
                #1=CARTESIAN_POINT('',(0.,0.,0.));
                ENDSEC;
                END-ISO-10303-21;
                """);

        assertThatThrownBy(() -> builder.build(dir, primary, false))
                .isInstanceOf(AssemblyBuildException.class)
                .hasMessageContaining("PRODUCT");
    }
}
