package org.stepaas.assembly.step;

import org.junit.jupiter.api.Test;
import org.stepaas.assembly.model.Annotation;
import org.stepaas.assembly.model.AssemblyEdge;

import static org.assertj.core.api.Assertions.assertThat;

class StepReferenceResolverTest {

    private static final String HOUSING = """
            DATA;
            #1=PRODUCT('H-1','Housing','',(#100));
            #2=PRODUCT_DEFINITION_FORMATION('','',#1);
            #3=PRODUCT_DEFINITION('design','',#2,#200);
            #4=PRODUCT('L-1','Lid','',(#100));
            #5=PRODUCT_DEFINITION_FORMATION('','',#4);
            #6=PRODUCT_DEFINITION('design','',#5,#200);
            #7=NEXT_ASSEMBLY_USAGE_OCCURRENCE('1','Lid-1','',#3,#6,'R1');
            #8=NEXT_ASSEMBLY_USAGE_OCCURRENCE('2','ghost','',#3,#777,$);
            #10=DESCRIPTIVE_REPRESENTATION_ITEM('Material','Steel');
            #11=REPRESENTATION('',(#10),#300);
            #12=PROPERTY_DEFINITION('material','',#3);
            #13=PROPERTY_DEFINITION_REPRESENTATION(#12,#11);
            #14=PROPERTY_DEFINITION('material again','',#3);
            #15=PROPERTY_DEFINITION_REPRESENTATION(#14,#11);
            #20=DESCRIPTIVE_REPRESENTATION_ITEM('Color','Red');
            #21=REPRESENTATION('',(#20),#300);
            #22=PROPERTY_DEFINITION('color','',#999);
            #23=PROPERTY_DEFINITION_REPRESENTATION(#22,#21);
            #30=DESCRIPTIVE_REPRESENTATION_ITEM('Note','for Housing');
            #40=DESCRIPTIVE_REPRESENTATION_ITEM('','');
            #50=SHAPE_REPRESENTATION('',(#51),#300);
            #52=PROPERTY_DEFINITION_REPRESENTATION(#12,#50);
            ENDSEC;
            """;

    private final StepRecordExtractor extractor = new StepRecordExtractor();
    private final StepReferenceResolver resolver = new StepReferenceResolver();

    @Test
    void resolve_linksAnnotationsThroughPropertyChain() {
        ResolvedDocument doc = resolver.resolve(extractor.extract(HOUSING), false);

        assertThat(doc.annotationsOf(1)).containsExactly(new Annotation("Material", "Steel"));
        assertThat(doc.annotationsOf(4)).isEmpty();
        assertThat(doc.stats().annotationsLinked()).isEqualTo(1);
    }

    @Test
    void resolve_countsBrokenChainsAndLeavesTheirAnnotationsUnlinked() {
        ResolvedDocument doc = resolver.resolve(extractor.extract(HOUSING), false);

        ResolutionStats stats = doc.stats();
        assertThat(stats.brokenAnnotationChains()).isEqualTo(1);
        assertThat(stats.unlinkedAnnotations()).isEqualTo(3);
        assertThat(stats.fallbackLinks()).isZero();
        assertThat(doc.allAnnotations()).doesNotContain(new Annotation("Color", "Red"));
    }

    @Test
    void resolve_emitsEdgesOnlyWhenBothEndsResolve() {
        ResolvedDocument doc = resolver.resolve(extractor.extract(HOUSING), false);

        assertThat(doc.edges()).containsExactly(new AssemblyEdge(7, 1, 4, "R1"));
        assertThat(doc.stats().edgesResolved()).isEqualTo(1);
        assertThat(doc.stats().unresolvedEdges()).isEqualTo(1);
    }

    @Test
    void resolve_textFallbackAttachesOnlyWhenRequested() {
        ResolvedDocument doc = resolver.resolve(extractor.extract(HOUSING), true);

        assertThat(doc.annotationsOf(1)).containsExactly(
                new Annotation("Material", "Steel"),
                new Annotation("Note", "for Housing"));
        assertThat(doc.stats().fallbackLinks()).isEqualTo(1);
        assertThat(doc.stats().unlinkedAnnotations()).isEqualTo(2);
        assertThat(doc.annotationsOf(4)).isEmpty();
    }

    @Test
    void resolve_emptyRecordsYieldEmptyDocument() {
        ResolvedDocument doc = resolver.resolve(StepRecords.empty(), true);

        assertThat(doc.products()).isEmpty();
        assertThat(doc.edges()).isEmpty();
        assertThat(doc.stats()).isEqualTo(ResolutionStats.zero());
    }
}
