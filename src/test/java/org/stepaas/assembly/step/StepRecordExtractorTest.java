package org.stepaas.assembly.step;

import org.junit.jupiter.api.Test;
import org.stepaas.assembly.dto.step.StepProduct;
import org.stepaas.assembly.dto.step.StepUsage;

import java.util.EnumSet;

import static org.assertj.core.api.Assertions.assertThat;

class StepRecordExtractorTest {

    private final StepRecordExtractor extractor = new StepRecordExtractor();

    @Test
    void extract_readsMultiLineStatementsAndDropsMalformedOnes() {
        String step = """
                ISO-10303-21;
                HEADER;
                FILE_NAME('x.stp','',(''),(''),'','','');
                ENDSEC;
                DATA;
                #1=PRODUCT('Bolt;(x)','It''s',
                  'multi line',(#100));
                #2=PRODUCT('Broken','',(#100;
                #3=PRODUCT('Nut','Nut','',(#100));
                #4=(NAMED_UNIT(*) LENGTH_UNIT() SI_UNIT(.MILLI.,.METRE.));
                ENDSEC;
                END-ISO-10303-21;
                """;

        StepRecords records = extractor.extract(step);

        assertThat(records.products()).containsOnlyKeys(1, 3);
        StepProduct first = records.products().get(1);
        assertThat(first.identifier()).isEqualTo("Bolt;(x)");
        assertThat(first.name()).isEqualTo("It's");
        assertThat(first.description()).isEqualTo("multi line");
        assertThat(records.statementsScanned()).isEqualTo(2);
        assertThat(records.statementsDropped()).isEqualTo(1);
    }

    @Test
    void extract_missingTerminatorDropsOnlyThatStatement() {
        String step = """
                DATA;
                #1=PRODUCT('Bolt','Bolt','',(#100))
                #2=PRODUCT('Nut','Nut','',(#100));
                #3=PRODUCT('Washer','Washer','',(#100))
                ENDSEC;
                """;

        StepRecords records = extractor.extract(step);

        assertThat(records.products()).containsOnlyKeys(2);
        assertThat(records.products().get(2).name()).isEqualTo("Nut");
        assertThat(records.statementsScanned()).isEqualTo(1);
        assertThat(records.statementsDropped()).isEqualTo(2);
    }

    @Test
    void extract_returnsEmptyTablesForKindsAbsentFromText() {
        String step = """
                DATA;
                #1=PRODUCT('A','A','',(#100));
                ENDSEC;
                """;

        StepRecords records = extractor.extract(step);

        assertThat(records.products()).hasSize(1);
        assertThat(records.usages()).isEmpty();
        assertThat(records.annotations()).isEmpty();
        assertThat(records.propertyDefinitionRepresentations()).isEmpty();
    }

    @Test
    void extract_acceptsBothFormationSpellingsAndDecodesEscapes() {
        String step = """
                DATA;
                #1=PRODUCT('R','Au\\X2\\00DF\\X0\\enring','',(#100));
                #2=PRODUCT_DEFINITION_FORMATION('','',#1);
                #3=PRODUCT('S','Shaft','',(#100));
                #4=PRODUCT_DEFINITION_FORMATION_WITH_SPECIFIED_SOURCE('','',#3,.NOT_KNOWN.);
                #5=product_definition('design','',#2,#200);
                ENDSEC;
                """;

        StepRecords records = extractor.extract(step);

        assertThat(records.products().get(1).name()).isEqualTo("Außenring");
        assertThat(records.formations()).containsOnlyKeys(2, 4);
        assertThat(records.formations().get(4).productRef()).isEqualTo(3);
        assertThat(records.productDefinitions().get(5).formationRef()).isEqualTo(2);
        assertThat(records.productDefinitions().get(5).contextRef()).isEqualTo(200);
    }

    @Test
    void extract_readsUsageFieldsAndRepresentationItems() {
        String step = """
                DATA;
                #10=NEXT_ASSEMBLY_USAGE_OCCURRENCE('1','Lid-1','',#3,#6,'R1');
                #11=ASSEMBLY_COMPONENT_USAGE('2','Pad','',#3,#9,$);
                #20=DESCRIPTIVE_REPRESENTATION_ITEM('Torque','10 Nm');
                #21=REPRESENTATION('props',(#20,(#22)),#300);
                #23=PROPERTY_DEFINITION_REPRESENTATION(#24,#21);
                ENDSEC;
                """;

        StepRecords records = extractor.extract(step);

        StepUsage nauo = records.usages().get(10);
        assertThat(nauo.type()).isEqualTo("NEXT_ASSEMBLY_USAGE_OCCURRENCE");
        assertThat(nauo.name()).isEqualTo("Lid-1");
        assertThat(nauo.relatingDefinitionRef()).isEqualTo(3);
        assertThat(nauo.relatedDefinitionRef()).isEqualTo(6);
        assertThat(nauo.referenceDesignator()).isEqualTo("R1");
        assertThat(records.usages().get(11).referenceDesignator()).isNull();
        assertThat(records.annotations().get(20).description()).isEqualTo("10 Nm");
        assertThat(records.representations().get(21).itemRefs()).containsExactly(20, 22);
        assertThat(records.propertyDefinitionRepresentations().get(23).representationRef()).isEqualTo(21);
    }

    @Test
    void extract_limitsParsingToRequestedKinds() {
        String step = """
                DATA;
                #1=PRODUCT('A','A','',(#100));
                #2=DESCRIPTIVE_REPRESENTATION_ITEM('Weight','2 kg');
                ENDSEC;
                """;

        StepRecords records = extractor.extract(step, EnumSet.of(StepKind.ANNOTATION));

        assertThat(records.products()).isEmpty();
        assertThat(records.annotations()).containsOnlyKeys(2);
    }

    @Test
    void extract_emptyInputYieldsEmptyRecords() {
        assertThat(extractor.extract("")).isEqualTo(StepRecords.empty());
        assertThat(extractor.extract("DATA;\nENDSEC;\n").products()).isEmpty();
    }
}
