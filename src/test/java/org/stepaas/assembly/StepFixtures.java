package org.stepaas.assembly;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * 测试用 STEP 文档：一个主装配（Gripper）和若干辅助文档。
 */
public final class StepFixtures {

    private StepFixtures() {
    }

    public static final String GRIPPER = """
            ISO-10303-21;
            HEADER;
            FILE_DESCRIPTION(('gripper'),'2;1');
            FILE_NAME('Gripper.stp','2024-05-02T10:00:00',('M\\X2\\00FC\\X0\\ller'),('Institut'),'pp','cad','');
            FILE_SCHEMA(('AUTOMOTIVE_DESIGN'));
            ENDSEC;
            DATA;
            #1=PRODUCT('Gripper','Gripper','main assembly',(#100));
            #2=PRODUCT_DEFINITION_FORMATION_WITH_SPECIFIED_SOURCE('','',#1,.NOT_KNOWN.);
            #3=PRODUCT_DEFINITION('design','',#2,#200);
            #4=PRODUCT('Base Plate','Base Plate','',(#100));
            #5=PRODUCT_DEFINITION_FORMATION('','',#4);
            #6=PRODUCT_DEFINITION('design','',#5,#200);
            #7=PRODUCT('M6 Screw','M6 Screw','',(#100));
            #8=PRODUCT_DEFINITION_FORMATION('','',#7);
            #9=PRODUCT_DEFINITION('design','',#8,#200);
            #10=NEXT_ASSEMBLY_USAGE_OCCURRENCE('1','Base Plate-1','',#3,#6,$);
            #11=NEXT_ASSEMBLY_USAGE_OCCURRENCE('2','M6 Screw-1','',#3,#9,$);
            #20=DESCRIPTIVE_REPRESENTATION_ITEM('Material','S235');
            #21=REPRESENTATION('',(#20),#300);
            #22=PROPERTY_DEFINITION('material','',#6);
            #23=PROPERTY_DEFINITION_REPRESENTATION(#22,#21);
            #30=CARTESIAN_POINT('',(0.,0.,0.));
            #31=CARTESIAN_POINT('',(100.,50.,20.));
            ENDSEC;
            END-ISO-10303-21;
            """;

    /**
     * 只含一个产品和一组标注的辅助文档。
     */
    public static String annotated(String productName, String... namesAndValues) {
        StringBuilder items = new StringBuilder();
        StringBuilder refs = new StringBuilder();
        for (int i = 0; i + 1 < namesAndValues.length; i += 2) {
            int id = 10 + i / 2;
            items.append("#").append(id).append("=DESCRIPTIVE_REPRESENTATION_ITEM('")
                    .append(namesAndValues[i]).append("','").append(namesAndValues[i + 1]).append("');\n");
            refs.append(refs.length() == 0 ? "" : ",").append("#").append(id);
        }
        return """
                ISO-10303-21;
                HEADER;
                FILE_DESCRIPTION((''),'2;1');
                FILE_NAME('','',(''),(''),'','','');
                FILE_SCHEMA(('AUTOMOTIVE_DESIGN'));
                ENDSEC;
                DATA;
                #1=PRODUCT('%1$s','%1$s','',(#100));
                #2=PRODUCT_DEFINITION_FORMATION('','',#1);
                #3=PRODUCT_DEFINITION('design','',#2,#200);
                %2$s#50=REPRESENTATION('',(%3$s),#300);
                #51=PROPERTY_DEFINITION('properties','',#3);
                #52=PROPERTY_DEFINITION_REPRESENTATION(#51,#50);
                ENDSEC;
                END-ISO-10303-21;
                """.formatted(productName, items, refs);
    }

    /**
     * 只有几何、没有标注的辅助文档。
     */
    public static final String DRAWING = """
            ISO-10303-21;
            HEADER;
            FILE_DESCRIPTION((''),'2;1');
            FILE_NAME('','',(''),(''),'','','');
            FILE_SCHEMA(('AUTOMOTIVE_DESIGN'));
            ENDSEC;
            DATA;
            #1=PRODUCT('Drawing','Drawing','',(#100));
            #2=PRODUCT_DEFINITION_FORMATION('','',#1);
            #3=PRODUCT_DEFINITION('design','',#2,#200);
            #4=CARTESIAN_POINT('',(1.,1.,1.));
            ENDSEC;
            END-ISO-10303-21;
            """;

    /**
     * 写出完整的测试目录：主文档 + 两份重复标注 + 无标注文档 + 无法匹配的文档。
     */
    public static Path writeGripperDirectory(Path dir) throws IOException {
        write(dir, "Gripper.stp", GRIPPER);
        write(dir, "Base Plate-2.stp", annotated("Base Plate", "Torque", "10 Nm", "Material", "S235"));
        write(dir, "Base Plate-3.stp", annotated("Base Plate", "Torque", "10 Nm"));
        write(dir, "Drawing.stp", DRAWING);
        write(dir, "Unknown Bracket.STEP", annotated("Bracket", "Finish", "anodized"));
        write(dir, "notes.txt", "not a step document");
        return dir.resolve("Gripper.stp");
    }

    public static Path write(Path dir, String name, String content) throws IOException {
        Path file = dir.resolve(name);
        Files.writeString(file, content, StandardCharsets.UTF_8);
        return file;
    }
}
