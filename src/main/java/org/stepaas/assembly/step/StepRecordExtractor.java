package org.stepaas.assembly.step;

import org.stepaas.assembly.dto.step.StepDescriptiveItem;
import org.stepaas.assembly.dto.step.StepFormation;
import org.stepaas.assembly.dto.step.StepProduct;
import org.stepaas.assembly.dto.step.StepProductDefinition;
import org.stepaas.assembly.dto.step.StepPropertyDefinition;
import org.stepaas.assembly.dto.step.StepPropertyDefinitionRepresentation;
import org.stepaas.assembly.dto.step.StepRepresentation;
import org.stepaas.assembly.dto.step.StepUsage;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * 记录抽取器：把 STEP 原始文本转换为按种类分组的类型化记录（尽力而为）。
 * <p>
 * 处理方式：
 * <ul>
 *   <li>先对每个种类做一次大小写无关的子串检查，文本中不存在的种类直接返回空表</li>
 *   <li>剩余种类只做一次语句扫描，按类型名分派到各自的表</li>
 *   <li>畸形语句丢弃并计数；参数个数不足的记录缺失字段按 null 处理</li>
 * </ul>
 */
public final class StepRecordExtractor {

    public StepRecords extract(String text) {
        return extract(text, EnumSet.allOf(StepKind.class));
    }

    public StepRecords extract(String text, Set<StepKind> kinds) {
        if (text == null || text.isBlank() || kinds == null || kinds.isEmpty()) {
            return StepRecords.empty();
        }

        Set<String> wantedTypes = new HashSet<>();
        for (StepKind kind : kinds) {
            if (kind.mayOccurIn(text)) {
                wantedTypes.addAll(kind.typeNames());
            }
        }
        if (wantedTypes.isEmpty()) {
            return StepRecords.empty();
        }

        Map<Integer, StepProduct> products = new LinkedHashMap<>();
        Map<Integer, StepProductDefinition> definitions = new LinkedHashMap<>();
        Map<Integer, StepFormation> formations = new LinkedHashMap<>();
        Map<Integer, StepUsage> usages = new LinkedHashMap<>();
        Map<Integer, StepDescriptiveItem> annotations = new LinkedHashMap<>();
        Map<Integer, StepRepresentation> representations = new LinkedHashMap<>();
        Map<Integer, StepPropertyDefinition> propertyDefinitions = new LinkedHashMap<>();
        Map<Integer, StepPropertyDefinitionRepresentation> pdrs = new LinkedHashMap<>();

        StepStatementScanner.ScanStats stats = StepStatementScanner.scan(text, wantedTypes::contains, e -> {
            StepKind kind = StepKind.ofType(e.type());
            if (kind == null) {
                return;
            }
            switch (kind) {
                // PRODUCT(id, name, description, (frame_of_reference))
                case PRODUCT -> products.put(e.id(), new StepProduct(e.id(), e.string(0), e.string(1), e.string(2)));
                // PRODUCT_DEFINITION(id, description, formation, frame_of_reference)
                case PRODUCT_DEFINITION -> definitions.put(e.id(),
                        new StepProductDefinition(e.id(), e.string(0), e.string(1), e.ref(2), e.ref(3)));
                case FORMATION -> formations.put(e.id(), new StepFormation(e.id(), e.string(0), e.string(1), e.ref(2)));
                // NAUO(id, name, description, relating, related, reference_designator)
                case USAGE -> usages.put(e.id(),
                        new StepUsage(e.id(), e.type(), e.string(1), e.ref(3), e.ref(4), e.string(5)));
                case ANNOTATION -> annotations.put(e.id(), new StepDescriptiveItem(e.id(), e.string(0), e.string(1)));
                case REPRESENTATION -> representations.put(e.id(),
                        new StepRepresentation(e.id(), e.string(0), e.refs(1), e.ref(2)));
                case PROPERTY_DEFINITION -> propertyDefinitions.put(e.id(),
                        new StepPropertyDefinition(e.id(), e.string(0), e.string(1), e.ref(2)));
                case PROPERTY_DEFINITION_REPRESENTATION -> pdrs.put(e.id(),
                        new StepPropertyDefinitionRepresentation(e.id(), e.ref(0), e.ref(1)));
            }
        });

        return new StepRecords(
                Collections.unmodifiableMap(products),
                Collections.unmodifiableMap(definitions),
                Collections.unmodifiableMap(formations),
                Collections.unmodifiableMap(usages),
                Collections.unmodifiableMap(annotations),
                Collections.unmodifiableMap(representations),
                Collections.unmodifiableMap(propertyDefinitions),
                Collections.unmodifiableMap(pdrs),
                stats.scanned(),
                stats.dropped()
        );
    }
}
