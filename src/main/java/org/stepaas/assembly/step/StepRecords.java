package org.stepaas.assembly.step;

import org.stepaas.assembly.dto.step.StepDescriptiveItem;
import org.stepaas.assembly.dto.step.StepFormation;
import org.stepaas.assembly.dto.step.StepProduct;
import org.stepaas.assembly.dto.step.StepProductDefinition;
import org.stepaas.assembly.dto.step.StepPropertyDefinition;
import org.stepaas.assembly.dto.step.StepPropertyDefinitionRepresentation;
import org.stepaas.assembly.dto.step.StepRepresentation;
import org.stepaas.assembly.dto.step.StepUsage;

import java.util.Map;

/**
 * 单个文档抽取出的类型化记录（{@code native id -> record}，保持文档顺序）。
 * <p>
 * native id 只在同一文档内有效，不能跨文档比较。
 *
 * @param statementsScanned 成功定位的语句数
 * @param statementsDropped 因畸形而丢弃的语句数
 */
public record StepRecords(
        Map<Integer, StepProduct> products,
        Map<Integer, StepProductDefinition> productDefinitions,
        Map<Integer, StepFormation> formations,
        Map<Integer, StepUsage> usages,
        Map<Integer, StepDescriptiveItem> annotations,
        Map<Integer, StepRepresentation> representations,
        Map<Integer, StepPropertyDefinition> propertyDefinitions,
        Map<Integer, StepPropertyDefinitionRepresentation> propertyDefinitionRepresentations,
        int statementsScanned,
        int statementsDropped
) {

    public static StepRecords empty() {
        return new StepRecords(Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), Map.of(), 0, 0);
    }
}
