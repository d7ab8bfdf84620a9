package org.stepaas.assembly.dto.step;

/**
 * {@code PRODUCT_DEFINITION(id, description, formation, frame_of_reference)}。
 *
 * @param id           实体实例 id
 * @param identifier   PRODUCT_DEFINITION.id
 * @param description  PRODUCT_DEFINITION.description
 * @param formationRef 指向 PRODUCT_DEFINITION_FORMATION 的引用
 * @param contextRef   指向 PRODUCT_DEFINITION_CONTEXT 的引用
 */
public record StepProductDefinition(
        int id,
        String identifier,
        String description,
        Integer formationRef,
        Integer contextRef
) {
}
