package org.stepaas.assembly.dto.step;

/**
 * {@code PRODUCT_DEFINITION_FORMATION[_WITH_SPECIFIED_SOURCE](id, description, of_product[, source])}。
 *
 * @param id          实体实例 id
 * @param identifier  版本标识
 * @param description 描述
 * @param productRef  指向 PRODUCT 的引用
 */
public record StepFormation(
        int id,
        String identifier,
        String description,
        Integer productRef
) {
}
