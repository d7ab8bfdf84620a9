package org.stepaas.assembly.dto.step;

/**
 * 装配使用关系：{@code NEXT_ASSEMBLY_USAGE_OCCURRENCE} / {@code ASSEMBLY_COMPONENT_USAGE}
 * {@code (id, name, description, relating_product_definition, related_product_definition, reference_designator)}。
 *
 * @param id                    实体实例 id
 * @param type                  实体类型名（大写）
 * @param name                  关系名称
 * @param relatingDefinitionRef 父级 PRODUCT_DEFINITION 引用
 * @param relatedDefinitionRef  子级 PRODUCT_DEFINITION 引用
 * @param referenceDesignator   引用标号（若存在）
 */
public record StepUsage(
        int id,
        String type,
        String name,
        Integer relatingDefinitionRef,
        Integer relatedDefinitionRef,
        String referenceDesignator
) {
}
