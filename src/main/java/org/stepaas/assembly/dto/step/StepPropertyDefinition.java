package org.stepaas.assembly.dto.step;

/**
 * {@code PROPERTY_DEFINITION(name, description, definition)}。
 *
 * @param definitionRef 被描述对象的引用（通常是 PRODUCT_DEFINITION）
 */
public record StepPropertyDefinition(
        int id,
        String name,
        String description,
        Integer definitionRef
) {
}
