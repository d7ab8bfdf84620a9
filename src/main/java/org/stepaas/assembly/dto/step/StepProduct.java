package org.stepaas.assembly.dto.step;

/**
 * {@code PRODUCT(id, name, description, frame_of_reference)}。
 *
 * @param id          实体实例 id
 * @param identifier  PRODUCT.id（常用作料号/零件编号）
 * @param name        PRODUCT.name
 * @param description PRODUCT.description
 */
public record StepProduct(
        int id,
        String identifier,
        String name,
        String description
) {

    /**
     * 组件显示名：优先 PRODUCT.name，为空时退回 PRODUCT.id。
     */
    public String displayName() {
        if (name != null && !name.isBlank()) {
            return name.strip();
        }
        return identifier == null ? "" : identifier.strip();
    }
}
