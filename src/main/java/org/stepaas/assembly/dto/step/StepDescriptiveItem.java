package org.stepaas.assembly.dto.step;

/**
 * {@code DESCRIPTIVE_REPRESENTATION_ITEM(name, description)}：自由文本标注。
 */
public record StepDescriptiveItem(
        int id,
        String name,
        String description
) {
}
