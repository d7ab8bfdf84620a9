package org.stepaas.assembly.dto.step;

import java.util.List;

/**
 * {@code REPRESENTATION(name, (items), context)}。
 *
 * @param id         实体实例 id
 * @param name       表示名称
 * @param itemRefs   items 列表中的引用（文档顺序）
 * @param contextRef 表示上下文引用
 */
public record StepRepresentation(
        int id,
        String name,
        List<Integer> itemRefs,
        Integer contextRef
) {
}
