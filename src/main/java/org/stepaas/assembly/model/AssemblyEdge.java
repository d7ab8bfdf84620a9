package org.stepaas.assembly.model;

/**
 * 已解析到 PRODUCT 的装配关系（父 PRODUCT -> 子 PRODUCT）。
 *
 * @param usageId             装配关系实体 id（例如 NAUO 的实例 id）
 * @param parentProductId     父级 PRODUCT 实体 id
 * @param childProductId      子级 PRODUCT 实体 id
 * @param referenceDesignator 引用标号（若存在）
 */
public record AssemblyEdge(
        int usageId,
        int parentProductId,
        int childProductId,
        String referenceDesignator
) {
}
