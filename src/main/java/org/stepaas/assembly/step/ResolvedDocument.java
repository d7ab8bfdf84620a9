package org.stepaas.assembly.step;

import org.stepaas.assembly.dto.step.StepProduct;
import org.stepaas.assembly.model.Annotation;
import org.stepaas.assembly.model.AssemblyEdge;

import java.util.List;
import java.util.Map;

/**
 * 单个文档的解析结果。
 *
 * @param products           文档中的产品（native id -> 产品，文档顺序）
 * @param productAnnotations 产品 native id -> 标注（无重复 (name, description) 对）
 * @param edges              两端都解析成功的装配关系（文档顺序）
 * @param stats              解析计数
 */
public record ResolvedDocument(
        Map<Integer, StepProduct> products,
        Map<Integer, List<Annotation>> productAnnotations,
        List<AssemblyEdge> edges,
        ResolutionStats stats
) {

    public List<Annotation> annotationsOf(int productId) {
        return productAnnotations.getOrDefault(productId, List.of());
    }

    /**
     * 按产品顺序展开全部标注（跨产品可能出现重复对，由调用方去重）。
     */
    public List<Annotation> allAnnotations() {
        return productAnnotations.values().stream().flatMap(List::stream).toList();
    }
}
