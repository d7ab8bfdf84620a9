package org.stepaas.assembly.dto;

import org.stepaas.assembly.dto.step.StepHeader;
import org.stepaas.assembly.model.Annotation;
import org.stepaas.assembly.model.AssemblyEdge;
import org.stepaas.assembly.step.ResolutionStats;

import java.util.List;

/**
 * 单个 STEP 文档的解析结果（不构建装配树，便于排查引用链问题）。
 *
 * @param rootId            根目录 ID
 * @param path              文档路径（相对根目录）
 * @param charset           实际使用的编码
 * @param truncated         是否截断读取
 * @param header            HEADER 信息
 * @param products          产品及其标注（文档顺序）
 * @param edges             解析成功的装配关系（native id）
 * @param stats             引用解析计数
 * @param statementsScanned 定位到的语句数
 * @param statementsDropped 丢弃的畸形语句数
 * @param warnings          提示
 */
public record DocumentResolutionResult(
        String rootId,
        String path,
        String charset,
        boolean truncated,
        StepHeader header,
        List<ProductEntry> products,
        List<AssemblyEdge> edges,
        ResolutionStats stats,
        int statementsScanned,
        int statementsDropped,
        List<String> warnings
) {

    /**
     * @param nativeId    文档内实体 id
     * @param name        组件名称
     * @param description 描述
     * @param kind        分类结果
     * @param annotations 标注
     */
    public record ProductEntry(
            int nativeId,
            String name,
            String description,
            String kind,
            List<Annotation> annotations
    ) {
    }
}
