package org.stepaas.assembly.dto;

import org.stepaas.assembly.model.ParentConflict;
import org.stepaas.assembly.step.ResolutionStats;

import java.util.List;

/**
 * 一次批量构建的汇总报告。列表字段受 {@code app.assembly.max-reported-misses} 限制。
 *
 * @param primaryDocument              主文档（相对根目录的显示路径）
 * @param documentsDiscovered          目录中发现的 STEP 文档数（含主文档）
 * @param annotationDocumentsProcessed 处理过的辅助文档数
 * @param annotationDocumentsMatched   匹配到组件的辅助文档数
 * @param totalComponents              组件总数（不含虚拟根）
 * @param leafParts                    叶子组件数
 * @param componentsWithAnnotations    带标注的组件数
 * @param totalAnnotations             标注总条数
 * @param standardParts                标准件数
 * @param assemblyRelationships        生效的父子关系数
 * @param rootId                       根节点 synthetic id
 * @param rootName                     根节点名称
 * @param virtualRoot                  根节点是否为合成的虚拟根
 * @param conflicts                    被拒绝的父子关系
 * @param detached                     唯一真实根下不可达的组件
 * @param unmatchedDocuments           没有匹配到组件的辅助文档
 * @param unreadableDocuments          无法读取的辅助文档
 * @param duplicateNames               名称索引中被先登记者占位的组件名
 * @param resolutionStats              主文档引用解析计数
 * @param statementsScanned            主文档中定位到的语句数
 * @param statementsDropped            主文档中丢弃的畸形语句数
 * @param warnings                     其他提示
 */
public record AssemblyBuildReport(
        String primaryDocument,
        int documentsDiscovered,
        int annotationDocumentsProcessed,
        int annotationDocumentsMatched,
        int totalComponents,
        int leafParts,
        int componentsWithAnnotations,
        int totalAnnotations,
        int standardParts,
        int assemblyRelationships,
        String rootId,
        String rootName,
        boolean virtualRoot,
        List<ParentConflict> conflicts,
        List<String> detached,
        List<String> unmatchedDocuments,
        List<String> unreadableDocuments,
        List<String> duplicateNames,
        ResolutionStats resolutionStats,
        int statementsScanned,
        int statementsDropped,
        List<String> warnings
) {
}
