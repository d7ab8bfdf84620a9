package org.stepaas.assembly;

import java.nio.file.Path;

/**
 * 单个辅助文档的补充标注结果。
 *
 * @param document           文档路径
 * @param status             处理结果
 * @param matchedComponentId 匹配到的组件 synthetic id（未匹配时为 null）
 * @param candidateCount     文档内解析出的候选标注数（去重后）
 * @param added              实际新增到组件上的标注数（重复处理时为 0）
 * @param detail             补充说明（不可读原因、匹配键等）
 */
public record SupplementOutcome(
        Path document,
        Status status,
        String matchedComponentId,
        int candidateCount,
        int added,
        String detail
) {

    public enum Status {
        MATCHED,
        UNMATCHED,
        NO_ANNOTATIONS,
        UNREADABLE
    }

    static SupplementOutcome of(Path document, Status status, int candidateCount, String detail) {
        return new SupplementOutcome(document, status, null, candidateCount, 0, detail);
    }
}
