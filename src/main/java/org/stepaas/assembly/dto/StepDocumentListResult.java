package org.stepaas.assembly.dto;

import java.util.List;

/**
 * 目录中发现的 STEP 文档。
 *
 * @param rootId    根目录 ID
 * @param directory 目录（相对根目录）
 * @param documents 文档（相对根目录，发现顺序）
 */
public record StepDocumentListResult(
        String rootId,
        String directory,
        List<StepDocumentEntry> documents
) {

    /**
     * @param path      相对根目录的路径
     * @param sizeBytes 文件大小（读取失败为 null）
     */
    public record StepDocumentEntry(String path, Long sizeBytes) {
    }
}
