package org.stepaas.assembly.dto;

import java.util.List;

/**
 * 交给打包/输出端的完整结构：单根元素树 + 引用文件列表。
 */
public record AssemblyStructure(
        ElementNode submodel,
        List<ReferencedFile> files
) {
}
