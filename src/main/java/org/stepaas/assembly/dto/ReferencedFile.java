package org.stepaas.assembly.dto;

/**
 * 输出结构引用的文件。
 *
 * @param sourcePath  本地文件绝对路径
 * @param logicalPath 包内逻辑路径（例如 {@code /aasx/stp/annotations/Annotation_Bolt.stp}）
 * @param mimeType    MIME 类型
 */
public record ReferencedFile(
        String sourcePath,
        String logicalPath,
        String mimeType
) {
}
