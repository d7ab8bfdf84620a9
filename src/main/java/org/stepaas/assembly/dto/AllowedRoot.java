package org.stepaas.assembly.dto;

/**
 * 允许读取的输入根目录。
 *
 * @param rootId 根目录 ID（root0、root1...）
 * @param path   根目录绝对路径
 */
public record AllowedRoot(
        String rootId,
        String path
) {
}
