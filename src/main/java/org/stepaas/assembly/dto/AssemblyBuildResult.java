package org.stepaas.assembly.dto;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * {@code step_build_assembly} 的返回结果。
 *
 * @param rootId    根目录 ID
 * @param directory 输入目录（相对根目录）
 * @param report    汇总报告
 * @param hierarchy 装配层级视图
 * @param structure 输出元素树（未请求时为 null）
 * @param files     输出结构引用的文件（未请求时为 null）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AssemblyBuildResult(
        String rootId,
        String directory,
        AssemblyBuildReport report,
        AssemblyNodeView hierarchy,
        ElementNode structure,
        List<ReferencedFile> files
) {
}
