package org.stepaas.assembly.dto;

import java.util.List;

/**
 * 装配层级视图（只读，不含 parent 引用，便于序列化）。
 *
 * @param id              synthetic id
 * @param name            组件名称
 * @param kind            ASSEMBLY / PART / STANDARD_PART
 * @param level           深度（根为 0）
 * @param annotationCount 标注条数
 * @param children        子节点
 */
public record AssemblyNodeView(
        String id,
        String name,
        String kind,
        int level,
        int annotationCount,
        List<AssemblyNodeView> children
) {
}
