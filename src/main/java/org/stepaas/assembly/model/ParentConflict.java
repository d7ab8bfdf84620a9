package org.stepaas.assembly.model;

/**
 * 被拒绝的装配关系记录（不抛异常，只记录）。
 *
 * @param usageId          被拒绝的装配关系实体 id
 * @param childId          子节点 synthetic id
 * @param keptParentId     已生效的父节点 synthetic id（CYCLE 时为 null）
 * @param rejectedParentId 被拒绝的父节点 synthetic id
 * @param reason           拒绝原因
 */
public record ParentConflict(
        int usageId,
        String childId,
        String keptParentId,
        String rejectedParentId,
        Reason reason
) {

    public enum Reason {
        /**
         * 子节点已有另一个父节点（按文档顺序先到先得）。
         */
        CONFLICTING_PARENT,
        /**
         * 该关系会形成环（子节点是父节点本身或其祖先）。
         */
        CYCLE
    }
}
