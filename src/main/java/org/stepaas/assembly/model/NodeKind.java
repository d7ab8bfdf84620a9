package org.stepaas.assembly.model;

/**
 * 组件节点类型。
 * <ul>
 *   <li>{@link #ASSEMBLY}：在任一装配关系中作为父节点出现（结构证据优先）</li>
 *   <li>{@link #STANDARD_PART}：命中标准件关键字或厂商/型号模式</li>
 *   <li>{@link #PART}：其余普通零件</li>
 * </ul>
 */
public enum NodeKind {
    ASSEMBLY,
    PART,
    STANDARD_PART
}
