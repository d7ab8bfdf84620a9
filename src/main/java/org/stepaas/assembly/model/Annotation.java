package org.stepaas.assembly.model;

/**
 * 文本标注（name/description 对）。
 * <p>
 * 以值语义比较：两条标注 name 与 description 完全相同即视为同一条，节点上不会重复保存。
 *
 * @param name        标注名称（已去除首尾空白，不为 null）
 * @param description 标注内容（已去除首尾空白，不为 null）
 */
public record Annotation(String name, String description) {

    public Annotation {
        name = (name == null) ? "" : name.strip();
        description = (description == null) ? "" : description.strip();
    }

    public boolean isComplete() {
        return !name.isEmpty() && !description.isEmpty();
    }
}
