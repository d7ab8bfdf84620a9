package org.stepaas.assembly.model;

/**
 * 根节点的几何度量（由几何服务提供，任一项都可能缺失）。
 *
 * @param volume       体积（>= 0，未知为 null）
 * @param surfaceArea  表面积（>= 0，未知为 null）
 * @param centerOfMass 质心（未知为 null）
 * @param boundingBox  轴对齐包围盒（未知为 null）
 */
public record GeometryInfo(
        Double volume,
        Double surfaceArea,
        Vector3 centerOfMass,
        BoundingBox boundingBox
) {

    public record Vector3(double x, double y, double z) {
    }

    /**
     * @param min   最小角点
     * @param max   最大角点
     * @param range 各轴跨度（max - min）
     */
    public record BoundingBox(Vector3 min, Vector3 max, Vector3 range) {

        public static BoundingBox of(Vector3 min, Vector3 max) {
            return new BoundingBox(min, max, new Vector3(max.x() - min.x(), max.y() - min.y(), max.z() - min.z()));
        }
    }
}
