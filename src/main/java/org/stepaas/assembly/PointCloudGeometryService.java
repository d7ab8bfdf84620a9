package org.stepaas.assembly;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.stepaas.assembly.model.GeometryInfo;
import org.stepaas.assembly.model.GeometryInfo.BoundingBox;
import org.stepaas.assembly.model.GeometryInfo.Vector3;
import org.stepaas.assembly.step.StepEntity;
import org.stepaas.assembly.step.StepStatementScanner;
import org.stepaas.assembly.step.StepValue;
import org.stepaas.assembly.step.StepValue.StepList;
import org.stepaas.assembly.step.StepValue.StepNumber;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

/**
 * 默认几何服务：仅基于 {@code CARTESIAN_POINT} 粗略统计包围盒（尽力而为）。
 * <p>
 * 不做 B-Rep 求值，因此体积、表面积、质心未知（null）。包围盒只用于判断模型量级/坐标范围，
 * 并非严格的几何包围盒（控制点、定位点也会被计入）。
 */
public class PointCloudGeometryService implements GeometryService {

    private static final Logger log = LoggerFactory.getLogger(PointCloudGeometryService.class);

    private final StepDocumentReader reader;

    public PointCloudGeometryService(StepDocumentReader reader) {
        this.reader = reader;
    }

    @Override
    public Optional<GeometryInfo> measure(Path document) {
        String text;
        try {
            text = reader.read(document).text();
        } catch (IOException e) {
            log.warn("几何信息读取失败：{}（{}）", document, e.getMessage());
            return Optional.empty();
        }
        BoundingBoxAccumulator bbox = new BoundingBoxAccumulator();
        StepStatementScanner.scan(text, "CARTESIAN_POINT"::equals, entity -> addPoint(entity, bbox));
        BoundingBox box = bbox.toBoundingBox();
        return (box == null) ? Optional.empty() : Optional.of(new GeometryInfo(null, null, null, box));
    }

    // CARTESIAN_POINT('',(x,y,z))，二维点的 z 按 0 处理
    private static void addPoint(StepEntity entity, BoundingBoxAccumulator bbox) {
        if (entity.fields().size() < 2 || !(entity.fields().get(1) instanceof StepList list)) {
            return;
        }
        List<StepValue> items = list.items();
        if (items.size() < 2) {
            return;
        }
        Double x = number(items.get(0));
        Double y = number(items.get(1));
        Double z = (items.size() >= 3) ? number(items.get(2)) : Double.valueOf(0.0);
        if (x == null || y == null || z == null) {
            return;
        }
        bbox.add(x, y, z);
    }

    private static Double number(StepValue value) {
        if (value instanceof StepNumber n && n.value() != null && Double.isFinite(n.value())) {
            return n.value();
        }
        return null;
    }

    private static final class BoundingBoxAccumulator {
        boolean initialized = false;
        double minX;
        double minY;
        double minZ;
        double maxX;
        double maxY;
        double maxZ;

        void add(double x, double y, double z) {
            if (!initialized) {
                initialized = true;
                minX = maxX = x;
                minY = maxY = y;
                minZ = maxZ = z;
            } else {
                minX = Math.min(minX, x);
                minY = Math.min(minY, y);
                minZ = Math.min(minZ, z);
                maxX = Math.max(maxX, x);
                maxY = Math.max(maxY, y);
                maxZ = Math.max(maxZ, z);
            }
        }

        BoundingBox toBoundingBox() {
            if (!initialized) {
                return null;
            }
            return BoundingBox.of(new Vector3(minX, minY, minZ), new Vector3(maxX, maxY, maxZ));
        }
    }
}
