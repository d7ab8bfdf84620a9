package org.stepaas.assembly;

import org.stepaas.assembly.model.GeometryInfo;

import java.nio.file.Path;
import java.util.Optional;

/**
 * 几何服务：只为装配树的真实根节点调用。没有结果或失败都视为“没有几何信息”，不是错误。
 */
public interface GeometryService {

    Optional<GeometryInfo> measure(Path document);
}
