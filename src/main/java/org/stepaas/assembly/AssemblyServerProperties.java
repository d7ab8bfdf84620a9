package org.stepaas.assembly;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;
import org.springframework.validation.annotation.Validated;

import java.util.List;

/**
 * 装配构建 MCP Server 的业务配置（{@code app.assembly.*}）。
 * <p>
 * 重点：
 * <ul>
 *   <li>通过 {@link #roots} 指定允许读取的输入目录白名单，STEP 文档只能从这些目录中读取。</li>
 *   <li>通过 {@link #maxDocumentBytes} 限制单个文档读入内存的大小。</li>
 *   <li>{@link #annotationFallback} 是低精度的文本兜底匹配，默认关闭。</li>
 * </ul>
 */
@Validated
@ConfigurationProperties(prefix = "app.assembly")
public class AssemblyServerProperties {

    /**
     * 允许读取的根目录白名单（root0、root1...）。
     */
    @NotNull
    private List<String> roots = List.of(".");

    /**
     * 是否允许访问符号链接（symlink）。默认 false，防止路径逃逸。
     */
    private boolean allowSymlink = false;

    /**
     * 单个 STEP 文档读入的最大字节数（超过则截断并给出警告）。
     */
    @NotNull
    private DataSize maxDocumentBytes = DataSize.ofMegabytes(64);

    /**
     * 引用链之外是否按文本包含关系把标注挂到产品上（工具调用可单独覆盖）。
     */
    private boolean annotationFallback = false;

    /**
     * 是否为真实根节点提取几何信息（虚拟根永远不提取）。
     */
    private boolean extractRootGeometry = true;

    /**
     * 无法确定唯一根节点时合成的虚拟根名称。
     */
    @NotBlank
    private String virtualRootName = "Assembly_Root";

    /**
     * 报告中冲突/未匹配等列表的最大条数（上限保护）。
     */
    @Min(1)
    @Max(100_000)
    private int maxReportedMisses = 200;

    public List<String> getRoots() {
        return roots;
    }

    public void setRoots(List<String> roots) {
        this.roots = roots;
    }

    public boolean isAllowSymlink() {
        return allowSymlink;
    }

    public void setAllowSymlink(boolean allowSymlink) {
        this.allowSymlink = allowSymlink;
    }

    public DataSize getMaxDocumentBytes() {
        return maxDocumentBytes;
    }

    public void setMaxDocumentBytes(DataSize maxDocumentBytes) {
        this.maxDocumentBytes = maxDocumentBytes;
    }

    public boolean isAnnotationFallback() {
        return annotationFallback;
    }

    public void setAnnotationFallback(boolean annotationFallback) {
        this.annotationFallback = annotationFallback;
    }

    public boolean isExtractRootGeometry() {
        return extractRootGeometry;
    }

    public void setExtractRootGeometry(boolean extractRootGeometry) {
        this.extractRootGeometry = extractRootGeometry;
    }

    public String getVirtualRootName() {
        return virtualRootName;
    }

    public void setVirtualRootName(String virtualRootName) {
        this.virtualRootName = virtualRootName;
    }

    public int getMaxReportedMisses() {
        return maxReportedMisses;
    }

    public void setMaxReportedMisses(int maxReportedMisses) {
        this.maxReportedMisses = maxReportedMisses;
    }
}
