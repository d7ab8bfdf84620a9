package org.stepaas.assembly;

/**
 * 结构性失败：缺少主文档或主文档中没有任何产品，无法构建装配树。
 */
public class AssemblyBuildException extends RuntimeException {

    public AssemblyBuildException(String message) {
        super(message);
    }

    public AssemblyBuildException(String message, Throwable cause) {
        super(message, cause);
    }
}
