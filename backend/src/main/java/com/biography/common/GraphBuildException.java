package com.biography.common;

/**
 * 叙事图构建失败（原子存储读取异常等）
 */
public class GraphBuildException extends BiographyException {

    public static final String CODE = "GRAPH_BUILD_FAILED";

    public GraphBuildException(String message, Throwable cause) {
        super(message, CODE, cause);
    }
}
