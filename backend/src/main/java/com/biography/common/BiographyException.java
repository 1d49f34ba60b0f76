package com.biography.common;

/**
 * 传记流水线业务异常基类
 */
public class BiographyException extends RuntimeException {

    private final String code;

    public BiographyException(String message) {
        this(message, "BIOGRAPHY_ERROR");
    }

    public BiographyException(String message, String code) {
        super(message);
        this.code = code;
    }

    public BiographyException(String message, String code, Throwable cause) {
        super(message, cause);
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
