package com.biography.common;

/**
 * 过滤后没有任何原子：流水线快速失败，不产出部分传记
 */
public class InsufficientDataException extends BiographyException {

    public static final String CODE = "NO_MATCHING_ATOMS";

    public InsufficientDataException(String message) {
        super(message, CODE);
    }
}
