package com.biography.common;

public class BiographyNotFoundException extends BiographyException {

    public static final String CODE = "BIOGRAPHY_NOT_FOUND";

    public BiographyNotFoundException(String biographyId) {
        super("未找到传记: " + biographyId, CODE);
    }
}
