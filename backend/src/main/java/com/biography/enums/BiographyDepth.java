package com.biography.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 传记深度
 *
 * 决定原子数量上限、单章容量、生成token上限以及篇幅估算参数
 */
public enum BiographyDepth {

    SUMMARY("summary", 20, 10, 500, 12, 250),
    DETAILED("detailed", 50, 25, 1000, 6, 500),
    EPIC("epic", 100, 50, 2000, 4, 800);

    private final String code;
    private final int atomCeiling;
    private final int chapterCapacity;
    private final int maxTokens;
    private final int atomsPerPage;
    private final int wordsPerPage;

    BiographyDepth(String code, int atomCeiling, int chapterCapacity, int maxTokens,
                   int atomsPerPage, int wordsPerPage) {
        this.code = code;
        this.atomCeiling = atomCeiling;
        this.chapterCapacity = chapterCapacity;
        this.maxTokens = maxTokens;
        this.atomsPerPage = atomsPerPage;
        this.wordsPerPage = wordsPerPage;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    /**
     * 过滤后保留的原子数上限
     */
    public int getAtomCeiling() {
        return atomCeiling;
    }

    /**
     * 每章最多原子数
     */
    public int getChapterCapacity() {
        return chapterCapacity;
    }

    public int getMaxTokens() {
        return maxTokens;
    }

    public int getAtomsPerPage() {
        return atomsPerPage;
    }

    public int getWordsPerPage() {
        return wordsPerPage;
    }

    @JsonCreator
    public static BiographyDepth fromCode(String code) {
        for (BiographyDepth depth : values()) {
            if (depth.code.equalsIgnoreCase(code) || depth.name().equalsIgnoreCase(code)) {
                return depth;
            }
        }
        throw new IllegalArgumentException("未知的传记深度: " + code);
    }
}
