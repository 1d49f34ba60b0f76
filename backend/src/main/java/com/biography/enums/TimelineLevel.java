package com.biography.enums;

/**
 * 时间线层级：传奇 -> 篇章弧 -> 章节
 */
public enum TimelineLevel {
    SAGA,
    ARC,
    CHAPTER
}
