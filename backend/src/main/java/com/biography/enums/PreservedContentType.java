package com.biography.enums;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 保留原文的内容类型及其放置规则
 *
 * 结构性内容（前言、献词、致谢、尾声）固定放在首章/末章；
 * 其余为情境内容，按相关性选择章节。
 */
public enum PreservedContentType {

    PREFACE("preface", true, 1, ChapterPosition.OPENING),
    DEDICATION("dedication", true, 2, ChapterPosition.OPENING),
    ACKNOWLEDGMENT("acknowledgment", true, 3, ChapterPosition.OPENING),
    EPILOGUE("epilogue", true, 1, ChapterPosition.CLOSING),
    TESTIMONY("testimony", false, 0, ChapterPosition.OPENING),
    ADVICE("advice", false, 0, ChapterPosition.CLOSING),
    MESSAGE_TO_READER("message_to_reader", false, 0, ChapterPosition.MIDDLE),
    MANIFESTO("manifesto", false, 0, ChapterPosition.OPENING),
    VOW("vow", false, 0, ChapterPosition.CLOSING),
    PROMISE("promise", false, 0, ChapterPosition.MIDDLE),
    DECLARATION("declaration", false, 0, ChapterPosition.OPENING),
    STANDARD("standard", false, 0, ChapterPosition.MIDDLE);

    private final String code;
    private final boolean structural;
    private final int priority;
    private final ChapterPosition defaultPosition;

    PreservedContentType(String code, boolean structural, int priority, ChapterPosition defaultPosition) {
        this.code = code;
        this.structural = structural;
        this.priority = priority;
        this.defaultPosition = defaultPosition;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isStructural() {
        return structural;
    }

    public int getPriority() {
        return priority;
    }

    public ChapterPosition getDefaultPosition() {
        return defaultPosition;
    }

    @JsonCreator
    public static PreservedContentType fromCode(String code) {
        for (PreservedContentType type : values()) {
            if (type.code.equalsIgnoreCase(code) || type.name().equalsIgnoreCase(code)) {
                return type;
            }
        }
        return STANDARD;
    }
}
