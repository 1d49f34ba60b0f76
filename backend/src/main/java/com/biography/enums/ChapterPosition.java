package com.biography.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * 保留内容在章节中的位置
 */
public enum ChapterPosition {

    OPENING("opening"),
    MIDDLE("middle"),
    CLOSING("closing"),
    STANDALONE("standalone");

    private final String code;

    ChapterPosition(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }
}
