package com.biography.model;

import com.biography.enums.BiographyAudience;
import com.biography.enums.BiographyDepth;
import com.biography.enums.BiographyTone;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 章节叙述上下文：交给文本生成协作方的全部输入
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChapterContext {

    public enum Purpose {
        TITLE,
        NARRATIVE
    }

    private Purpose purpose;

    private String userId;

    private String chapterId;

    /**
     * 章节序号（从1开始）
     */
    private int chapterNumber;

    private String title;

    @Builder.Default
    private List<NarrativeAtom> atoms = new ArrayList<>();

    @Builder.Default
    private List<String> themes = new ArrayList<>();

    private TimeSpan timeSpan;

    private BiographyTone tone;

    private BiographyAudience audience;

    private BiographyDepth depth;

    private boolean includeIntrospection;
}
