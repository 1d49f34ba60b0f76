package com.biography.service.narration;

import com.biography.model.ChapterContext;

/**
 * 章节文本生成协作方
 *
 * 同一上下文应产出等价的文本（不要求逐字一致）。
 */
public interface ChapterNarrator {

    /**
     * @throws com.biography.common.NarratorException 调用失败
     */
    String generate(ChapterContext context);
}
