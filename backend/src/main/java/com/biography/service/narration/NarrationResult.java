package com.biography.service.narration;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * 一次叙述的结果
 */
@Data
@AllArgsConstructor
public class NarrationResult {

    private String text;

    /**
     * 是否来自模板兜底
     */
    private boolean templateGenerated;

    public static NarrationResult generated(String text) {
        return new NarrationResult(text, false);
    }

    public static NarrationResult template(String text) {
        return new NarrationResult(text, true);
    }
}
