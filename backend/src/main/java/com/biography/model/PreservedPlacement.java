package com.biography.model;

import com.biography.enums.ChapterPosition;
import com.biography.enums.PreservedContentType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 保留内容的放置结果
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PreservedPlacement {

    private String atomId;

    private String chapterId;

    private ChapterPosition position;

    private PreservedContentType contentType;

    private String reasoning;
}
