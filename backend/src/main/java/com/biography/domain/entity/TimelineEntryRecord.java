package com.biography.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 时间线条目表（传奇/篇章弧/章节共用，通过 level 区分）
 */
@Data
@TableName("timeline_entries")
public class TimelineEntryRecord {

    @TableId(type = IdType.INPUT)
    private String id;

    @TableField("user_id")
    private String userId;

    /**
     * SAGA / ARC / CHAPTER
     */
    private String level;

    @TableField("parent_id")
    private String parentId;

    private String title;

    private String description;

    private String summary;

    @TableField("start_date")
    private LocalDateTime startDate;

    @TableField("end_date")
    private LocalDateTime endDate;
}
