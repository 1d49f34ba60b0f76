package com.biography.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 叙事原子表
 *
 * 列表类字段以JSON文本存储
 */
@Data
@TableName("narrative_atoms")
public class NarrativeAtomRecord {

    @TableId(type = IdType.INPUT)
    private String id;

    @TableField("user_id")
    private String userId;

    @TableField("atom_type")
    private String atomType;

    /**
     * 发生时间（UTC）
     */
    @TableField("occurred_at")
    private LocalDateTime occurredAt;

    private String domains; // JSON格式

    @TableField("emotional_weight")
    private Double emotionalWeight;

    private Double sensitivity;

    private Double significance;

    @TableField("people_ids")
    private String peopleIds; // JSON格式

    private String tags; // JSON格式

    private String content;

    @TableField("timeline_ids")
    private String timelineIds; // JSON格式

    @TableField("source_refs")
    private String sourceRefs; // JSON格式

    private String metadata; // JSON格式

    @TableField("created_time")
    private LocalDateTime createdTime;
}
