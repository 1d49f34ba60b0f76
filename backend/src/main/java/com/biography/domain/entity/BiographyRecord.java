package com.biography.domain.entity;

import com.baomidou.mybatisplus.annotation.IdType;
import com.baomidou.mybatisplus.annotation.TableField;
import com.baomidou.mybatisplus.annotation.TableId;
import com.baomidou.mybatisplus.annotation.TableName;
import com.fasterxml.jackson.annotation.JsonFormat;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 传记表
 */
@Data
@TableName("biographies")
public class BiographyRecord {

    @TableId(type = IdType.INPUT)
    private String id;

    @TableField("user_id")
    private String userId;

    private String title;

    private String subtitle;

    private String domain;

    /**
     * 构建标志
     */
    private String version;

    @TableField("biography_data")
    private String biographyData; // JSON格式

    @TableField("base_biography_id")
    private String baseBiographyId;

    @TableField("is_core_lorebook")
    private Boolean coreLorebook;

    @TableField("lorebook_name")
    private String lorebookName;

    @TableField("lorebook_version")
    private Integer lorebookVersion;

    @TableField("memory_snapshot_at")
    private LocalDateTime memorySnapshotAt;

    @TableField("atom_snapshot_hash")
    private String atomSnapshotHash;

    @TableField("created_time")
    @JsonFormat(pattern = "yyyy-MM-dd HH:mm:ss")
    private LocalDateTime createdTime;
}
