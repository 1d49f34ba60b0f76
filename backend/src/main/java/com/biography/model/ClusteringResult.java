package com.biography.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 聚类结果：有序章节 + 被丢弃的原子
 *
 * 单原子且重要性不高于0.7的簇会被丢弃，时间线章节超出容量的原子会被裁剪，
 * 二者都记录在 excludedAtomIds 中。
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ClusteringResult {

    private List<ChapterCluster> chapters = new ArrayList<>();

    private List<String> excludedAtomIds = new ArrayList<>();
}
