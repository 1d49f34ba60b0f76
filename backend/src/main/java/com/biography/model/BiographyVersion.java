package com.biography.model;

import com.biography.enums.BuildFlag;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * 版本历史条目
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class BiographyVersion {

    private String id;

    private BuildFlag version;

    private String title;

    private Instant generatedAt;

    private Instant memorySnapshotAt;

    private String atomSnapshotHash;
}
