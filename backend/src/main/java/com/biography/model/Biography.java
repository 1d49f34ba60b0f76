package com.biography.model;

import com.biography.enums.BuildFlag;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * 编译完成的传记
 *
 * 每次运行产出一个新实例；新版本通过 baseBiographyId 关联，不做原地修改
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class Biography {

    private String id;

    private String title;

    private String subtitle;

    private BuildFlag version;

    @Builder.Default
    private List<BiographyChapter> chapters = new ArrayList<>();

    private BiographyMetadata metadata;
}
