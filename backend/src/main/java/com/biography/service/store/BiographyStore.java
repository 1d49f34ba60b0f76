package com.biography.service.store;

import com.biography.model.Biography;

import java.util.List;
import java.util.Optional;

/**
 * 传记存储（外部协作方）
 */
public interface BiographyStore {

    void save(String userId, Biography biography);

    Optional<Biography> findById(String biographyId, String userId);

    /**
     * 建立版本关联
     */
    void linkVersions(String baseId, String versionId);

    /**
     * 指定 lorebook 的全部版本，按生成时间倒序
     */
    List<Biography> findByLorebookName(String lorebookName, String userId);

    /**
     * 基础版本及所有派生版本，按生成时间正序
     */
    List<Biography> findVersionFamily(String baseBiographyId, String userId);
}
