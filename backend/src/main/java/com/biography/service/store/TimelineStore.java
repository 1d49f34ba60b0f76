package com.biography.service.store;

import com.biography.model.BiographySpec;
import com.biography.model.TimelineHierarchy;

/**
 * 时间线层级存储（外部协作方）
 *
 * 没有层级数据是合法状态，此时返回空层级
 */
public interface TimelineStore {

    TimelineHierarchy getHierarchy(String userId, BiographySpec spec);
}
