package com.biography.service.store;

import com.biography.domain.entity.TimelineEntryRecord;
import com.biography.enums.TimelineLevel;
import com.biography.model.BiographySpec;
import com.biography.model.TimelineChapter;
import com.biography.model.TimelineHierarchy;
import com.biography.repository.TimelineEntryRepository;
import com.biography.util.DateTimeUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 基于 MyBatis-Plus 的时间线存储：把扁平条目组装成 sagas -> arcs -> chapters
 */
@Service
public class MybatisTimelineStore implements TimelineStore {

    private static final Logger logger = LoggerFactory.getLogger(MybatisTimelineStore.class);

    private final TimelineEntryRepository timelineEntryRepository;

    public MybatisTimelineStore(TimelineEntryRepository timelineEntryRepository) {
        this.timelineEntryRepository = timelineEntryRepository;
    }

    @Override
    public TimelineHierarchy getHierarchy(String userId, BiographySpec spec) {
        List<TimelineEntryRecord> entries = timelineEntryRepository.findByUserId(userId);
        if (entries == null || entries.isEmpty()) {
            logger.info("📌 用户暂无时间线层级数据: userId={}", userId);
            return TimelineHierarchy.empty();
        }

        Map<String, TimelineHierarchy.Saga> sagas = new LinkedHashMap<>();
        Map<String, TimelineHierarchy.Arc> arcs = new LinkedHashMap<>();

        for (TimelineEntryRecord entry : entries) {
            if (TimelineLevel.SAGA.name().equalsIgnoreCase(entry.getLevel())) {
                sagas.put(entry.getId(), TimelineHierarchy.Saga.builder()
                    .id(entry.getId())
                    .title(entry.getTitle())
                    .description(entry.getDescription())
                    .startDate(DateTimeUtils.toInstant(entry.getStartDate()))
                    .endDate(DateTimeUtils.toInstant(entry.getEndDate()))
                    .build());
            }
        }
        for (TimelineEntryRecord entry : entries) {
            if (TimelineLevel.ARC.name().equalsIgnoreCase(entry.getLevel())) {
                TimelineHierarchy.Arc arc = TimelineHierarchy.Arc.builder()
                    .id(entry.getId())
                    .title(entry.getTitle())
                    .description(entry.getDescription())
                    .startDate(DateTimeUtils.toInstant(entry.getStartDate()))
                    .endDate(DateTimeUtils.toInstant(entry.getEndDate()))
                    .build();
                arcs.put(arc.getId(), arc);
                TimelineHierarchy.Saga saga = sagas.get(entry.getParentId());
                if (saga != null) {
                    saga.getArcs().add(arc);
                } else {
                    logger.warn("⚠️ 篇章弧缺少所属传奇，已跳过: arcId={}, parentId={}", entry.getId(), entry.getParentId());
                }
            }
        }
        for (TimelineEntryRecord entry : entries) {
            if (TimelineLevel.CHAPTER.name().equalsIgnoreCase(entry.getLevel())) {
                TimelineHierarchy.Arc arc = arcs.get(entry.getParentId());
                if (arc == null) {
                    logger.warn("⚠️ 时间线章节缺少所属篇章弧，已跳过: chapterId={}", entry.getId());
                    continue;
                }
                arc.getChapters().add(TimelineChapter.builder()
                    .id(entry.getId())
                    .title(entry.getTitle())
                    .description(entry.getDescription())
                    .summary(entry.getSummary())
                    .startDate(DateTimeUtils.toInstant(entry.getStartDate()))
                    .endDate(DateTimeUtils.toInstant(entry.getEndDate()))
                    .parentId(entry.getParentId())
                    .build());
            }
        }

        TimelineHierarchy hierarchy = TimelineHierarchy.builder()
            .sagas(new ArrayList<>(sagas.values()))
            .build();
        logger.info("✅ 时间线层级加载完成: sagas={}, chapters={}", sagas.size(), hierarchy.getAllChapters().size());
        return hierarchy;
    }
}
