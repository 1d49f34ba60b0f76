package com.biography.service.store;

import com.biography.domain.entity.NarrativeAtomRecord;
import com.biography.enums.LifeDomain;
import com.biography.enums.NarrativeAtomType;
import com.biography.model.AtomMetadata;
import com.biography.model.NarrativeAtom;
import com.biography.repository.NarrativeAtomRepository;
import com.biography.util.DateTimeUtils;
import com.biography.util.JsonColumnUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * 基于 MyBatis-Plus 的原子存储
 */
@Service
public class MybatisAtomStore implements AtomStore {

    private static final Logger logger = LoggerFactory.getLogger(MybatisAtomStore.class);

    private final NarrativeAtomRepository atomRepository;
    private final ObjectMapper objectMapper;

    public MybatisAtomStore(NarrativeAtomRepository atomRepository, ObjectMapper objectMapper) {
        this.atomRepository = atomRepository;
        this.objectMapper = objectMapper;
    }

    @Override
    public List<NarrativeAtom> getAtoms(String userId) {
        List<NarrativeAtomRecord> records = atomRepository.findByUserId(userId);
        List<NarrativeAtom> atoms = new ArrayList<>(records.size());
        for (NarrativeAtomRecord record : records) {
            atoms.add(toAtom(record));
        }
        logger.debug("读取原子: userId={}, count={}", userId, atoms.size());
        return atoms;
    }

    NarrativeAtom toAtom(NarrativeAtomRecord record) {
        NarrativeAtomType type = NarrativeAtomType.fromCode(record.getAtomType());

        NarrativeAtom.NarrativeAtomBuilder builder = NarrativeAtom.builder()
            .id(record.getId())
            .type(type)
            .timestamp(DateTimeUtils.toInstant(record.getOccurredAt()))
            .emotionalWeight(valueOrZero(record.getEmotionalWeight()))
            .sensitivity(valueOrZero(record.getSensitivity()))
            .significance(valueOrZero(record.getSignificance()))
            .content(record.getContent())
            .peopleIds(JsonColumnUtils.readStringList(objectMapper, record.getPeopleIds()))
            .tags(JsonColumnUtils.readStringList(objectMapper, record.getTags()))
            .timelineIds(JsonColumnUtils.readStringList(objectMapper, record.getTimelineIds()))
            .sourceRefs(JsonColumnUtils.readStringList(objectMapper, record.getSourceRefs()));

        for (String domain : JsonColumnUtils.readStringList(objectMapper, record.getDomains())) {
            builder.domain(LifeDomain.fromCode(domain));
        }

        AtomMetadata metadata = JsonColumnUtils.read(objectMapper, record.getMetadata(), AtomMetadata.class);
        if (metadata != null && metadata.getKind() != type) {
            logger.warn("⚠️ 原子元数据类型与原子类型不一致，已忽略元数据: atomId={}, type={}, metadata={}",
                record.getId(), type, metadata.getKind());
            metadata = null;
        }
        builder.metadata(metadata);

        return builder.build();
    }

    private static double valueOrZero(Double value) {
        return value != null ? value : 0.0;
    }
}
