package com.biography.service.store;

import com.biography.domain.entity.BiographyRecord;
import com.biography.model.Biography;
import com.biography.model.BiographyMetadata;
import com.biography.repository.BiographyRepository;
import com.biography.util.DateTimeUtils;
import com.biography.util.JsonColumnUtils;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 基于 MyBatis-Plus 的传记存储，传记整体以JSON保存
 */
@Service
public class MybatisBiographyStore implements BiographyStore {

    private static final Logger logger = LoggerFactory.getLogger(MybatisBiographyStore.class);

    private final BiographyRepository biographyRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public MybatisBiographyStore(BiographyRepository biographyRepository, ObjectMapper objectMapper, Clock clock) {
        this.biographyRepository = biographyRepository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public void save(String userId, Biography biography) {
        BiographyMetadata metadata = biography.getMetadata();

        BiographyRecord record = new BiographyRecord();
        record.setId(biography.getId());
        record.setUserId(userId);
        record.setTitle(biography.getTitle());
        record.setSubtitle(biography.getSubtitle());
        record.setVersion(biography.getVersion() != null ? biography.getVersion().getCode() : null);
        record.setBiographyData(JsonColumnUtils.write(objectMapper, biography));
        if (metadata != null) {
            record.setDomain(metadata.getDomain() != null ? metadata.getDomain().getCode() : null);
            record.setBaseBiographyId(metadata.getBaseBiographyId());
            record.setCoreLorebook(metadata.isCoreLorebook());
            record.setLorebookName(metadata.getLorebookName());
            record.setLorebookVersion(metadata.getLorebookVersion() != null ? metadata.getLorebookVersion() : 1);
            record.setMemorySnapshotAt(DateTimeUtils.toLocalDateTime(metadata.getMemorySnapshotAt()));
            record.setAtomSnapshotHash(metadata.getAtomSnapshotHash());
        }
        record.setCreatedTime(LocalDateTime.now(clock));

        biographyRepository.insert(record);
        logger.info("💾 传记已保存: id={}, userId={}, version={}", biography.getId(), userId, record.getVersion());
    }

    @Override
    public Optional<Biography> findById(String biographyId, String userId) {
        BiographyRecord record = biographyRepository.findByIdAndUserId(biographyId, userId);
        return Optional.ofNullable(record).map(this::toBiography);
    }

    @Override
    public void linkVersions(String baseId, String versionId) {
        int updated = biographyRepository.linkToBase(versionId, baseId);
        if (updated == 0) {
            logger.warn("⚠️ 关联版本时未找到传记: versionId={}", versionId);
        }
    }

    @Override
    public List<Biography> findByLorebookName(String lorebookName, String userId) {
        return toBiographies(biographyRepository.findByLorebookName(userId, lorebookName));
    }

    @Override
    public List<Biography> findVersionFamily(String baseBiographyId, String userId) {
        return toBiographies(biographyRepository.findVersionFamily(userId, baseBiographyId));
    }

    private List<Biography> toBiographies(List<BiographyRecord> records) {
        List<Biography> biographies = new ArrayList<>();
        if (records == null) {
            return biographies;
        }
        for (BiographyRecord record : records) {
            biographies.add(toBiography(record));
        }
        return biographies;
    }

    private Biography toBiography(BiographyRecord record) {
        Biography biography = JsonColumnUtils.read(objectMapper, record.getBiographyData(), Biography.class);
        if (biography != null && biography.getMetadata() != null && record.getBaseBiographyId() != null) {
            biography.getMetadata().setBaseBiographyId(record.getBaseBiographyId());
        }
        return biography;
    }
}
