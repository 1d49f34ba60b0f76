package com.biography.service.filter;

import com.biography.enums.BiographyAudience;
import com.biography.enums.BuildFlag;
import com.biography.enums.NarrativeAtomType;
import com.biography.model.NarrativeAtom;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * 版本过滤（构建标志）
 *
 * 严格程度 SAFE > MAIN > PRIVATE = EXPLICIT，同一原子集合上保留数量单调不减。
 */
@Component
public class VersionFilter {

    private static final Logger logger = LoggerFactory.getLogger(VersionFilter.class);

    static final double SAFE_SENSITIVITY_LIMIT = 0.7;
    static final double SAFE_EMOTION_LIMIT = 0.85;
    static final double MAIN_SENSITIVITY_LIMIT = 0.9;

    public List<NarrativeAtom> apply(List<NarrativeAtom> atoms, BuildFlag flag, BiographyAudience audience) {
        BuildFlag effective = flag != null ? flag : BuildFlag.MAIN;

        List<NarrativeAtom> result;
        switch (effective) {
            case PRIVATE:
            case EXPLICIT:
                result = new ArrayList<>(atoms);
                break;
            case SAFE:
                result = new ArrayList<>();
                for (NarrativeAtom atom : atoms) {
                    if (atom.getSensitivity() > SAFE_SENSITIVITY_LIMIT) {
                        continue;
                    }
                    if (atom.getEmotionalWeight() > SAFE_EMOTION_LIMIT) {
                        continue;
                    }
                    if (atom.getType() == NarrativeAtomType.CONFLICT && audience == BiographyAudience.PUBLIC) {
                        continue;
                    }
                    result.add(atom);
                }
                break;
            case MAIN:
            default:
                result = new ArrayList<>();
                for (NarrativeAtom atom : atoms) {
                    if (atom.getSensitivity() <= MAIN_SENSITIVITY_LIMIT) {
                        result.add(atom);
                    }
                }
                break;
        }

        if (result.size() < atoms.size()) {
            logger.info("🔒 版本过滤: flag={}, 移除{}个原子", effective.getCode(), atoms.size() - result.size());
        }
        return result;
    }

    /**
     * 构建标志对应的过滤器名称
     */
    public List<String> describeFilters(BuildFlag flag) {
        BuildFlag effective = flag != null ? flag : BuildFlag.MAIN;
        switch (effective) {
            case SAFE:
                return Arrays.asList("sensitivity-filter", "high-emotion-filter", "conflict-filter");
            case MAIN:
                return Collections.singletonList("extreme-sensitivity-filter");
            case PRIVATE:
            case EXPLICIT:
            default:
                return Collections.emptyList();
        }
    }
}
