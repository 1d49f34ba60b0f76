package com.biography.service.cluster;

import com.biography.enums.ChapterPosition;
import com.biography.enums.LifeDomain;
import com.biography.enums.NarrativeAtomType;
import com.biography.enums.PreservedContentType;
import com.biography.model.AtomMetadata;
import com.biography.model.ChapterCluster;
import com.biography.model.NarrativeAtom;
import com.biography.model.PreservedPlacement;
import com.biography.model.TimeSpan;
import com.biography.support.AtomFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PreservedContentPlacerTest {

    private final PreservedContentPlacer placer = new PreservedContentPlacer();

    private final ChapterCluster january = ChapterCluster.builder()
        .id("jan")
        .atoms(Collections.singletonList(AtomFixtures.atom("sparring", "2025-01-10").peopleId("coach").build()))
        .dominantThemes(Collections.singletonList("fighting"))
        .timeSpan(TimeSpan.of(AtomFixtures.day("2025-01-01"), AtomFixtures.day("2025-01-31")))
        .significance(0.5)
        .build();

    private final ChapterCluster gap = ChapterCluster.builder()
        .id("void-chapter-void-0-1")
        .timeSpan(TimeSpan.of(AtomFixtures.day("2025-01-31"), AtomFixtures.day("2025-03-01")))
        .voidChapter(true)
        .build();

    private final ChapterCluster march = ChapterCluster.builder()
        .id("mar")
        .dominantThemes(Collections.singletonList("robotics"))
        .timeSpan(TimeSpan.of(AtomFixtures.day("2025-03-01"), AtomFixtures.day("2025-03-31")))
        .significance(0.5)
        .build();

    private static NarrativeAtom preserved(String id, String date, PreservedContentType type, LifeDomain domain) {
        return AtomFixtures.atom(id, date)
            .type(NarrativeAtomType.REFLECTION)
            .clearDomains()
            .domain(domain)
            .metadata(new AtomMetadata.Reflection(type))
            .build();
    }

    private static PreservedPlacement find(List<PreservedPlacement> placements, String atomId) {
        for (PreservedPlacement placement : placements) {
            if (placement.getAtomId().equals(atomId)) {
                return placement;
            }
        }
        return null;
    }

    // ========== STRUCTURAL TESTS ==========

    @Test
    @DisplayName("前言、献词、致谢按顺序放在首个普通章节开头，尾声放在末章结尾")
    void structuralContentGoesToBookEnds() {
        List<NarrativeAtom> atoms = Arrays.asList(
            preserved("thanks", "2025-02-01", PreservedContentType.ACKNOWLEDGMENT, LifeDomain.PERSONAL),
            preserved("epilogue", "2025-01-01", PreservedContentType.EPILOGUE, LifeDomain.PERSONAL),
            preserved("dedication", "2025-02-01", PreservedContentType.DEDICATION, LifeDomain.PERSONAL),
            preserved("preface", "2025-02-01", PreservedContentType.PREFACE, LifeDomain.PERSONAL));

        List<PreservedPlacement> placements = placer.place(atoms, Arrays.asList(gap, january, march));

        assertEquals(4, placements.size());
        assertEquals("preface", placements.get(0).getAtomId());
        assertEquals("dedication", placements.get(1).getAtomId());
        assertEquals("thanks", placements.get(2).getAtomId());
        for (int i = 0; i < 3; i++) {
            assertEquals("jan", placements.get(i).getChapterId());
            assertEquals(ChapterPosition.OPENING, placements.get(i).getPosition());
        }
        PreservedPlacement epilogue = placements.get(3);
        assertEquals("mar", epilogue.getChapterId());
        assertEquals(ChapterPosition.CLOSING, epilogue.getPosition());
        assertEquals(PreservedContentType.EPILOGUE, epilogue.getContentType());
    }

    @Test
    @DisplayName("只有空白章节时不放置")
    void nothingPlacedWithoutRegularChapters() {
        List<NarrativeAtom> atoms = Collections.singletonList(
            preserved("preface", "2025-02-01", PreservedContentType.PREFACE, LifeDomain.PERSONAL));

        assertTrue(placer.place(atoms, Collections.singletonList(gap)).isEmpty());
        assertTrue(placer.place(new ArrayList<NarrativeAtom>(), Arrays.asList(january, march)).isEmpty());
    }

    // ========== CONTEXTUAL TESTS ==========

    @Test
    @DisplayName("情境内容放到相关性最高的章节")
    void contextualContentGoesToBestChapter() {
        NarrativeAtom vow = preserved("vow", "2025-03-15", PreservedContentType.VOW, LifeDomain.ROBOTICS);

        List<PreservedPlacement> placements = placer.place(Collections.singletonList(vow), Arrays.asList(january, march));

        PreservedPlacement placement = find(placements, "vow");
        assertNotNull(placement);
        assertEquals("mar", placement.getChapterId());
        assertEquals(ChapterPosition.CLOSING, placement.getPosition());
    }

    @Test
    @DisplayName("相关性得分：时间0.4 + 主题0.3 + 人物0.2")
    void scoresTimeThemeAndPeople() {
        NarrativeAtom testimony = AtomFixtures.atom("testimony", "2025-01-20")
            .clearDomains()
            .domain(LifeDomain.FIGHTING)
            .peopleId("coach")
            .metadata(new AtomMetadata.Reflection(PreservedContentType.TESTIMONY))
            .build();

        assertEquals(0.9, placer.scoreChapter(testimony, january), 1e-9);
        assertEquals(0.0, placer.scoreChapter(testimony, march), 1e-9);
    }

    @Test
    @DisplayName("得分不高于0.3的内容不放置")
    void weakMatchesAreSkipped() {
        NarrativeAtom themeOnly = preserved("advice", "2024-06-01", PreservedContentType.ADVICE, LifeDomain.FIGHTING);
        NarrativeAtom unrelated = preserved("message", "2030-01-01", PreservedContentType.MESSAGE_TO_READER, LifeDomain.ROMANCE);

        assertEquals(0.3, placer.scoreChapter(themeOnly, january), 1e-9);
        assertTrue(placer.place(Arrays.asList(themeOnly, unrelated), Arrays.asList(january, march)).isEmpty());
    }

    @Test
    @DisplayName("默认在中间的内容靠近章节开头或结尾时随之移动")
    void middleContentFollowsChapterEdges() {
        NarrativeAtom early = preserved("early", "2025-03-02", PreservedContentType.PROMISE, LifeDomain.ROBOTICS);
        NarrativeAtom middle = preserved("middle", "2025-03-16", PreservedContentType.PROMISE, LifeDomain.ROBOTICS);
        NarrativeAtom late = preserved("late", "2025-03-30", PreservedContentType.PROMISE, LifeDomain.ROBOTICS);

        assertEquals(ChapterPosition.OPENING, placer.determinePosition(early, march));
        assertEquals(ChapterPosition.MIDDLE, placer.determinePosition(middle, march));
        assertEquals(ChapterPosition.CLOSING, placer.determinePosition(late, march));
    }
}
