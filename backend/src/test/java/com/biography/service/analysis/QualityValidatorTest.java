package com.biography.service.analysis;

import com.biography.model.BiographyChapter;
import com.biography.model.NarrativeAtom;
import com.biography.model.QualityReport;
import com.biography.model.TimeSpan;
import com.biography.support.AtomFixtures;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QualityValidatorTest {

    private final QualityValidator validator = new QualityValidator();

    private static BiographyChapter chapter(String id, String start, String end, String text, NarrativeAtom... atoms) {
        return BiographyChapter.builder()
            .id(id)
            .title(id)
            .text(text)
            .timeSpan(TimeSpan.of(AtomFixtures.day(start), AtomFixtures.day(end)))
            .atoms(new ArrayList<>(Arrays.asList(atoms)))
            .build();
    }

    // ========== TEMPORAL TESTS ==========

    @Test
    @DisplayName("相邻章节重叠超过1天视为顺序错乱")
    void detectsOverlapBeyondOneDay() {
        List<BiographyChapter> chapters = Arrays.asList(
            chapter("a", "2025-01-01", "2025-01-31", ""),
            chapter("b", "2025-01-15", "2025-02-15", ""));

        QualityReport.TemporalCheck check = validator.checkTemporalConsistency(chapters);

        assertFalse(check.isValid());
        assertEquals(Collections.singletonList("b"), check.getOutOfOrderChapters());
        assertEquals(0.5, check.getScore(), 1e-9);
    }

    @Test
    @DisplayName("重叠1天以内仍视为有序")
    void toleratesOneDayOverlap() {
        List<BiographyChapter> chapters = Arrays.asList(
            chapter("a", "2025-01-01", "2025-01-31", ""),
            chapter("b", "2025-01-30", "2025-02-15", ""));

        assertTrue(validator.checkTemporalConsistency(chapters).isValid());
    }

    // ========== FIDELITY TESTS ==========

    @Test
    @DisplayName("正文提到年份、领域或内容片段即算忠实")
    void fidelityMatchesYearDomainOrContent() {
        NarrativeAtom a = AtomFixtures.atom("a", "2025-01-01").content("Won the regional final").build();
        NarrativeAtom b = AtomFixtures.simple("b", "2025-01-02");
        List<NarrativeAtom> sources = Arrays.asList(a, b);

        BiographyChapter faithful = chapter("good", "2025-01-01", "2025-01-02", "It all happened in 2025.", a, b);
        BiographyChapter unfaithful = chapter("bad", "2025-01-01", "2025-01-02", "Nothing to see.", a, b);
        BiographyChapter partial = chapter("half", "2025-01-01", "2025-01-02", "He WON THE REGIONAL FINAL.", a, b);

        List<QualityReport.FidelityMismatch> mismatches = new ArrayList<>();
        assertEquals(1.0, validator.verifyChapterFidelity(faithful, sources, mismatches), 1e-9);
        assertEquals(0.0, validator.verifyChapterFidelity(unfaithful, sources, mismatches), 1e-9);
        assertEquals(2, mismatches.size());
        assertEquals(0.5, validator.verifyChapterFidelity(partial, sources, mismatches), 1e-9);
    }

    @Test
    @DisplayName("空章节忠实度为1，找不到来源原子时为0.5")
    void fidelityEdgeCases() {
        List<QualityReport.FidelityMismatch> mismatches = new ArrayList<>();
        BiographyChapter empty = chapter("void", "2025-01-01", "2025-02-01", "There are no records.");
        BiographyChapter orphan = chapter("orphan", "2025-01-01", "2025-02-01", "Text",
            AtomFixtures.simple("ghost", "2025-01-01"));

        assertEquals(1.0, validator.verifyChapterFidelity(empty, Collections.<NarrativeAtom>emptyList(), mismatches), 1e-9);
        assertEquals(0.5, validator.verifyChapterFidelity(orphan, Collections.<NarrativeAtom>emptyList(), mismatches), 1e-9);
        assertEquals("No source atoms found", mismatches.get(0).getSourceAtom());
    }

    // ========== COMPLETENESS / CONFLICT TESTS ==========

    @Test
    @DisplayName("重要原子缺失会降低完整性并给出提示")
    void completenessTracksImportantAtoms() {
        NarrativeAtom included = AtomFixtures.atom("included", "2025-01-01").significance(0.8).build();
        NarrativeAtom missing = AtomFixtures.atom("missing", "2025-06-01").emotionalWeight(0.9).content("Other").build();
        NarrativeAtom minor = AtomFixtures.simple("minor", "2025-09-01");
        List<BiographyChapter> chapters = Collections.singletonList(
            chapter("c", "2025-01-01", "2025-01-01", "In 2025", included));

        QualityReport report = validator.validate(chapters, Arrays.asList(included, missing, minor));

        assertEquals(0.5, report.getCompleteness(), 1e-9);
        assertEquals(Collections.singletonList("missing"), report.getCompletenessCheck().getMissingImportantAtoms());
        assertTrue(report.getWarnings().contains("Completeness below threshold: 50% of important atoms included"));
    }

    @Test
    @DisplayName("30天内同人物同领域的不同描述视为冲突")
    void detectsConflictingMemories() {
        NarrativeAtom first = AtomFixtures.atom("first", "2025-01-01").peopleId("coach").content("We won").build();
        NarrativeAtom second = AtomFixtures.atom("second", "2025-01-06").peopleId("coach").content("We lost").build();
        List<BiographyChapter> chapters = Collections.singletonList(
            chapter("c", "2025-01-01", "2025-01-06", "In 2025", first, second));

        QualityReport.ConflictCheck check = validator.detectConflicts(chapters, Arrays.asList(first, second));

        assertEquals(1, check.getConflictsFound());
        assertEquals("c", check.getFindings().get(0).getChapterId());
        assertEquals(Arrays.asList("first", "second"), check.getFindings().get(0).getConflictingAtoms());
        assertEquals(0.0, check.getScore(), 1e-9);
    }

    @Test
    @DisplayName("相隔30天以上的不同描述不算冲突")
    void distantMemoriesAreNotConflicts() {
        NarrativeAtom first = AtomFixtures.atom("first", "2025-01-01").peopleId("coach").content("We won").build();
        NarrativeAtom second = AtomFixtures.atom("second", "2025-03-01").peopleId("coach").content("We lost").build();

        assertEquals(0, validator.detectConflicts(Collections.<BiographyChapter>emptyList(),
            Arrays.asList(first, second)).getConflictsFound());
    }

    @Test
    @DisplayName("无问题时总分为1且没有提示")
    void cleanBiographyScoresPerfectly() {
        NarrativeAtom a = AtomFixtures.simple("a", "2025-01-01");
        NarrativeAtom b = AtomFixtures.atom("b", "2025-02-01").peopleId("sister").build();
        List<BiographyChapter> chapters = Arrays.asList(
            chapter("one", "2025-01-01", "2025-01-01", "Early 2025.", a),
            chapter("two", "2025-02-01", "2025-02-01", "Later in 2025.", b));

        QualityReport report = validator.validate(chapters, Arrays.asList(a, b));

        assertEquals(1.0, report.getOverallScore(), 1e-9);
        assertTrue(report.getWarnings().isEmpty());
    }
}
