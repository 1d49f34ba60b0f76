package com.biography.service.narration;

import com.biography.model.ChapterContext;
import com.biography.model.NarrativeAtom;
import com.biography.util.DateTimeUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * 模板兜底：不依赖外部服务的确定性文本
 *
 * 正文为按日期排列的原子摘要段落，加一句主题收尾；标题为 "Chapter N"。
 */
@Component
public class TemplateNarrator {

    public String narrate(ChapterContext context) {
        if (context.getPurpose() == ChapterContext.Purpose.TITLE) {
            return "Chapter " + context.getChapterNumber();
        }

        List<NarrativeAtom> atoms = new ArrayList<>(context.getAtoms());
        atoms.sort(Comparator.comparing(NarrativeAtom::getTimestamp));

        List<String> paragraphs = new ArrayList<>();
        for (NarrativeAtom atom : atoms) {
            paragraphs.add("[" + DateTimeUtils.formatDate(atom.getTimestamp()) + "] "
                + StringUtils.defaultString(atom.getContent()).trim());
        }

        if (!context.getThemes().isEmpty()) {
            paragraphs.add("This chapter centers on " + String.join(", ", context.getThemes()) + ".");
        } else {
            paragraphs.add("This chapter gathers " + atoms.size() + " moments from this period.");
        }

        return String.join("\n\n", paragraphs);
    }
}
