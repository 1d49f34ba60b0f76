package com.biography.service.narration;

import com.biography.enums.BiographyAudience;
import com.biography.enums.BiographyDepth;
import com.biography.enums.BiographyTone;
import com.biography.model.ChapterContext;
import com.biography.model.NarrativeAtom;
import com.biography.util.DateTimeUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 章节提示词组装（标题 / 正文）
 */
@Component
public class ChapterPromptBuilder {

    static final int TITLE_MAX_TOKENS = 20;
    private static final int KEY_EVENT_COUNT = 3;
    private static final int KEY_EVENT_LENGTH = 50;

    public List<Map<String, String>> buildMessages(ChapterContext context) {
        List<Map<String, String>> messages = new ArrayList<>();
        if (context.getPurpose() == ChapterContext.Purpose.TITLE) {
            messages.add(message("system", titleSystemPrompt(context)));
            messages.add(message("user", titleUserPrompt(context)));
        } else {
            messages.add(message("system", narrativeSystemPrompt(context)));
            messages.add(message("user", narrativeUserPrompt(context)));
        }
        return messages;
    }

    public int maxTokens(ChapterContext context) {
        if (context.getPurpose() == ChapterContext.Purpose.TITLE) {
            return TITLE_MAX_TOKENS;
        }
        BiographyDepth depth = context.getDepth() != null ? context.getDepth() : BiographyDepth.DETAILED;
        return depth.getMaxTokens();
    }

    private String titleSystemPrompt(ChapterContext context) {
        return "Generate a concise, evocative chapter title (3-8 words) based on themes and events.\n"
            + "Tone: " + tone(context).getCode() + ".\n"
            + "Examples: \"Forged in Backyard Fights\", \"Learning to Build Instead of Break\", "
            + "\"When Discipline Became Identity\"";
    }

    private String titleUserPrompt(ChapterContext context) {
        List<String> keyEvents = new ArrayList<>();
        for (NarrativeAtom atom : context.getAtoms()) {
            if (keyEvents.size() >= KEY_EVENT_COUNT) {
                break;
            }
            keyEvents.add(StringUtils.left(StringUtils.defaultString(atom.getContent()), KEY_EVENT_LENGTH));
        }
        return "Themes: " + String.join(", ", context.getThemes()) + "\n"
            + "Key events: " + String.join("; ", keyEvents) + "\n"
            + "Generate a chapter title:";
    }

    private String narrativeSystemPrompt(ChapterContext context) {
        BiographyDepth depth = context.getDepth() != null ? context.getDepth() : BiographyDepth.DETAILED;
        BiographyAudience audience = context.getAudience() != null ? context.getAudience() : BiographyAudience.SELF;
        String introspection = context.isIncludeIntrospection()
            ? "Include introspection and inner thoughts."
            : "Focus on external events and actions.";

        return "You are writing a " + depth.getCode() + " biography chapter in " + tone(context).getCode()
            + " tone for " + audience.getCode() + " audience.\n"
            + tone(context).getInstructions() + "\n"
            + audience.getInstructions() + "\n"
            + introspection + "\n"
            + "Write in first person. Create cohesive narrative prose that flows naturally.";
    }

    private String narrativeUserPrompt(ChapterContext context) {
        List<NarrativeAtom> atoms = new ArrayList<>(context.getAtoms());
        atoms.sort(Comparator.comparing(NarrativeAtom::getTimestamp));

        StringBuilder events = new StringBuilder();
        for (NarrativeAtom atom : atoms) {
            events.append('[').append(DateTimeUtils.formatDate(atom.getTimestamp())).append("] ")
                .append(StringUtils.defaultString(atom.getContent())).append('\n');
        }
        return "Chapter Title: " + StringUtils.defaultString(context.getTitle()) + "\n\n"
            + "Events:\n" + events + "\n"
            + "Write the chapter narrative:";
    }

    private static BiographyTone tone(ChapterContext context) {
        return context.getTone() != null ? context.getTone() : BiographyTone.NEUTRAL;
    }

    private static Map<String, String> message(String role, String content) {
        Map<String, String> message = new HashMap<>();
        message.put("role", role);
        message.put("content", content);
        return message;
    }
}
