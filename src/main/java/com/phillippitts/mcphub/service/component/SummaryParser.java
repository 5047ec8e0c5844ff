package com.phillippitts.mcphub.service.component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Parses the markdown layout the summarize prompt asks for:
 * <pre>
 * ## Summary
 * free text
 * ## Action Items
 * - item
 * ## Participants
 * - name
 * </pre>
 * Headings are matched case-insensitively; text before any heading counts as summary.
 */
final class SummaryParser {

    record MeetingSummary(String summary, List<String> actionItems, List<String> participants) { }

    private enum Section { SUMMARY, ACTIONS, PARTICIPANTS, OTHER }

    private SummaryParser() {
    }

    static MeetingSummary parse(String markdown) {
        StringBuilder summary = new StringBuilder();
        List<String> actions = new ArrayList<>();
        List<String> participants = new ArrayList<>();
        Section section = Section.SUMMARY;

        for (String raw : markdown == null ? new String[0] : markdown.split("\\R")) {
            String line = raw.strip();
            if (line.startsWith("#")) {
                section = sectionOf(line.replaceFirst("^#+", "").strip());
                continue;
            }
            if (line.isEmpty()) {
                continue;
            }
            switch (section) {
                case SUMMARY -> {
                    if (!summary.isEmpty()) {
                        summary.append('\n');
                    }
                    summary.append(line);
                }
                case ACTIONS -> addItem(actions, line);
                case PARTICIPANTS -> addItem(participants, line);
                case OTHER -> { }
            }
        }
        return new MeetingSummary(summary.toString(), List.copyOf(actions), List.copyOf(participants));
    }

    private static Section sectionOf(String heading) {
        String h = heading.toLowerCase(Locale.ROOT);
        if (h.startsWith("summary") || h.startsWith("meeting summary")) {
            return Section.SUMMARY;
        }
        if (h.startsWith("action")) {
            return Section.ACTIONS;
        }
        if (h.startsWith("participant") || h.startsWith("attendee")) {
            return Section.PARTICIPANTS;
        }
        return Section.OTHER;
    }

    private static void addItem(List<String> items, String line) {
        String item = line.replaceFirst("^([-*+]|\\d+[.)])\\s*", "").strip();
        // Placeholder rows such as "- none" or "- [item]" are not items.
        if (item.isEmpty() || item.equalsIgnoreCase("none") || item.equalsIgnoreCase("n/a")
                || (item.startsWith("[") && item.endsWith("]"))) {
            return;
        }
        items.add(item);
    }
}
