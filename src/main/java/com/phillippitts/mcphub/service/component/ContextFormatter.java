package com.phillippitts.mcphub.service.component;

import com.phillippitts.mcphub.domain.SearchHit;

import java.util.List;

final class ContextFormatter {

    static final int MAX_CHUNK_CHARS = 1200;

    private ContextFormatter() {
    }

    /** Renders hits as numbered excerpts, or a placeholder when there are none. */
    static String format(List<?> hits) {
        if (hits == null || hits.isEmpty()) {
            return "(no related documents found)";
        }
        StringBuilder sb = new StringBuilder();
        int i = 1;
        for (Object o : hits) {
            if (o instanceof SearchHit hit) {
                String text = hit.text().length() > MAX_CHUNK_CHARS
                        ? hit.text().substring(0, MAX_CHUNK_CHARS) + "..." : hit.text();
                sb.append('[').append(i++).append("] ").append(hit.source()).append('\n').append(text).append("\n\n");
            } else {
                sb.append('[').append(i++).append("] ").append(o).append("\n\n");
            }
        }
        return sb.toString().strip();
    }
}
