package com.phillippitts.mcphub.service.component;

import com.phillippitts.mcphub.domain.SearchHit;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ContextFormatterTest {

    @Test
    void emptyHitsGivePlaceholder() {
        assertThat(ContextFormatter.format(List.of())).isEqualTo("(no related documents found)");
        assertThat(ContextFormatter.format(null)).isEqualTo("(no related documents found)");
    }

    @Test
    void numbersHitsAndTruncatesLongChunks() {
        String longText = "x".repeat(ContextFormatter.MAX_CHUNK_CHARS + 50);
        String out = ContextFormatter.format(List.of(
                new SearchHit("a.md", "first", 0.9),
                new SearchHit("b.md", longText, 0.5)));

        assertThat(out).startsWith("[1] a.md\nfirst\n\n[2] b.md\n");
        assertThat(out).endsWith("x...");
        assertThat(out).hasSize("[1] a.md\nfirst\n\n[2] b.md\n".length() + ContextFormatter.MAX_CHUNK_CHARS + 3);
    }
}
