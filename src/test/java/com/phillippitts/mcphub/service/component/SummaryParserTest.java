package com.phillippitts.mcphub.service.component;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SummaryParserTest {

    @Test
    void parsesAllThreeSections() {
        String md = """
                ## Summary
                The team agreed to ship on Friday.
                QA signs off Thursday.

                ## Action Items
                - Alice: update the release notes
                * Bob: tag the build
                1. Carol: notify support

                ## Participants
                - Alice
                - Bob
                """;

        SummaryParser.MeetingSummary parsed = SummaryParser.parse(md);

        assertThat(parsed.summary()).isEqualTo("The team agreed to ship on Friday.\nQA signs off Thursday.");
        assertThat(parsed.actionItems()).containsExactly(
                "Alice: update the release notes", "Bob: tag the build", "Carol: notify support");
        assertThat(parsed.participants()).containsExactly("Alice", "Bob");
    }

    @Test
    void placeholderRowsAreNotItems() {
        String md = """
                ## Summary
                Nothing decided.
                ## Action Items
                - none
                - N/A
                - [one action item per line]
                ## Participants
                -
                """;

        SummaryParser.MeetingSummary parsed = SummaryParser.parse(md);

        assertThat(parsed.actionItems()).isEmpty();
        assertThat(parsed.participants()).isEmpty();
    }

    @Test
    void headingsMatchCaseInsensitivelyAndUnknownSectionsAreIgnored() {
        String md = """
                # MEETING SUMMARY
                Short sync.
                ### action items
                - Dana follows up
                ## Risks
                - schedule slip
                ## Attendees
                - Dana
                """;

        SummaryParser.MeetingSummary parsed = SummaryParser.parse(md);

        assertThat(parsed.summary()).isEqualTo("Short sync.");
        assertThat(parsed.actionItems()).containsExactly("Dana follows up");
        assertThat(parsed.participants()).containsExactly("Dana");
    }

    @Test
    void textWithoutHeadingsIsSummary() {
        SummaryParser.MeetingSummary parsed = SummaryParser.parse("Just a plain answer.");

        assertThat(parsed.summary()).isEqualTo("Just a plain answer.");
        assertThat(parsed.actionItems()).isEmpty();
    }

    @Test
    void nullInputGivesEmptySummary() {
        SummaryParser.MeetingSummary parsed = SummaryParser.parse(null);

        assertThat(parsed.summary()).isEmpty();
        assertThat(parsed.actionItems()).isEmpty();
        assertThat(parsed.participants()).isEmpty();
    }
}
