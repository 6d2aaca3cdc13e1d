package com.radioss.translator.deck;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.*;

class DeckPreviewTest {

    private static final String DECK = """
        /BEGIN
        model
        /MAT/LAW1/1
        STEEL
        #              RHO_I
                      7800.0
        #include mesh.inc
        /PART/4
        wheel
        /PART/5
        hub
        /END
        """;

    @Test
    void testExtractStopsAtInclude() {
        assertThat(DeckPreview.extract(DECK, "/MAT/")).contains(
                "/MAT/LAW1/1\nSTEEL\n#              RHO_I\n              7800.0");
    }

    @Test
    void testExtractAllReturnsEveryCard() {
        assertThat(DeckPreview.extractAll(DECK, "/PART/")).containsExactly("/PART/4\nwheel", "/PART/5\nhub");
    }

    @Test
    void testMissingCardIsEmpty() {
        assertThat(DeckPreview.extract(DECK, "/INTER/")).isEmpty();
    }
}
