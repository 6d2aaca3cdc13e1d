package com.radioss.translator.deck;

import com.radioss.translator.deck.config.ControlSettings;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class ControlCardRendererTest {

    private final ControlCardRenderer renderer = new ControlCardRenderer();

    @Test
    void testDefaultControlCards() {
        String cards = renderer.renderControlCards(ControlSettings.defaults(), "crash");
        List<String> lines = cards.lines().toList();

        assertThat(lines.get(0)).isEqualTo("/RUN/crash/1");
        assertThat(lines.get(2)).isEqualTo(CardFormat.reals(0.01));
        assertThat(lines).contains("/STOP", "/ANIM/DT");
        assertThat(cards).doesNotContain("/TFILE", "/PRINT", "/RFILE", "/H3D", "/ADYREL", "/DT/NODA");
        assertThat(lines).noneMatch(String::isBlank);
    }

    @Test
    void testOptionalCardsAreWrittenWhenSet() {
        ControlSettings settings = ControlSettings.builder()
                .endTime(0.05)
                .historyDt(1.0E-5)
                .dtScale(0.9)
                .dtMin(1.0E-7)
                .printFrequency(1000)
                .restartFrequency(5000)
                .h3dDt(0.001)
                .adyrelStart(0.0)
                .adyrelStop(0.02)
                .stopCard(false)
                .build();

        String cards = renderer.renderControlCards(settings, "run");

        assertThat(cards)
                .contains("/TFILE/0\n")
                .contains("/DT/NODA/CST/0\n")
                .contains("/PRINT/1000/1\n")
                .contains("/RFILE/5000\n")
                .contains("/H3D/DT\n")
                .contains("/ADYREL\n")
                .contains(CardFormat.reals(0.9, 1.0E-7))
                .doesNotContain("/STOP");
    }

    @Test
    void testEngineFileStartsWithMarkerAndRunCard() {
        String engine = renderer.renderEngine(ControlSettings.defaults(), "model");

        assertThat(engine).startsWith("#RADIOSS ENGINE\n/RUN/model/1\n");
        assertThat(engine).contains("/ANIM/DT");
    }
}
