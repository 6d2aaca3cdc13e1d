package com.radioss.translator.deck;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DeckValidatorTest {

    private final DeckValidator validator = new DeckValidator();

    private static final String VALID = """
        #RADIOSS STARTER
        /BEGIN
        model
              2022         0
                          Mg                  mm                   s
                          Mg                  mm                   s
        /MAT/LAW1/1
        STEEL
        #              RHO_I
                      7800.0
        #                  E                  Nu
                    210000.0                 0.3
        #include mesh.inc
        /PROP/SHELL/2
        SHELL_2
        #   Ishell    Ismstr     Ish3n
                 0         0         0
        /SUBSET/3
        wheel
                 1         2
        /PART/4
        wheel
        #  prop_ID    mat_ID subset_ID
                 2         1         3
        /END
        """;

    @Test
    void testValidDeckHasNoErrors() {
        assertThat(validator.validate(VALID)).isEmpty();
    }

    @Test
    void testUnknownKeywordIsReported() {
        String deck = VALID.replace("/SUBSET/3", "/SUBSETX/3");

        List<String> errors = validator.validate(deck);

        assertThat(errors).anyMatch(e -> e.contains("unknown keyword /SUBSETX/3"));
        assertThat(errors).anyMatch(e -> e.contains("undefined subset 3"));
    }

    @Test
    void testMissingEndIsReported() {
        assertThat(validator.validate(VALID.replace("/END\n", ""))).contains("Missing /END");
    }

    @Test
    void testContentAfterEndIsReported() {
        assertThat(validator.validate(VALID + "/PART/9\n")).anyMatch(e -> e.contains("content after /END"));
    }

    @Test
    void testDeckMustStartWithBegin() {
        String deck = VALID.replace("/BEGIN\n", "");

        assertThat(validator.validate(deck)).anyMatch(e -> e.contains("deck must start with /BEGIN"));
    }

    @Test
    void testNonNumericDataLineIsReported() {
        String deck = VALID.replace("                 0.3", "               0.3x");

        assertThat(validator.validate(deck)).anyMatch(e -> e.contains("non-numeric value '0.3x'"));
    }

    @Test
    void testPartReferencesMustResolve() {
        String deck = VALID.replace("         2         1         3", "         7         8         3");

        assertThat(validator.validate(deck)).containsExactlyInAnyOrder(
                "Line 24: /PART references undefined property 7",
                "Line 24: /PART references undefined material 8");
    }

    @Test
    void testConnectorBoxAndTimeHistoryCardsAreKnown() {
        String deck = VALID.replace("/END\n", """
            /GRNOD/NODE/5
            hub_nodes
                     2         3
            /RBODY/1
            hub
                     1         0         0         0                 0.0         5         0         0         0
                             0.0                 0.0                 0.0
                             0.0                 0.0                 0.0
            /RBE2/1
            link
                     1   111 000         0         5         0
            /BOX/RECTA/2
            edge
                     0         0         0
                            -1.0                -1.0                -1.0
                             1.0                 1.0                 1.0
            /GRNOD/BOX/6
            edge
                     2
            /TH/NODE/1
            tip
                   DEF
                     1         0
            /END
            """);

        assertThat(validator.validate(deck)).isEmpty();
    }

    @Test
    void testIncompleteConnectorCardIsReported() {
        String deck = VALID.replace("/END\n", """
            /RBODY/1
            hub
                     1         0         0         0                 0.0         5         0         0         0
            /TH/NODE/2
            tip
                   DEF
            /END
            """);

        assertThat(validator.validate(deck)).containsExactly(
                "Line 25: incomplete /RBODY/1 block",
                "Line 28: incomplete /TH/NODE/2 block");
    }

    @Test
    void testVariableNamesOutsideTimeHistoryAreNotNumeric() {
        String deck = VALID.replace("wheel\n         1         2", "wheel\n       DEF");

        assertThat(validator.validate(deck)).anyMatch(e -> e.contains("non-numeric value 'DEF'"));
    }
}
