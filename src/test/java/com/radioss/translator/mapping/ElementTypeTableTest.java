package com.radioss.translator.mapping;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ElementTypeTableTest {

    private final ElementTypeTable table = ElementTypeTable.standard();

    @ParameterizedTest
    @CsvSource({
            "181, 4, SHELL",
            "181, 3, SHELL",
            "185, 8, BRICK",
            "186, 20, BRIC20",
            "187, 10, TETRA10",
            "285, 4, TETRA4",
            "188, 2, BEAM",
            "180, 2, TRUSS",
            "14, 2, SPRING"
    })
    void testTableLookupWinsOverNodeCount(int typeCode, int nodeCount, ElementKeyword expected) {
        assertThat(table.resolve(typeCode, nodeCount)).isEqualTo(expected);
    }

    @ParameterizedTest
    @CsvSource({
            "3, SH3N",
            "4, SHELL",
            "8, BRICK",
            "10, TETRA10",
            "20, BRIC20",
            "2, TETRA4",
            "6, TETRA4"
    })
    void testUnknownCodeFallsBackOnNodeCount(int nodeCount, ElementKeyword expected) {
        assertThat(table.resolve(99999, nodeCount)).isEqualTo(expected);
        assertThat(table.isKnown(99999)).isFalse();
    }

    @Test
    void testResolveIsPure() {
        ElementKeyword first = table.resolve(4242, 8);
        for (int i = 0; i < 10; i++) {
            assertThat(table.resolve(4242, 8)).isEqualTo(first);
        }
    }

    @Test
    void testLookupWithoutFallback() {
        assertThat(table.lookup(185)).contains(ElementKeyword.BRICK);
        assertThat(table.lookup(1)).isEmpty();
    }

    @Test
    void testCustomFallbackPolicy() {
        ElementTypeTable custom = ElementTypeTable.withFallback(
                new NodeCountFallback(Map.of(2, ElementKeyword.BEAM), ElementKeyword.SHELL));

        assertThat(custom.resolve(99999, 2)).isEqualTo(ElementKeyword.BEAM);
        assertThat(custom.resolve(99999, 8)).isEqualTo(ElementKeyword.SHELL);
        assertThat(custom.resolve(185, 2)).isEqualTo(ElementKeyword.BRICK);
    }

    @Test
    void testKeywordFamilies() {
        assertThat(ElementKeyword.SH3N.getFamily()).isEqualTo(PropertyFamily.SHELL);
        assertThat(ElementKeyword.TETRA10.getFamily()).isEqualTo(PropertyFamily.SOLID);
        assertThat(ElementKeyword.BRIC20.header()).isEqualTo("/BRIC20");
    }
}
