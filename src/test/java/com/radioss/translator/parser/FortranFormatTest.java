package com.radioss.translator.parser;

import com.radioss.translator.exception.MalformedRecordException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.*;

class FortranFormatTest {

    @ParameterizedTest
    @CsvSource(delimiter = ';', value = {
            "(3i9,6e21.13e3);  3; 9; 6; 21",
            "(3i8,6e16.9);     3; 8; 6; 16",
            "(19i9);          19; 9; 0; 0",
            "(8i10);           8; 10; 0; 0",
            "(2i9);            2; 9; 0; 0"
    })
    void testParseFormatLine(String line, int intCount, int intWidth, int realCount, int realWidth) {
        FortranFormat format = FortranFormat.parse(line, BlockKind.NODE, 1);

        assertThat(format.getIntCount()).isEqualTo(intCount);
        assertThat(format.getIntWidth()).isEqualTo(intWidth);
        assertThat(format.getRealCount()).isEqualTo(realCount);
        assertThat(format.getRealWidth()).isEqualTo(realWidth);
    }

    @Test
    void testFieldsAreCutByColumn() {
        FortranFormat format = new FortranFormat(2, 5, 2, 8);
        String line = "   12   -3   1.5e2    -0.5";

        assertThat(format.intFields(line)).containsExactly("12", "-3");
        assertThat(format.realFields(line)).containsExactly("1.5e2", "-0.5");
    }

    @Test
    void testShortLineLeavesMissingRealsEmpty() {
        FortranFormat format = new FortranFormat(1, 4, 3, 6);

        assertThat(format.realFields("   1   2.0")).containsExactly("2.0", "", "");
    }

    @Test
    void testInvalidDescriptorIsMalformed() {
        assertThatThrownBy(() -> FortranFormat.parse("(3x9)", BlockKind.ELEMENT, 12))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("line 12");
    }

    @Test
    void testFormatLineDetection() {
        assertThat(FortranFormat.isFormatLine("(3i9,6e21.13e3)")).isTrue();
        assertThat(FortranFormat.isFormatLine("        1        0")).isFalse();
    }
}
