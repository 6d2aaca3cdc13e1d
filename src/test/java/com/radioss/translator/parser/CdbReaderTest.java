package com.radioss.translator.parser;

import com.radioss.translator.exception.DanglingReferenceException;
import com.radioss.translator.exception.MalformedRecordException;
import com.radioss.translator.model.MeshModel;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for CdbReader and the integrity checks it runs after parsing.
 */
class CdbReaderTest {

    @TempDir
    Path tempDir;

    @Test
    void testReadFromFile() throws IOException {
        Path file = tempDir.resolve("plate.cdb");
        Files.writeString(file, """
            NBLOCK
            1, 0.0, 0.0, 0.0
            2, 1.0, 0.0, 0.0
            3, 1.0, 1.0, 0.0
            -1
            EBLOCK
            1, 181, 1, 2, 3
            -1
            """);

        MeshModel model = new CdbReader().read(file);

        assertThat(model.getSourceName()).isEqualTo("plate.cdb");
        assertThat(model.getNodeCount()).isEqualTo(3);
        assertThat(model.getElementCount()).isEqualTo(1);
    }

    @Test
    void testNonAsciiSelectionNameSurvivesFileRead() throws IOException {
        Path file = tempDir.resolve("tub.cdb");
        Files.writeString(file, """
            NBLOCK
            1, 0.0, 0.0, 0.0
            2, 1.0, 0.0, 0.0
            -1
            CMBLOCK,Bañera,NODE,       2
            (8i10)
                     1         2
            """, StandardCharsets.UTF_8);

        MeshModel model = new CdbReader().read(file);

        assertThat(model.findSelection("Bañera")).hasValueSatisfying(s ->
                assertThat(s.getMembers()).containsExactly(1, 2));
    }

    @Test
    void testInvalidUtf8ReportsItsLine() throws IOException {
        Path file = tempDir.resolve("latin1.cdb");
        byte[] latin1 = "NBLOCK\n1, 0.0, 0.0, 0.0\n-1\nCMBLOCK,Bañera,NODE,       1\n(8i10)\n         1\n"
                .getBytes(StandardCharsets.ISO_8859_1);
        Files.write(file, latin1);

        assertThatThrownBy(() -> new CdbReader().read(file))
                .isInstanceOfSatisfying(MalformedRecordException.class, e -> {
                    assertThat(e.getLineNumber()).isEqualTo(4);
                    assertThat(e.getBlockKind()).isEqualTo(BlockKind.SELECTION);
                })
                .hasMessageContaining("UTF-8");
    }

    @Test
    void testLineEndingsAndByteOrderMark() {
        byte[] bytes = "\uFEFFNBLOCK\r\n1, 0.0, 0.0, 0.0\r-1".getBytes(StandardCharsets.UTF_8);

        assertThat(CdbReader.decodeLines(bytes)).containsExactly("NBLOCK", "1, 0.0, 0.0, 0.0", "-1");
    }

    @Test
    void testMissingFileIsAnIoError() {
        assertThatThrownBy(() -> new CdbReader().read(tempDir.resolve("missing.cdb")))
                .isInstanceOf(IOException.class);
    }

    @Test
    void testElementWithUnknownNodeIsDangling() {
        String cdb = """
            NBLOCK
            1, 0.0, 0.0, 0.0
            2, 1.0, 0.0, 0.0
            -1
            EBLOCK
            5, 181, 1, 2, 42
            -1
            """;

        assertThatThrownBy(() -> new CdbReader().read(cdb, "test.cdb"))
                .isInstanceOfSatisfying(DanglingReferenceException.class, e -> {
                    assertThat(e.getEntityKind()).isEqualTo("node");
                    assertThat(e.getMissingId()).isEqualTo(42L);
                });
    }

    @Test
    void testSelectionWithUnknownMemberIsDangling() {
        String cdb = """
            NBLOCK
            1, 0.0, 0.0, 0.0
            -1
            CMBLOCK,FIXED,NODE,       2
            (8i10)
                     1         9
            """;

        assertThatThrownBy(() -> new CdbReader().read(cdb, "test.cdb"))
                .isInstanceOf(DanglingReferenceException.class)
                .hasMessageContaining("FIXED");
    }
}
