package com.radioss.translator.parser;

import com.radioss.translator.exception.MalformedRecordException;
import com.radioss.translator.mapping.ElementKeyword;
import com.radioss.translator.model.Element;
import com.radioss.translator.model.MaterialLaw;
import com.radioss.translator.model.MaterialRecord;
import com.radioss.translator.model.MeshModel;
import com.radioss.translator.model.Node;
import com.radioss.translator.model.Selection;
import com.radioss.translator.model.SelectionKind;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for CdbParser.
 */
class CdbParserTest {

    @Test
    void testParseDelimitedNodesAndElements() {
        String cdb = """
            NBLOCK
            1, 0.0, 0.0, 0.0
            2, 1.0, 0.0, 0.0
            3, 1.0, 1.0, 0.0
            4, 0.0, 1.0, 0.0
            -1
            EBLOCK
            10, 181, 1, 2, 3, 4
            -1
            """;

        MeshModel model = parse(cdb);

        assertThat(model.getNodeCount()).isEqualTo(4);
        assertThat(model.getNodes().get(3)).isEqualTo(new Node(3, 1.0, 1.0, 0.0));

        Element element = model.getElements().get(0);
        assertThat(element.getId()).isEqualTo(10);
        assertThat(element.getTypeCode()).isEqualTo(181);
        assertThat(element.getNodeIds()).containsExactly(1, 2, 3, 4);
        assertThat(element.getKeyword()).isEqualTo(ElementKeyword.SHELL);
    }

    @Test
    void testParseFixedColumnNodesWithOmittedCoordinates() {
        String cdb = String.join("\n",
                "NBLOCK,6,SOLID,         2,         2",
                "(3i9,6e21.13e3)",
                nodeLine(1),
                nodeLine(2, 1.5, -2.0D),
                "N,R5.3,LOC,       -1,");

        MeshModel model = parse(cdb);

        assertThat(model.getNodes().get(1)).isEqualTo(new Node(1, 0.0, 0.0, 0.0));
        assertThat(model.getNodes().get(2)).isEqualTo(new Node(2, 1.5, -2.0, 0.0));
    }

    @Test
    void testFortranExponentsAreAccepted() {
        MeshModel model = parse("""
            NBLOCK
            7, 1.0D+01, 2.5d-1, -3.0E0
            -1
            """);

        assertThat(model.getNodes().get(7)).isEqualTo(new Node(7, 10.0, 0.25, -3.0));
    }

    @Test
    void testSolidLayoutUsesElementTypeTable() {
        String cdb = String.join("\n",
                "ET,        1,185",
                "ET,        2,SHELL181",
                "EBLOCK,19,SOLID,         2,         2",
                "(19i9)",
                elementLine(3, 1, 5, 1, 2, 3, 4, 5, 6, 7, 8),
                elementLine(4, 2, 6, 1, 2, 3, 4),
                "       -1");

        MeshModel model = parse(cdb);

        assertThat(model.getElementTypes()).containsEntry(1, 185).containsEntry(2, 181);
        Element brick = model.findElement(5).orElseThrow();
        assertThat(brick.getMaterialId()).isEqualTo(3);
        assertThat(brick.getTypeCode()).isEqualTo(185);
        assertThat(brick.getKeyword()).isEqualTo(ElementKeyword.BRICK);
        assertThat(brick.getNodeIds()).containsExactly(1, 2, 3, 4, 5, 6, 7, 8);

        Element shell = model.findElement(6).orElseThrow();
        assertThat(shell.getKeyword()).isEqualTo(ElementKeyword.SHELL);
        assertThat(shell.getMaterialId()).isEqualTo(4);
    }

    @Test
    void testSolidLayoutNodesContinueOnNextLine() {
        int[] nodes = new int[20];
        for (int i = 0; i < 20; i++) {
            nodes[i] = i + 1;
        }
        String first = elementLine(1, 186, 1, Arrays.copyOf(nodes, 8));
        StringBuilder continuation = new StringBuilder();
        for (int i = 8; i < 20; i++) {
            continuation.append(String.format(Locale.ROOT, "%9d", nodes[i]));
        }
        String cdb = String.join("\n",
                "EBLOCK,19,SOLID,         1,         1",
                "(19i9)",
                // header declares 20 nodes, the first record only carries 8
                first.substring(0, 72) + String.format(Locale.ROOT, "%9d", 20) + first.substring(81),
                continuation.toString(),
                "       -1");

        Element element = parse(cdb).getElements().get(0);

        assertThat(element.getNodeCount()).isEqualTo(20);
        assertThat(element.getKeyword()).isEqualTo(ElementKeyword.BRIC20);
    }

    @Test
    void testUnknownTypeCodeFallsBackOnNodeCount() {
        MeshModel model = parse("""
            EBLOCK
            1, 9999, 1, 2, 3, 4, 5, 6, 7, 8
            2, 9999, 1, 2, 3, 4
            3, 9999, 1, 2, 3
            -1
            """);

        assertThat(model.getElements()).extracting(Element::getKeyword)
                .containsExactly(ElementKeyword.BRICK, ElementKeyword.SHELL, ElementKeyword.SH3N);
    }

    @Test
    void testSelectionRangesAndAccumulation() {
        MeshModel model = parse("""
            CMBLOCK,WHEEL,ELEM,       3  ! users element component definitions
            (8i10)
                     1        -3         7
            CMBLOCK,WHEEL,ELEM,       1
            (8i10)
                     9
            CMBLOCK,BASE,NODE,       2
            (8i10)
                     4         5
            """);

        Selection wheel = model.findSelection("WHEEL").orElseThrow();
        assertThat(wheel.getKind()).isEqualTo(SelectionKind.ELEMENT);
        assertThat(wheel.getMembers()).containsExactly(1, 2, 3, 7, 9);
        assertThat(model.getSelections(SelectionKind.NODE)).extracting(Selection::getName).containsExactly("BASE");
    }

    @Test
    void testUnsupportedSelectionEntityIsSkipped() {
        MeshModel model = parse("""
            CMBLOCK,KPS,KP,       2
            (8i10)
                     1         2
            """);

        assertThat(model.getSelections()).isEmpty();
    }

    @Test
    void testSelectionKindMismatchIsRejected() {
        String cdb = """
            CMBLOCK,SET,ELEM,       1
            (8i10)
                     1
            CMBLOCK,SET,NODE,       1
            (8i10)
                     1
            """;

        assertThatThrownBy(() -> parse(cdb))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("line 4");
    }

    @Test
    void testMaterialDataBothForms() {
        MeshModel model = parse("""
            MPDATA,R5.0, 1,EX  ,       1, 1,  210000.000    ,
            MPDATA,R5.0, 1,EX  ,       1, 2,  190000.000    ,
            MPDATA,NUXY,1,1,0.29
            """);

        MaterialRecord material = model.findMaterial(1).orElseThrow();
        // second temperature point ignored
        assertThat(material.getParameters()).containsEntry("EX", 210000.0).containsEntry("NUXY", 0.29);
        assertThat(material.getLaw()).isEqualTo(MaterialLaw.LINEAR_ELASTIC);
    }

    @Test
    void testRepeatedMaterialParameterMergePolicy() {
        String cdb = """
            MPDATA,EX,1,1,100.0
            MPDATA,EX,1,1,200.0
            """;

        assertThat(parse(cdb).findMaterial(1).orElseThrow().getParameters()).containsEntry("EX", 200.0);

        ParserOptions firstWins = ParserOptions.builder()
                .materialMergePolicy(MaterialMergePolicy.FIRST_VALUE_WINS)
                .build();
        MeshModel model = new CdbParser(cdb.lines().toList(), "test.cdb", firstWins).parse();
        assertThat(model.findMaterial(1).orElseThrow().getParameters()).containsEntry("EX", 100.0);
    }

    @Test
    void testBilinearTableBecomesJohnsonCook() {
        MeshModel model = parse("""
            TB,BISO,       2,   1,   2,
            TBTEMP,0.0
            TBDATA,,  250.0    ,  1000.0    ,,,,
            """);

        MaterialRecord material = model.findMaterial(2).orElseThrow();
        assertThat(material.getLaw()).isEqualTo(MaterialLaw.JOHNSON_COOK);
        assertThat(material.getParameters())
                .containsEntry("A", 250.0)
                .containsEntry("B", 1000.0)
                .containsEntry("N", 1.0);
    }

    @Test
    void testMultilinearTableKeepsCurve() {
        MeshModel model = parse("""
            TB,PLAS,       3,   1,   2,MISO
            TBPT,,0.0,300.0
            TBPT,,0.1,400.0
            """);

        MaterialRecord material = model.findMaterial(3).orElseThrow();
        assertThat(material.getLaw()).isEqualTo(MaterialLaw.TABULATED_PLASTIC);
        assertThat(material.getCurve()).hasSize(2);
        assertThat(material.getCurve().get(1).getY()).isEqualTo(400.0);
    }

    @Test
    void testUnknownBlocksAreSkipped() {
        MeshModel model = parse("""
            /COM,ANSYS RELEASE 2022 R2
            /PREP7
            KEYOP,1,3,2
            SECTYPE,1,SHELL
            NBLOCK
            1, 0.0, 0.0, 0.0
            -1
            /GO
            FINISH
            """);

        assertThat(model.getNodeCount()).isEqualTo(1);
        assertThat(model.getElements()).isEmpty();
    }

    @Test
    void testMalformedNodeReportsBlockAndLine() {
        String cdb = """
            NBLOCK
            1, 0.0, 0.0, 0.0
            2, abc, 0.0, 0.0
            -1
            """;

        assertThatThrownBy(() -> parse(cdb))
                .isInstanceOfSatisfying(MalformedRecordException.class, e -> {
                    assertThat(e.getBlockKind()).isEqualTo(BlockKind.NODE);
                    assertThat(e.getLineNumber()).isEqualTo(3);
                })
                .hasMessageContaining("abc");
    }

    @Test
    void testDuplicateNodeIdIsRejected() {
        String cdb = """
            NBLOCK
            1, 0.0, 0.0, 0.0
            2, 1.0, 0.0, 0.0
            1, 5.0, 5.0, 5.0
            -1
            """;

        assertThatThrownBy(() -> parse(cdb))
                .isInstanceOfSatisfying(MalformedRecordException.class, e -> {
                    assertThat(e.getBlockKind()).isEqualTo(BlockKind.NODE);
                    assertThat(e.getLineNumber()).isEqualTo(4);
                })
                .hasMessageContaining("Duplicate node id 1");
    }

    @Test
    void testDuplicateNodeIdAcrossBlocksIsRejected() {
        String cdb = """
            NBLOCK
            7, 0.0, 0.0, 0.0
            -1
            NBLOCK
            7, 1.0, 0.0, 0.0
            -1
            """;

        assertThatThrownBy(() -> parse(cdb))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("line 5");
    }

    @Test
    void testMajorPoissonRatioIsStoredAsNuxy() {
        MeshModel model = parse("""
            MPDATA,R5.0, 1,EX  ,       1, 1,  210000.000    ,
            MPDATA,R5.0, 1,PRXY,       1, 1,  0.28    ,
            MPDATA,PRXY,2,1,0.33
            """);

        assertThat(model.findMaterial(1).orElseThrow().getParameters())
                .containsEntry("NUXY", 0.28)
                .doesNotContainKey("PRXY");
        assertThat(model.findMaterial(2).orElseThrow().getParameters()).containsEntry("NUXY", 0.33);
    }

    @Test
    void testDuplicateElementIdIsRejected() {
        String cdb = """
            EBLOCK
            1, 181, 1, 2, 3, 4
            1, 181, 5, 6, 7, 8
            -1
            """;

        assertThatThrownBy(() -> parse(cdb))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("Duplicate element id 1");
    }

    @Test
    void testTruncatedSolidRecordIsRejected() {
        String cdb = String.join("\n",
                "EBLOCK,19,SOLID,         1,         1",
                "(19i9)",
                elementLine(1, 185, 1, 1, 2, 3, 4).substring(0, 72) + String.format(Locale.ROOT, "%9d%9d%9d", 8, 0, 1),
                "       -1");

        assertThatThrownBy(() -> parse(cdb))
                .isInstanceOf(MalformedRecordException.class)
                .hasMessageContaining("declares 8 nodes");
    }

    private static MeshModel parse(String text) {
        List<String> lines = text.lines().toList();
        return new CdbParser(lines, "test.cdb").parse();
    }

    private static String nodeLine(int id, double... coordinates) {
        StringBuilder sb = new StringBuilder(String.format(Locale.ROOT, "%9d%9d%9d", id, 0, 0));
        for (double c : coordinates) {
            sb.append(String.format(Locale.ROOT, "%21.13E", c));
        }
        return sb.toString();
    }

    /** Solid layout record: mat, type, real, secnum, esys, birth, ref, shape, count, unused, id, nodes. */
    private static String elementLine(int material, int type, int id, int... nodes) {
        StringBuilder sb = new StringBuilder();
        int[] attributes = {material, type, 1, 1, 0, 0, 0, 0, nodes.length, 0, id};
        for (int value : attributes) {
            sb.append(String.format(Locale.ROOT, "%9d", value));
        }
        for (int node : nodes) {
            sb.append(String.format(Locale.ROOT, "%9d", node));
        }
        return sb.toString();
    }
}
