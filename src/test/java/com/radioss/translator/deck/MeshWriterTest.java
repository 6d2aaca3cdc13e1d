package com.radioss.translator.deck;

import com.radioss.translator.mapping.ElementKeyword;
import com.radioss.translator.model.Element;
import com.radioss.translator.model.MeshModel;
import com.radioss.translator.model.Node;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class MeshWriterTest {

    private final MeshWriter writer = new MeshWriter();

    @Test
    void testNodesAreWrittenInAscendingOrder() {
        MeshModel model = new MeshModel("test.cdb");
        model.addNode(new Node(3, 0.0, 1.0, 0.0));
        model.addNode(new Node(1, 0.0, 0.0, 0.0));
        model.addNode(new Node(2, 1.0, 0.0, -0.5));

        String[] lines = writer.write(model).split("\n");

        assertThat(lines[0]).isEqualTo("/NODE");
        assertThat(lines[1]).isEqualTo("         1                 0.0                 0.0                 0.0");
        assertThat(lines[2]).isEqualTo("         2                 1.0                 0.0                -0.5");
        assertThat(lines[3]).startsWith("         3");
    }

    @Test
    void testElementsAreGroupedByKeywordInFirstSeenOrder() {
        MeshModel model = new MeshModel("test.cdb");
        for (int i = 1; i <= 8; i++) {
            model.addNode(new Node(i, i, 0.0, 0.0));
        }
        model.addElement(element(10, ElementKeyword.SHELL, 1, 2, 3, 4));
        model.addElement(element(20, ElementKeyword.BRICK, 1, 2, 3, 4, 5, 6, 7, 8));
        model.addElement(element(11, ElementKeyword.SHELL, 5, 6, 7, 8));

        String mesh = writer.write(model);
        List<String> lines = mesh.lines().toList();

        int shell = lines.indexOf("/SHELL");
        int brick = lines.indexOf("/BRICK");
        assertThat(shell).isPositive().isLessThan(brick);
        assertThat(lines.get(shell + 1)).isEqualTo("        10         1         2         3         4");
        assertThat(lines.get(shell + 2)).isEqualTo("        11         5         6         7         8");
        assertThat(lines.get(brick + 1)).startsWith("        20         1");
        assertThat(lines).filteredOn(l -> l.equals("/SHELL")).hasSize(1);
    }

    @Test
    void testConnectivityOrderIsKept() {
        MeshModel model = new MeshModel("test.cdb");
        model.addElement(element(1, ElementKeyword.SH3N, 9, 3, 7));

        assertThat(writer.write(model)).contains("/SH3N\n         1         9         3         7\n");
    }

    private static Element element(int id, ElementKeyword keyword, Integer... nodes) {
        return Element.builder()
                .id(id)
                .typeCode(0)
                .nodeIds(List.of(nodes))
                .keyword(keyword)
                .build();
    }
}
