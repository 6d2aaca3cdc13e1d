package com.radioss.translator.deck;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.radioss.translator.mapping.ElementKeyword;
import com.radioss.translator.model.Element;
import com.radioss.translator.model.MeshModel;
import com.radioss.translator.model.Node;

/**
 * Writes the node and element blocks of the mesh include file.
 *
 * Nodes come out in ascending identifier order. Elements are grouped by keyword,
 * blocks ordered by the first appearance of each keyword in the input, and
 * each element keeps its connectivity order.
 */
public class MeshWriter {
    private static final Logger log = LoggerFactory.getLogger(MeshWriter.class);

    public String write(MeshModel model) {
        StringBuilder out = new StringBuilder();

        out.append("/NODE\n");
        for (Node node : model.getNodeList()) {
            out.append(CardFormat.intColumn(node.getId()))
                    .append(CardFormat.realColumn(node.getX()))
                    .append(CardFormat.realColumn(node.getY()))
                    .append(CardFormat.realColumn(node.getZ()))
                    .append('\n');
        }

        Map<ElementKeyword, List<Element>> blocks = groupByKeyword(model.getElements());
        for (Map.Entry<ElementKeyword, List<Element>> block : blocks.entrySet()) {
            out.append(block.getKey().header()).append('\n');
            for (Element element : block.getValue()) {
                out.append(CardFormat.intColumn(element.getId()));
                for (int nodeId : element.getNodeIds()) {
                    out.append(CardFormat.intColumn(nodeId));
                }
                out.append('\n');
            }
            log.debug("{}: {} elements", block.getKey().header(), block.getValue().size());
        }
        return out.toString();
    }

    static Map<ElementKeyword, List<Element>> groupByKeyword(List<Element> elements) {
        Map<ElementKeyword, List<Element>> blocks = new LinkedHashMap<>();
        for (Element element : elements) {
            blocks.computeIfAbsent(element.getKeyword(), k -> new ArrayList<>()).add(element);
        }
        return blocks;
    }
}
