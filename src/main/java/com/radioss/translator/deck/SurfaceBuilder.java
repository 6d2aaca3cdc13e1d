package com.radioss.translator.deck;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.radioss.translator.model.Element;

/**
 * Turns an element group into contact segments.
 * Shells contribute themselves; solids contribute the faces that no other element of the group shares.
 * Line elements have no surface and are skipped.
 */
public class SurfaceBuilder {

    private static final int[][] HEXA_FACES = {
            {0, 3, 2, 1}, {4, 5, 6, 7}, {0, 1, 5, 4}, {1, 2, 6, 5}, {2, 3, 7, 6}, {3, 0, 4, 7}
    };
    private static final int[][] TETRA_FACES = {
            {0, 2, 1}, {0, 1, 3}, {1, 2, 3}, {0, 3, 2}
    };

    public List<List<Integer>> segments(List<Element> elements) {
        List<List<Integer>> segments = new ArrayList<>();
        Map<String, List<Integer>> faces = new LinkedHashMap<>();
        Map<String, Integer> faceUse = new LinkedHashMap<>();

        for (Element element : elements) {
            List<Integer> nodes = element.getNodeIds();
            switch (element.getKeyword()) {
                case SHELL -> {
                    if (nodes.size() >= 4) {
                        segments.add(List.of(nodes.get(0), nodes.get(1), nodes.get(2), nodes.get(3)));
                    }
                }
                case SH3N -> {
                    if (nodes.size() >= 3) {
                        segments.add(List.of(nodes.get(0), nodes.get(1), nodes.get(2), nodes.get(2)));
                    }
                }
                case BRICK, BRIC20 -> {
                    if (nodes.size() >= 8) {
                        collectFaces(nodes, HEXA_FACES, faces, faceUse);
                    }
                }
                case TETRA4, TETRA10 -> {
                    if (nodes.size() >= 4) {
                        collectFaces(nodes, TETRA_FACES, faces, faceUse);
                    }
                }
                default -> {
                    // no surface
                }
            }
        }

        for (Map.Entry<String, List<Integer>> face : faces.entrySet()) {
            if (faceUse.get(face.getKey()) == 1) {
                segments.add(face.getValue());
            }
        }
        return segments;
    }

    private static void collectFaces(List<Integer> nodes, int[][] table, Map<String, List<Integer>> faces,
            Map<String, Integer> faceUse) {
        for (int[] local : table) {
            List<Integer> face = new ArrayList<>(4);
            for (int index : local) {
                face.add(nodes.get(index));
            }
            if (face.size() == 3) {
                face.add(face.get(2));
            }
            String key = face.stream().distinct().sorted().map(String::valueOf).reduce((a, b) -> a + "-" + b).orElse("");
            faces.putIfAbsent(key, List.copyOf(face));
            faceUse.merge(key, 1, Integer::sum);
        }
    }
}
