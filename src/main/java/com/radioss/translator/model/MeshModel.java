package com.radioss.translator.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import lombok.AccessLevel;
import lombok.Getter;

/**
 * In-memory result of parsing one CDB export. Owned by a single translation run.
 */
@Getter
public class MeshModel {

    private final String sourceName;
    private final Map<Integer, Node> nodes = new TreeMap<>();
    private final List<Element> elements = new ArrayList<>();
    private final Map<String, Selection> selections = new LinkedHashMap<>();
    private final Map<Integer, MaterialRecord> materials = new LinkedHashMap<>();

    /** Local element type number to element routine number (ET records). */
    private final Map<Integer, Integer> elementTypes = new LinkedHashMap<>();

    @Getter(AccessLevel.NONE)
    private Map<Integer, Element> elementIndex;

    public MeshModel(String sourceName) {
        this.sourceName = sourceName;
    }

    public void addNode(Node node) {
        nodes.put(node.getId(), node);
    }

    public void addElement(Element element) {
        elements.add(element);
        elementIndex = null;
    }

    public Collection<Node> getNodeList() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    public boolean hasNode(int id) {
        return nodes.containsKey(id);
    }

    public boolean hasElement(int id) {
        return index().containsKey(id);
    }

    public Optional<Element> findElement(int id) {
        return Optional.ofNullable(index().get(id));
    }

    public Optional<Selection> findSelection(String name) {
        return Optional.ofNullable(selections.get(name));
    }

    public List<Selection> getSelections(SelectionKind kind) {
        return selections.values().stream()
                .filter(s -> s.getKind() == kind)
                .toList();
    }

    public Optional<MaterialRecord> findMaterial(int id) {
        return Optional.ofNullable(materials.get(id));
    }

    public int getNodeCount() {
        return nodes.size();
    }

    public int getElementCount() {
        return elements.size();
    }

    private Map<Integer, Element> index() {
        if (elementIndex == null) {
            Map<Integer, Element> built = new LinkedHashMap<>();
            for (Element element : elements) {
                built.put(element.getId(), element);
            }
            elementIndex = built;
        }
        return elementIndex;
    }
}
