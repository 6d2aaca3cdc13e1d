package com.radioss.translator.parser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.radioss.translator.exception.DanglingReferenceException;
import com.radioss.translator.model.Element;
import com.radioss.translator.model.MeshModel;
import com.radioss.translator.model.Selection;
import com.radioss.translator.model.SelectionKind;

/**
 * Cross-reference checks run once parsing is complete.
 * Element connectivity must name existing nodes, selection members must exist in the entity set of their kind.
 */
public class ModelIntegrityChecker {
    private static final Logger log = LoggerFactory.getLogger(ModelIntegrityChecker.class);

    public void check(MeshModel model) {
        for (Element element : model.getElements()) {
            for (int nodeId : element.getNodeIds()) {
                if (!model.hasNode(nodeId)) {
                    throw new DanglingReferenceException("node", nodeId,
                            "Element " + element.getId() + " (line " + element.getSourceLine()
                                    + ") references missing node " + nodeId);
                }
            }
        }

        for (Selection selection : model.getSelections().values()) {
            for (int member : selection.getMembers()) {
                boolean exists = selection.getKind() == SelectionKind.NODE
                        ? model.hasNode(member)
                        : model.hasElement(member);
                if (!exists) {
                    String entity = selection.getKind() == SelectionKind.NODE ? "node" : "element";
                    throw new DanglingReferenceException(entity, member,
                            "Selection " + selection.getName() + " (line " + selection.getSourceLine()
                                    + ") references missing " + entity + " " + member);
                }
            }
        }
        log.debug("Integrity check passed for {}", model.getSourceName());
    }
}
