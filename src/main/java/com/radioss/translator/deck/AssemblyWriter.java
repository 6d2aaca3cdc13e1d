package com.radioss.translator.deck;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.radioss.translator.deck.card.BoundaryCard;
import com.radioss.translator.deck.card.BoundaryType;
import com.radioss.translator.deck.card.BoxCard;
import com.radioss.translator.deck.card.ContactCard;
import com.radioss.translator.deck.card.ContactType;
import com.radioss.translator.deck.card.FunctionCard;
import com.radioss.translator.deck.card.LoadCard;
import com.radioss.translator.deck.card.LoadType;
import com.radioss.translator.deck.card.NodeGroupCard;
import com.radioss.translator.deck.card.PartCard;
import com.radioss.translator.deck.card.PropertyCard;
import com.radioss.translator.deck.card.Rbe2Card;
import com.radioss.translator.deck.card.Rbe3Card;
import com.radioss.translator.deck.card.RigidBodyCard;
import com.radioss.translator.deck.card.SensorCard;
import com.radioss.translator.deck.card.SubsetCard;
import com.radioss.translator.deck.card.SurfaceCard;
import com.radioss.translator.deck.card.TimeHistoryCard;
import com.radioss.translator.deck.config.DeckOptions;
import com.radioss.translator.deck.config.UnitSystem;
import com.radioss.translator.model.CurvePoint;
import com.radioss.translator.model.FailureCriterion;
import com.radioss.translator.model.MaterialRecord;
import com.radioss.translator.model.MeshModel;

/**
 * Writes the starter deck.
 *
 * Card order: header, control cards, materials and functions, mesh include,
 * node groups, boxes and boundary conditions, properties, subsets and parts,
 * then contacts, loads, rigid connectors, sensors, time histories and failure criteria.
 */
public class AssemblyWriter {
    private static final Logger log = LoggerFactory.getLogger(AssemblyWriter.class);

    static final String STARTER_MARKER = "#RADIOSS STARTER";
    static final String BEGIN = "/BEGIN";
    static final String END = "/END";
    static final String INCLUDE = "#include ";
    static final int FORMAT_VERSION = 2022;

    private static final int IDS_PER_LINE = 10;
    private static final int REALS_PER_LINE = 5;

    private final ControlCardRenderer controlCards;

    public AssemblyWriter() {
        this(new ControlCardRenderer());
    }

    public AssemblyWriter(ControlCardRenderer controlCards) {
        this.controlCards = controlCards;
    }

    /**
     * Plans every card with a fresh allocator, then writes the starter text.
     */
    public AssembledDeck assemble(MeshModel model, DeckOptions options) {
        DeckPlan plan = new DeckPlanner(model, options, new IdentifierAllocator()).plan();
        String text = write(plan, options);
        log.debug("Starter assembled: {} characters, {} completions", text.length(), plan.getCompletions().size());
        return new AssembledDeck(text, plan);
    }

    String write(DeckPlan plan, DeckOptions options) {
        StringBuilder out = new StringBuilder();
        writeHeader(out, options);

        if (options.isEmitControlCards()) {
            out.append(controlCards.renderControlCards(options.getControl(), options.getRunName()));
        }

        for (MaterialRecord material : plan.getMaterials().values()) {
            writeMaterial(out, material, plan.getMaterialFunctions().getOrDefault(material.getId(), 0));
        }
        for (FunctionCard function : plan.getFunctions()) {
            writeFunction(out, function);
        }

        if (options.isIncludeMesh()) {
            out.append(INCLUDE).append(options.getMeshFileName()).append('\n');
        }

        for (NodeGroupCard group : plan.getNodeGroups()) {
            writeNodeGroup(out, group);
        }
        for (BoxCard box : plan.getBoxes()) {
            writeBox(out, box);
        }
        for (BoundaryCard boundary : plan.getBoundaries()) {
            writeBoundary(out, boundary);
        }

        for (PropertyCard property : plan.getProperties().values()) {
            writeProperty(out, property);
        }
        for (SubsetCard subset : plan.getSubsets()) {
            writeSubset(out, subset);
        }
        for (PartCard part : plan.getParts()) {
            writePart(out, part);
        }

        for (SurfaceCard surface : plan.getSurfaces()) {
            writeSurface(out, surface);
        }
        for (ContactCard contact : plan.getContacts()) {
            writeContact(out, contact);
        }
        for (LoadCard load : plan.getLoads()) {
            writeLoad(out, load);
        }
        for (RigidBodyCard body : plan.getRigidBodies()) {
            writeRigidBody(out, body);
        }
        for (Rbe2Card rbe2 : plan.getRbe2Elements()) {
            writeRbe2(out, rbe2);
        }
        for (Rbe3Card rbe3 : plan.getRbe3Elements()) {
            writeRbe3(out, rbe3);
        }
        for (SensorCard sensor : plan.getSensors()) {
            writeSensor(out, sensor);
        }
        for (TimeHistoryCard history : plan.getTimeHistories()) {
            writeTimeHistory(out, history);
        }
        for (MaterialRecord material : plan.getMaterials().values()) {
            if (material.getFailure() != null) {
                writeFailure(out, material.getId(), material.getFailure());
            }
        }

        out.append(END).append('\n');
        return out.toString();
    }

    private void writeHeader(StringBuilder out, DeckOptions options) {
        UnitSystem units = options.getUnitSystem();
        String unitsRow = CardFormat.textColumn(units.getMass(), CardFormat.REAL_WIDTH)
                + CardFormat.textColumn(units.getLength(), CardFormat.REAL_WIDTH)
                + CardFormat.textColumn(units.getTime(), CardFormat.REAL_WIDTH);
        out.append(STARTER_MARKER).append('\n');
        out.append(BEGIN).append('\n');
        out.append(options.getRunName()).append('\n');
        out.append(CardFormat.ints(FORMAT_VERSION, 0)).append('\n');
        // input units, then work units
        out.append(unitsRow).append('\n');
        out.append(unitsRow).append('\n');
    }

    // ---- materials ----

    private void writeMaterial(StringBuilder out, MaterialRecord material, int functionId) {
        out.append("/MAT/").append(material.getLaw().keyword()).append('/').append(material.getId()).append('\n');
        out.append(material.displayName()).append('\n');
        row(out, material, "RHO_I", "DENS");
        out.append(CardFormat.header(CardFormat.REAL_WIDTH, "E", "Nu")).append('\n');
        out.append(CardFormat.reals(material.parameterOr("EX", 0.0), material.parameterOr("NUXY", 0.0))).append('\n');

        switch (material.getLaw()) {
            case LINEAR_ELASTIC -> {
                // elastic constants only
            }
            case JOHNSON_COOK -> {
                out.append(CardFormat.header(CardFormat.REAL_WIDTH, "a", "b", "n")).append('\n');
                out.append(values(material, "A", "B", "N")).append('\n');
                out.append(CardFormat.header(CardFormat.REAL_WIDTH, "c", "EPS0")).append('\n');
                out.append(values(material, "C", "EPS0")).append('\n');
            }
            case PLASTIC_BRITTLE -> {
                out.append(CardFormat.header(CardFormat.REAL_WIDTH, "SIG0", "SU", "EPSU")).append('\n');
                out.append(values(material, "SIG0", "SU", "EPSU")).append('\n');
            }
            case TABULATED_PLASTIC -> {
                out.append(CardFormat.header(CardFormat.REAL_WIDTH, "Fsmooth", "Fcut", "Chard")).append('\n');
                out.append(values(material, "FSMOOTH", "FCUT", "CHARD")).append('\n');
                out.append(CardFormat.header(CardFormat.INT_WIDTH, "fct_IDp")).append('\n');
                out.append(CardFormat.ints(functionId)).append('\n');
            }
            case COWPER_SYMONDS -> {
                out.append(CardFormat.header(CardFormat.REAL_WIDTH, "a", "b", "n")).append('\n');
                out.append(values(material, "A", "B", "N")).append('\n');
                out.append(CardFormat.header(CardFormat.REAL_WIDTH, "c")).append('\n');
                out.append(values(material, "C")).append('\n');
            }
        }
    }

    private static void row(StringBuilder out, MaterialRecord material, String label, String key) {
        out.append(CardFormat.header(CardFormat.REAL_WIDTH, label)).append('\n');
        out.append(values(material, key)).append('\n');
    }

    /** Parameter lookup ignores case: law defaults use mixed-case keys, parsed labels are upper case. */
    private static String values(MaterialRecord material, String... keys) {
        double[] values = new double[keys.length];
        for (int i = 0; i < keys.length; i++) {
            values[i] = lookup(material.getParameters(), keys[i]);
        }
        return CardFormat.reals(values);
    }

    private static double lookup(Map<String, Double> parameters, String key) {
        Double exact = parameters.get(key);
        if (exact != null) {
            return exact;
        }
        for (Map.Entry<String, Double> entry : parameters.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(key)) {
                return entry.getValue();
            }
        }
        return 0.0;
    }

    private void writeFailure(StringBuilder out, int materialId, FailureCriterion failure) {
        out.append(failure.getModel().keyword()).append('/').append(materialId).append('\n');
        List<String> keys = new ArrayList<>(MaterialDefaults.failureParameters(failure.getModel()).keySet());
        for (String key : failure.getParameters().keySet()) {
            if (keys.stream().noneMatch(k -> k.equalsIgnoreCase(key))) {
                keys.add(key);
            }
        }
        for (int start = 0; start < keys.size(); start += REALS_PER_LINE) {
            List<String> chunk = keys.subList(start, Math.min(keys.size(), start + REALS_PER_LINE));
            double[] values = chunk.stream().mapToDouble(k -> lookup(failure.getParameters(), k)).toArray();
            out.append(CardFormat.header(CardFormat.REAL_WIDTH, chunk.toArray(new String[0]))).append('\n');
            out.append(CardFormat.reals(values)).append('\n');
        }
    }

    private void writeFunction(StringBuilder out, FunctionCard function) {
        out.append("/FUNCT/").append(function.getId()).append('\n');
        out.append(function.getName()).append('\n');
        out.append(CardFormat.header(CardFormat.REAL_WIDTH, "X", "Y")).append('\n');
        for (CurvePoint point : function.getPoints()) {
            out.append(CardFormat.reals(point.getX(), point.getY())).append('\n');
        }
    }

    // ---- groups and boundary conditions ----

    private void writeNodeGroup(StringBuilder out, NodeGroupCard group) {
        out.append("/GRNOD/NODE/").append(group.getId()).append('\n');
        out.append(group.getName()).append('\n');
        CardFormat.appendIdLines(out, group.getNodeIds(), IDS_PER_LINE);
    }

    private void writeBox(StringBuilder out, BoxCard box) {
        out.append("/BOX/RECTA/").append(box.getId()).append('\n');
        out.append(box.getName()).append('\n');
        out.append(CardFormat.header(CardFormat.INT_WIDTH, "node_ID1", "node_ID2", "skew_ID")).append('\n');
        out.append(CardFormat.ints(0, 0, 0)).append('\n');
        out.append(CardFormat.header(CardFormat.REAL_WIDTH, "Xp1", "Yp1", "Zp1")).append('\n');
        out.append(CardFormat.reals(box.getMin().get(0), box.getMin().get(1), box.getMin().get(2))).append('\n');
        out.append(CardFormat.header(CardFormat.REAL_WIDTH, "Xp2", "Yp2", "Zp2")).append('\n');
        out.append(CardFormat.reals(box.getMax().get(0), box.getMax().get(1), box.getMax().get(2))).append('\n');

        out.append("/GRNOD/BOX/").append(box.getNodeGroupId()).append('\n');
        out.append(box.getName()).append('\n');
        out.append(CardFormat.header(CardFormat.INT_WIDTH, "box_ID")).append('\n');
        out.append(CardFormat.ints(box.getId())).append('\n');
    }

    private void writeBoundary(StringBuilder out, BoundaryCard boundary) {
        if (boundary.getType() == BoundaryType.BCS) {
            out.append("/BCS/").append(boundary.getId()).append('\n');
            out.append(boundary.getName()).append('\n');
            out.append(CardFormat.header(CardFormat.INT_WIDTH, "Tra rot", "skew_ID", "grnod_ID")).append('\n');
            out.append(CardFormat.textColumn(boundary.getDof()))
                    .append(CardFormat.ints(0, boundary.getNodeGroupId())).append('\n');
        } else {
            out.append("/BOUNDARY/PRESCRIBED_MOTION/").append(boundary.getId()).append('\n');
            out.append(boundary.getName()).append('\n');
            out.append(CardFormat.header(CardFormat.INT_WIDTH, "Dir", "fct_ID", "sens_ID", "grnod_ID")).append('\n');
            out.append(CardFormat.textColumn(boundary.getDirection()))
                    .append(CardFormat.ints(boundary.getFunctionId(), 0, boundary.getNodeGroupId())).append('\n');
            out.append(CardFormat.header(CardFormat.REAL_WIDTH, "Ascale_x", "Fscale_y")).append('\n');
            out.append(CardFormat.reals(0.0, boundary.getValue())).append('\n');
        }
    }

    // ---- properties, subsets, parts ----

    private void writeProperty(StringBuilder out, PropertyCard property) {
        out.append("/PROP/").append(property.getFamily().name()).append('/').append(property.getId()).append('\n');
        out.append(property.getName()).append('\n');
        switch (property.getFamily()) {
            case SHELL -> {
                out.append(CardFormat.header(CardFormat.INT_WIDTH, "Ishell", "Ismstr", "Ish3n")).append('\n');
                out.append(CardFormat.ints(0, 0, 0)).append('\n');
                out.append(CardFormat.header(CardFormat.INT_WIDTH, "N", "Istrain")).append(pad("Thick")).append('\n');
                out.append(CardFormat.ints(5, 0)).append(CardFormat.realColumn(property.getThickness())).append('\n');
            }
            case SOLID -> {
                out.append(CardFormat.header(CardFormat.INT_WIDTH, "Isolid", "Ismstr", "Icpre")).append('\n');
                out.append(CardFormat.ints(0, 0, 0)).append('\n');
            }
            case BEAM -> {
                out.append(CardFormat.header(CardFormat.REAL_WIDTH, "Area", "Iyy", "Izz", "Ixx")).append('\n');
                out.append(CardFormat.reals(1.0, 1.0, 1.0, 1.0)).append('\n');
            }
            case TRUSS -> {
                out.append(CardFormat.header(CardFormat.REAL_WIDTH, "Area")).append('\n');
                out.append(CardFormat.reals(1.0)).append('\n');
            }
            case SPRING -> {
                out.append(CardFormat.header(CardFormat.REAL_WIDTH, "Mass", "K")).append('\n');
                out.append(CardFormat.reals(0.0, 1.0)).append('\n');
            }
        }
    }

    private void writeSubset(StringBuilder out, SubsetCard subset) {
        out.append("/SUBSET/").append(subset.getId()).append('\n');
        out.append(subset.getName()).append('\n');
        CardFormat.appendIdLines(out, subset.getElementIds(), IDS_PER_LINE);
    }

    private void writePart(StringBuilder out, PartCard part) {
        out.append("/PART/").append(part.getId()).append('\n');
        out.append(part.getName()).append('\n');
        out.append(CardFormat.header(CardFormat.INT_WIDTH, "prop_ID", "mat_ID", "subset_ID")).append('\n');
        out.append(CardFormat.ints(part.getPropertyId(), part.getMaterialId(), part.getSubsetId())).append('\n');
    }

    // ---- contacts, loads, sensors ----

    private void writeSurface(StringBuilder out, SurfaceCard surface) {
        out.append("/SURF/SEG/").append(surface.getId()).append('\n');
        out.append(surface.getName()).append('\n');
        out.append(CardFormat.header(CardFormat.INT_WIDTH, "seg_ID", "node_ID1", "node_ID2", "node_ID3", "node_ID4"))
                .append('\n');
        int segmentId = 1;
        for (List<Integer> segment : surface.getSegments()) {
            out.append(CardFormat.intColumn(segmentId++));
            for (int nodeId : segment) {
                out.append(CardFormat.intColumn(nodeId));
            }
            out.append('\n');
        }
    }

    private void writeContact(StringBuilder out, ContactCard contact) {
        out.append("/INTER/").append(contact.getType().name()).append('/').append(contact.getId()).append('\n');
        out.append(contact.getName()).append('\n');
        out.append(CardFormat.header(CardFormat.INT_WIDTH, "grnd_IDs", "surf_IDm")).append('\n');
        out.append(CardFormat.ints(contact.getSecondaryNodeGroupId(), contact.getMainSurfaceId())).append('\n');
        if (contact.getType() == ContactType.TYPE7) {
            out.append(CardFormat.header(CardFormat.REAL_WIDTH, "Fric", "Gapmin")).append('\n');
            out.append(CardFormat.reals(contact.getFriction(), contact.getGap())).append('\n');
        } else {
            out.append(CardFormat.header(CardFormat.REAL_WIDTH, "Fric")).append('\n');
            out.append(CardFormat.reals(contact.getFriction())).append('\n');
        }
    }

    private void writeLoad(StringBuilder out, LoadCard load) {
        out.append(load.getType().getKeyword()).append('/').append(load.getId()).append('\n');
        out.append(load.getName()).append('\n');
        if (load.getType() == LoadType.INIVEL) {
            double[] velocity = new double[3];
            velocity["XYZ".indexOf(load.getDirection().charAt(0))] = load.getValue();
            out.append(CardFormat.header(CardFormat.REAL_WIDTH, "Vx", "Vy", "Vz")).append('\n');
            out.append(CardFormat.reals(velocity)).append('\n');
            out.append(CardFormat.header(CardFormat.INT_WIDTH, "grnod_ID", "sens_ID")).append('\n');
            out.append(CardFormat.ints(load.getNodeGroupId(), load.getSensorId())).append('\n');
            return;
        }
        out.append(CardFormat.header(CardFormat.INT_WIDTH, "fct_ID", "Dir", "skew_ID", "sens_ID", "grnod_ID")).append('\n');
        out.append(CardFormat.intColumn(load.getFunctionId()))
                .append(CardFormat.textColumn(load.getDirection()))
                .append(CardFormat.ints(0, load.getSensorId(), load.getNodeGroupId())).append('\n');
        out.append(CardFormat.header(CardFormat.REAL_WIDTH, "Ascale_x", "Fscale_y")).append('\n');
        out.append(CardFormat.reals(0.0, load.getValue())).append('\n');
    }

    // ---- rigid connectors ----

    private void writeRigidBody(StringBuilder out, RigidBodyCard body) {
        out.append("/RBODY/").append(body.getId()).append('\n');
        out.append(body.getName()).append('\n');
        out.append(CardFormat.header(CardFormat.INT_WIDTH, "node_ID", "sens_ID", "skew_ID", "Ispher"))
                .append(pad("Mass"))
                .append(CardFormat.textColumn("grnd_ID"))
                .append(CardFormat.textColumn("Ikrem"))
                .append(CardFormat.textColumn("ICoG"))
                .append(CardFormat.textColumn("surf_ID")).append('\n');
        out.append(CardFormat.ints(body.getMainNodeId(), 0, 0, 0))
                .append(CardFormat.realColumn(0.0))
                .append(CardFormat.ints(body.getNodeGroupId(), 0, 0, 0)).append('\n');
        // zero inertia: the solver computes it from the secondary nodes
        out.append(CardFormat.header(CardFormat.REAL_WIDTH, "Jxx", "Jyy", "Jzz")).append('\n');
        out.append(CardFormat.reals(0.0, 0.0, 0.0)).append('\n');
        out.append(CardFormat.header(CardFormat.REAL_WIDTH, "Jxy", "Jyz", "Jxz")).append('\n');
        out.append(CardFormat.reals(0.0, 0.0, 0.0)).append('\n');
    }

    private void writeRbe2(StringBuilder out, Rbe2Card rbe2) {
        out.append("/RBE2/").append(rbe2.getId()).append('\n');
        out.append(rbe2.getName()).append('\n');
        out.append(CardFormat.header(CardFormat.INT_WIDTH, "N_main", "Tra rot", "skew_ID", "grnd_ID", "Iflag"))
                .append('\n');
        out.append(CardFormat.intColumn(rbe2.getMainNodeId()))
                .append(CardFormat.textColumn(rbe2.getDof()))
                .append(CardFormat.ints(0, rbe2.getNodeGroupId(), 0)).append('\n');
    }

    private void writeRbe3(StringBuilder out, Rbe3Card rbe3) {
        out.append("/RBE3/").append(rbe3.getId()).append('\n');
        out.append(rbe3.getName()).append('\n');
        out.append(CardFormat.header(CardFormat.INT_WIDTH, "N_dep", "Tra rot", "skew_ID", "I_modif")).append('\n');
        out.append(CardFormat.intColumn(rbe3.getDependentNodeId()))
                .append(CardFormat.textColumn(rbe3.getDof()))
                .append(CardFormat.ints(0, 0)).append('\n');
        out.append(CardFormat.header(CardFormat.REAL_WIDTH, "Wt_i"))
                .append(CardFormat.textColumn("Tra rot"))
                .append(CardFormat.textColumn("grnd_ID")).append('\n');
        for (Rbe3Card.WeightedGroup group : rbe3.getGroups()) {
            out.append(CardFormat.realColumn(group.getWeight()))
                    .append(CardFormat.textColumn(rbe3.getDof()))
                    .append(CardFormat.intColumn(group.getNodeGroupId())).append('\n');
        }
    }

    private void writeSensor(StringBuilder out, SensorCard sensor) {
        out.append("/SENSOR/TIME/").append(sensor.getId()).append('\n');
        out.append(sensor.getName()).append('\n');
        out.append(CardFormat.header(CardFormat.REAL_WIDTH, "Tdelay")).append('\n');
        out.append(CardFormat.reals(sensor.getDelay())).append('\n');
    }

    private void writeTimeHistory(StringBuilder out, TimeHistoryCard history) {
        out.append("/TH/NODE/").append(history.getId()).append('\n');
        out.append(history.getName()).append('\n');
        out.append(CardFormat.header(CardFormat.INT_WIDTH, "var_ID1", "var_ID2", "var_ID3")).append('\n');
        List<String> variables = history.getVariables();
        for (int start = 0; start < variables.size(); start += IDS_PER_LINE) {
            for (String variable : variables.subList(start, Math.min(variables.size(), start + IDS_PER_LINE))) {
                out.append(CardFormat.textColumn(variable));
            }
            out.append('\n');
        }
        out.append(CardFormat.header(CardFormat.INT_WIDTH, "node_ID", "skew_ID")).append('\n');
        for (int nodeId : history.getNodeIds()) {
            out.append(CardFormat.ints(nodeId, 0)).append('\n');
        }
    }

    private static String pad(String label) {
        return CardFormat.textColumn(label, CardFormat.REAL_WIDTH);
    }
}
