package com.radioss.translator.deck;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

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
import com.radioss.translator.deck.config.BoundaryConditionDefinition;
import com.radioss.translator.deck.config.BoxDefinition;
import com.radioss.translator.deck.config.ContactDefinition;
import com.radioss.translator.deck.config.CurvePointDefinition;
import com.radioss.translator.deck.config.DeckDefinition;
import com.radioss.translator.deck.config.DeckOptions;
import com.radioss.translator.deck.config.LoadDefinition;
import com.radioss.translator.deck.config.MaterialDefinition;
import com.radioss.translator.deck.config.PartDefinition;
import com.radioss.translator.deck.config.PropertyDefinition;
import com.radioss.translator.deck.config.Rbe2Definition;
import com.radioss.translator.deck.config.Rbe3Definition;
import com.radioss.translator.deck.config.RigidBodyDefinition;
import com.radioss.translator.deck.config.SensorDefinition;
import com.radioss.translator.deck.config.TimeHistoryDefinition;
import com.radioss.translator.deck.config.WeightedNodeDefinition;
import com.radioss.translator.exception.DanglingReferenceException;
import com.radioss.translator.exception.TranslationException;
import com.radioss.translator.exception.UnresolvedReferenceException;
import com.radioss.translator.mapping.PropertyFamily;
import com.radioss.translator.model.CurvePoint;
import com.radioss.translator.model.Element;
import com.radioss.translator.model.FailureCriterion;
import com.radioss.translator.model.FailureModel;
import com.radioss.translator.model.MaterialLaw;
import com.radioss.translator.model.MaterialRecord;
import com.radioss.translator.model.MeshModel;
import com.radioss.translator.model.Selection;
import com.radioss.translator.model.SelectionKind;

/**
 * Decides every card of the starter deck and its identifier.
 *
 * Identifiers are requested in a fixed order so repeated runs on the same input
 * produce the same numbers:
 * 1. ids fixed by the input (source materials, configured properties and parts)
 * 2. subsets, numeric selection names first, then the others in source order
 * 3. extra materials in configuration order
 * 4. parts with their generated properties and default materials
 * 5. node groups, boxes, surfaces, functions, sensors and cards in configuration order
 * 6. rigid connectors and time histories
 *
 * Within one card kind, ids written in the deck definition are claimed before any id is generated.
 */
public class DeckPlanner {
    private static final Logger log = LoggerFactory.getLogger(DeckPlanner.class);

    private static final Pattern DOF = Pattern.compile("([01]{3})\\s*([01]{3})");
    private static final Set<String> DIRECTIONS = Set.of("X", "Y", "Z", "XX", "YY", "ZZ");
    private static final Pattern TH_VARIABLE = Pattern.compile("[A-Z][A-Z0-9_]{0,8}");
    private static final double DEFAULT_SHELL_THICKNESS = 1.0;
    private static final String MESH_PART_NAME = "MESH";

    private final MeshModel model;
    private final DeckOptions options;
    private final DeckDefinition definition;
    private final IdentifierAllocator allocator;
    private final SurfaceBuilder surfaceBuilder = new SurfaceBuilder();
    private final DeckPlan plan;

    private final Set<Integer> sourceMaterialIds = new LinkedHashSet<>();
    private final Map<Integer, Integer> renumberedMaterials = new HashMap<>();
    private final Map<String, SubsetCard> subsetsBySelection = new LinkedHashMap<>();
    private final Map<PropertyFamily, Integer> autoProperties = new HashMap<>();
    private final Map<String, NodeGroupCard> nodeGroupsBySelection = new LinkedHashMap<>();
    private final Map<String, BoxCard> boxesByName = new LinkedHashMap<>();
    private final Map<String, SurfaceCard> surfacesBySelection = new LinkedHashMap<>();
    private final Map<String, Integer> sensorsByName = new HashMap<>();
    private NodeGroupCard allNodes;

    public DeckPlanner(MeshModel model, DeckOptions options, IdentifierAllocator allocator) {
        this.model = model;
        this.options = options;
        this.definition = options.getDefinition();
        this.allocator = allocator;
        this.plan = new DeckPlan(new CompletionReport());
    }

    public DeckPlan plan() {
        reserveFixedIds();
        planSubsets();
        planExtraMaterials();
        planParts();
        completeMaterials();
        planNodeSelections();
        planBoxes();
        planSensors();
        planBoundaries();
        planContacts();
        planLoads();
        planRigidBodies();
        planRbe2Elements();
        planRbe3Elements();
        planTimeHistories();

        log.debug("Planned {} materials, {} properties, {} parts, {} subsets, {} node groups, {} cards, {} connectors",
                plan.getMaterials().size(), plan.getProperties().size(), plan.getParts().size(),
                plan.getSubsets().size(), plan.getNodeGroups().size(),
                plan.getBoundaries().size() + plan.getContacts().size() + plan.getLoads().size(),
                plan.getRigidBodies().size() + plan.getRbe2Elements().size() + plan.getRbe3Elements().size());
        return plan;
    }

    // ---- 1. fixed identifiers ----

    private void reserveFixedIds() {
        if (options.isEmitSourceMaterials()) {
            List<MaterialRecord> source = new ArrayList<>(model.getMaterials().values());
            source.sort(Comparator.comparingInt(MaterialRecord::getId));
            for (MaterialRecord record : source) {
                allocator.reserve(EntityKind.MATERIAL, record.getId());
                sourceMaterialIds.add(record.getId());
                plan.getMaterials().put(record.getId(), record.copy());
            }
        }
        for (PropertyDefinition property : definition.getProperties()) {
            if (property.getId() != null) {
                reserveConfigured(EntityKind.PROPERTY, property.getId(), "property");
            }
        }
        for (PartDefinition part : definition.getParts()) {
            if (part.getId() != null) {
                reserveConfigured(EntityKind.PART, part.getId(), "part");
            }
        }
    }

    // ---- 2. subsets ----

    private void planSubsets() {
        Set<String> needed = new LinkedHashSet<>();
        for (PartDefinition part : definition.getParts()) {
            if (part.getSelection() != null) {
                needed.add(elementSelection(part.getSelection(), "Part " + partLabel(part)).getName());
            }
        }
        boolean allSelections = options.isEmitSelections()
                || (definition.getParts().isEmpty() && options.isAutoParts());

        List<Selection> ordered = new ArrayList<>();
        for (Selection selection : model.getSelections(SelectionKind.ELEMENT)) {
            if (allSelections || needed.contains(selection.getName())) {
                ordered.add(selection);
            }
        }
        // Numeric names keep their value; they are claimed first so generated ids land above them.
        for (Selection selection : ordered) {
            if (selection.hasNumericName()) {
                addSubset(selection, allocator.reserve(EntityKind.SUBSET, selection.numericName()));
            }
        }
        for (Selection selection : ordered) {
            if (!selection.hasNumericName()) {
                addSubset(selection, allocator.allocate(EntityKind.SUBSET));
            }
        }
        for (Selection selection : ordered) {
            plan.getSubsets().add(subsetsBySelection.get(selection.getName()));
        }
    }

    private void addSubset(Selection selection, int id) {
        SubsetCard subset = new SubsetCard(id, selection.getName(), new ArrayList<>(new TreeSet<>(selection.getMembers())));
        subsetsBySelection.put(selection.getName(), subset);
        log.debug("Subset {} -> {}", selection.getName(), id);
    }

    // ---- 3. extra materials ----

    private void planExtraMaterials() {
        for (MaterialDefinition def : definition.getMaterials()) {
            MaterialRecord record = toRecord(def);
            int id;
            if (def.getId() == null) {
                id = allocator.allocate(EntityKind.MATERIAL);
            } else if (sourceMaterialIds.contains(def.getId())) {
                id = allocator.allocate(EntityKind.MATERIAL);
                renumberedMaterials.put(def.getId(), id);
                plan.getCompletions().add(CompletionKind.MATERIAL_RENUMBERED, id,
                        "material " + def.getId() + " already defined by the export, renumbered to " + id);
            } else {
                id = reserveConfigured(EntityKind.MATERIAL, def.getId(), "material");
            }
            plan.getMaterials().put(id, record.withId(id));
        }
    }

    private MaterialRecord toRecord(MaterialDefinition def) {
        MaterialRecord record = new MaterialRecord(def.getId() != null ? def.getId() : 0);
        record.setName(def.getName());
        record.setLaw(MaterialLaw.fromName(def.getLaw()));
        if (def.getParameters() != null) {
            def.getParameters().forEach((key, value) -> record.putParameter(MaterialRecord.canonicalKey(key), value));
        }
        if (def.getCurve() != null) {
            for (CurvePointDefinition point : def.getCurve()) {
                record.getCurve().add(new CurvePoint(point.getX(), point.getY()));
            }
        }
        if (def.getFailure() != null) {
            FailureModel failureModel = FailureModel.fromName(def.getFailure().getModel());
            record.setFailure(new FailureCriterion(failureModel, def.getFailure().getParameters()));
        }
        return record;
    }

    // ---- 4. properties, parts, default materials ----

    private void planParts() {
        for (PropertyDefinition def : definition.getProperties()) {
            int id = def.getId() != null ? def.getId() : allocator.allocate(EntityKind.PROPERTY);
            PropertyFamily family = propertyFamily(def);
            plan.getProperties().put(id, PropertyCard.builder()
                    .id(id)
                    .name(def.getName() != null ? def.getName() : family + "_" + id)
                    .family(family)
                    .thickness(def.getThickness() != null ? def.getThickness() : DEFAULT_SHELL_THICKNESS)
                    .build());
        }

        for (PartDefinition def : partDefinitions()) {
            List<Element> elements = elementsOf(def.getSelection());
            int partId = def.getId() != null ? def.getId() : allocator.allocate(EntityKind.PART);
            int subsetId = def.getSelection() != null ? subsetsBySelection.get(def.getSelection()).getId() : 0;

            int materialId;
            if (def.getMaterial() != null) {
                materialId = renumberedMaterials.getOrDefault(def.getMaterial(), def.getMaterial());
            } else {
                materialId = dominantMaterial(elements);
            }
            if (materialId <= 0) {
                throw new TranslationException("Part " + partId + " has invalid material id " + materialId);
            }
            int propertyId = resolveProperty(def.getProperty(), elements, partId);
            ensureMaterial(materialId, partId);

            String name = def.getName() != null ? def.getName() : "PART_" + partId;
            plan.getParts().add(PartCard.builder()
                    .id(partId)
                    .name(name)
                    .propertyId(propertyId)
                    .materialId(materialId)
                    .subsetId(subsetId)
                    .build());
        }
    }

    private List<PartDefinition> partDefinitions() {
        if (!definition.getParts().isEmpty() || !options.isAutoParts()) {
            return definition.getParts();
        }
        List<PartDefinition> auto = new ArrayList<>();
        for (Selection selection : model.getSelections(SelectionKind.ELEMENT)) {
            auto.add(PartDefinition.builder().name(selection.getName()).selection(selection.getName()).build());
        }
        if (auto.isEmpty() && !model.getElements().isEmpty()) {
            auto.add(PartDefinition.builder().name(MESH_PART_NAME).build());
        }
        for (PartDefinition part : auto) {
            log.info("Creating part {} for {}", part.getName(),
                    part.getSelection() != null ? "selection " + part.getSelection() : "the whole mesh");
        }
        return auto;
    }

    private int resolveProperty(Integer requested, List<Element> elements, int partId) {
        if (requested != null && plan.getProperties().containsKey(requested)) {
            return requested;
        }
        PropertyFamily family = dominantFamily(elements);
        if (requested != null) {
            allocator.reserve(EntityKind.PROPERTY, requested);
            addAutoProperty(requested, family, "property " + requested + " referenced by part " + partId);
            return requested;
        }
        Integer shared = autoProperties.get(family);
        if (shared != null) {
            return shared;
        }
        int id = allocator.allocate(EntityKind.PROPERTY);
        autoProperties.put(family, id);
        addAutoProperty(id, family, family + " property for part " + partId);
        return id;
    }

    private void addAutoProperty(int id, PropertyFamily family, String reason) {
        plan.getProperties().put(id, PropertyCard.builder()
                .id(id)
                .name(family + "_" + id)
                .family(family)
                .thickness(DEFAULT_SHELL_THICKNESS)
                .build());
        plan.getCompletions().add(CompletionKind.AUTO_PROPERTY, id, reason);
    }

    private void ensureMaterial(int materialId, int partId) {
        if (plan.getMaterials().containsKey(materialId)) {
            return;
        }
        if (!options.isDefaultMaterial()) {
            throw new DanglingReferenceException("material", materialId,
                    "Part " + partId + " references missing material " + materialId);
        }
        allocator.reserve(EntityKind.MATERIAL, materialId);
        plan.getMaterials().put(materialId, MaterialDefaults.defaultMaterial(materialId));
        plan.getCompletions().add(CompletionKind.DEFAULT_MATERIAL, materialId,
                "linear elastic steel for part " + partId);
    }

    private void completeMaterials() {
        for (MaterialRecord record : plan.getMaterials().values()) {
            MaterialDefaults.complete(record, plan.getCompletions());
            if (record.getLaw() == MaterialLaw.TABULATED_PLASTIC) {
                int functionId = allocator.allocate(EntityKind.FUNCTION);
                plan.getFunctions().add(new FunctionCard(functionId, record.displayName() + "_HARDENING",
                        List.copyOf(record.getCurve())));
                plan.getMaterialFunctions().put(record.getId(), functionId);
            }
        }
    }

    // ---- 5. node groups and cards ----

    private void planNodeSelections() {
        if (!options.isEmitSelections()) {
            return;
        }
        for (Selection selection : model.getSelections(SelectionKind.NODE)) {
            nodeGroupId(selection.getName(), "Node selection");
        }
    }

    private void planSensors() {
        List<SensorDefinition> sensors = definition.getSensors();
        List<Integer> ids = assignIds(sensors, SensorDefinition::getId, EntityKind.SENSOR, "sensor");
        for (int i = 0; i < sensors.size(); i++) {
            SensorDefinition def = sensors.get(i);
            int id = ids.get(i);
            String name = def.getName() != null ? def.getName() : "SENSOR_" + id;
            if (sensorsByName.putIfAbsent(name, id) != null) {
                throw new TranslationException("Duplicate sensor name '" + name + "' in deck definition");
            }
            plan.getSensors().add(new SensorCard(id, name, def.getDelay()));
        }
    }

    private void planBoundaries() {
        for (BoundaryConditionDefinition def : definition.getBoundaryConditions()) {
            String owner = "Boundary condition " + def.getName();
            BoundaryType type = BoundaryType.fromName(def.getType());
            int nodeGroupId = nodeGroupId(def.getSelection(), owner);
            int id = allocator.allocate(EntityKind.BOUNDARY);
            BoundaryCard.BoundaryCardBuilder card = BoundaryCard.builder()
                    .id(id)
                    .name(nameOr(def.getName(), "BC", id))
                    .type(type)
                    .nodeGroupId(nodeGroupId);
            if (type == BoundaryType.BCS) {
                card.dof(normalizeDof(def.getDof(), owner));
            } else {
                card.direction(direction(def.getDirection(), owner))
                        .value(def.getValue() != null ? def.getValue() : 0.0)
                        .functionId(constantFunction(nameOr(def.getName(), "BC", id)));
            }
            plan.getBoundaries().add(card.build());
        }
    }

    private void planContacts() {
        for (ContactDefinition def : definition.getContacts()) {
            String owner = "Contact " + def.getName();
            ContactType type = ContactType.fromName(def.getType());
            int secondaryGroupId = nodeGroupId(def.getSecondary(), owner);
            SurfaceCard main = surfaceFor(def.getMain(), owner);
            int id = allocator.allocate(EntityKind.INTERFACE);
            plan.getContacts().add(ContactCard.builder()
                    .id(id)
                    .name(nameOr(def.getName(), "CONTACT", id))
                    .type(type)
                    .secondaryNodeGroupId(secondaryGroupId)
                    .mainSurfaceId(main.getId())
                    .friction(def.getFriction())
                    .gap(def.getGap())
                    .build());
        }
    }

    private void planLoads() {
        for (LoadDefinition def : definition.getLoads()) {
            String owner = "Load " + def.getName();
            LoadType type = LoadType.fromName(def.getType());
            int nodeGroupId = def.getSelection() != null ? nodeGroupId(def.getSelection(), owner) : allNodesGroup().getId();
            int sensorId = 0;
            if (def.getSensor() != null) {
                Integer found = sensorsByName.get(def.getSensor());
                if (found == null) {
                    throw new UnresolvedReferenceException(def.getSensor(),
                            owner + " references undefined sensor " + def.getSensor());
                }
                sensorId = found;
            }
            String direction = direction(def.getDirection(), owner);
            if (!type.allowsRotation() && direction.length() > 1) {
                throw new TranslationException(owner + ": " + type + " needs a translational direction X, Y or Z, got '"
                        + def.getDirection() + "'");
            }
            int functionId = type.usesFunction() ? constantFunction(nameOr(def.getName(), type.name(), 0)) : 0;
            int id = allocator.allocate(EntityKind.LOAD);
            plan.getLoads().add(LoadCard.builder()
                    .id(id)
                    .name(nameOr(def.getName(), type.name(), id))
                    .type(type)
                    .nodeGroupId(nodeGroupId)
                    .direction(direction)
                    .value(def.getValue())
                    .functionId(functionId)
                    .sensorId(sensorId)
                    .build());
        }
    }

    private void planBoxes() {
        List<BoxDefinition> boxes = definition.getBoxes();
        List<Integer> ids = assignIds(boxes, BoxDefinition::getId, EntityKind.BOX, "box");
        for (int i = 0; i < boxes.size(); i++) {
            BoxDefinition def = boxes.get(i);
            int id = ids.get(i);
            String name = nameOr(def.getName(), "BOX", id);
            String owner = "Box " + name;
            if (def.getMin().size() != 3 || def.getMax().size() != 3) {
                throw new TranslationException(owner + ": min and max need three coordinates each");
            }
            if (model.findSelection(name).isPresent() || boxesByName.containsKey(name)) {
                throw new TranslationException(owner + ": name already used by a selection or another box");
            }
            List<Double> min = new ArrayList<>();
            List<Double> max = new ArrayList<>();
            for (int axis = 0; axis < 3; axis++) {
                double a = def.getMin().get(axis);
                double b = def.getMax().get(axis);
                min.add(Math.min(a, b));
                max.add(Math.max(a, b));
            }
            BoxCard box = new BoxCard(id, name, min, max, allocator.allocate(EntityKind.NODE_GROUP));
            boxesByName.put(name, box);
            plan.getBoxes().add(box);
        }
    }

    // ---- 6. connectors and time histories ----

    private void planRigidBodies() {
        List<RigidBodyDefinition> bodies = definition.getRigidBodies();
        List<Integer> ids = assignIds(bodies, RigidBodyDefinition::getId, EntityKind.RIGID_BODY, "rigid body");
        for (int i = 0; i < bodies.size(); i++) {
            RigidBodyDefinition def = bodies.get(i);
            int id = ids.get(i);
            String name = nameOr(def.getName(), "RBODY", id);
            String owner = "Rigid body " + name;
            int mainNode = def.getMainNode() != null ? def.getMainNode() : 0;
            if (mainNode != 0) {
                requireNode(mainNode, owner);
            }
            Set<Integer> nodes = nodesOf(def.getSelection(), def.getNodes(), owner);
            nodes.remove(mainNode);
            requireNodes(nodes, owner);
            plan.getRigidBodies().add(new RigidBodyCard(id, name, mainNode, addNodeGroup(name + "_NODES", nodes)));
        }
    }

    private void planRbe2Elements() {
        List<Rbe2Definition> elements = definition.getRbe2Elements();
        List<Integer> ids = assignIds(elements, Rbe2Definition::getId, EntityKind.RBE2, "RBE2");
        for (int i = 0; i < elements.size(); i++) {
            Rbe2Definition def = elements.get(i);
            int id = ids.get(i);
            String name = nameOr(def.getName(), "RBE2", id);
            String owner = "RBE2 " + name;
            int mainNode = requireNode(def.getMainNode(), owner);
            String dof = normalizeDof(def.getDof(), owner);
            Set<Integer> nodes = nodesOf(def.getSelection(), def.getNodes(), owner);
            nodes.remove(mainNode);
            requireNodes(nodes, owner);
            plan.getRbe2Elements().add(new Rbe2Card(id, name, mainNode, dof, addNodeGroup(name + "_NODES", nodes)));
        }
    }

    private void planRbe3Elements() {
        List<Rbe3Definition> elements = definition.getRbe3Elements();
        List<Integer> ids = assignIds(elements, Rbe3Definition::getId, EntityKind.RBE3, "RBE3");
        for (int i = 0; i < elements.size(); i++) {
            Rbe3Definition def = elements.get(i);
            int id = ids.get(i);
            String name = nameOr(def.getName(), "RBE3", id);
            String owner = "RBE3 " + name;
            int dependent = requireNode(def.getDependentNode(), owner);

            Map<Integer, Double> weights = new LinkedHashMap<>();
            if (def.getSelection() != null) {
                for (int node : selectionNodes(requireSelection(def.getSelection(), owner))) {
                    weights.put(node, 1.0);
                }
            }
            for (WeightedNodeDefinition node : def.getIndependent()) {
                requireNode(node.getNode(), owner);
                if (node.getWeight() <= 0.0) {
                    throw new TranslationException(owner + ": weight of node " + node.getNode() + " must be positive");
                }
                weights.put(node.getNode(), node.getWeight());
            }
            if (weights.containsKey(dependent)) {
                throw new TranslationException(owner + ": dependent node " + dependent + " is also an independent node");
            }
            if (weights.isEmpty()) {
                throw new TranslationException(owner + " has no independent nodes");
            }

            Map<Double, Set<Integer>> byWeight = new LinkedHashMap<>();
            weights.forEach((node, weight) -> byWeight.computeIfAbsent(weight, w -> new TreeSet<>()).add(node));
            Rbe3Card.Rbe3CardBuilder card = Rbe3Card.builder()
                    .id(id)
                    .name(name)
                    .dependentNodeId(dependent)
                    .dof(normalizeDof(def.getDof(), owner));
            int set = 1;
            for (Map.Entry<Double, Set<Integer>> entry : byWeight.entrySet()) {
                int groupId = addNodeGroup(name + "_W" + set++, entry.getValue());
                card.group(new Rbe3Card.WeightedGroup(entry.getKey(), groupId));
            }
            plan.getRbe3Elements().add(card.build());
        }
    }

    private void planTimeHistories() {
        List<TimeHistoryDefinition> histories = definition.getTimeHistories();
        List<Integer> ids = assignIds(histories, TimeHistoryDefinition::getId, EntityKind.TIME_HISTORY, "time history");
        for (int i = 0; i < histories.size(); i++) {
            TimeHistoryDefinition def = histories.get(i);
            int id = ids.get(i);
            String name = nameOr(def.getName(), "TH", id);
            String owner = "Time history " + name;
            Set<Integer> nodes = nodesOf(def.getSelection(), def.getNodes(), owner);
            List<String> variables = new ArrayList<>();
            for (String variable : def.getVariables().isEmpty() ? List.of("DEF") : def.getVariables()) {
                String value = variable != null ? variable.trim().toUpperCase(Locale.ROOT) : "";
                if (!TH_VARIABLE.matcher(value).matches()) {
                    throw new TranslationException(owner + ": invalid variable '" + variable + "'");
                }
                variables.add(value);
            }
            plan.getTimeHistories().add(new TimeHistoryCard(id, name, variables, new ArrayList<>(nodes)));
        }
    }

    /** Union of a selection's nodes and an explicit node list; never empty. */
    private Set<Integer> nodesOf(String selectionName, List<Integer> explicit, String owner) {
        Set<Integer> nodes = new TreeSet<>();
        if (selectionName != null) {
            nodes.addAll(selectionNodes(requireSelection(selectionName, owner)));
        }
        for (Integer node : explicit) {
            nodes.add(requireNode(node, owner));
        }
        requireNodes(nodes, owner);
        return nodes;
    }

    private static void requireNodes(Set<Integer> nodes, String owner) {
        if (nodes.isEmpty()) {
            throw new TranslationException(owner + " has no nodes");
        }
    }

    private int requireNode(Integer nodeId, String owner) {
        if (nodeId == null || nodeId <= 0) {
            throw new TranslationException(owner + " needs a node id");
        }
        if (!model.hasNode(nodeId)) {
            throw new DanglingReferenceException("node", nodeId, owner + " references missing node " + nodeId);
        }
        return nodeId;
    }

    /** Node group of a selection or a box, created on first use. */
    private int nodeGroupId(String selectionName, String owner) {
        BoxCard box = selectionName != null ? boxesByName.get(selectionName) : null;
        if (box != null) {
            return box.getNodeGroupId();
        }
        Selection selection = requireSelection(selectionName, owner);
        NodeGroupCard existing = nodeGroupsBySelection.get(selection.getName());
        if (existing != null) {
            return existing.getId();
        }
        Integer preferred = selection.hasNumericName() ? selection.numericName() : null;
        int id = allocator.allocate(EntityKind.NODE_GROUP, preferred);
        NodeGroupCard group = new NodeGroupCard(id, selection.getName(), new ArrayList<>(selectionNodes(selection)));
        nodeGroupsBySelection.put(selection.getName(), group);
        plan.getNodeGroups().add(group);
        return id;
    }

    private Set<Integer> selectionNodes(Selection selection) {
        Set<Integer> nodes = new TreeSet<>();
        if (selection.getKind() == SelectionKind.NODE) {
            nodes.addAll(selection.getMembers());
        } else {
            for (int elementId : selection.getMembers()) {
                model.findElement(elementId).ifPresent(e -> nodes.addAll(e.getNodeIds()));
            }
        }
        return nodes;
    }

    private int addNodeGroup(String name, Collection<Integer> nodeIds) {
        int id = allocator.allocate(EntityKind.NODE_GROUP);
        plan.getNodeGroups().add(new NodeGroupCard(id, name, new ArrayList<>(nodeIds)));
        return id;
    }

    private NodeGroupCard allNodesGroup() {
        if (allNodes == null) {
            int id = allocator.allocate(EntityKind.NODE_GROUP);
            allNodes = new NodeGroupCard(id, "ALL_NODES", new ArrayList<>(model.getNodes().keySet()));
            plan.getNodeGroups().add(allNodes);
        }
        return allNodes;
    }

    private SurfaceCard surfaceFor(String selectionName, String owner) {
        Selection selection = elementSelection(selectionName, owner);
        SurfaceCard existing = surfacesBySelection.get(selection.getName());
        if (existing != null) {
            return existing;
        }
        List<List<Integer>> segments = surfaceBuilder.segments(elementsOf(selection.getName()));
        if (segments.isEmpty()) {
            throw new TranslationException(owner + ": selection " + selection.getName() + " has no surface segments");
        }
        int id = allocator.allocate(EntityKind.SURFACE);
        SurfaceCard surface = new SurfaceCard(id, selection.getName(), segments);
        surfacesBySelection.put(selection.getName(), surface);
        plan.getSurfaces().add(surface);
        return surface;
    }

    private int constantFunction(String owner) {
        int id = allocator.allocate(EntityKind.FUNCTION);
        plan.getFunctions().add(FunctionCard.constant(id, owner + "_FUNCTION"));
        return id;
    }

    // ---- helpers ----

    /** Ids for one card kind: configured ids first, then generated ones in list order. */
    private <T> List<Integer> assignIds(List<T> defs, Function<T, Integer> idOf, EntityKind kind, String what) {
        List<Integer> ids = new ArrayList<>();
        for (T def : defs) {
            Integer id = idOf.apply(def);
            ids.add(id != null ? reserveConfigured(kind, id, what) : null);
        }
        for (int i = 0; i < ids.size(); i++) {
            if (ids.get(i) == null) {
                ids.set(i, allocator.allocate(kind));
            }
        }
        return ids;
    }

    /** Claims an id written in the deck definition. */
    private int reserveConfigured(EntityKind kind, int id, String what) {
        if (id <= 0) {
            throw new TranslationException("Invalid " + what + " id " + id + " in deck definition");
        }
        if (allocator.isUsed(kind, id)) {
            throw new TranslationException("Duplicate " + what + " id " + id + " in deck definition");
        }
        return allocator.reserve(kind, id);
    }

    private Selection requireSelection(String name, String owner) {
        if (name == null || name.isBlank()) {
            throw new UnresolvedReferenceException("", owner + " names no selection");
        }
        return model.findSelection(name)
                .orElseThrow(() -> new UnresolvedReferenceException(name, owner + " references undefined selection " + name));
    }

    private Selection elementSelection(String name, String owner) {
        Selection selection = requireSelection(name, owner);
        if (selection.getKind() != SelectionKind.ELEMENT) {
            throw new UnresolvedReferenceException(name, owner + " needs an element selection but " + name + " is a node selection");
        }
        return selection;
    }

    private List<Element> elementsOf(String selectionName) {
        if (selectionName == null) {
            return model.getElements();
        }
        List<Element> elements = new ArrayList<>();
        for (int id : elementSelection(selectionName, "Part").getMembers()) {
            model.findElement(id).ifPresent(elements::add);
        }
        return elements;
    }

    /** Most frequent element material, ties to the lowest id; 1 when the export carries none. */
    private static int dominantMaterial(List<Element> elements) {
        Map<Integer, Integer> counts = new HashMap<>();
        for (Element element : elements) {
            if (element.getMaterialId() > 0) {
                counts.merge(element.getMaterialId(), 1, Integer::sum);
            }
        }
        return counts.entrySet().stream()
                .max(Map.Entry.<Integer, Integer>comparingByValue()
                        .thenComparing(Map.Entry.comparingByKey(Comparator.reverseOrder())))
                .map(Map.Entry::getKey)
                .orElse(1);
    }

    /** Most frequent property family, ties in declaration order; shell for an empty part. */
    private static PropertyFamily dominantFamily(List<Element> elements) {
        Map<PropertyFamily, Integer> counts = new HashMap<>();
        for (Element element : elements) {
            counts.merge(element.getKeyword().getFamily(), 1, Integer::sum);
        }
        PropertyFamily best = PropertyFamily.SHELL;
        int bestCount = 0;
        for (PropertyFamily family : PropertyFamily.values()) {
            int count = counts.getOrDefault(family, 0);
            if (count > bestCount) {
                best = family;
                bestCount = count;
            }
        }
        return best;
    }

    private static PropertyFamily propertyFamily(PropertyDefinition def) {
        String type = def.getType() != null ? def.getType().trim().toUpperCase(Locale.ROOT) : "SHELL";
        try {
            return PropertyFamily.valueOf(type);
        } catch (IllegalArgumentException e) {
            throw new TranslationException("Property " + def.getId() + " has unknown type '" + def.getType() + "'", e);
        }
    }

    private static String normalizeDof(String dof, String owner) {
        String value = dof != null ? dof.trim() : "111 111";
        Matcher matcher = DOF.matcher(value);
        if (!matcher.matches()) {
            throw new TranslationException(owner + ": invalid dof code '" + dof + "', expected e.g. '111 000'");
        }
        return matcher.group(1) + " " + matcher.group(2);
    }

    private static String direction(String direction, String owner) {
        String value = direction != null ? direction.trim().toUpperCase(Locale.ROOT) : "X";
        if (!DIRECTIONS.contains(value)) {
            throw new TranslationException(owner + ": invalid direction '" + direction + "'");
        }
        return value;
    }

    private static String nameOr(String name, String prefix, int id) {
        if (name != null && !name.isBlank()) {
            return name;
        }
        return id > 0 ? prefix + "_" + id : prefix;
    }

    private static String partLabel(PartDefinition part) {
        return part.getName() != null ? part.getName() : String.valueOf(part.getId());
    }
}
