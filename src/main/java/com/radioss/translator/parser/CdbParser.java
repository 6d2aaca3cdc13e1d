package com.radioss.translator.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.radioss.translator.exception.MalformedRecordException;
import com.radioss.translator.mapping.ElementKeyword;
import com.radioss.translator.mapping.ElementTypeTable;
import com.radioss.translator.model.CurvePoint;
import com.radioss.translator.model.Element;
import com.radioss.translator.model.MaterialLaw;
import com.radioss.translator.model.MaterialRecord;
import com.radioss.translator.model.MeshModel;
import com.radioss.translator.model.Node;
import com.radioss.translator.model.Selection;
import com.radioss.translator.model.SelectionKind;

/**
 * Parser for Ansys {@code .cdb} exports.
 * Converts the text into a {@link MeshModel}.
 *
 * Parsing only:
 * - Reads NBLOCK, EBLOCK, CMBLOCK, ET/ETBLOCK, MPDATA and TB records
 * - Skips every other block
 * - Fails on the first malformed record, with block kind and line number
 *
 * It does NOT check cross references; see {@link ModelIntegrityChecker}.
 */
public class CdbParser {
    private static final Logger log = LoggerFactory.getLogger(CdbParser.class);

    private final List<String> lines;
    private final String sourceName;
    private final ParserOptions options;
    private int pos = 0;

    private final MeshModel model;
    private final List<RawElement> rawElements = new ArrayList<>();
    private int skippedLines = 0;

    public CdbParser(List<String> lines, String sourceName) {
        this(lines, sourceName, ParserOptions.defaults());
    }

    public CdbParser(List<String> lines, String sourceName, ParserOptions options) {
        this.lines = lines;
        this.sourceName = sourceName;
        this.options = options;
        this.model = new MeshModel(sourceName);
    }

    public MeshModel parse() {
        while (!isAtEnd()) {
            BlockKind kind = BlockKind.classify(peek());
            switch (kind) {
                case ELEMENT_TYPE -> parseElementType();
                case ELEMENT_TYPE_TABLE -> parseElementTypeTable();
                case NODE -> parseNodeBlock();
                case ELEMENT -> parseElementBlock();
                case SELECTION -> parseSelectionBlock();
                case MATERIAL -> parseMaterialData();
                case MATERIAL_TABLE -> parseMaterialTable();
                case IGNORE -> {
                    skippedLines++;
                    advance();
                }
            }
        }

        resolveElements();

        log.debug("Parsed {}: {} nodes, {} elements, {} selections, {} materials ({} lines skipped)",
                sourceName, model.getNodeCount(), model.getElementCount(),
                model.getSelections().size(), model.getMaterials().size(), skippedLines);
        return model;
    }

    // ---- ET / ETBLOCK ----

    private void parseElementType() {
        int line = lineNumber();
        List<String> parts = splitCommas(advance());
        if (parts.size() < 3) {
            throw new MalformedRecordException(BlockKind.ELEMENT_TYPE, line, "Expected 'ET,itype,ename'");
        }
        int localType = parseInt(parts.get(1), BlockKind.ELEMENT_TYPE, line);
        int routine = parseRoutine(parts.get(2), line);
        model.getElementTypes().put(localType, routine);
        log.debug("Element type {} -> routine {}", localType, routine);
    }

    private void parseElementTypeTable() {
        advance();
        FortranFormat format = readFormat(FortranFormat.ETBLOCK_DEFAULT, BlockKind.ELEMENT_TYPE_TABLE);
        while (!isAtEnd()) {
            String raw = peek();
            String t = raw.trim();
            if (t.isEmpty()) {
                advance();
                continue;
            }
            if (isTerminator(t)) {
                advance();
                break;
            }
            if (startsWithLetter(t)) {
                break;
            }
            int line = lineNumber();
            List<String> fields = format.intFields(raw);
            if (fields.size() < 2) {
                throw new MalformedRecordException(BlockKind.ELEMENT_TYPE_TABLE, line, "Expected local type and routine number");
            }
            model.getElementTypes().put(parseInt(fields.get(0), BlockKind.ELEMENT_TYPE_TABLE, line),
                    parseInt(fields.get(1), BlockKind.ELEMENT_TYPE_TABLE, line));
            advance();
        }
    }

    private int parseRoutine(String value, int line) {
        String digits = value.trim().replaceAll("^[A-Za-z]+", "");
        return parseInt(digits, BlockKind.ELEMENT_TYPE, line);
    }

    // ---- NBLOCK ----

    private void parseNodeBlock() {
        advance();
        FortranFormat format = readFormat(FortranFormat.NBLOCK_DEFAULT, BlockKind.NODE);
        int count = 0;

        while (!isAtEnd()) {
            String raw = peek();
            String t = raw.trim();
            if (t.isEmpty()) {
                advance();
                continue;
            }
            if (isTerminator(t) || t.toUpperCase(Locale.ROOT).startsWith("N,")) {
                advance();
                break;
            }
            if (startsWithLetter(t)) {
                break;
            }
            int line = lineNumber();
            Node node = readNode(raw, format, line);
            if (model.hasNode(node.getId())) {
                throw new MalformedRecordException(BlockKind.NODE, line, "Duplicate node id " + node.getId());
            }
            model.addNode(node);
            count++;
            advance();
        }
        log.debug("NBLOCK: {} nodes", count);
    }

    private Node readNode(String raw, FortranFormat format, int line) {
        if (isDelimited(raw)) {
            List<String> parts = splitDelimited(raw);
            if (parts.size() < 4) {
                throw new MalformedRecordException(BlockKind.NODE, line, "Expected node id and three coordinates");
            }
            return new Node(parseInt(parts.get(0), BlockKind.NODE, line),
                    parseReal(parts.get(1), BlockKind.NODE, line),
                    parseReal(parts.get(2), BlockKind.NODE, line),
                    parseReal(parts.get(3), BlockKind.NODE, line));
        }

        List<String> ints = format.intFields(raw);
        if (ints.isEmpty()) {
            throw new MalformedRecordException(BlockKind.NODE, line, "Missing node id");
        }
        int id = parseInt(ints.get(0), BlockKind.NODE, line);
        List<String> reals = format.realFields(raw);
        // Trailing zero coordinates are omitted by the exporter.
        double[] xyz = new double[3];
        for (int i = 0; i < 3 && i < reals.size(); i++) {
            xyz[i] = reals.get(i).isEmpty() ? 0.0 : parseReal(reals.get(i), BlockKind.NODE, line);
        }
        return new Node(id, xyz[0], xyz[1], xyz[2]);
    }

    // ---- EBLOCK ----

    private void parseElementBlock() {
        advance();
        FortranFormat format = readFormat(FortranFormat.EBLOCK_DEFAULT, BlockKind.ELEMENT);
        int count = 0;

        while (!isAtEnd()) {
            String raw = peek();
            String t = raw.trim();
            if (t.isEmpty()) {
                advance();
                continue;
            }
            if (isTerminator(t)) {
                advance();
                break;
            }
            if (startsWithLetter(t)) {
                break;
            }
            int line = lineNumber();
            advance();
            if (isDelimited(raw)) {
                rawElements.add(readCompactElement(splitDelimited(raw), line));
            } else {
                rawElements.add(readSolidElement(format.intFields(raw), format, line));
            }
            count++;
        }
        log.debug("EBLOCK: {} elements", count);
    }

    /**
     * Solid layout: mat, type, real, secnum, esys, birth/death, solid ref, shape, node count, unused, id, nodes...
     */
    private RawElement readSolidElement(List<String> fields, FortranFormat format, int line) {
        if (fields.size() < 11) {
            throw new MalformedRecordException(BlockKind.ELEMENT, line,
                    "Expected at least 11 attribute fields, got " + fields.size());
        }
        int materialId = parseInt(fields.get(0), BlockKind.ELEMENT, line);
        int localType = parseInt(fields.get(1), BlockKind.ELEMENT, line);
        int nodeCount = parseInt(fields.get(8), BlockKind.ELEMENT, line);
        int id = parseInt(fields.get(10), BlockKind.ELEMENT, line);

        List<Integer> nodes = new ArrayList<>();
        for (int i = 11; i < fields.size() && nodes.size() < nodeCount; i++) {
            nodes.add(parseInt(fields.get(i), BlockKind.ELEMENT, line));
        }
        // Node lists longer than one record continue on the following line(s).
        while (nodes.size() < nodeCount) {
            if (isAtEnd()) {
                throw new MalformedRecordException(BlockKind.ELEMENT, line,
                        "Element " + id + " declares " + nodeCount + " nodes but only " + nodes.size() + " were found");
            }
            int contLine = lineNumber();
            String cont = advance();
            if (isTerminator(cont.trim()) || startsWithLetter(cont.trim())) {
                throw new MalformedRecordException(BlockKind.ELEMENT, line,
                        "Element " + id + " declares " + nodeCount + " nodes but only " + nodes.size() + " were found");
            }
            for (String field : format.intFields(cont)) {
                if (nodes.size() < nodeCount && !field.isEmpty()) {
                    nodes.add(parseInt(field, BlockKind.ELEMENT, contLine));
                }
            }
        }
        return new RawElement(id, localType, materialId, nodes, line);
    }

    /**
     * Delimited layout: id, type, nodes...
     */
    private RawElement readCompactElement(List<String> fields, int line) {
        if (fields.size() < 3) {
            throw new MalformedRecordException(BlockKind.ELEMENT, line, "Expected element id, type and nodes");
        }
        int id = parseInt(fields.get(0), BlockKind.ELEMENT, line);
        int localType = parseInt(fields.get(1), BlockKind.ELEMENT, line);
        List<Integer> nodes = new ArrayList<>();
        for (int i = 2; i < fields.size(); i++) {
            if (!fields.get(i).isEmpty()) {
                nodes.add(parseInt(fields.get(i), BlockKind.ELEMENT, line));
            }
        }
        return new RawElement(id, localType, 0, nodes, line);
    }

    private void resolveElements() {
        ElementTypeTable table = options.getTypeTable();
        Map<Integer, Integer> elementTypes = model.getElementTypes();
        int fallbackHits = 0;

        for (RawElement raw : rawElements) {
            if (model.hasElement(raw.id())) {
                throw new MalformedRecordException(BlockKind.ELEMENT, raw.line(), "Duplicate element id " + raw.id());
            }
            int typeCode = elementTypes.getOrDefault(raw.localType(), raw.localType());
            if (!table.isKnown(typeCode)) {
                fallbackHits++;
            }
            ElementKeyword keyword = table.resolve(typeCode, raw.nodes().size());
            model.addElement(Element.builder()
                    .id(raw.id())
                    .typeCode(typeCode)
                    .materialId(raw.materialId())
                    .nodeIds(raw.nodes())
                    .keyword(keyword)
                    .sourceLine(raw.line())
                    .build());
        }
        if (fallbackHits > 0) {
            log.debug("{} element(s) resolved through the node-count fallback", fallbackHits);
        }
    }

    // ---- CMBLOCK ----

    private void parseSelectionBlock() {
        int headerLine = lineNumber();
        String header = stripComment(advance());
        List<String> parts = splitCommas(header);
        if (parts.size() < 4) {
            throw new MalformedRecordException(BlockKind.SELECTION, headerLine, "Expected 'CMBLOCK,name,entity,count'");
        }
        String name = parts.get(1).trim();
        SelectionKind kind = SelectionKind.fromCdb(parts.get(2));
        int expected = parseInt(parts.get(3), BlockKind.SELECTION, headerLine);
        FortranFormat format = readFormat(FortranFormat.CMBLOCK_DEFAULT, BlockKind.SELECTION);

        List<Integer> values = new ArrayList<>();
        while (!isAtEnd() && values.size() < expected) {
            String raw = peek();
            String t = raw.trim();
            if (t.isEmpty()) {
                advance();
                continue;
            }
            if (startsWithLetter(t)) {
                break;
            }
            int line = lineNumber();
            List<String> fields = isDelimited(raw) ? splitDelimited(raw) : format.intFields(raw);
            for (String field : fields) {
                if (!field.isEmpty()) {
                    values.add(parseInt(field, BlockKind.SELECTION, line));
                }
            }
            advance();
        }
        if (values.size() < expected) {
            throw new MalformedRecordException(BlockKind.SELECTION, headerLine,
                    "Selection " + name + " declares " + expected + " values but only " + values.size() + " were found");
        }

        if (kind == null) {
            log.debug("Skipping CMBLOCK {} of unsupported entity {}", name, parts.get(2).trim());
            return;
        }

        Selection selection = model.getSelections().get(name);
        if (selection == null) {
            selection = new Selection(name, kind, headerLine);
            model.getSelections().put(name, selection);
        } else if (selection.getKind() != kind) {
            throw new MalformedRecordException(BlockKind.SELECTION, headerLine,
                    "Selection " + name + " was declared as " + selection.getKind() + " and is redeclared as " + kind);
        }
        selection.addMembers(expandRanges(values, headerLine));
        log.debug("CMBLOCK {} ({}): {} members", name, kind, selection.size());
    }

    /**
     * A negative value closes a range opened by the value before it: {@code 1 -4} means 1, 2, 3, 4.
     */
    private List<Integer> expandRanges(List<Integer> values, int line) {
        List<Integer> members = new ArrayList<>();
        Integer previous = null;
        for (int value : values) {
            if (value < 0) {
                if (previous == null) {
                    throw new MalformedRecordException(BlockKind.SELECTION, line, "Range end " + value + " has no start");
                }
                for (int id = previous + 1; id <= -value; id++) {
                    members.add(id);
                }
                previous = null;
            } else {
                members.add(value);
                previous = value;
            }
        }
        return members;
    }

    // ---- MPDATA / TB ----

    private void parseMaterialData() {
        int line = lineNumber();
        List<String> parts = splitCommas(stripComment(advance()));

        String label;
        String materialField;
        String locationField;
        String valueField;
        if (parts.size() > 1 && parts.get(1).toUpperCase(Locale.ROOT).startsWith("R5")) {
            // MPDATA,R5.0,len,LAB,MAT,STLOC,VAL1
            if (parts.size() < 7) {
                throw new MalformedRecordException(BlockKind.MATERIAL, line, "Expected 'MPDATA,R5.0,len,LAB,MAT,STLOC,VAL'");
            }
            label = parts.get(3);
            materialField = parts.get(4);
            locationField = parts.get(5);
            valueField = parts.get(6);
        } else {
            // MPDATA,LAB,MAT,STLOC,VAL1
            if (parts.size() < 5) {
                throw new MalformedRecordException(BlockKind.MATERIAL, line, "Expected 'MPDATA,LAB,MAT,STLOC,VAL'");
            }
            label = parts.get(1);
            materialField = parts.get(2);
            locationField = parts.get(3);
            valueField = parts.get(4);
        }

        int materialId = parseInt(materialField, BlockKind.MATERIAL, line);
        int location = locationField.isBlank() ? 1 : parseInt(locationField, BlockKind.MATERIAL, line);
        if (location != 1) {
            // Temperature-dependent tables: only the first temperature point is kept.
            return;
        }
        double value = parseReal(valueField, BlockKind.MATERIAL, line);
        String key = MaterialRecord.canonicalKey(label);

        MaterialRecord record = model.getMaterials().computeIfAbsent(materialId, MaterialRecord::new);
        options.getMaterialMergePolicy().merge(record.getParameters(), key, value);
    }

    private void parseMaterialTable() {
        int line = lineNumber();
        List<String> parts = splitCommas(stripComment(advance()));
        if (parts.size() < 3) {
            throw new MalformedRecordException(BlockKind.MATERIAL_TABLE, line, "Expected 'TB,LAB,MAT'");
        }
        String label = parts.get(1).trim().toUpperCase(Locale.ROOT);
        int materialId = parseInt(parts.get(2), BlockKind.MATERIAL_TABLE, line);
        if (label.equals("PLAS") && parts.size() > 5 && !parts.get(5).isBlank()) {
            label = parts.get(5).trim().toUpperCase(Locale.ROOT);
        }

        List<Double> data = new ArrayList<>();
        List<CurvePoint> points = new ArrayList<>();
        while (!isAtEnd()) {
            String t = stripComment(peek()).trim();
            String upper = t.toUpperCase(Locale.ROOT);
            if (upper.startsWith("TBTEMP")) {
                advance();
                continue;
            }
            if (upper.startsWith("TBDATA")) {
                int dataLine = lineNumber();
                List<String> fields = splitCommas(t);
                // TBDATA,start,c1,c2,...
                for (int i = 2; i < fields.size(); i++) {
                    if (!fields.get(i).isBlank()) {
                        data.add(parseReal(fields.get(i), BlockKind.MATERIAL_TABLE, dataLine));
                    }
                }
                advance();
                continue;
            }
            if (upper.startsWith("TBPT")) {
                int dataLine = lineNumber();
                List<String> fields = splitCommas(t);
                if (fields.size() < 4) {
                    throw new MalformedRecordException(BlockKind.MATERIAL_TABLE, dataLine, "Expected 'TBPT,oper,x,y'");
                }
                points.add(new CurvePoint(parseReal(fields.get(2), BlockKind.MATERIAL_TABLE, dataLine),
                        parseReal(fields.get(3), BlockKind.MATERIAL_TABLE, dataLine)));
                advance();
                continue;
            }
            break;
        }

        MaterialRecord record = model.getMaterials().computeIfAbsent(materialId, MaterialRecord::new);
        MaterialMergePolicy policy = options.getMaterialMergePolicy();
        switch (label) {
            case "BISO" -> {
                if (data.size() < 2) {
                    throw new MalformedRecordException(BlockKind.MATERIAL_TABLE, line, "BISO needs yield stress and tangent modulus");
                }
                // Bilinear hardening as Johnson-Cook with n = 1.
                record.setLaw(MaterialLaw.JOHNSON_COOK);
                policy.merge(record.getParameters(), "A", data.get(0));
                policy.merge(record.getParameters(), "B", data.get(1));
                policy.merge(record.getParameters(), "N", 1.0);
            }
            case "MISO", "MULTILINEAR" -> {
                record.setLaw(MaterialLaw.TABULATED_PLASTIC);
                if (!points.isEmpty()) {
                    record.getCurve().clear();
                    record.getCurve().addAll(points);
                }
            }
            default -> log.debug("Skipping TB,{} for material {} at line {}", label, materialId, line);
        }
    }

    // ---- helpers ----

    private FortranFormat readFormat(FortranFormat fallback, BlockKind kind) {
        if (!isAtEnd() && FortranFormat.isFormatLine(peek())) {
            int line = lineNumber();
            return FortranFormat.parse(advance(), kind, line);
        }
        return fallback;
    }

    private static boolean isTerminator(String trimmed) {
        return trimmed.startsWith("-1") && (trimmed.length() == 2 || !Character.isDigit(trimmed.charAt(2)));
    }

    private static boolean startsWithLetter(String trimmed) {
        return !trimmed.isEmpty() && Character.isLetter(trimmed.charAt(0));
    }

    private static boolean isDelimited(String raw) {
        return raw.indexOf(',') >= 0 || raw.indexOf(';') >= 0;
    }

    private static List<String> splitDelimited(String raw) {
        List<String> parts = new ArrayList<>();
        for (String p : raw.trim().split("[,;]")) {
            if (!p.isBlank()) {
                parts.add(p.trim());
            }
        }
        return parts;
    }

    private static List<String> splitCommas(String raw) {
        List<String> parts = new ArrayList<>();
        for (String p : raw.split(",", -1)) {
            parts.add(p.trim());
        }
        return parts;
    }

    private static String stripComment(String raw) {
        int bang = raw.indexOf('!');
        return bang >= 0 ? raw.substring(0, bang) : raw;
    }

    private static int parseInt(String value, BlockKind kind, int line) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(kind, line, "Invalid integer '" + value.trim() + "'", e);
        }
    }

    private static double parseReal(String value, BlockKind kind, int line) {
        try {
            return Double.parseDouble(value.trim().replace('D', 'E').replace('d', 'e'));
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(kind, line, "Invalid number '" + value.trim() + "'", e);
        }
    }

    private boolean isAtEnd() {
        return pos >= lines.size();
    }

    private String peek() {
        return lines.get(pos);
    }

    private String advance() {
        return lines.get(pos++);
    }

    /** 1-based number of the line at the cursor. */
    private int lineNumber() {
        return pos + 1;
    }

    private record RawElement(int id, int localType, int materialId, List<Integer> nodes, int line) {
    }
}
