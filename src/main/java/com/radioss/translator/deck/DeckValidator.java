package com.radioss.translator.deck;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Structural checks on a written starter deck.
 *
 * Checks the keyword vocabulary this translator writes, the {@code /BEGIN ... /END} framing,
 * that data lines are numeric, and that every {@code /PART} points at a property, a material
 * and (when non-zero) a subset defined in the same deck. Connector, box and time history cards
 * must carry all their rows. It does not judge physical validity.
 */
public class DeckValidator {
    private static final Logger log = LoggerFactory.getLogger(DeckValidator.class);

    private static final Pattern NUMBER = Pattern.compile("[+-]?(?:\\d+\\.\\d*|\\d*\\.\\d+|\\d+)(?:[Ee][+-]?\\d+)?");
    private static final Pattern BCS_CODE = Pattern.compile("[01]{3}");
    private static final Set<String> WORD_TOKENS = Set.of("X", "Y", "Z", "XX", "YY", "ZZ");

    private static final List<String> KEYWORDS = List.of(
            "/BEGIN", "/END", "/NODE", "/SHELL", "/SH3N", "/BRICK", "/BRIC20", "/TETRA4", "/TETRA10",
            "/BEAM", "/TRUSS", "/SPRING",
            "/MAT/", "/FAIL/", "/FUNCT/", "/PROP/", "/PART/", "/SUBSET/", "/GRNOD/NODE/", "/GRNOD/BOX/", "/BOX/RECTA/",
            "/RBODY/", "/RBE2/", "/RBE3/", "/TH/",
            "/BCS/", "/BOUNDARY/PRESCRIBED_MOTION/", "/INTER/TYPE7/", "/INTER/TYPE2/", "/SURF/SEG/",
            "/IMPVEL/", "/CLOAD/", "/GRAV/", "/INIVEL/TRA/", "/SENSOR/TIME/",
            "/RUN/", "/STOP", "/TFILE/", "/ANIM/DT", "/DT/NODA/CST/0", "/PRINT/", "/RFILE/", "/H3D/DT", "/ADYREL");

    /** Keywords whose first data line is a free-text title. */
    private static final List<String> TITLED = List.of(
            "/MAT/", "/FUNCT/", "/PROP/", "/PART/", "/SUBSET/", "/GRNOD/", "/BCS/", "/BOUNDARY/",
            "/INTER/", "/SURF/", "/IMPVEL/", "/CLOAD/", "/GRAV/", "/INIVEL/", "/SENSOR/", "/BOX/",
            "/RBODY/", "/RBE2/", "/RBE3/", "/TH/");

    /** Fewest non-comment lines after the keyword, title included. */
    private static final Map<String, Integer> MIN_DATA_LINES = Map.of(
            "/RBODY/", 4,
            "/RBE2/", 2,
            "/RBE3/", 3,
            "/BOX/RECTA/", 4,
            "/GRNOD/BOX/", 2,
            "/TH/", 3);

    /** Output variable names on /TH data lines. */
    private static final Pattern TH_VARIABLE = Pattern.compile("[A-Z][A-Z0-9_]*");

    /** Lines after /BEGIN: run name, version, input units, work units. */
    private static final int BEGIN_LINES = 4;

    public List<String> validate(String deck) {
        List<String> errors = new ArrayList<>();
        String[] lines = deck.split("\\R", -1);

        Set<Integer> properties = new HashSet<>();
        Set<Integer> materials = new HashSet<>();
        Set<Integer> subsets = new HashSet<>();
        List<int[]> partReferences = new ArrayList<>();
        List<Integer> partLines = new ArrayList<>();

        int beginCount = 0;
        int endLine = -1;
        boolean sawKeyword = false;
        String current = null;
        int currentLine = 0;
        int dataLine = 0;

        for (int i = 0; i < lines.length; i++) {
            String line = lines[i].stripTrailing();
            int number = i + 1;
            if (line.isBlank() || line.startsWith("#")) {
                continue;
            }
            if (endLine > 0) {
                errors.add("Line " + number + ": content after /END");
                break;
            }
            if (line.startsWith("/")) {
                String keyword = line.split("\\s+")[0];
                if (!isKnown(keyword)) {
                    errors.add("Line " + number + ": unknown keyword " + keyword);
                }
                if (!sawKeyword && !keyword.equals("/BEGIN")) {
                    errors.add("Line " + number + ": deck must start with /BEGIN");
                }
                sawKeyword = true;
                if (keyword.equals("/BEGIN")) {
                    beginCount++;
                } else if (keyword.equals("/END")) {
                    endLine = number;
                }
                registerDefinition(keyword, properties, materials, subsets);
                checkComplete(current, currentLine, dataLine, errors);
                current = keyword;
                currentLine = number;
                dataLine = 0;
                continue;
            }

            dataLine++;
            if (current == null) {
                errors.add("Line " + number + ": data before the first keyword");
                continue;
            }
            if (isTextLine(current, dataLine)) {
                continue;
            }
            String[] tokens = line.trim().split("\\s+");
            if (current.startsWith("/TH/") && isVariableLine(tokens)) {
                continue;
            }
            for (String token : tokens) {
                if (!isNumericToken(token)) {
                    errors.add("Line " + number + ": non-numeric value '" + token + "' in " + current);
                    break;
                }
            }
            if (current.startsWith("/PART/") && dataLine == 2) {
                if (tokens.length < 3 || !allIntegers(tokens)) {
                    errors.add("Line " + number + ": /PART needs prop_ID mat_ID subset_ID");
                } else {
                    partReferences.add(new int[] {
                            Integer.parseInt(tokens[0]), Integer.parseInt(tokens[1]), Integer.parseInt(tokens[2]) });
                    partLines.add(number);
                }
            }
        }

        if (endLine < 0) {
            checkComplete(current, currentLine, dataLine, errors);
        }
        if (!sawKeyword) {
            errors.add("No keywords found");
        }
        if (beginCount != 1 && sawKeyword) {
            errors.add("Expected exactly one /BEGIN, found " + beginCount);
        }
        if (endLine < 0) {
            errors.add("Missing /END");
        }

        for (int p = 0; p < partReferences.size(); p++) {
            int[] ref = partReferences.get(p);
            int line = partLines.get(p);
            if (!properties.contains(ref[0])) {
                errors.add("Line " + line + ": /PART references undefined property " + ref[0]);
            }
            if (!materials.contains(ref[1])) {
                errors.add("Line " + line + ": /PART references undefined material " + ref[1]);
            }
            if (ref[2] != 0 && !subsets.contains(ref[2])) {
                errors.add("Line " + line + ": /PART references undefined subset " + ref[2]);
            }
        }

        if (errors.isEmpty()) {
            log.debug("Deck is valid ({} lines)", lines.length);
        } else {
            log.warn("Deck validation found {} problem(s)", errors.size());
        }
        return errors;
    }

    private static boolean isKnown(String keyword) {
        for (String known : KEYWORDS) {
            if (known.endsWith("/") ? keyword.startsWith(known) : keyword.equals(known) || keyword.startsWith(known + "/")) {
                return true;
            }
        }
        return false;
    }

    private static void checkComplete(String keyword, int line, int dataLines, List<String> errors) {
        if (keyword == null) {
            return;
        }
        for (Map.Entry<String, Integer> entry : MIN_DATA_LINES.entrySet()) {
            if (keyword.startsWith(entry.getKey()) && dataLines < entry.getValue()) {
                errors.add("Line " + line + ": incomplete " + keyword + " block");
            }
        }
    }

    private static boolean isVariableLine(String[] tokens) {
        for (String token : tokens) {
            if (!TH_VARIABLE.matcher(token).matches()) {
                return false;
            }
        }
        return true;
    }

    private static boolean isTextLine(String keyword, int dataLine) {
        if (keyword.equals("/BEGIN")) {
            return dataLine <= BEGIN_LINES && dataLine != 2;
        }
        if (dataLine != 1) {
            return false;
        }
        for (String titled : TITLED) {
            if (keyword.startsWith(titled)) {
                return true;
            }
        }
        return false;
    }

    private static void registerDefinition(String keyword, Set<Integer> properties, Set<Integer> materials,
            Set<Integer> subsets) {
        Integer id = trailingId(keyword);
        if (id == null) {
            return;
        }
        if (keyword.startsWith("/PROP/")) {
            properties.add(id);
        } else if (keyword.startsWith("/MAT/")) {
            materials.add(id);
        } else if (keyword.startsWith("/SUBSET/")) {
            subsets.add(id);
        }
    }

    private static Integer trailingId(String keyword) {
        String last = keyword.substring(keyword.lastIndexOf('/') + 1);
        if (last.isEmpty() || !last.chars().allMatch(Character::isDigit)) {
            return null;
        }
        return Integer.parseInt(last);
    }

    private static boolean isNumericToken(String token) {
        return NUMBER.matcher(token).matches() || WORD_TOKENS.contains(token) || BCS_CODE.matcher(token).matches();
    }

    private static boolean allIntegers(String[] tokens) {
        for (int i = 0; i < 3; i++) {
            if (!tokens[i].chars().allMatch(Character::isDigit)) {
                return false;
            }
        }
        return true;
    }
}
