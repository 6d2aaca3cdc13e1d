package com.radioss.translator.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.radioss.translator.exception.MalformedRecordException;

/**
 * Fixed-column layout taken from a CDB format line such as {@code (3i9,6e21.13e3)}.
 * Integer fields come first, followed by the real fields.
 */
public final class FortranFormat {

    private static final Pattern GROUP = Pattern.compile("(\\d*)([ieEfaAgG])(\\d+)(?:\\.\\d+)?(?:[eE]\\d+)?", Pattern.CASE_INSENSITIVE);

    public static final FortranFormat NBLOCK_DEFAULT = new FortranFormat(3, 9, 6, 21);
    public static final FortranFormat EBLOCK_DEFAULT = new FortranFormat(19, 9, 0, 0);
    public static final FortranFormat CMBLOCK_DEFAULT = new FortranFormat(8, 10, 0, 0);
    public static final FortranFormat ETBLOCK_DEFAULT = new FortranFormat(2, 9, 0, 0);

    private final int intCount;
    private final int intWidth;
    private final int realCount;
    private final int realWidth;

    public FortranFormat(int intCount, int intWidth, int realCount, int realWidth) {
        this.intCount = intCount;
        this.intWidth = intWidth;
        this.realCount = realCount;
        this.realWidth = realWidth;
    }

    public static boolean isFormatLine(String line) {
        return line != null && line.trim().startsWith("(");
    }

    /**
     * Parse {@code (3i9,6e21.13e3)}-style descriptors. Character groups ({@code a9}) are read as integer columns.
     */
    public static FortranFormat parse(String line, BlockKind kind, int lineNumber) {
        String body = line.trim();
        if (!body.startsWith("(") || !body.contains(")")) {
            throw new MalformedRecordException(kind, lineNumber, "Invalid format line: " + line.trim());
        }
        body = body.substring(1, body.indexOf(')'));

        int intCount = 0;
        int intWidth = 0;
        int realCount = 0;
        int realWidth = 0;
        for (String group : body.split(",")) {
            Matcher m = GROUP.matcher(group.trim());
            if (!m.matches()) {
                throw new MalformedRecordException(kind, lineNumber, "Unsupported format descriptor: " + group.trim());
            }
            int repeat = m.group(1).isEmpty() ? 1 : Integer.parseInt(m.group(1));
            String type = m.group(2).toLowerCase(Locale.ROOT);
            int width = Integer.parseInt(m.group(3));
            if (type.equals("i") || type.equals("a")) {
                if (realCount == 0) {
                    intCount += repeat;
                    intWidth = width;
                }
            } else {
                realCount += repeat;
                realWidth = width;
            }
        }
        if (intWidth == 0) {
            throw new MalformedRecordException(kind, lineNumber, "Format has no integer columns: " + line.trim());
        }
        return new FortranFormat(intCount, intWidth, realCount, realWidth);
    }

    /**
     * Integer columns of the line; trailing blank columns are dropped.
     */
    public List<String> intFields(String line) {
        List<String> fields = new ArrayList<>();
        for (int i = 0; i < intCount; i++) {
            int start = i * intWidth;
            if (start >= line.length()) {
                break;
            }
            String field = line.substring(start, Math.min(line.length(), start + intWidth)).trim();
            fields.add(field);
        }
        while (!fields.isEmpty() && fields.get(fields.size() - 1).isEmpty()) {
            fields.remove(fields.size() - 1);
        }
        return fields;
    }

    /**
     * Real columns of the line, after the integer columns. Missing columns come back as empty strings.
     */
    public List<String> realFields(String line) {
        List<String> fields = new ArrayList<>();
        int offset = intCount * intWidth;
        for (int i = 0; i < realCount; i++) {
            int start = offset + i * realWidth;
            if (start >= line.length()) {
                fields.add("");
                continue;
            }
            fields.add(line.substring(start, Math.min(line.length(), start + realWidth)).trim());
        }
        return fields;
    }

    public int getIntCount() {
        return intCount;
    }

    public int getIntWidth() {
        return intWidth;
    }

    public int getRealCount() {
        return realCount;
    }

    public int getRealWidth() {
        return realWidth;
    }
}
