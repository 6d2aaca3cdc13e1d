package com.radioss.translator.deck;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collection;
import java.util.Iterator;
import java.util.Locale;

/**
 * Fixed-column formatting shared by the mesh and starter writers.
 * Integers take 10 columns, reals 20, both right-aligned.
 */
public final class CardFormat {

    public static final int INT_WIDTH = 10;
    public static final int REAL_WIDTH = 20;

    /** One column of a real field stays blank so neighbouring values never touch. */
    private static final int MAX_NUMBER_LENGTH = REAL_WIDTH - 1;

    private CardFormat() {
    }

    /**
     * Shortest text that reads back as the same double; plain notation between 1e-4 and 1e10, scientific outside.
     * Always carries a decimal point or an exponent so the solver reads it as a real.
     * Text that would not leave a separating blank in a real column falls back to scientific notation,
     * and only then to fewer significant digits.
     */
    public static String number(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Cannot write non-finite value " + value);
        }
        if (value == 0.0) {
            return "0.0";
        }
        BigDecimal decimal = BigDecimal.valueOf(value).stripTrailingZeros();
        double magnitude = Math.abs(value);
        boolean plainRange = magnitude >= 1e-4 && magnitude < 1e10;
        String text = text(decimal, plainRange);
        for (int digits = decimal.precision() - 1; text.length() > MAX_NUMBER_LENGTH && digits > 0; digits--) {
            text = text(decimal.round(new MathContext(digits)), plainRange);
        }
        return text;
    }

    private static String text(BigDecimal value, boolean plainRange) {
        if (plainRange) {
            String plain = value.stripTrailingZeros().toPlainString();
            if (plain.indexOf('.') < 0) {
                plain = plain + ".0";
            }
            if (plain.length() <= MAX_NUMBER_LENGTH) {
                return plain;
            }
        }
        return scientific(value);
    }

    private static String scientific(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        String digits = stripped.unscaledValue().abs().toString();
        int exponent = digits.length() - 1 - stripped.scale();
        StringBuilder sb = new StringBuilder();
        if (stripped.signum() < 0) {
            sb.append('-');
        }
        sb.append(digits.charAt(0)).append('.').append(digits.length() > 1 ? digits.substring(1) : "0");
        return sb.append('E').append(exponent).toString();
    }

    public static String intColumn(long value) {
        return String.format(Locale.ROOT, "%10d", value);
    }

    public static String realColumn(double value) {
        return leftPad(number(value), REAL_WIDTH);
    }

    public static String textColumn(String value) {
        return leftPad(value, INT_WIDTH);
    }

    public static String textColumn(String value, int width) {
        return leftPad(value, width);
    }

    public static String ints(long... values) {
        StringBuilder sb = new StringBuilder();
        for (long value : values) {
            sb.append(intColumn(value));
        }
        return sb.toString();
    }

    public static String reals(double... values) {
        StringBuilder sb = new StringBuilder();
        for (double value : values) {
            sb.append(realColumn(value));
        }
        return sb.toString();
    }

    /**
     * Column comment line, e.g. {@code #  prop_ID    mat_ID}. Labels are right-aligned over their columns.
     */
    public static String header(int width, String... labels) {
        StringBuilder sb = new StringBuilder("#");
        for (int i = 0; i < labels.length; i++) {
            int w = i == 0 ? width - 1 : width;
            sb.append(leftPad(labels[i], w));
        }
        return sb.toString();
    }

    /**
     * Identifier lines, {@code perLine} values each.
     */
    public static void appendIdLines(StringBuilder out, Collection<Integer> ids, int perLine) {
        Iterator<Integer> it = ids.iterator();
        int onLine = 0;
        while (it.hasNext()) {
            out.append(intColumn(it.next()));
            if (++onLine == perLine) {
                out.append('\n');
                onLine = 0;
            }
        }
        if (onLine > 0) {
            out.append('\n');
        }
    }

    private static String leftPad(String value, int width) {
        if (value.length() >= width) {
            return value;
        }
        return " ".repeat(width - value.length()) + value;
    }
}
