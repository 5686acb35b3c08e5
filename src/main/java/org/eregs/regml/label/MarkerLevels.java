package org.eregs.regml.label;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Paragraph marker alphabets, in the priority order used when looking for a marker's
 * predecessor: lowercase, numeric, roman, uppercase, emphasized numeric, emphasized roman.
 */
public final class MarkerLevels {

    public static final List<String> LOWER = Collections.unmodifiableList(letters('a'));
    public static final List<String> INTS = Collections.unmodifiableList(ints());
    public static final List<String> ROMAN = Collections.unmodifiableList(romans());
    public static final List<String> UPPER = Collections.unmodifiableList(letters('A'));
    public static final List<String> EM_INTS = Collections.unmodifiableList(emphasized(INTS));
    public static final List<String> EM_ROMAN = Collections.unmodifiableList(emphasized(ROMAN));

    public static final List<List<String>> ALL = List.of(LOWER, INTS, ROMAN, UPPER, EM_INTS, EM_ROMAN);

    private static final int MAX_MARKER = 50;

    private MarkerLevels() {}

    /** The first level (in priority order) containing {@code marker}, or null. */
    public static List<String> levelOf(String marker) {
        for (List<String> level : ALL) {
            if (level.contains(marker)) return level;
        }
        return null;
    }

    /** a..z followed by the doubled aa..zz. */
    private static List<String> letters(char first) {
        List<String> out = new ArrayList<>(52);
        for (int i = 0; i < 26; i++) out.add(String.valueOf((char) (first + i)));
        for (int i = 0; i < 26; i++) {
            char c = (char) (first + i);
            out.add(new String(new char[]{c, c}));
        }
        return out;
    }

    private static List<String> ints() {
        List<String> out = new ArrayList<>(MAX_MARKER);
        for (int i = 1; i <= MAX_MARKER; i++) out.add(Integer.toString(i));
        return out;
    }

    private static List<String> romans() {
        List<String> out = new ArrayList<>(MAX_MARKER);
        for (int i = 1; i <= MAX_MARKER; i++) out.add(toRoman(i));
        return out;
    }

    private static List<String> emphasized(List<String> markers) {
        List<String> out = new ArrayList<>(markers.size());
        for (String m : markers) out.add("<E T=\"03\">" + m + "</E>");
        return out;
    }

    static String toRoman(int n) {
        int[] values = {50, 40, 10, 9, 5, 4, 1};
        String[] numerals = {"l", "xl", "x", "ix", "v", "iv", "i"};
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < values.length; i++) {
            while (n >= values[i]) { sb.append(numerals[i]); n -= values[i]; }
        }
        return sb.toString();
    }
}
