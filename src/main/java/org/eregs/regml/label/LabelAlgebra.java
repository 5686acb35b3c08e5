package org.eregs.regml.label;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Parent and preceding-sibling computation over dash-delimited labels
 * such as {@code 1234-1-a-2} or {@code 1234-1-a-2-Interp}.
 */
public final class LabelAlgebra {

    public static final String DELIMITER = "-";
    public static final String INTERP = "Interp";
    public static final String SUBPART = "Subpart";

    private LabelAlgebra() {}

    public static List<String> split(String label) {
        return new ArrayList<>(Arrays.asList(label.split(DELIMITER)));
    }

    public static String join(List<String> parts) {
        return parts == null ? null : String.join(DELIMITER, parts);
    }

    /** Parent label, or null for the root. */
    public static String parentLabel(String label) {
        return join(parentLabel(split(label)));
    }

    /** Preceding sibling label, or null when none can be computed. */
    public static String siblingLabel(String label) {
        return join(siblingLabel(split(label)));
    }

    public static List<String> parentLabel(List<String> parts) {
        if (parts.size() <= 1) return null;

        // {part}-Interp and {part}-{section} both hang off the part
        if (parts.size() == 2) return new ArrayList<>(parts.subList(0, 1));

        if (INTERP.equals(last(parts))) {
            List<String> parent = parentLabel(parts.subList(0, parts.size() - 1));
            if (parent == null) return null;
            parent.add(INTERP);
            return parent;
        }

        int subpart = parts.indexOf(SUBPART);
        if (subpart > 0) return new ArrayList<>(parts.subList(0, subpart));

        return new ArrayList<>(parts.subList(0, parts.size() - 1));
    }

    public static List<String> siblingLabel(List<String> parts) {
        if (parts.size() <= 1) return null;

        boolean interp = INTERP.equals(last(parts));
        int markerAt = interp ? parts.size() - 2 : parts.size() - 1;
        String marker = parts.get(markerAt);

        List<String> level = MarkerLevels.levelOf(marker);
        if (level == null) return null;
        int index = level.indexOf(marker);
        if (index == 0) return null;

        List<String> sibling = new ArrayList<>(parts.subList(0, markerAt));
        sibling.add(level.get(index - 1));
        if (interp) sibling.add(INTERP);
        return sibling;
    }

    private static String last(List<String> parts) {
        return parts.get(parts.size() - 1);
    }
}
