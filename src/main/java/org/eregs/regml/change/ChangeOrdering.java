package org.eregs.regml.change;

import org.eregs.regml.label.LabelAlgebra;

import java.util.Comparator;

/** Orderings that make the result of a notice independent of its changeset order. */
final class ChangeOrdering {

    private static final String INTERP_SUFFIX = LabelAlgebra.DELIMITER + LabelAlgebra.INTERP;

    /**
     * Part first; within a part, subpart labels ({@code 1234-Subpart} as well as
     * {@code 1234-Subpart-A}) before everything else; then the label with {@code -Interp}
     * removed, so {@code 1234-Interp} sits next to {@code 1234} rather than after
     * {@code 1234-1-Interp}; the raw label breaks ties.
     */
    static final Comparator<String> LABELS = Comparator
            .comparing(ChangeOrdering::partOf)
            .thenComparing(l -> LabelAlgebra.split(l).contains(LabelAlgebra.SUBPART) ? 0 : 1)
            .thenComparing(l -> l.replace(INTERP_SUFFIX, ""))
            .thenComparing(Comparator.naturalOrder());

    static final Comparator<Change> BY_LABEL = Comparator.comparing(Change::label, LABELS);

    static final Comparator<Change.ChangeTarget> RETARGETS = Comparator
            .comparing((Change.ChangeTarget c) -> c.oldTarget)
            .thenComparing(c -> c.newTarget)
            .thenComparing(c -> c.text == null ? "" : c.text);

    private ChangeOrdering() {}

    private static String partOf(String label) {
        int i = label.indexOf(LabelAlgebra.DELIMITER);
        return i < 0 ? label : label.substring(0, i);
    }
}
