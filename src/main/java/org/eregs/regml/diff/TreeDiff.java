package org.eregs.regml.diff;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.w3c.dom.Document;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Label-level differences between two regulation versions:
 * {@code {label: {op: added|modified|deleted, ...}}}. The reverse of what a notice does,
 * used for reporting.
 */
public final class TreeDiff {

    public static final String ADDED = "added";
    public static final String MODIFIED = "modified";
    public static final String DELETED = "deleted";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private TreeDiff() {}

    // ---------------- Core API ----------------

    public static Map<String, Map<String, Object>> diff(Document left, Document right) {
        return diff(RegTreeBuilder.build(left), RegTreeBuilder.build(right));
    }

    /**
     * Added and modified labels come in right-hand document order, then deleted labels in
     * left-hand order.
     */
    public static Map<String, Map<String, Object>> diff(List<RegNode> left, List<RegNode> right) {
        Map<String, RegNode> l = byLabel(left);
        Map<String, RegNode> r = byLabel(right);
        Map<String, Map<String, Object>> out = new LinkedHashMap<>();

        for (RegNode rn : r.values()) {
            RegNode ln = l.get(rn.label);
            if (ln == null) {
                out.put(rn.label, change(ADDED, rn));
            } else if (!ln.contentHash.equals(rn.contentHash)) {
                out.put(rn.label, change(MODIFIED, rn));
            }
        }
        for (RegNode ln : l.values()) {
            if (!r.containsKey(ln.label)) out.put(ln.label, change(DELETED, null));
        }
        return out;
    }

    /**
     * Diffs for every ordered pair of versions, a version against itself included:
     * {@code result.get(left).get(right)}. Quadratic in the number of versions.
     */
    public static Map<String, Map<String, Map<String, Map<String, Object>>>> diffAll(Map<String, Document> versions) {
        Map<String, List<RegNode>> built = new LinkedHashMap<>();
        for (Map.Entry<String, Document> e : versions.entrySet()) built.put(e.getKey(), RegTreeBuilder.build(e.getValue()));

        Map<String, Map<String, Map<String, Map<String, Object>>>> out = new LinkedHashMap<>();
        for (Map.Entry<String, List<RegNode>> le : built.entrySet()) {
            Map<String, Map<String, Map<String, Object>>> row = new LinkedHashMap<>();
            for (Map.Entry<String, List<RegNode>> re : built.entrySet()) {
                row.put(re.getKey(), diff(le.getValue(), re.getValue()));
            }
            out.put(le.getKey(), row);
        }
        return out;
    }

    // ---------------- JSON ----------------

    public static String toJson(Map<String, Map<String, Object>> diff) {
        try {
            return MAPPER.writerWithDefaultPrettyPrinter().writeValueAsString(diff);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("diff is not serializable", e);
        }
    }

    // ---------------- Helpers ----------------

    private static Map<String, RegNode> byLabel(List<RegNode> roots) {
        Map<String, RegNode> m = new LinkedHashMap<>();
        for (RegNode root : roots) {
            for (RegNode n : root.flatten()) m.putIfAbsent(n.label, n);
        }
        return m;
    }

    private static Map<String, Object> change(String op, RegNode node) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("op", op);
        if (node != null) m.put("node", node.summary());
        return m;
    }
}
