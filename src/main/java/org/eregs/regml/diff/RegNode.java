package org.eregs.regml.diff;

import org.eregs.regml.label.LabelAlgebra;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Comparison model of one labeled element: its own content, with labeled children split out. */
public final class RegNode {

    public final String label;
    public final String nodeType;
    /** Whitespace-normalized text of the element, excluding labeled descendants. */
    public final String text;
    /** Hex SHA-256 over node type, text and canonical source. */
    public final String contentHash;
    public final List<RegNode> children;

    RegNode(String label, String nodeType, String text, String contentHash, List<RegNode> children) {
        this.label = label;
        this.nodeType = nodeType;
        this.text = text;
        this.contentHash = contentHash;
        this.children = Collections.unmodifiableList(children);
    }

    /** This node and all its descendants, pre-order. */
    public List<RegNode> flatten() {
        List<RegNode> out = new ArrayList<>();
        flatten(this, out);
        return out;
    }

    private static void flatten(RegNode n, List<RegNode> out) {
        out.add(n);
        for (RegNode c : n.children) flatten(c, out);
    }

    Map<String, Object> summary() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("label", LabelAlgebra.split(label));
        m.put("node_type", nodeType);
        m.put("text", text);
        return m;
    }
}
