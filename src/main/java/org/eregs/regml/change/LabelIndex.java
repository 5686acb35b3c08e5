package org.eregs.regml.change;

import org.eregs.regml.xml.Elements;
import org.eregs.regml.xml.RegmlNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/** Label to element map over one document, kept current as the engine edits it. */
final class LabelIndex {

    private static final Logger log = LoggerFactory.getLogger(LabelIndex.class);

    private final Map<String, Element> byLabel = new HashMap<>();

    LabelIndex(Element root) {
        index(root);
    }

    Element get(String label) {
        return label == null ? null : byLabel.get(label);
    }

    boolean contains(String label) {
        return byLabel.containsKey(label);
    }

    /** Adds every labeled element of the subtree. */
    void index(Element subtree) {
        visit(subtree, true);
    }

    /** Drops every labeled element of the subtree. */
    void unindex(Element subtree) {
        visit(subtree, false);
    }

    void relabel(String oldLabel, String newLabel) {
        Element el = byLabel.remove(oldLabel);
        if (el != null) byLabel.put(newLabel, el);
    }

    /** Labels in the subtree, in document order. */
    static List<String> labelsIn(Element subtree) {
        List<String> out = new ArrayList<>();
        String own = Elements.attr(subtree, RegmlNames.ATTR_LABEL);
        if (own != null) out.add(own);
        for (Element c : Elements.children(subtree)) out.addAll(labelsIn(c));
        return out;
    }

    private void visit(Element el, boolean add) {
        String label = Elements.attr(el, RegmlNames.ATTR_LABEL);
        if (label != null) {
            if (add) {
                Element prior = byLabel.putIfAbsent(label, el);
                if (prior != null && prior != el) log.warn("Label {} appears more than once; keeping the first", label);
            } else if (byLabel.get(label) == el) {
                byLabel.remove(label);
            }
        }
        for (Element c : Elements.children(el)) visit(c, add);
    }
}
