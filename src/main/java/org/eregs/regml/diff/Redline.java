package org.eregs.regml.diff;

import org.eregs.regml.label.LabelAlgebra;
import org.eregs.regml.xml.Elements;
import org.eregs.regml.xml.RegmlDocuments;
import org.eregs.regml.xml.RegmlNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A marked-up copy of the left version showing what the right version changed.
 *
 * <ul>
 *   <li>Labels only on the right are copied in next to their preceding sibling and
 *       marked {@code action="added"}, descendants included.</li>
 *   <li>Labels only on the left stay in place, marked {@code action="deleted"}.</li>
 *   <li>Sections whose subject changed carry {@code leftSubject} and {@code rightSubject};
 *       interpretation sections and paragraphs likewise pair titles, and paragraphs pair
 *       their {@code content}. Such nodes are marked {@code action="modified"}.</li>
 *   <li>The first table of contents is the right one, with entries for modified sections
 *       marked {@code action="modified"}.</li>
 * </ul>
 */
public final class Redline {

    private static final Logger log = LoggerFactory.getLogger(Redline.class);

    private Redline() {}

    public static Document of(Document left, Document right) {
        Document out = RegmlDocuments.copy(left);
        Map<String, Element> outLabels = labeled(out.getDocumentElement());
        Map<String, Element> rightLabels = labeled(right.getDocumentElement());
        Set<String> leftLabels = new LinkedHashSet<>(outLabels.keySet());

        int added = 0;
        for (Map.Entry<String, Element> e : rightLabels.entrySet()) {
            if (leftLabels.contains(e.getKey())) continue;
            Element r = e.getValue();
            Element ancestor = labeledAncestor(r);
            // nested additions travel with the outermost added node
            if (ancestor != null && !leftLabels.contains(ancestor.getAttribute(RegmlNames.ATTR_LABEL))) continue;

            Element copy = (Element) out.importNode(r, true);
            mark(copy, TreeDiff.ADDED);
            Element prev = previousLabeled(r);
            Element anchor = prev == null ? null : outLabels.get(prev.getAttribute(RegmlNames.ATTR_LABEL));
            if (anchor != null) {
                Elements.insertAfter(anchor, copy);
            } else {
                Element parent = ancestor == null
                        ? out.getDocumentElement()
                        : outLabels.get(ancestor.getAttribute(RegmlNames.ATTR_LABEL));
                contentOf(parent).appendChild(copy);
            }
            for (Map.Entry<String, Element> n : labeled(copy).entrySet()) outLabels.putIfAbsent(n.getKey(), n.getValue());
            added++;
        }

        int deleted = 0;
        for (String label : leftLabels) {
            if (rightLabels.containsKey(label)) continue;
            mark(outLabels.get(label), TreeDiff.DELETED);
            deleted++;
        }

        Set<String> modifiedTocTargets = new HashSet<>();
        int modified = 0;
        for (String label : leftLabels) {
            Element r = rightLabels.get(label);
            if (r == null) continue;
            if (compare(outLabels.get(label), r)) {
                modifiedTocTargets.add(tocTarget(label));
                modified++;
            }
        }

        replaceToc(out, right, modifiedTocTargets);
        log.info("Redline: {} added, {} deleted, {} modified", added, deleted, modified);
        return out;
    }

    // ---------------- Modified nodes ----------------

    /** Pairs the changed parts of {@code l} with those of {@code r}; true if anything differed. */
    private static boolean compare(Element l, Element r) {
        String type = Elements.localName(l);
        if (!type.equals(Elements.localName(r))) {
            log.warn("{} is a {} on the left but a {} on the right", l.getAttribute(RegmlNames.ATTR_LABEL), type, Elements.localName(r));
            return false;
        }
        boolean changed = false;
        if (RegmlNames.SECTION.equals(type)) {
            changed = pair(l, r, RegmlNames.SUBJECT, RegmlNames.LEFT_SUBJECT, RegmlNames.RIGHT_SUBJECT);
        } else if (RegmlNames.INTERP_SECTION.equals(type)) {
            changed = pair(l, r, RegmlNames.TITLE, RegmlNames.LEFT_TITLE, RegmlNames.RIGHT_TITLE);
        } else if (RegmlNames.PARAGRAPH.equals(type) || RegmlNames.INTERP_PARAGRAPH.equals(type)) {
            changed = pair(l, r, RegmlNames.TITLE, RegmlNames.LEFT_TITLE, RegmlNames.RIGHT_TITLE);
            changed |= pair(l, r, RegmlNames.CONTENT, RegmlNames.LEFT_CONTENT, RegmlNames.RIGHT_CONTENT);
        }
        if (changed) l.setAttribute(RegmlNames.ATTR_ACTION, TreeDiff.MODIFIED);
        return changed;
    }

    /**
     * When the {@code name} children differ in text, renames the left one to {@code leftName}
     * and puts a copy of the right one, renamed {@code rightName}, after it.
     */
    private static boolean pair(Element l, Element r, String name, String leftName, String rightName) {
        Element le = Elements.child(l, name);
        Element re = Elements.child(r, name);
        if (le == null || re == null) return false;
        if (Objects.equals(normalized(le), normalized(re))) return false;

        Document doc = l.getOwnerDocument();
        Element renamed = rename(le, leftName);
        Element copy = rename((Element) doc.importNode(re, true), rightName);
        Elements.insertAfter(renamed, copy);
        return true;
    }

    private static Element rename(Element el, String localName) {
        String prefix = el.getPrefix();
        return (Element) el.getOwnerDocument().renameNode(el, el.getNamespaceURI(),
                prefix == null ? localName : prefix + ":" + localName);
    }

    // ---------------- Table of contents ----------------

    private static void replaceToc(Document out, Document right, Set<String> modifiedTargets) {
        List<Element> leftTocs = Elements.descendants(out.getDocumentElement(), RegmlNames.TABLE_OF_CONTENTS);
        List<Element> rightTocs = Elements.descendants(right.getDocumentElement(), RegmlNames.TABLE_OF_CONTENTS);
        if (leftTocs.isEmpty() || rightTocs.isEmpty()) return;

        Element toc = (Element) out.importNode(rightTocs.get(0), true);
        for (Element entry : Elements.children(toc)) {
            if (modifiedTargets.contains(Elements.attr(entry, RegmlNames.ATTR_TARGET))) {
                entry.setAttribute(RegmlNames.ATTR_ACTION, TreeDiff.MODIFIED);
            }
        }
        Element old = leftTocs.get(0);
        old.getParentNode().replaceChild(toc, old);
    }

    /** Section-level label a TOC entry would target: the first two segments. */
    private static String tocTarget(String label) {
        List<String> parts = LabelAlgebra.split(label);
        return parts.size() <= 2 ? label : LabelAlgebra.join(parts.subList(0, 2));
    }

    // ---------------- Helpers ----------------

    private static Map<String, Element> labeled(Element root) {
        Map<String, Element> out = new LinkedHashMap<>();
        String own = Elements.attr(root, RegmlNames.ATTR_LABEL);
        if (own != null) out.put(own, root);
        for (Element c : Elements.children(root)) {
            for (Map.Entry<String, Element> e : labeled(c).entrySet()) out.putIfAbsent(e.getKey(), e.getValue());
        }
        return out;
    }

    private static Element labeledAncestor(Element el) {
        Node n = el.getParentNode();
        while (n != null && n.getNodeType() == Node.ELEMENT_NODE) {
            if (((Element) n).hasAttribute(RegmlNames.ATTR_LABEL)) return (Element) n;
            n = n.getParentNode();
        }
        return null;
    }

    private static Element previousLabeled(Element el) {
        Node n = el.getPreviousSibling();
        while (n != null) {
            if (n.getNodeType() == Node.ELEMENT_NODE && ((Element) n).hasAttribute(RegmlNames.ATTR_LABEL)) return (Element) n;
            n = n.getPreviousSibling();
        }
        return null;
    }

    /** Parts and subparts keep their children in a nested {@code content} element. */
    private static Element contentOf(Element parent) {
        if (!Elements.is(parent, RegmlNames.PART) && !Elements.is(parent, RegmlNames.SUBPART)) return parent;
        Element content = Elements.child(parent, RegmlNames.CONTENT);
        return content == null ? parent : content;
    }

    private static void mark(Element el, String action) {
        el.setAttribute(RegmlNames.ATTR_ACTION, action);
        for (Element c : Elements.children(el)) mark(c, action);
    }

    private static String normalized(Element el) {
        return Elements.text(el).replaceAll("\\s+", " ");
    }
}
