package org.eregs.regml.xml;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.List;

/** Small DOM helpers. Element names are matched on local name only. */
public final class Elements {

    private Elements() {}

    public static String localName(Node n) {
        String ln = n.getLocalName();
        return ln == null ? n.getNodeName() : ln;
    }

    public static boolean is(Node n, String localName) {
        return n != null && n.getNodeType() == Node.ELEMENT_NODE && localName.equals(localName(n));
    }

    public static List<Element> children(Element parent) {
        List<Element> out = new ArrayList<>();
        NodeList kids = parent.getChildNodes();
        for (int i = 0; i < kids.getLength(); i++) {
            Node k = kids.item(i);
            if (k.getNodeType() == Node.ELEMENT_NODE) out.add((Element) k);
        }
        return out;
    }

    public static List<Element> children(Element parent, String localName) {
        List<Element> out = new ArrayList<>();
        for (Element c : children(parent)) {
            if (localName.equals(localName(c))) out.add(c);
        }
        return out;
    }

    public static Element child(Element parent, String localName) {
        for (Element c : children(parent)) {
            if (localName.equals(localName(c))) return c;
        }
        return null;
    }

    /** All descendants of {@code root} (document order, root excluded) with the given local name. */
    public static List<Element> descendants(Element root, String localName) {
        List<Element> out = new ArrayList<>();
        collect(root, localName, out);
        return out;
    }

    private static void collect(Element el, String localName, List<Element> out) {
        for (Element c : children(el)) {
            if (localName.equals(localName(c))) out.add(c);
            collect(c, localName, out);
        }
    }

    /** Trimmed text content, or null when the element is absent. */
    public static String text(Element el) {
        if (el == null) return null;
        String t = el.getTextContent();
        return t == null ? "" : t.trim();
    }

    public static String childText(Element parent, String localName) {
        return text(child(parent, localName));
    }

    /** Attribute value, with the DOM's empty string for "absent" turned into null. */
    public static String attr(Element el, String name) {
        if (!el.hasAttribute(name)) return null;
        return el.getAttribute(name);
    }

    /** Creates an element in the namespace and prefix of {@code like}. */
    public static Element create(Document doc, Element like, String localName) {
        String ns = like.getNamespaceURI();
        if (ns == null) return doc.createElement(localName);
        String prefix = like.getPrefix();
        return doc.createElementNS(ns, prefix == null ? localName : prefix + ":" + localName);
    }

    public static void insertAt(Element parent, Node child, int index) {
        List<Element> kids = children(parent);
        if (index >= kids.size()) parent.appendChild(child);
        else parent.insertBefore(child, kids.get(index));
    }

    public static void insertAfter(Node anchor, Node child) {
        Node parent = anchor.getParentNode();
        Node next = anchor.getNextSibling();
        if (next == null) parent.appendChild(child);
        else parent.insertBefore(child, next);
    }

    /** Detaches {@code n} from its parent; returns false if it had none. */
    public static boolean detach(Node n) {
        Node parent = n.getParentNode();
        if (parent == null) return false;
        parent.removeChild(n);
        return true;
    }
}
