package org.eregs.regml.diff;

import org.eregs.regml.xml.Elements;
import org.eregs.regml.xml.RegmlNames;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Builds the {@link RegNode} model of a regulation. Every labeled element becomes a node;
 * its hash covers only what is not itself labeled, so editing a paragraph does not mark
 * the section around it as changed. Tables of contents are denormalized copies of other
 * nodes' data and are left out of hashes.
 */
public final class RegTreeBuilder {

    private RegTreeBuilder() {}

    /** Top-level labeled nodes of the document, in document order. */
    public static List<RegNode> build(Document doc) {
        List<RegNode> out = new ArrayList<>();
        Element root = doc.getDocumentElement();
        if (root != null) collect(root, out);
        return out;
    }

    private static void collect(Element el, List<RegNode> out) {
        if (el.hasAttribute(RegmlNames.ATTR_LABEL)) {
            out.add(node(el));
            return;
        }
        for (Element c : Elements.children(el)) collect(c, out);
    }

    private static RegNode node(Element el) {
        List<RegNode> children = new ArrayList<>();
        for (Element c : Elements.children(el)) collect(c, children);

        StringBuilder text = new StringBuilder();
        renderText(el, text);
        String rendered = text.toString().trim().replaceAll("\\s+", " ");

        StringBuilder source = new StringBuilder();
        canonicalSource(el, source);

        String type = Elements.localName(el);
        String hash = Hashes.hex(Hashes.sha256("N|" + type + "|" + rendered + "|" + source));
        return new RegNode(el.getAttribute(RegmlNames.ATTR_LABEL), type, rendered, hash, children);
    }

    private static void renderText(Element el, StringBuilder out) {
        NodeList kids = el.getChildNodes();
        for (int i = 0; i < kids.getLength(); i++) {
            Node k = kids.item(i);
            if (k.getNodeType() == Node.TEXT_NODE || k.getNodeType() == Node.CDATA_SECTION_NODE) {
                out.append(k.getNodeValue()).append(' ');
            } else if (k.getNodeType() == Node.ELEMENT_NODE && !skipped((Element) k)) {
                renderText((Element) k, out);
            }
        }
    }

    /** Element name, sorted attributes, trimmed text and unlabeled children, in order. */
    private static void canonicalSource(Element el, StringBuilder out) {
        out.append('<').append(Elements.localName(el));
        NamedNodeMap attrs = el.getAttributes();
        List<String> an = new ArrayList<>();
        for (int i = 0; i < attrs.getLength(); i++) {
            Node a = attrs.item(i);
            if (!"http://www.w3.org/2000/xmlns/".equals(a.getNamespaceURI())) an.add(Elements.localName(a) + "=" + a.getNodeValue());
        }
        Collections.sort(an);
        for (String a : an) out.append(' ').append(a);
        out.append('>');

        NodeList kids = el.getChildNodes();
        for (int i = 0; i < kids.getLength(); i++) {
            Node k = kids.item(i);
            if (k.getNodeType() == Node.TEXT_NODE || k.getNodeType() == Node.CDATA_SECTION_NODE) {
                String t = k.getNodeValue().trim();
                if (!t.isEmpty()) out.append(t.replaceAll("\\s+", " "));
            } else if (k.getNodeType() == Node.ELEMENT_NODE && !skipped((Element) k)) {
                canonicalSource((Element) k, out);
            }
        }
        out.append("</").append(Elements.localName(el)).append('>');
    }

    private static boolean skipped(Element el) {
        return el.hasAttribute(RegmlNames.ATTR_LABEL) || Elements.is(el, RegmlNames.TABLE_OF_CONTENTS);
    }
}
