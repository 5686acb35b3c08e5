package org.eregs.regml;

import org.eregs.regml.xml.Elements;
import org.eregs.regml.xml.RegmlDocuments;
import org.eregs.regml.xml.RegmlNames;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.List;

/** Inline RegML documents for tests. */
public final class Fixtures {

  private Fixtures() {}

  public static Document regulation(String body) {
    return RegmlDocuments.parse("<regulation xmlns=\"eregs\">"
        + "<fdsys><title>Old fdsys</title></fdsys>"
        + "<preamble><documentNumber>2014-000</documentNumber><effectiveDate>2014-01-01</effectiveDate></preamble>"
        + body
        + "</regulation>");
  }

  public static Document notice(String changes) {
    return notice("2015-001", "2015-01-01", "2014-000", changes, "");
  }

  public static Document notice(String docNumber, String effective, String appliesTo, String changes, String extra) {
    return RegmlDocuments.parse("<notice xmlns=\"eregs\">"
        + "<fdsys><title>Notice fdsys</title></fdsys>"
        + "<preamble><documentNumber>" + docNumber + "</documentNumber>"
        + "<effectiveDate>" + effective + "</effectiveDate></preamble>"
        + "<changeset leftDocumentNumber=\"" + appliesTo + "\">" + changes + "</changeset>"
        + extra
        + "</notice>");
  }

  /** The element labeled {@code label}, or null. */
  public static Element find(Document doc, String label) {
    for (Element e : all(doc.getDocumentElement())) {
      if (label.equals(Elements.attr(e, RegmlNames.ATTR_LABEL))) return e;
    }
    return null;
  }

  /** Labels of the element children of {@code parent}, in order. */
  public static List<String> childLabels(Element parent) {
    List<String> out = new ArrayList<>();
    for (Element c : Elements.children(parent)) out.add(c.getAttribute(RegmlNames.ATTR_LABEL));
    return out;
  }

  /** Every labeled element's label, in document order. */
  public static List<String> allLabels(Document doc) {
    List<String> out = new ArrayList<>();
    for (Element e : all(doc.getDocumentElement())) {
      String l = Elements.attr(e, RegmlNames.ATTR_LABEL);
      if (l != null) out.add(l);
    }
    return out;
  }

  public static int indexInParent(Element el) {
    return Elements.children((Element) el.getParentNode()).indexOf(el);
  }

  private static List<Element> all(Element root) {
    List<Element> out = new ArrayList<>();
    out.add(root);
    for (Element c : Elements.children(root)) out.addAll(all(c));
    return out;
  }
}
