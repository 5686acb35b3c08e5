package org.eregs.regml.xml;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

public class RegmlDocumentsTest {

  private static final String XML =
      "<regulation xmlns=\"eregs\"><!-- dropped --><part label=\"1234\"><content>"
      + "<paragraph label=\"1234-1\">Text <ref target=\"1234-2\">here</ref></paragraph>"
      + "</content></part></regulation>";

  @Test
  void parse_is_namespace_aware_and_drops_comments() {
    Document doc = RegmlDocuments.parse(XML);
    Element root = doc.getDocumentElement();
    assertEquals("eregs", root.getNamespaceURI());
    assertEquals("regulation", Elements.localName(root));
    assertEquals(1, root.getChildNodes().getLength());
  }

  @Test
  void copy_is_independent() {
    Document doc = RegmlDocuments.parse(XML);
    Document copy = RegmlDocuments.copy(doc);
    Element part = Elements.child(copy.getDocumentElement(), "part");
    part.setAttribute("label", "9999");

    assertEquals("1234", Elements.child(doc.getDocumentElement(), "part").getAttribute("label"));
  }

  @Test
  void write_then_parse(@TempDir Path dir) {
    Path file = dir.resolve("1234.xml");
    RegmlDocuments.write(RegmlDocuments.parse(XML), file);
    Document back = RegmlDocuments.parse(file);

    Element ref = Elements.descendants(back.getDocumentElement(), "ref").get(0);
    assertEquals("1234-2", Elements.attr(ref, "target"));
    assertEquals("here", Elements.text(ref));
  }

  @Test
  void malformed_input_is_reported() {
    RegmlDocumentException e = assertThrows(RegmlDocumentException.class,
        () -> RegmlDocuments.parse("<regulation><part></regulation>"));
    assertNotNull(e.getCause());
  }

  @Test
  void missing_file_is_reported(@TempDir Path dir) {
    assertThrows(RegmlDocumentException.class, () -> RegmlDocuments.parse(dir.resolve("nope.xml")));
  }

  @Test
  void attr_and_text_distinguish_absent_from_empty() {
    Element p = Elements.descendants(RegmlDocuments.parse(XML).getDocumentElement(), "paragraph").get(0);
    assertNull(Elements.attr(p, "marker"));
    assertNull(Elements.childText(p, "title"));
    assertTrue(Elements.detach(p));
    assertFalse(Elements.detach(p));
  }
}
