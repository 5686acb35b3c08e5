package org.eregs.regml.diff;

import org.eregs.regml.Fixtures;
import org.eregs.regml.toc.TocIndex;
import org.eregs.regml.xml.Elements;
import org.eregs.regml.xml.RegmlDocuments;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.Arrays;

import static org.eregs.regml.Fixtures.childLabels;
import static org.eregs.regml.Fixtures.find;
import static org.eregs.regml.Fixtures.regulation;
import static org.junit.jupiter.api.Assertions.*;

public class RedlineTest {

  private static final String LEFT =
      "<part label=\"1234\">"
      + "<tableOfContents>"
      + "<tocSecEntry target=\"1234-1\"><sectionNum>1</sectionNum><sectionSubject>§ 1234.1 Authority.</sectionSubject></tocSecEntry>"
      + "<tocSecEntry target=\"1234-2\"><sectionNum>2</sectionNum><sectionSubject>§ 1234.2 Definitions.</sectionSubject></tocSecEntry>"
      + "</tableOfContents>"
      + "<content>"
      + "<section label=\"1234-1\" sectionNum=\"1\"><subject>§ 1234.1 Authority.</subject>"
      + "<paragraph label=\"1234-1-a\"><content>Old text</content></paragraph>"
      + "<paragraph label=\"1234-1-b\"><content>Unchanged</content></paragraph>"
      + "</section>"
      + "<section label=\"1234-2\" sectionNum=\"2\"><subject>§ 1234.2 Definitions.</subject>"
      + "<paragraph label=\"1234-2-a\"><content>Going away</content></paragraph>"
      + "</section>"
      + "</content></part>";

  private static final String RIGHT =
      "<part label=\"1234\">"
      + "<tableOfContents>"
      + "<tocSecEntry target=\"1234-1\"><sectionNum>1</sectionNum><sectionSubject>§ 1234.1 Authority and purpose.</sectionSubject></tocSecEntry>"
      + "<tocSecEntry target=\"1234-2\"><sectionNum>2</sectionNum><sectionSubject>§ 1234.2 Definitions.</sectionSubject></tocSecEntry>"
      + "</tableOfContents>"
      + "<content>"
      + "<section label=\"1234-1\" sectionNum=\"1\"><subject>§ 1234.1 Authority and purpose.</subject>"
      + "<paragraph label=\"1234-1-a\"><content>New   text</content></paragraph>"
      + "<paragraph label=\"1234-1-b\"><content>Unchanged</content></paragraph>"
      + "<paragraph label=\"1234-1-c\"><content>Added</content>"
      + "<paragraph label=\"1234-1-c-1\"><content>Nested</content></paragraph></paragraph>"
      + "</section>"
      + "<section label=\"1234-2\" sectionNum=\"2\"><subject>§ 1234.2 Definitions.</subject></section>"
      + "</content></part>";

  private static Document redline() {
    return Redline.of(regulation(LEFT), regulation(RIGHT));
  }

  @Test
  void added_nodes_are_copied_in_after_their_sibling() {
    Document out = redline();
    Element added = find(out, "1234-1-c");

    assertEquals("added", added.getAttribute("action"));
    assertEquals("added", find(out, "1234-1-c-1").getAttribute("action"));
    assertEquals(Arrays.asList("", "", "1234-1-a", "1234-1-b", "1234-1-c"), childLabels(find(out, "1234-1")));
    assertEquals(1, Fixtures.allLabels(out).stream().filter("1234-1-c-1"::equals).count());
  }

  @Test
  void deleted_nodes_stay_marked() {
    Element gone = find(redline(), "1234-2-a");
    assertNotNull(gone);
    assertEquals("deleted", gone.getAttribute("action"));
    assertEquals("deleted", Elements.child(gone, "content").getAttribute("action"));
  }

  @Test
  void changed_subject_is_paired() {
    Element section = find(redline(), "1234-1");

    assertEquals("modified", section.getAttribute("action"));
    assertNull(Elements.child(section, "subject"));
    assertEquals("§ 1234.1 Authority.", Elements.childText(section, "leftSubject"));
    assertEquals("§ 1234.1 Authority and purpose.", Elements.childText(section, "rightSubject"));
  }

  @Test
  void changed_paragraph_content_is_paired() {
    Document out = redline();
    Element a = find(out, "1234-1-a");

    assertEquals("modified", a.getAttribute("action"));
    assertEquals("Old text", Elements.childText(a, "leftContent"));
    assertEquals("New   text", Elements.childText(a, "rightContent"));
    assertFalse(find(out, "1234-1-b").hasAttribute("action"));
  }

  @Test
  void toc_comes_from_the_right_with_modified_entries_marked() {
    Document out = redline();
    TocIndex toc = TocIndex.of(out);
    Element one = toc.findAll("1234-1").get(0);

    assertEquals("§ 1234.1 Authority and purpose.", Elements.childText(one, "sectionSubject"));
    assertEquals("modified", one.getAttribute("action"));
    assertFalse(toc.findAll("1234-2").get(0).hasAttribute("action"));
  }

  @Test
  void inputs_are_left_alone() {
    Document left = regulation(LEFT);
    String before = RegmlDocuments.toXml(left);
    Redline.of(left, regulation(RIGHT));
    assertEquals(before, RegmlDocuments.toXml(left));
  }
}
