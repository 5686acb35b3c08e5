package org.eregs.regml.toc;

import org.eregs.regml.Fixtures;
import org.eregs.regml.xml.Elements;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TocIndexTest {

  private static final String TOC_PART =
      "<tableOfContents>"
      + "<tocSecEntry target=\"1234-1\"><sectionNum>1</sectionNum><sectionSubject>Authority.</sectionSubject></tocSecEntry>"
      + "<tocSecEntry target=\"1234-2\"><sectionNum>2</sectionNum><sectionSubject>Definitions.</sectionSubject></tocSecEntry>"
      + "<tocAppEntry target=\"1234-A\"><appendixLetter>A</appendixLetter><appendixSubject>Forms</appendixSubject></tocAppEntry>"
      + "</tableOfContents>";

  private static final String TOC_SUBPART =
      "<tableOfContents>"
      + "<tocSecEntry target=\"1234-1\"><sectionNum>1</sectionNum><sectionSubject>Authority.</sectionSubject></tocSecEntry>"
      + "</tableOfContents>";

  private static Document doc() {
    return Fixtures.regulation("<part label=\"1234\">" + TOC_PART
        + "<content><subpart label=\"1234-Subpart-A\" subpartLetter=\"A\">" + TOC_SUBPART + "<content/></subpart></content>"
        + "</part>");
  }

  @Test
  void finds_every_container() {
    assertEquals(2, TocIndex.of(doc()).containers().size());
  }

  @Test
  void find_entry_by_target() {
    TocIndex toc = TocIndex.of(doc());
    Element part = toc.containers().get(0);
    assertEquals("tocSecEntry", Elements.localName(TocIndex.findEntry(part, "1234-2")));
    assertNull(TocIndex.findEntry(part, "1234-9"));
  }

  @Test
  void find_all_spans_containers() {
    TocIndex toc = TocIndex.of(doc());
    assertEquals(2, toc.findAll("1234-1").size());
    assertEquals(1, toc.findAll("1234-A").size());
    assertTrue(toc.findAll("1234-9").isEmpty());
  }

  @Test
  void create_after_given_entry() {
    TocIndex toc = TocIndex.of(doc());
    Element part = toc.containers().get(0);
    Element after = TocIndex.findEntry(part, "1234-1");
    Element created = TocIndex.createEntry(part, "1234-1a", "1a", "Scope.", after, TocEntryKind.SECTION);

    List<Element> entries = Elements.children(part);
    assertSame(created, entries.get(1));
    assertEquals("1a", Elements.childText(created, "sectionNum"));
    assertEquals("Scope.", Elements.childText(created, "sectionSubject"));
  }

  @Test
  void create_without_anchor_appends() {
    TocIndex toc = TocIndex.of(doc());
    Element part = toc.containers().get(0);
    Element created = TocIndex.createEntry(part, "1234-Interp", null, "Supplement I", null, TocEntryKind.INTERP);

    List<Element> entries = Elements.children(part);
    assertSame(created, entries.get(entries.size() - 1));
    assertEquals("tocInterpEntry", Elements.localName(created));
    assertEquals(1, Elements.children(created).size());
    assertEquals("Supplement I", Elements.childText(created, "interpTitle"));
  }

  @Test
  void create_for_existing_target_updates_instead() {
    TocIndex toc = TocIndex.of(doc());
    Element part = toc.containers().get(0);
    int before = Elements.children(part).size();
    Element e = TocIndex.createEntry(part, "1234-2", "2", "Terms.", null, TocEntryKind.SECTION);

    assertEquals(before, Elements.children(part).size());
    assertEquals("Terms.", Elements.childText(e, "sectionSubject"));
  }

  @Test
  void update_reports_whether_anything_changed() {
    Element entry = TocIndex.findEntry(TocIndex.of(doc()).containers().get(0), "1234-2");
    assertFalse(TocIndex.updateEntry(entry, "2", "Definitions.", TocEntryKind.SECTION));
    assertTrue(TocIndex.updateEntry(entry, "3", "Definitions.", TocEntryKind.SECTION));
    assertEquals("3", Elements.childText(entry, "sectionNum"));
  }

  @Test
  void update_fills_in_missing_fields() {
    Document d = Fixtures.regulation("<part label=\"1234\"><tableOfContents>"
        + "<tocSecEntry target=\"1234-1\"/></tableOfContents><content/></part>");
    Element entry = TocIndex.findEntry(TocIndex.of(d).containers().get(0), "1234-1");

    assertTrue(TocIndex.updateEntry(entry, "1", "Authority.", TocEntryKind.SECTION));
    assertEquals("1", Elements.childText(entry, "sectionNum"));
    assertEquals("Authority.", Elements.childText(entry, "sectionSubject"));
    assertEquals("sectionNum", Elements.localName(Elements.children(entry).get(0)));
  }

  @Test
  void delete_is_safe_twice() {
    Element part = TocIndex.of(doc()).containers().get(0);
    Element entry = TocIndex.findEntry(part, "1234-A");
    assertTrue(TocIndex.deleteEntry(entry));
    assertFalse(TocIndex.deleteEntry(entry));
    assertNull(TocIndex.findEntry(part, "1234-A"));
  }

  @Test
  void delete_all_and_retarget() {
    TocIndex toc = TocIndex.of(doc());
    assertEquals(2, toc.retarget("1234-1", "1234-7"));
    assertTrue(toc.findAll("1234-1").isEmpty());
    assertEquals(2, toc.deleteAll("1234-7"));
    assertTrue(toc.findAll("1234-7").isEmpty());
  }

  @Test
  void entry_kind_of_structural_nodes() {
    Document d = Fixtures.regulation("<part label=\"1234\"><content>"
        + "<section label=\"1234-1\" sectionNum=\"1\"><subject>Authority.</subject></section>"
        + "<appendix label=\"1234-A\" appendixLetter=\"A\"><appendixTitle>Forms</appendixTitle></appendix>"
        + "<paragraph label=\"1234-2\">text</paragraph>"
        + "</content></part>");
    Element section = Fixtures.find(d, "1234-1");
    Element appendix = Fixtures.find(d, "1234-A");

    assertEquals(TocEntryKind.SECTION, TocEntryKind.forNode(section));
    assertEquals("1", TocEntryKind.SECTION.designatorOf(section));
    assertEquals("Authority.", TocEntryKind.SECTION.subjectOf(section));
    assertEquals(TocEntryKind.APPENDIX, TocEntryKind.forNode(appendix));
    assertEquals("A", TocEntryKind.APPENDIX.designatorOf(appendix));
    assertNull(TocEntryKind.forNode(Fixtures.find(d, "1234-2")));
  }
}
