package org.eregs.regml.analysis;

import org.eregs.regml.xml.Elements;
import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.List;
import java.util.Map;

import static org.eregs.regml.Fixtures.notice;
import static org.eregs.regml.Fixtures.regulation;
import static org.junit.jupiter.api.Assertions.*;

public class AnalysisMergerTest {

  private static final String PART =
      "<part label=\"1234\"><content><paragraph label=\"1234-1\">An existing paragraph</paragraph></content></part>";

  private static String analysis(String... sections) {
    return "<analysis>" + String.join("", sections) + "</analysis>";
  }

  private static String section(String target, String notice, String date) {
    return "<analysisSection target=\"" + target + "\" notice=\"" + notice + "\" date=\"" + date + "\">"
        + "<title>Section-by-section</title><analysisParagraph>Why " + target + " changed.</analysisParagraph>"
        + "</analysisSection>";
  }

  private static List<Element> sections(Document doc) {
    Element analysis = Elements.child(doc.getDocumentElement(), "analysis");
    return analysis == null ? null : Elements.children(analysis, "analysisSection");
  }

  @Test
  void notice_without_analysis_leaves_regulation_alone() {
    Document reg = regulation(PART);
    Document result = AnalysisMerger.mergeAnalysis(reg, notice(""));

    assertSame(reg, result);
    assertNull(sections(result));
  }

  @Test
  void first_analysis_is_adopted() {
    Document n = notice("2015-001", "2015-01-01", "2014-000", "",
        analysis(section("1234-1", "2015-001", "2015-01-01")));
    Document result = AnalysisMerger.mergeAnalysis(regulation(PART), n);

    assertEquals(1, sections(result).size());
    assertEquals("1234-1", sections(result).get(0).getAttribute("target"));
  }

  @Test
  void later_analysis_accretes() {
    Document reg = regulation(PART + analysis(section("1234-1", "2014-000", "2014-01-01")));
    Document n = notice("2015-001", "2015-01-01", "2014-000", "",
        analysis(section("1234-1", "2015-001", "2015-01-01"), section("1234-2", "2015-001", "2015-01-01")));
    AnalysisMerger.mergeAnalysis(reg, n);

    List<Element> all = sections(reg);
    assertEquals(3, all.size());
    assertEquals("2014-000", all.get(0).getAttribute("notice"));
    assertEquals("1234-2", all.get(2).getAttribute("target"));
    assertEquals(1, Elements.children(reg.getDocumentElement(), "analysis").size());
  }

  @Test
  void references_group_by_label() {
    Document reg = regulation(PART + analysis(
        section("1234-1", "2014-000", "2014-01-01"),
        section("1234-2", "2015-001", "2015-01-01"),
        section("1234-1", "2015-001", "2015-01-01")));

    Map<String, List<AnalysisReference>> refs = AnalysisMerger.references(reg);
    assertEquals(2, refs.size());
    List<AnalysisReference> one = refs.get("1234-1");
    assertEquals(2, one.size());
    assertEquals("2014-000", one.get(0).documentNumber);
    assertEquals("2015-01-01", one.get(1).publicationDate);
  }

  @Test
  void references_without_analysis_are_empty() {
    assertTrue(AnalysisMerger.references(regulation(PART)).isEmpty());
  }

  @Test
  void section_missing_its_date_is_an_error() {
    Document reg = regulation(PART + "<analysis><analysisSection target=\"1234-1\" notice=\"2015-001\"/></analysis>");

    AnalysisException e = assertThrows(AnalysisException.class, () -> AnalysisMerger.references(reg));
    assertTrue(e.getMessage().contains("2014-000"));
  }
}
