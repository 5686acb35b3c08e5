package org.eregs.regml.analysis;

import org.eregs.regml.xml.Elements;
import org.eregs.regml.xml.RegmlNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Carries the analysis of a notice into a regulation tree. Analysis accumulates: once a
 * regulation has an analysis block, later notices only append sections to it.
 */
public final class AnalysisMerger {

    private static final Logger log = LoggerFactory.getLogger(AnalysisMerger.class);

    private AnalysisMerger() {}

    /**
     * Merges in place and returns {@code regulation}.
     */
    public static Document mergeAnalysis(Document regulation, Document notice) {
        Element noticeAnalysis = Elements.child(notice.getDocumentElement(), RegmlNames.ANALYSIS);
        if (noticeAnalysis == null) return regulation;

        Element root = regulation.getDocumentElement();
        Element existing = Elements.child(root, RegmlNames.ANALYSIS);
        if (existing == null) {
            root.appendChild(regulation.importNode(noticeAnalysis, true));
            log.info("Adopted analysis block with {} sections",
                    Elements.children(noticeAnalysis, RegmlNames.ANALYSIS_SECTION).size());
            return regulation;
        }

        int added = 0;
        for (Element section : Elements.children(noticeAnalysis, RegmlNames.ANALYSIS_SECTION)) {
            if (!hasReferenceAttributes(section)) {
                log.warn("analysisSection for target '{}' lacks notice or date", Elements.attr(section, RegmlNames.ATTR_TARGET));
            }
            existing.appendChild(regulation.importNode(section, true));
            added++;
        }
        log.info("Appended {} analysis sections", added);
        return regulation;
    }

    /**
     * Analysis references by target label, in document order.
     *
     * @throws AnalysisException if a section is missing its target, notice or date
     */
    public static Map<String, List<AnalysisReference>> references(Document regulation) {
        Map<String, List<AnalysisReference>> out = new LinkedHashMap<>();
        Element root = regulation.getDocumentElement();
        Element analysis = Elements.child(root, RegmlNames.ANALYSIS);
        if (analysis == null) return out;

        for (Element section : Elements.children(analysis, RegmlNames.ANALYSIS_SECTION)) {
            String label = Elements.attr(section, RegmlNames.ATTR_TARGET);
            String notice = Elements.attr(section, RegmlNames.ATTR_NOTICE);
            String date = Elements.attr(section, RegmlNames.ATTR_DATE);
            if (label == null || notice == null || date == null) {
                Element preamble = Elements.child(root, RegmlNames.PREAMBLE);
                String docNumber = preamble == null ? null : Elements.childText(preamble, RegmlNames.DOCUMENT_NUMBER);
                throw new AnalysisException("In " + docNumber + ", analysisSection is missing attribute information: "
                        + "{label=" + label + ", notice=" + notice + ", date=" + date + "}");
            }
            out.computeIfAbsent(label, k -> new ArrayList<>()).add(new AnalysisReference(label, notice, date));
        }
        return out;
    }

    private static boolean hasReferenceAttributes(Element section) {
        return section.hasAttribute(RegmlNames.ATTR_TARGET)
                && section.hasAttribute(RegmlNames.ATTR_NOTICE)
                && section.hasAttribute(RegmlNames.ATTR_DATE);
    }
}
