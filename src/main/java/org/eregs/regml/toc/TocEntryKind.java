package org.eregs.regml.toc;

import org.eregs.regml.xml.Elements;
import org.eregs.regml.xml.RegmlNames;
import org.w3c.dom.Element;

/** Table-of-contents entry shapes, one per kind of structural node a TOC can point at. */
public enum TocEntryKind {

    SECTION("tocSecEntry", "sectionNum", "sectionSubject",
            RegmlNames.SECTION, RegmlNames.ATTR_SECTION_NUM, RegmlNames.SUBJECT),
    APPENDIX("tocAppEntry", "appendixLetter", "appendixSubject",
            RegmlNames.APPENDIX, RegmlNames.ATTR_APPENDIX_LETTER, RegmlNames.APPENDIX_TITLE),
    SUBPART("tocSubpartEntry", "subpartLetter", "subpartTitle",
            RegmlNames.SUBPART, RegmlNames.ATTR_SUBPART_LETTER, RegmlNames.TITLE),
    INTERP("tocInterpEntry", null, "interpTitle",
            RegmlNames.INTERPRETATIONS, null, RegmlNames.TITLE);

    public final String entryTag;
    /** Null for interpretation entries, which carry no designator. */
    public final String designatorTag;
    public final String subjectTag;

    private final String nodeTag;
    private final String nodeDesignatorAttr;
    private final String nodeSubjectTag;

    TocEntryKind(String entryTag, String designatorTag, String subjectTag,
                 String nodeTag, String nodeDesignatorAttr, String nodeSubjectTag) {
        this.entryTag = entryTag;
        this.designatorTag = designatorTag;
        this.subjectTag = subjectTag;
        this.nodeTag = nodeTag;
        this.nodeDesignatorAttr = nodeDesignatorAttr;
        this.nodeSubjectTag = nodeSubjectTag;
    }

    /** The kind of TOC entry that would describe {@code node}, or null if TOCs never list it. */
    public static TocEntryKind forNode(Element node) {
        String tag = Elements.localName(node);
        for (TocEntryKind k : values()) {
            if (k.nodeTag.equals(tag)) return k;
        }
        return null;
    }

    /** Section number, appendix letter or subpart letter of a structural node. */
    public String designatorOf(Element node) {
        return nodeDesignatorAttr == null ? null : Elements.attr(node, nodeDesignatorAttr);
    }

    public String subjectOf(Element node) {
        return Elements.childText(node, nodeSubjectTag);
    }
}
