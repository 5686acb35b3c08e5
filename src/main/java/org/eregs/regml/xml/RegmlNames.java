package org.eregs.regml.xml;

/** Element and attribute names of the RegML vocabulary. */
public final class RegmlNames {

    public static final String NS = "eregs";

    // ---------------- Structure ----------------

    public static final String REGULATION = "regulation";
    public static final String NOTICE = "notice";
    public static final String FDSYS = "fdsys";
    public static final String PREAMBLE = "preamble";
    public static final String PART = "part";
    public static final String SUBPART = "subpart";
    public static final String CONTENT = "content";
    public static final String SECTION = "section";
    public static final String SUBJECT = "subject";
    public static final String PARAGRAPH = "paragraph";
    public static final String APPENDIX = "appendix";
    public static final String APPENDIX_TITLE = "appendixTitle";
    public static final String INTERPRETATIONS = "interpretations";
    public static final String INTERP_SECTION = "interpSection";
    public static final String INTERP_PARAGRAPH = "interpParagraph";
    public static final String TITLE = "title";
    public static final String REF = "ref";
    public static final String DOCUMENT_NUMBER = "documentNumber";
    public static final String EFFECTIVE_DATE = "effectiveDate";

    // ---------------- Changes ----------------

    public static final String CHANGESET = "changeset";
    public static final String CHANGE = "change";

    // ---------------- Table of contents ----------------

    public static final String TABLE_OF_CONTENTS = "tableOfContents";

    // ---------------- Analysis ----------------

    public static final String ANALYSIS = "analysis";
    public static final String ANALYSIS_SECTION = "analysisSection";

    // ---------------- Redline ----------------

    public static final String LEFT_SUBJECT = "leftSubject";
    public static final String RIGHT_SUBJECT = "rightSubject";
    public static final String LEFT_TITLE = "leftTitle";
    public static final String RIGHT_TITLE = "rightTitle";
    public static final String LEFT_CONTENT = "leftContent";
    public static final String RIGHT_CONTENT = "rightContent";

    // ---------------- Attributes ----------------

    public static final String ATTR_LABEL = "label";
    public static final String ATTR_TARGET = "target";
    public static final String ATTR_OPERATION = "operation";
    public static final String ATTR_PARENT = "parent";
    public static final String ATTR_BEFORE = "before";
    public static final String ATTR_AFTER = "after";
    public static final String ATTR_SUBPATH = "subpath";
    public static final String ATTR_OLD_TARGET = "oldTarget";
    public static final String ATTR_NEW_TARGET = "newTarget";
    public static final String ATTR_NEW_LABEL = "newLabel";
    public static final String ATTR_SECTION_NUM = "sectionNum";
    public static final String ATTR_APPENDIX_LETTER = "appendixLetter";
    public static final String ATTR_SUBPART_LETTER = "subpartLetter";
    public static final String ATTR_LEFT_DOCUMENT_NUMBER = "leftDocumentNumber";
    public static final String ATTR_NOTICE = "notice";
    public static final String ATTR_DATE = "date";
    public static final String ATTR_ACTION = "action";

    private RegmlNames() {}
}
