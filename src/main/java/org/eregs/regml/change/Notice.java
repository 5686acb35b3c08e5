package org.eregs.regml.change;

import org.eregs.regml.xml.Elements;
import org.eregs.regml.xml.RegmlNames;
import org.w3c.dom.Document;
import org.w3c.dom.Element;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/** A parsed amendment notice: its publication metadata and its changeset. */
public final class Notice {

    public final Document document;
    /** Null when the preamble does not say. */
    public final String documentNumber;
    public final String effectiveDate;
    /** Document number of the version this notice amends. */
    public final String appliesTo;
    public final List<Change> changes;

    private Notice(Document document, String documentNumber, String effectiveDate,
                   String appliesTo, List<Change> changes) {
        this.document = document;
        this.documentNumber = documentNumber;
        this.effectiveDate = effectiveDate;
        this.appliesTo = appliesTo;
        this.changes = Collections.unmodifiableList(changes);
    }

    /**
     * Reads metadata and directives from a notice document.
     *
     * @throws ChangeApplicationException if a directive is incomplete
     */
    public static Notice from(Document document) {
        Element root = document.getDocumentElement();
        Element preamble = Elements.child(root, RegmlNames.PREAMBLE);
        String docNumber = preamble == null ? null : Elements.childText(preamble, RegmlNames.DOCUMENT_NUMBER);
        String effective = preamble == null ? null : Elements.childText(preamble, RegmlNames.EFFECTIVE_DATE);
        Element changeset = Elements.child(root, RegmlNames.CHANGESET);
        String appliesTo = changeset == null ? null : Elements.attr(changeset, RegmlNames.ATTR_LEFT_DOCUMENT_NUMBER);
        return new Notice(document, docNumber, effective, appliesTo, ChangeReader.readAll(changeset));
    }

    /** One line per directive, in changeset order. */
    public List<String> describeChanges() {
        List<String> out = new ArrayList<>(changes.size());
        for (Change c : changes) out.add(c.toString());
        return out;
    }

    @Override
    public String toString() {
        return "Notice " + documentNumber + " (effective " + effectiveDate + ")";
    }
}
