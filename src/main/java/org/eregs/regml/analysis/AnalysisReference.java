package org.eregs.regml.analysis;

/** Where to find one piece of analysis for a label: the notice it came from and its date. */
public final class AnalysisReference {

    public final String label;
    public final String documentNumber;
    public final String publicationDate;

    public AnalysisReference(String label, String documentNumber, String publicationDate) {
        this.label = label;
        this.documentNumber = documentNumber;
        this.publicationDate = publicationDate;
    }

    @Override
    public String toString() {
        return label + " <- " + documentNumber + " (" + publicationDate + ")";
    }
}
