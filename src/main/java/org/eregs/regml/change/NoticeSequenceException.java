package org.eregs.regml.change;

/** A notice in a sequence failed; names the notice and wraps the directive failure. */
public class NoticeSequenceException extends RuntimeException {

    private final String documentNumber;

    public NoticeSequenceException(String documentNumber, ChangeApplicationException cause) {
        super("notice " + documentNumber + " could not be applied: " + cause.getMessage(), cause);
        this.documentNumber = documentNumber;
    }

    public String documentNumber() {
        return documentNumber;
    }

    @Override
    public synchronized ChangeApplicationException getCause() {
        return (ChangeApplicationException) super.getCause();
    }
}
