package org.eregs.regml.change;

/** A move has no parent, or the resolved parent label is not in the tree. */
public class MissingParentException extends ChangeApplicationException {

    public MissingParentException(String label, String operation, String message) {
        super(label, operation, message);
    }
}
