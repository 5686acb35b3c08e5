package org.eregs.regml.change;

/** A directive's target label, subpath or positioning anchor is not in the tree. */
public class MissingLabelException extends ChangeApplicationException {

    public MissingLabelException(String label, String operation, String message) {
        super(label, operation, message);
    }
}
