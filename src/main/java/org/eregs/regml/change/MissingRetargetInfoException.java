package org.eregs.regml.change;

/** A changeTarget or changeLabel directive lacks its old or new value. */
public class MissingRetargetInfoException extends ChangeApplicationException {

    public MissingRetargetInfoException(String label, String operation, String message) {
        super(label, operation, message);
    }
}
