package org.eregs.regml.change;

/** An added or relabeled node would collide with an existing label. */
public class DuplicateLabelException extends ChangeApplicationException {

    public DuplicateLabelException(String label, String operation, String message) {
        super(label, operation, message);
    }
}
