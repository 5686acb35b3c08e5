package org.eregs.regml.change;

/** An added or modified directive does not carry exactly one replacement element. */
public class MissingPayloadException extends ChangeApplicationException {

    public MissingPayloadException(String label, String operation, String message) {
        super(label, operation, message);
    }
}
