package org.eregs.regml.change;

/**
 * A directive of a notice could not be applied. The whole notice is rejected; the base
 * tree is left as it was.
 */
public class ChangeApplicationException extends RuntimeException {

    private final String label;
    private final String operation;

    public ChangeApplicationException(String label, String operation, String message) {
        super(operation + " " + label + ": " + message);
        this.label = label;
        this.operation = operation;
    }

    /** Label (or, for retargeting, old target) of the offending directive. */
    public String label() {
        return label;
    }

    public String operation() {
        return operation;
    }
}
