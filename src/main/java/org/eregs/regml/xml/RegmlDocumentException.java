package org.eregs.regml.xml;

/** Raised when a RegML document cannot be parsed, copied or serialized. */
public class RegmlDocumentException extends RuntimeException {

    public RegmlDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
