package org.eregs.regml.analysis;

/** An analysis section lacks the target, notice or date it must carry. */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }
}
