package org.carball.rightsizer.analyzer;

/**
 * The run cannot continue: the inventory or every regional catalog is unreachable.
 */
public class AnalysisException extends RuntimeException {

    public AnalysisException(String message) {
        super(message);
    }

    public AnalysisException(String message, Throwable cause) {
        super(message, cause);
    }
}
