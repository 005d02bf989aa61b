package org.carball.rightsizer.connector;

/**
 * A collaborator could not be read (missing export, unreachable API, malformed payload).
 */
public class ConnectorException extends RuntimeException {

    public ConnectorException(String message) {
        super(message);
    }

    public ConnectorException(String message, Throwable cause) {
        super(message, cause);
    }
}
