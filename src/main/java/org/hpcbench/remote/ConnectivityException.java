package org.hpcbench.remote;

/**
 * Transient failure of the remote channel (dropped connection, handshake timeout).
 */
public class ConnectivityException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public ConnectivityException(String message) {
        super(message);
    }

    public ConnectivityException(String message, Throwable cause) {
        super(message, cause);
    }
}
