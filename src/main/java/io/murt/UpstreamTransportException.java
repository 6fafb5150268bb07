package io.murt;

/**
 * The call to the upstream server could not be made or did not complete. Results in a 502.
 */
public class UpstreamTransportException extends InvocationException {

    public UpstreamTransportException(String message, Throwable cause) {
        super(502, message, cause);
    }
}
