package io.murt;

/**
 * The upstream server responded but its body could not be read in full.
 */
public class UpstreamBodyReadException extends UpstreamTransportException {

    public UpstreamBodyReadException(String message, Throwable cause) {
        super(message, cause);
    }
}
