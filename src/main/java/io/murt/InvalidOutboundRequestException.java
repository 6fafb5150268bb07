package io.murt;

/**
 * A template's URL or method could not be turned into an HTTP request.
 * <p>This is reported the same way as any other failure to reach the upstream server.</p>
 */
public class InvalidOutboundRequestException extends UpstreamTransportException {

    public InvalidOutboundRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
