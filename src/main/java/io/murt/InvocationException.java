package io.murt;

/**
 * The base class for failures that are isolated to a single invocation and are reported to the caller
 * as an HTTP error response.
 */
public abstract class InvocationException extends Exception {

    private final int status;

    InvocationException(int status, String message, Throwable cause) {
        super(message, cause);
        this.status = status;
    }

    /**
     * @return The HTTP status code to send to the caller
     */
    public int status() {
        return status;
    }
}
