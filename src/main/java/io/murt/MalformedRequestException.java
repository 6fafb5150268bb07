package io.murt;

/**
 * The caller sent an invocation that could not be understood. Results in a 400.
 */
public class MalformedRequestException extends InvocationException {

    public MalformedRequestException(String message) {
        this(message, null);
    }

    public MalformedRequestException(String message, Throwable cause) {
        super(400, message, cause);
    }
}
