package io.murt;

/**
 * A runtime parameter had a value that cannot be placed in a query string.
 */
public class InvalidParameterException extends MalformedRequestException {

    private final String parameterName;

    public InvalidParameterException(String parameterName, String message) {
        super(message);
        this.parameterName = parameterName;
    }

    /**
     * @return The name of the offending parameter
     */
    public String parameterName() {
        return parameterName;
    }
}
