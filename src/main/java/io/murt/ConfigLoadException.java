package io.murt;

/**
 * Thrown when the template configuration file cannot be read or parsed. This is fatal at startup.
 */
public class ConfigLoadException extends RuntimeException {

    /**
     * @param message A description of the problem
     * @param cause   The underlying IO or parse error
     */
    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
