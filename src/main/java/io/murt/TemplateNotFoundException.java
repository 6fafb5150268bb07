package io.murt;

/**
 * No template matches the name or index given by the caller. Results in a 400 and no upstream call.
 */
public class TemplateNotFoundException extends InvocationException {

    public TemplateNotFoundException(String message) {
        super(400, message, null);
    }
}
