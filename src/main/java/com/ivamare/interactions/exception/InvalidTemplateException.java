package com.ivamare.interactions.exception;

/**
 * Thrown when a custom-id template string cannot be parsed.
 */
public class InvalidTemplateException extends InteractionsException {

    private final String template;

    public InvalidTemplateException(String template, String reason) {
        super("Invalid custom-id template '" + template + "': " + reason);
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }
}
