package com.ivamare.interactions.exception;

/**
 * Thrown when a handler returns a value the response resolver cannot interpret.
 */
public class UnsupportedResponseElementException extends InvalidResponseException {

    private final Class<?> elementType;

    public UnsupportedResponseElementException(Class<?> elementType) {
        super("Unsupported response element: " + (elementType != null ? elementType.getName() : "null"));
        this.elementType = elementType;
    }

    /**
     * @return type of the rejected element, or null when the handler returned nothing
     */
    public Class<?> getElementType() {
        return elementType;
    }
}
