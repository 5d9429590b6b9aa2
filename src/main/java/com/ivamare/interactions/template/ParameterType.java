package com.ivamare.interactions.template;

/**
 * Declared type of a custom-id template parameter.
 *
 * <p>Coercion is opportunistic: a value that does not parse stays a string.
 */
public enum ParameterType {
    STRING("str"),
    INTEGER("int"),
    NUMBER("float"),
    BOOLEAN("bool");

    private final String alias;

    ParameterType(String alias) {
        this.alias = alias;
    }

    public String getAlias() {
        return alias;
    }

    /**
     * Convert a captured string to this type.
     *
     * @param raw captured text
     * @return converted value, or {@code raw} when it does not parse
     */
    public Object coerce(String raw) {
        try {
            return switch (this) {
                case STRING -> raw;
                case INTEGER -> Long.parseLong(raw);
                case NUMBER -> Double.parseDouble(raw);
                case BOOLEAN -> parseBoolean(raw);
            };
        } catch (NumberFormatException e) {
            return raw;
        }
    }

    private static Object parseBoolean(String raw) {
        if ("true".equalsIgnoreCase(raw)) {
            return Boolean.TRUE;
        }
        if ("false".equalsIgnoreCase(raw)) {
            return Boolean.FALSE;
        }
        return raw;
    }

    /**
     * Look up a type by alias ({@code int}) or name ({@code INTEGER}).
     *
     * @param value alias or name, case-insensitive
     * @return parameter type
     */
    public static ParameterType fromValue(String value) {
        for (ParameterType type : values()) {
            if (type.alias.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown ParameterType: " + value);
    }
}
