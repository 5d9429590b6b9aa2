package com.ivamare.interactions.response;

import java.util.Map;

/**
 * Autocomplete suggestion.
 *
 * @param name Text shown to the user
 * @param value Value filled into the option (string or number)
 */
public record Choice(String name, Object value) {

    public static Choice of(String nameAndValue) {
        return new Choice(nameAndValue, nameAndValue);
    }

    public Map<String, Object> toMap() {
        return Map.of("name", name, "value", value);
    }
}
