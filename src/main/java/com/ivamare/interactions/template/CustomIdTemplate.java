package com.ivamare.interactions.template;

import com.ivamare.interactions.exception.InvalidTemplateException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Parsed custom-id template such as {@code "role:{id:int}:{user}"}.
 *
 * <p>A template is an ordered sequence of literal segments and named parameter
 * slots. Parameter types are declared inline ({@code {id:int}}) or passed in when
 * parsing; undeclared parameters are strings. Every parameter must touch a
 * non-empty literal on at least one side, so two adjacent slots are rejected.
 *
 * <p>Matching is linear and does not backtrack: each parameter captures up to the
 * first occurrence of the literal that follows it. Values containing that literal
 * split at the wrong place.
 */
public final class CustomIdTemplate {

    private final String source;
    private final List<Segment> segments;
    private final List<String> parameterNames;

    private CustomIdTemplate(String source, List<Segment> segments) {
        this.source = source;
        this.segments = List.copyOf(segments);
        this.parameterNames = segments.stream()
            .filter(Segment::isParameter)
            .map(Segment::text)
            .toList();
    }

    /**
     * Whether a custom id or key is written as a template.
     *
     * @param key registration key
     * @return true if the key contains a parameter slot
     */
    public static boolean isTemplate(String key) {
        return key != null && key.indexOf('{') >= 0;
    }

    public static CustomIdTemplate parse(String template) {
        return parse(template, Map.of());
    }

    /**
     * Parse a template string.
     *
     * @param template template text
     * @param declaredTypes types for parameters without an inline type
     * @return parsed template
     * @throws InvalidTemplateException if the template is malformed
     */
    public static CustomIdTemplate parse(String template, Map<String, ParameterType> declaredTypes) {
        if (template == null || template.isEmpty()) {
            throw new InvalidTemplateException(String.valueOf(template), "template is empty");
        }

        List<Segment> segments = new ArrayList<>();
        Set<String> names = new HashSet<>();
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < template.length()) {
            char c = template.charAt(i);
            if (c == '}') {
                throw new InvalidTemplateException(template, "unmatched '}' at " + i);
            }
            if (c != '{') {
                literal.append(c);
                i++;
                continue;
            }

            int close = template.indexOf('}', i);
            if (close < 0) {
                throw new InvalidTemplateException(template, "unclosed '{' at " + i);
            }
            String slot = template.substring(i + 1, close);
            if (slot.indexOf('{') >= 0) {
                throw new InvalidTemplateException(template, "nested '{' at " + i);
            }

            if (!literal.isEmpty()) {
                segments.add(Segment.literal(literal.toString()));
                literal.setLength(0);
            } else if (!segments.isEmpty() && segments.get(segments.size() - 1).isParameter()) {
                throw new InvalidTemplateException(template, "parameters must be separated by a literal");
            }

            Segment parameter = parseSlot(template, slot, declaredTypes);
            if (!names.add(parameter.text())) {
                throw new InvalidTemplateException(template, "duplicate parameter '" + parameter.text() + "'");
            }
            segments.add(parameter);
            i = close + 1;
        }
        if (!literal.isEmpty()) {
            segments.add(Segment.literal(literal.toString()));
        }

        if (names.isEmpty()) {
            throw new InvalidTemplateException(template, "template has no parameters");
        }
        if (segments.size() == 1) {
            throw new InvalidTemplateException(template, "parameter must be bounded by a literal");
        }

        return new CustomIdTemplate(template, segments);
    }

    private static Segment parseSlot(String template, String slot, Map<String, ParameterType> declaredTypes) {
        String name = slot;
        ParameterType type = null;

        int colon = slot.indexOf(':');
        if (colon >= 0) {
            name = slot.substring(0, colon);
            try {
                type = ParameterType.fromValue(slot.substring(colon + 1).trim());
            } catch (IllegalArgumentException e) {
                throw new InvalidTemplateException(template, "unknown parameter type in '{" + slot + "}'");
            }
        }

        name = name.trim();
        if (name.isEmpty()) {
            throw new InvalidTemplateException(template, "parameter name is empty");
        }
        if (type == null) {
            type = declaredTypes.getOrDefault(name, ParameterType.STRING);
        }
        return Segment.parameter(name, type);
    }

    /**
     * Match a concrete custom id.
     *
     * @param customId custom id received with the interaction
     * @return parameter values in declaration order, or empty if the id does not match
     */
    public Optional<Map<String, Object>> match(String customId) {
        if (customId == null) {
            return Optional.empty();
        }

        Map<String, Object> captured = new LinkedHashMap<>();
        String remaining = customId;

        for (int i = 0; i < segments.size(); i++) {
            Segment segment = segments.get(i);

            if (!segment.isParameter()) {
                if (!remaining.startsWith(segment.text())) {
                    return Optional.empty();
                }
                remaining = remaining.substring(segment.text().length());
                continue;
            }

            if (i + 1 < segments.size()) {
                String next = segments.get(i + 1).text();
                int end = remaining.indexOf(next);
                if (end < 0) {
                    return Optional.empty();
                }
                captured.put(segment.text(), segment.type().coerce(remaining.substring(0, end)));
                remaining = remaining.substring(end);
            } else {
                captured.put(segment.text(), segment.type().coerce(remaining));
                remaining = "";
            }
        }

        if (!remaining.isEmpty() || captured.size() != parameterNames.size()) {
            return Optional.empty();
        }
        return Optional.of(Collections.unmodifiableMap(captured));
    }

    /**
     * Build a concrete custom id from parameter values.
     *
     * @param values value per parameter name
     * @return custom id
     * @throws IllegalArgumentException if a parameter has no value
     */
    public String format(Map<String, ?> values) {
        StringBuilder id = new StringBuilder();
        for (Segment segment : segments) {
            if (!segment.isParameter()) {
                id.append(segment.text());
                continue;
            }
            if (!values.containsKey(segment.text())) {
                throw new IllegalArgumentException("Missing value for parameter '" + segment.text() + "'");
            }
            id.append(values.get(segment.text()));
        }
        return id.toString();
    }

    public String source() {
        return source;
    }

    public List<String> parameterNames() {
        return parameterNames;
    }

    public ParameterType parameterType(String name) {
        return segments.stream()
            .filter(s -> s.isParameter() && s.text().equals(name))
            .map(Segment::type)
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown parameter '" + name + "'"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        return o instanceof CustomIdTemplate other && segments.equals(other.segments);
    }

    @Override
    public int hashCode() {
        return segments.hashCode();
    }

    @Override
    public String toString() {
        return source;
    }

    /**
     * Literal text, or a parameter name with its type.
     */
    record Segment(String text, ParameterType type) {

        static Segment literal(String text) {
            return new Segment(text, null);
        }

        static Segment parameter(String name, ParameterType type) {
            return new Segment(name, type);
        }

        boolean isParameter() {
            return type != null;
        }
    }
}
