package com.ivamare.interactions.response;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Rich embed attached to a message.
 */
public class Embed {

    private String title;
    private String description;
    private String url;
    private Integer color;
    private Instant timestamp;
    private Map<String, Object> footer;
    private Map<String, Object> author;
    private Map<String, Object> image;
    private Map<String, Object> thumbnail;
    private final List<Map<String, Object>> fields = new ArrayList<>();

    public static Embed titled(String title) {
        return new Embed().title(title);
    }

    public Embed title(String title) {
        this.title = title;
        return this;
    }

    public Embed description(String description) {
        this.description = description;
        return this;
    }

    public Embed url(String url) {
        this.url = url;
        return this;
    }

    public Embed color(int rgb) {
        this.color = rgb & 0xFFFFFF;
        return this;
    }

    public Embed timestamp(Instant timestamp) {
        this.timestamp = timestamp;
        return this;
    }

    public Embed footer(String text) {
        return footer(text, null);
    }

    public Embed footer(String text, String iconUrl) {
        this.footer = withoutNulls("text", text, "icon_url", iconUrl);
        return this;
    }

    public Embed author(String name) {
        return author(name, null, null);
    }

    public Embed author(String name, String url, String iconUrl) {
        this.author = withoutNulls("name", name, "url", url, "icon_url", iconUrl);
        return this;
    }

    public Embed image(String url) {
        this.image = Map.of("url", url);
        return this;
    }

    public Embed thumbnail(String url) {
        this.thumbnail = Map.of("url", url);
        return this;
    }

    public Embed field(String name, String value) {
        return field(name, value, false);
    }

    public Embed field(String name, String value, boolean inline) {
        fields.add(Map.of("name", name, "value", value, "inline", inline));
        return this;
    }

    public String getTitle() {
        return title;
    }

    public String getDescription() {
        return description;
    }

    public List<Map<String, Object>> getFields() {
        return List.copyOf(fields);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", "rich");
        putIfPresent(map, "title", title);
        putIfPresent(map, "description", description);
        putIfPresent(map, "url", url);
        putIfPresent(map, "color", color);
        putIfPresent(map, "timestamp", timestamp != null ? timestamp.toString() : null);
        putIfPresent(map, "footer", footer);
        putIfPresent(map, "author", author);
        putIfPresent(map, "image", image);
        putIfPresent(map, "thumbnail", thumbnail);
        if (!fields.isEmpty()) {
            map.put("fields", List.copyOf(fields));
        }
        return map;
    }

    private static void putIfPresent(Map<String, Object> map, String key, Object value) {
        if (value != null) {
            map.put(key, value);
        }
    }

    private static Map<String, Object> withoutNulls(Object... keysAndValues) {
        Map<String, Object> map = new LinkedHashMap<>();
        for (int i = 0; i < keysAndValues.length; i += 2) {
            putIfPresent(map, (String) keysAndValues[i], keysAndValues[i + 1]);
        }
        return map;
    }
}
