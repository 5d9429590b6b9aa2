package com.ivamare.interactions.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.interactions.model.CommandType;
import com.ivamare.interactions.model.ComponentType;
import com.ivamare.interactions.model.HandlerKind;
import com.ivamare.interactions.model.InteractionContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("InteractionDecoder")
class InteractionDecoderTest {

    private final InteractionDecoder decoder = new InteractionDecoder(new ObjectMapper(), "default-app");

    private InteractionContext decode(String json) {
        return decoder.decode(decoder.parse(json));
    }

    @Test
    @DisplayName("should recognise ping")
    void shouldRecognisePing() {
        JsonNode payload = decoder.parse("{\"type\":1,\"id\":\"1\",\"token\":\"t\"}");

        assertTrue(decoder.isPing(payload));
    }

    @Test
    @DisplayName("should decode a slash command with nested options")
    void shouldDecodeCommand() {
        InteractionContext context = decode("""
            {"type":2,"id":"i-1","application_id":"app","token":"tok","guild_id":"g","channel_id":"c",
             "member":{"user":{"id":"u-1"}},
             "data":{"name":"config","type":1,"options":[
               {"name":"set","type":1,"options":[{"name":"key","type":3,"value":"color"},{"name":"level","type":4,"value":3}]}
             ]}}
            """);

        assertEquals(HandlerKind.COMMAND, context.kind());
        assertEquals("config", context.name());
        assertEquals(CommandType.CHAT_INPUT, context.subType());
        assertEquals(Map.of("key", "color", "level", 3), context.options());
        assertEquals("u-1", context.userId());
        assertEquals("g", context.guildId());
        assertEquals("app", context.credentials().applicationId());
        assertEquals("tok", context.credentials().token());
    }

    @Test
    @DisplayName("should decode a button press")
    void shouldDecodeButton() {
        InteractionContext context = decode("""
            {"type":3,"id":"i-2","token":"tok","user":{"id":"u-2"},
             "data":{"custom_id":"add_role:123","component_type":2}}
            """);

        assertEquals(HandlerKind.COMPONENT, context.kind());
        assertEquals("add_role:123", context.name());
        assertEquals(ComponentType.BUTTON, context.subType());
        assertEquals("u-2", context.userId());
        assertEquals("default-app", context.credentials().applicationId());
    }

    @Test
    @DisplayName("should route every select variant as a select")
    void shouldDecodeSelects() {
        InteractionContext context = decode("""
            {"type":3,"id":"i-3","token":"tok","data":{"custom_id":"pick","component_type":6,"values":["r1","r2"]}}
            """);

        assertEquals(ComponentType.SELECT, context.subType());
        assertEquals(List.of("r1", "r2"), context.values());
    }

    @Test
    @DisplayName("should decode unknown command types without a sub-type")
    void shouldDecodeUnknownCommandType() {
        InteractionContext context = decode("""
            {"type":2,"id":"i-6","token":"tok","data":{"name":"launch","type":4}}
            """);

        assertEquals(HandlerKind.COMMAND, context.kind());
        assertEquals("launch", context.name());
        assertNull(context.subType());
    }

    @Test
    @DisplayName("should decode unknown component types without a sub-type")
    void shouldDecodeUnknownComponentType() {
        InteractionContext context = decode("""
            {"type":3,"id":"i-7","token":"tok","data":{"custom_id":"new-widget","component_type":42}}
            """);

        assertEquals(HandlerKind.COMPONENT, context.kind());
        assertNull(context.subType());
    }

    @Test
    @DisplayName("should decode autocomplete without a sub-type")
    void shouldDecodeAutocomplete() {
        InteractionContext context = decode("""
            {"type":4,"id":"i-4","token":"tok","data":{"name":"color","type":1,
             "options":[{"name":"value","type":3,"value":"re","focused":true}]}}
            """);

        assertEquals(HandlerKind.AUTOCOMPLETE, context.kind());
        assertNull(context.subType());
        assertEquals("re", context.option("value").orElseThrow());
    }

    @Test
    @DisplayName("should collect modal text inputs as options")
    void shouldDecodeModal() {
        InteractionContext context = decode("""
            {"type":5,"id":"i-5","token":"tok","data":{"custom_id":"report:42","components":[
              {"type":1,"components":[{"type":4,"custom_id":"reason","value":"spam"}]}
            ]}}
            """);

        assertEquals(HandlerKind.MODAL_SUBMIT, context.kind());
        assertEquals("report:42", context.name());
        assertEquals(Map.of("reason", "spam"), context.options());
    }

    @Test
    @DisplayName("should reject malformed payloads")
    void shouldRejectMalformedPayloads() {
        assertThrows(IllegalArgumentException.class, () -> decoder.parse("not json"));
        assertThrows(IllegalArgumentException.class, () -> decoder.parse("[1,2]"));
        assertThrows(IllegalArgumentException.class, () -> decode("{\"type\":2,\"id\":\"1\"}"));
        assertThrows(IllegalArgumentException.class, () -> decoder.type(decoder.parse("{\"type\":99}")));
    }
}
