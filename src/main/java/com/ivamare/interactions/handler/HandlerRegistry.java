package com.ivamare.interactions.handler;

import com.ivamare.interactions.model.HandlerKind;
import com.ivamare.interactions.model.InteractionSubType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of interaction handlers.
 *
 * <p>Lookup falls back from specific to generic to catch-all:
 * <ol>
 *   <li>exact match key for the kind (and sub-type, for components)</li>
 *   <li>custom-id templates, for components and modal submissions</li>
 *   <li>generic handler for the kind narrowed to the sub-type</li>
 *   <li>generic handler for the kind without sub-type</li>
 *   <li>the catch-all handler</li>
 * </ol>
 *
 * <p>Tables are written at registration time and read during serving. Callers
 * serialize load and unload operations themselves.
 */
public interface HandlerRegistry {

    /**
     * Register a handler.
     *
     * @param registration the registration
     * @throws com.ivamare.interactions.exception.DuplicateRegistrationException if the key is taken
     */
    void register(HandlerRegistration registration);

    /**
     * Remove exactly the given registration. No-op if absent.
     *
     * @param registration the registration
     * @return true if it was removed
     */
    boolean deregister(HandlerRegistration registration);

    /**
     * Resolve the handler for an interaction.
     *
     * @param kind interaction kind
     * @param matchKey command name or custom id (nullable)
     * @param subType sub-type of the interaction (nullable)
     * @return the resolution, empty if nothing matches
     */
    Optional<Resolution> resolve(HandlerKind kind, String matchKey, InteractionSubType subType);

    /**
     * Resolve the handler for an interaction, throwing if not found.
     *
     * @param kind interaction kind
     * @param matchKey command name or custom id
     * @param subType sub-type of the interaction
     * @return the resolution
     * @throws com.ivamare.interactions.exception.HandlerNotFoundException if nothing matches
     */
    Resolution resolveOrThrow(HandlerKind kind, String matchKey, InteractionSubType subType);

    /**
     * @return all registrations, specific first, then templates, generics and the catch-all
     */
    List<HandlerRegistration> registrations();

    int size();

    /**
     * Remove all handlers. Useful for testing.
     */
    void clear();

    /**
     * Result of a lookup.
     *
     * @param registration matched registration
     * @param parameters custom-id template parameters, empty unless a template matched
     */
    record Resolution(HandlerRegistration registration, Map<String, Object> parameters) {

        public Resolution {
            parameters = parameters != null ? parameters : Map.of();
        }

        public static Resolution of(HandlerRegistration registration) {
            return new Resolution(registration, Map.of());
        }
    }
}
