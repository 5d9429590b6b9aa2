package com.ivamare.interactions.handler;

import com.ivamare.interactions.model.CommandType;
import com.ivamare.interactions.model.ComponentType;
import com.ivamare.interactions.model.DeferPolicy;
import com.ivamare.interactions.model.HandlerKind;
import com.ivamare.interactions.model.InteractionSubType;
import com.ivamare.interactions.template.CustomIdTemplate;
import com.ivamare.interactions.template.ParameterType;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * A handler plus everything the registry and dispatcher need to route to it.
 *
 * <p>Immutable. Equality is identity, so {@link HandlerRegistry#deregister} removes
 * exactly the instance that was registered.
 *
 * <p>Example:
 * <pre>
 * registry.register(HandlerRegistration.component("add_role:{role}")
 *     .parameter("role", ParameterType.INTEGER)
 *     .handler(ctx -&gt; "Added role " + ctx.parameter("role"))
 *     .build());
 * </pre>
 */
public final class HandlerRegistration {

    private final HandlerKind kind;
    private final String matchKey;
    private final InteractionSubType subType;
    private final CustomIdTemplate template;
    private final InteractionHandler handler;
    private final DeferPolicy deferPolicy;
    private final InteractionHandler followup;

    private HandlerRegistration(Builder builder) {
        this.kind = Objects.requireNonNull(builder.kind, "kind");
        this.matchKey = builder.matchKey;
        this.subType = builder.subType;
        this.handler = Objects.requireNonNull(builder.handler, "handler");
        this.deferPolicy = builder.deferPolicy != null ? builder.deferPolicy : DeferPolicy.inherit();
        this.followup = builder.followup;

        if (!kind.accepts(subType)) {
            throw new IllegalArgumentException("Sub-type " + subType + " is not valid for " + kind);
        }
        if (kind == HandlerKind.CATCH_ALL && matchKey != null) {
            throw new IllegalArgumentException("Catch-all handler cannot have a match key");
        }

        if (kind.usesCustomId() && CustomIdTemplate.isTemplate(matchKey)) {
            this.template = CustomIdTemplate.parse(matchKey, builder.parameterTypes);
        } else {
            this.template = null;
        }
    }

    public static Builder builder(HandlerKind kind, String matchKey) {
        return new Builder(kind, matchKey);
    }

    public static Builder command(String name) {
        return new Builder(HandlerKind.COMMAND, name);
    }

    /**
     * Generic fallback for commands of one sub-type, or all commands when null.
     *
     * @param commandType sub-type filter (nullable)
     * @return builder
     */
    public static Builder anyCommand(CommandType commandType) {
        return new Builder(HandlerKind.COMMAND, null).subType(commandType);
    }

    public static Builder component(String customId) {
        return new Builder(HandlerKind.COMPONENT, customId);
    }

    public static Builder component(String customId, ComponentType componentType) {
        return new Builder(HandlerKind.COMPONENT, customId).subType(componentType);
    }

    /**
     * Generic fallback for components of one sub-type, or all components when null.
     *
     * @param componentType BUTTON, SELECT or null
     * @return builder
     */
    public static Builder anyComponent(ComponentType componentType) {
        return new Builder(HandlerKind.COMPONENT, null).subType(componentType);
    }

    public static Builder autocomplete(String commandName) {
        return new Builder(HandlerKind.AUTOCOMPLETE, commandName);
    }

    public static Builder modal(String customId) {
        return new Builder(HandlerKind.MODAL_SUBMIT, customId);
    }

    public static Builder catchAll() {
        return new Builder(HandlerKind.CATCH_ALL, null);
    }

    public HandlerKind kind() {
        return kind;
    }

    /**
     * @return name, custom id or custom-id template; null for generic and catch-all handlers
     */
    public String matchKey() {
        return matchKey;
    }

    public InteractionSubType subType() {
        return subType;
    }

    public Optional<CustomIdTemplate> template() {
        return Optional.ofNullable(template);
    }

    public boolean isGeneric() {
        return matchKey == null;
    }

    public InteractionHandler handler() {
        return handler;
    }

    /**
     * @return handler-level policy, fields are null where the client default applies
     */
    public DeferPolicy deferPolicy() {
        return deferPolicy;
    }

    /**
     * @return routine run after the primary response has been delivered
     */
    public Optional<InteractionHandler> followup() {
        return Optional.ofNullable(followup);
    }

    /**
     * Short description used in logs.
     *
     * @return kind, key and sub-type
     */
    public String describe() {
        StringBuilder sb = new StringBuilder(kind.name());
        sb.append('.').append(matchKey != null ? matchKey : "*");
        if (subType != null) {
            sb.append('[').append(subType).append(']');
        }
        return sb.toString();
    }

    @Override
    public String toString() {
        return "HandlerRegistration[" + describe() + "]";
    }

    /**
     * Builder for {@link HandlerRegistration}.
     */
    public static class Builder {

        private final HandlerKind kind;
        private final String matchKey;
        private final Map<String, ParameterType> parameterTypes = new LinkedHashMap<>();
        private InteractionSubType subType;
        private InteractionHandler handler;
        private DeferPolicy deferPolicy;
        private InteractionHandler followup;

        private Builder(HandlerKind kind, String matchKey) {
            this.kind = kind;
            this.matchKey = matchKey;
        }

        public Builder subType(InteractionSubType subType) {
            this.subType = subType;
            return this;
        }

        /**
         * Declare the type of a custom-id template parameter.
         *
         * @param name parameter name
         * @param type parameter type
         * @return this builder
         */
        public Builder parameter(String name, ParameterType type) {
            parameterTypes.put(name, type);
            return this;
        }

        public Builder handler(InteractionHandler handler) {
            this.handler = handler;
            return this;
        }

        public Builder deferPolicy(DeferPolicy deferPolicy) {
            this.deferPolicy = deferPolicy;
            return this;
        }

        /**
         * Shortcut overriding only the enabled flag of the defer policy.
         *
         * @param autoDefer whether to auto-defer this handler
         * @return this builder
         */
        public Builder autoDefer(boolean autoDefer) {
            DeferPolicy current = deferPolicy != null ? deferPolicy : DeferPolicy.inherit();
            this.deferPolicy = new DeferPolicy(autoDefer, current.timeout(), current.ephemeral());
            return this;
        }

        public Builder followup(InteractionHandler followup) {
            this.followup = followup;
            return this;
        }

        public HandlerRegistration build() {
            return new HandlerRegistration(this);
        }
    }
}
