package com.ivamare.interactions.handler.impl;

import com.ivamare.interactions.exception.DuplicateRegistrationException;
import com.ivamare.interactions.exception.HandlerNotFoundException;
import com.ivamare.interactions.handler.HandlerRegistration;
import com.ivamare.interactions.handler.HandlerRegistry;
import com.ivamare.interactions.model.HandlerKind;
import com.ivamare.interactions.model.InteractionSubType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Default implementation of HandlerRegistry.
 *
 * <p>Keeps four tables: specific handlers by key, custom-id templates in
 * registration order, generic handlers by (kind, sub-type) and a single catch-all.
 * Instances are independent, so several registries can coexist in one process.
 */
public class DefaultHandlerRegistry implements HandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultHandlerRegistry.class);

    private final Map<SpecificKey, HandlerRegistration> specific = new ConcurrentHashMap<>();
    private final List<HandlerRegistration> templates = new CopyOnWriteArrayList<>();
    private final Map<GenericKey, HandlerRegistration> generic = new ConcurrentHashMap<>();
    private final AtomicReference<HandlerRegistration> catchAll = new AtomicReference<>();

    @Override
    public synchronized void register(HandlerRegistration registration) {
        HandlerKind kind = registration.kind();

        if (kind == HandlerKind.CATCH_ALL) {
            if (!catchAll.compareAndSet(null, registration)) {
                throw new DuplicateRegistrationException(kind, null);
            }
            log.debug("Registered catch-all handler");
            return;
        }

        if (registration.isGeneric()) {
            var key = new GenericKey(kind, registration.subType());
            if (generic.putIfAbsent(key, registration) != null) {
                throw new DuplicateRegistrationException(kind, null);
            }
            log.debug("Registered generic handler {}", registration.describe());
            return;
        }

        if (registration.template().isPresent()) {
            boolean taken = templates.stream().anyMatch(existing ->
                existing.kind() == kind
                    && existing.matchKey().equals(registration.matchKey())
                    && sameSubType(existing, registration));
            if (taken) {
                throw new DuplicateRegistrationException(kind, registration.matchKey());
            }
            templates.add(registration);
            log.debug("Registered template handler {}", registration.describe());
            return;
        }

        var key = SpecificKey.of(registration);
        if (specific.putIfAbsent(key, registration) != null) {
            throw new DuplicateRegistrationException(kind, registration.matchKey());
        }
        log.debug("Registered handler {}", registration.describe());
    }

    @Override
    public synchronized boolean deregister(HandlerRegistration registration) {
        boolean removed;
        if (registration.kind() == HandlerKind.CATCH_ALL) {
            removed = catchAll.compareAndSet(registration, null);
        } else if (registration.isGeneric()) {
            removed = generic.remove(new GenericKey(registration.kind(), registration.subType()), registration);
        } else if (registration.template().isPresent()) {
            removed = templates.removeIf(existing -> existing == registration);
        } else {
            removed = specific.remove(SpecificKey.of(registration), registration);
        }

        if (removed) {
            log.debug("Deregistered handler {}", registration.describe());
        }
        return removed;
    }

    @Override
    public Optional<Resolution> resolve(HandlerKind kind, String matchKey, InteractionSubType subType) {
        if (matchKey != null) {
            HandlerRegistration exact = specific.get(new SpecificKey(kind, matchKey, specificSubType(kind, subType)));
            if (exact == null && kind == HandlerKind.COMPONENT && subType != null) {
                exact = specific.get(new SpecificKey(kind, matchKey, null));
            }
            if (exact != null) {
                return Optional.of(Resolution.of(exact));
            }

            if (kind.usesCustomId()) {
                for (HandlerRegistration candidate : templates) {
                    if (candidate.kind() != kind || !subTypeMatches(candidate, subType)) {
                        continue;
                    }
                    Optional<Map<String, Object>> parameters = candidate.template()
                        .flatMap(template -> template.match(matchKey));
                    if (parameters.isPresent()) {
                        return Optional.of(new Resolution(candidate, parameters.get()));
                    }
                }
            }
        }

        if (subType != null) {
            HandlerRegistration narrowed = generic.get(new GenericKey(kind, subType));
            if (narrowed != null) {
                return Optional.of(Resolution.of(narrowed));
            }
        }

        HandlerRegistration fallback = generic.get(new GenericKey(kind, null));
        if (fallback != null) {
            return Optional.of(Resolution.of(fallback));
        }

        return Optional.ofNullable(catchAll.get()).map(Resolution::of);
    }

    @Override
    public Resolution resolveOrThrow(HandlerKind kind, String matchKey, InteractionSubType subType) {
        return resolve(kind, matchKey, subType)
            .orElseThrow(() -> new HandlerNotFoundException(kind, matchKey));
    }

    @Override
    public List<HandlerRegistration> registrations() {
        List<HandlerRegistration> all = new ArrayList<>(specific.values());
        all.addAll(templates);
        all.addAll(generic.values());
        HandlerRegistration fallback = catchAll.get();
        if (fallback != null) {
            all.add(fallback);
        }
        return List.copyOf(all);
    }

    @Override
    public int size() {
        return specific.size() + templates.size() + generic.size() + (catchAll.get() != null ? 1 : 0);
    }

    @Override
    public synchronized void clear() {
        specific.clear();
        templates.clear();
        generic.clear();
        catchAll.set(null);
    }

    // only component keys include the sub-type
    private static InteractionSubType specificSubType(HandlerKind kind, InteractionSubType subType) {
        return kind == HandlerKind.COMPONENT ? subType : null;
    }

    private static boolean subTypeMatches(HandlerRegistration registration, InteractionSubType subType) {
        return registration.subType() == null || registration.subType().equals(subType);
    }

    private static boolean sameSubType(HandlerRegistration a, HandlerRegistration b) {
        return a.subType() == null ? b.subType() == null : a.subType().equals(b.subType());
    }

    /**
     * Key of a specific (named) handler.
     */
    record SpecificKey(HandlerKind kind, String matchKey, InteractionSubType subType) {

        static SpecificKey of(HandlerRegistration registration) {
            return new SpecificKey(
                registration.kind(),
                registration.matchKey(),
                specificSubType(registration.kind(), registration.subType()));
        }
    }

    /**
     * Key of a generic handler; a null sub-type matches every sub-type of the kind.
     */
    record GenericKey(HandlerKind kind, InteractionSubType subType) {}
}
