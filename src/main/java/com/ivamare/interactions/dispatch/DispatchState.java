package com.ivamare.interactions.dispatch;

import java.util.EnumSet;
import java.util.Set;

/**
 * Lifecycle of one interaction inside the dispatcher.
 *
 * <pre>
 * RECEIVED -&gt; ROUTED -&gt; EXECUTING -&gt; RESPONDED_IMMEDIATE
 *                    |              \-&gt; DEFERRED -&gt; FOLLOWUP_SENT
 *                    \-&gt; HANDLER_NOT_FOUND
 * </pre>
 */
public enum DispatchState {
    RECEIVED,
    ROUTED,
    EXECUTING,
    RESPONDED_IMMEDIATE,
    DEFERRED,
    FOLLOWUP_SENT,
    HANDLER_NOT_FOUND;

    /**
     * @param next candidate next state
     * @return true if the transition is allowed
     */
    public boolean canTransitionTo(DispatchState next) {
        return successors().contains(next);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }

    private Set<DispatchState> successors() {
        return switch (this) {
            case RECEIVED -> EnumSet.of(ROUTED);
            case ROUTED -> EnumSet.of(EXECUTING, HANDLER_NOT_FOUND);
            case EXECUTING -> EnumSet.of(RESPONDED_IMMEDIATE, DEFERRED);
            case DEFERRED -> EnumSet.of(FOLLOWUP_SENT);
            case RESPONDED_IMMEDIATE, FOLLOWUP_SENT, HANDLER_NOT_FOUND -> EnumSet.noneOf(DispatchState.class);
        };
    }
}
