package com.ivamare.interactions.web;

import com.ivamare.interactions.dispatch.DispatchOutcome;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;

/**
 * Flushes the interaction response and then marks the dispatch outcome as delivered,
 * which starts its background continuation. If the response cannot be written the
 * outcome is abandoned instead.
 */
public class InteractionDeliveryInterceptor implements HandlerInterceptor {

    private static final Logger log = LoggerFactory.getLogger(InteractionDeliveryInterceptor.class);

    public static final String OUTCOME_ATTRIBUTE = InteractionDeliveryInterceptor.class.getName() + ".outcome";

    @Override
    public void afterCompletion(HttpServletRequest request, HttpServletResponse response,
                                Object handler, Exception ex) {
        if (!(request.getAttribute(OUTCOME_ATTRIBUTE) instanceof DispatchOutcome outcome)) {
            return;
        }
        request.removeAttribute(OUTCOME_ATTRIBUTE);

        if (ex != null) {
            log.warn("Response for interaction {} failed, skipping background work",
                outcome.context().interactionId(), ex);
            outcome.abandon();
            return;
        }

        try {
            response.flushBuffer();
        } catch (IOException e) {
            log.warn("Could not deliver response for interaction {}, skipping background work",
                outcome.context().interactionId(), e);
            outcome.abandon();
            return;
        }
        outcome.markDelivered();
    }
}
