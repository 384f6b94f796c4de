package io.taskhooks.core.hook;

import io.taskhooks.core.model.Event;
import io.taskhooks.core.model.HookDefinition;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Selects the hooks that should run for an event.
 *
 * <p>
 * Every enabled hook whose event pattern and context filters accept the event is returned, in
 * declaration order. There is no "first match wins": one event may fire any number of hooks.
 *
 * <p>
 * Thread-safe and stateless.
 */
public final class HookMatcher {

    private static final Logger LOG = LoggerFactory.getLogger(HookMatcher.class);

    private HookMatcher() {}

    /**
     * Finds all matching hooks.
     *
     * @param registry the configured hooks
     * @param event    the event being dispatched
     * @return matching hooks in declaration order, empty if none
     */
    public static List<HookDefinition> findMatches(HookRegistry registry, Event event) {
        List<HookDefinition> matches = new ArrayList<>();
        for (HookDefinition hook : registry.hooks()) {
            if (!hook.enabled()) {
                LOG.trace("Hook '{}' is disabled, skipping", hook.name());
                continue;
            }
            if (hook.matches(event)) {
                matches.add(hook);
            }
        }
        LOG.debug("Event {} ({}) matched {} hook(s)", event.eventId(), event.eventType(), matches.size());
        return matches;
    }
}
