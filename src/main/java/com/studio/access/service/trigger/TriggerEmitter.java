package com.studio.access.service.trigger;

import java.util.Optional;

/**
 * Durable sink for door-open events.
 *
 * <p>Implementations return an empty result rather than throwing when the sink refuses or
 * cannot be reached. The caller decides how loudly to report it.
 */
public interface TriggerEmitter {

    Optional<TriggerConfirmation> emit(TriggerEvent event);

    /** {@code false} when the emitter can never deliver, e.g. no calendar configured. */
    boolean isConnected();
}
