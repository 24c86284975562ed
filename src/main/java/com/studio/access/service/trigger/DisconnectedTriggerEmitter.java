package com.studio.access.service.trigger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;

/**
 * Stand-in used when no door-control calendar is configured. Never confirms.
 */
public class DisconnectedTriggerEmitter implements TriggerEmitter {

    private static final Logger log = LoggerFactory.getLogger(DisconnectedTriggerEmitter.class);

    @Override
    public Optional<TriggerConfirmation> emit(TriggerEvent event) {
        log.warn("Trigger emitter disconnected, dropping event {}", event.eventId());
        return Optional.empty();
    }

    @Override
    public boolean isConnected() {
        return false;
    }
}
