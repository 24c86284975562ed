package com.studio.access.service.trigger;

/**
 * @param eventId   id under which the sink stored the event
 * @param duplicate the sink already held an event with this id
 */
public record TriggerConfirmation(String eventId, boolean duplicate) {}
