package com.studio.access.service.trigger;

import java.time.Instant;

/**
 * Door-control event watched by downstream automation. {@code start}/{@code end} bound
 * the short span during which the event is live.
 */
public record TriggerEvent(
    String summary,
    String description,
    Instant start,
    Instant end,
    String eventId,
    String roomId
) {}
